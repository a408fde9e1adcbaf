package com.tooldeck.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declarative metadata for a tool entry class. Every element is optional; the host reads the
 * annotation once when the tool JAR is loaded and fills in documented defaults for anything
 * left unset. A tool without this annotation behaves exactly as if it carried {@code @DeckTool}
 * with all defaults.
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface DeckTool {

    /** Sort priority used when a tool does not declare one. Lower values are listed first. */
    int DEFAULT_ORDER = 999;

    /** Display name shown in the tool list. Blank = derived from the JAR file name. */
    String name() default "";

    /** Short description shown next to the tool name. */
    String description() default "";

    /** Sort priority; lower appears first. */
    int order() default DEFAULT_ORDER;
}
