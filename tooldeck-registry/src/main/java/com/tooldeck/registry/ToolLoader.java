package com.tooldeck.registry;

import com.tooldeck.tools.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Objects;

/**
 * Loads one candidate and validates its entry point.
 * <p>
 * Any failure while resolving, {@link Error}s included, is caught and turned into a
 * {@link LoadErrorKind#LOAD_EXCEPTION} error; nothing a single candidate does can abort discovery.
 * Only {@link VirtualMachineError}s other than {@link StackOverflowError} are rethrown. After resolution the object must expose an
 * invokable entry point named {@code run}:
 * <ul>
 *   <li>it implements {@link Tool}, or</li>
 *   <li>it declares a public zero-argument method {@code run()}, or</li>
 *   <li>it has a public field {@code run} holding a {@link Tool} or {@link Runnable}.</li>
 * </ul>
 * Anything else named {@code run} is {@link LoadErrorKind#NOT_CALLABLE}; nothing named {@code run}
 * at all is {@link LoadErrorKind#MISSING_ENTRY_POINT}.
 */
public final class ToolLoader {

    private static final Logger log = LoggerFactory.getLogger(ToolLoader.class);

    private final UnitResolver resolver;
    private final String suffix;

    /**
     * @param resolver resolver for candidates
     * @param suffix   file name suffix stripped from candidate names in messages (e.g. {@code .jar})
     */
    public ToolLoader(UnitResolver resolver, String suffix) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.suffix = suffix != null ? suffix : "";
    }

    public ToolLoadResult load(ToolCandidate candidate) {
        Objects.requireNonNull(candidate, "candidate");
        String name = unitName(candidate);
        ResolvedUnit unit;
        try {
            unit = resolver.resolve(candidate);
            if (unit == null) {
                throw new ToolResolutionException("resolver returned nothing");
            }
        } catch (StackOverflowError e) {
            return loadFailed(candidate, name, e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            return loadFailed(candidate, name, e);
        }

        ToolLoadResult result;
        try {
            result = validate(candidate, name, unit);
        } catch (LinkageError e) {
            unit.close();
            return loadFailed(candidate, name, e);
        }
        if (!result.isLoaded()) {
            unit.close();
            log.warn("Rejected tool {}: {}", candidate, result.getError().getMessage());
        }
        return result;
    }

    private static ToolLoadResult loadFailed(ToolCandidate candidate, String name, Throwable e) {
        Throwable cause = rootCause(e);
        log.error("Error loading tool {} (skipping)", candidate, cause);
        return ToolLoadResult.failed(new LoadError(candidate.getFileName(),
                LoadErrorKind.LOAD_EXCEPTION, "Failed to load '" + name + "': " + cause));
    }

    private static ToolLoadResult validate(ToolCandidate candidate, String name, ResolvedUnit unit) {
        Object instance = unit.getInstance();
        if (instance instanceof Tool) {
            return ToolLoadResult.loaded((Tool) instance, unit);
        }
        Class<?> type = instance.getClass();
        Method method = findZeroArgRun(type);
        if (method != null) {
            return ToolLoadResult.loaded(new ReflectiveTool(instance, method), unit);
        }
        Field field = findPublicField(type);
        if (field != null) {
            Tool fieldTool = toolFromField(instance, field);
            if (fieldTool != null) {
                return ToolLoadResult.loaded(fieldTool, unit);
            }
            return notCallable(candidate, name);
        }
        if (hasPublicRunMethod(type)) {
            return notCallable(candidate, name);
        }
        return ToolLoadResult.failed(new LoadError(candidate.getFileName(),
                LoadErrorKind.MISSING_ENTRY_POINT, "Tool '" + name + "' missing required 'run()' entry point"));
    }

    private static ToolLoadResult notCallable(ToolCandidate candidate, String name) {
        return ToolLoadResult.failed(new LoadError(candidate.getFileName(),
                LoadErrorKind.NOT_CALLABLE, "Tool '" + name + "' has 'run' but it is not callable"));
    }

    private static Method findZeroArgRun(Class<?> type) {
        try {
            Method m = type.getMethod(Tool.ENTRY_POINT);
            return Modifier.isAbstract(m.getModifiers()) ? null : m;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static boolean hasPublicRunMethod(Class<?> type) {
        for (Method m : type.getMethods()) {
            if (Tool.ENTRY_POINT.equals(m.getName())) {
                return true;
            }
        }
        return false;
    }

    private static Field findPublicField(Class<?> type) {
        try {
            return type.getField(Tool.ENTRY_POINT);
        } catch (NoSuchFieldException e) {
            return null;
        }
    }

    private static Tool toolFromField(Object instance, Field field) {
        Object value;
        try {
            value = field.get(Modifier.isStatic(field.getModifiers()) ? null : instance);
        } catch (IllegalAccessException e) {
            log.debug("Field 'run' of {} is not readable: {}", instance.getClass().getName(), e.getMessage());
            return null;
        }
        if (value instanceof Tool) {
            return (Tool) value;
        }
        if (value instanceof Runnable) {
            return ((Runnable) value)::run;
        }
        return null;
    }

    /** Strips reflection and class initialization wrappers so the tool's own failure is reported. */
    private static Throwable rootCause(Throwable e) {
        Throwable current = e;
        while ((current instanceof InvocationTargetException || current instanceof ExceptionInInitializerError)
                && current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    private String unitName(ToolCandidate candidate) {
        String fileName = candidate.getFileName();
        return fileName.endsWith(suffix) ? fileName.substring(0, fileName.length() - suffix.length()) : fileName;
    }
}
