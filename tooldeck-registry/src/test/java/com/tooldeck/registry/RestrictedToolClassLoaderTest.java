package com.tooldeck.registry;

import com.tooldeck.annotations.DeckTool;
import com.tooldeck.tools.Tool;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RestrictedToolClassLoaderTest {

    private final RestrictedToolClassLoader loader = new RestrictedToolClassLoader();

    @Test
    void loadClass_exposesToolApiFromHostLoader() throws Exception {
        assertSame(Tool.class, loader.loadClass(Tool.class.getName()));
        assertSame(DeckTool.class, loader.loadClass(DeckTool.class.getName()));
        assertSame(String.class, loader.loadClass("java.lang.String"));
        assertSame(org.slf4j.Logger.class, loader.loadClass("org.slf4j.Logger"));
    }

    @Test
    void loadClass_deniesHostInternals() {
        ClassNotFoundException e = assertThrows(ClassNotFoundException.class,
                () -> loader.loadClass(ToolRegistry.class.getName()));

        assertTrue(e.getMessage().startsWith("Access denied"));
    }

    @Test
    void isAllowed_requiresFullPackagePrefix() {
        assertTrue(RestrictedToolClassLoader.isAllowed("com.tooldeck.tools.Tool"));
        assertFalse(RestrictedToolClassLoader.isAllowed("com.tooldeck.toolsx.Evil"));
        assertFalse(RestrictedToolClassLoader.isAllowed("com.tooldeck.registry.ToolLoader"));
        assertFalse(RestrictedToolClassLoader.isAllowed("ch.qos.logback.classic.Logger"));
    }
}
