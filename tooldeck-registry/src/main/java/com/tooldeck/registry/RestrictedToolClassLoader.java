package com.tooldeck.registry;

import com.tooldeck.tools.Tool;

import java.util.List;

/**
 * Restricted parent classloader for tool JARs. Exposes only explicitly allowed packages;
 * all others throw {@link ClassNotFoundException}. Keeps tools away from registry, dispatcher and
 * host internals; a tool that needs a library must bundle it in its own JAR.
 * <p>
 * <b>Allowed:</b> {@code java.*}, {@code javax.*}, {@code com.tooldeck.tools.*},
 * {@code com.tooldeck.annotations.*}, {@code org.slf4j.*}
 */
public final class RestrictedToolClassLoader extends ClassLoader {

    static final List<String> ALLOWED_PREFIXES = List.of(
            "java.",
            "javax.",
            "com.tooldeck.tools.",
            "com.tooldeck.annotations.",
            "org.slf4j.");

    private final ClassLoader kernelLoader;

    /**
     * Creates a restricted classloader with no parent. Delegates to the loader that
     * loaded {@link Tool} only for allowed package prefixes.
     */
    public RestrictedToolClassLoader() {
        super(null);
        this.kernelLoader = Tool.class.getClassLoader();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c != null) {
                if (resolve) resolveClass(c);
                return c;
            }
            if (isAllowed(name)) {
                c = kernelLoader.loadClass(name);
                if (resolve) resolveClass(c);
                return c;
            }
            throw new ClassNotFoundException("Access denied: " + name
                    + " (tools may only use java.*, javax.*, com.tooldeck.tools.*, com.tooldeck.annotations.*, org.slf4j.*)");
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
