package com.tooldeck.registry;

import com.tooldeck.tools.Tool;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Objects;

/**
 * Adapts an entry class that does not implement {@link Tool} but declares a public zero-argument
 * {@code run()} method. Exceptions thrown by the method reach the caller unwrapped, so the dispatcher
 * reports the tool's own exception type.
 */
final class ReflectiveTool implements Tool {

    private final Object target;
    private final Method method;

    ReflectiveTool(Object target, Method method) {
        this.target = Objects.requireNonNull(target, "target");
        this.method = Objects.requireNonNull(method, "method");
    }

    @Override
    public void run() throws Exception {
        try {
            method.invoke(Modifier.isStatic(method.getModifiers()) ? null : target);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
