package com.tooldeck.host.dispatch;

import com.tooldeck.registry.LoadedTool;
import com.tooldeck.registry.ToolDescriptor;
import com.tooldeck.registry.ToolRegistry;
import com.tooldeck.registry.ToolRegistryCache;
import com.tooldeck.tools.Tool;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolDispatcherTest {

    private static LoadedTool tool(String name, int numericId, Tool entry) {
        return new LoadedTool(new ToolDescriptor(name, "", 999, numericId), entry, "code" + numericId + ".jar", null);
    }

    private static ToolRegistryCache cacheOf(LoadedTool... tools) {
        ToolRegistry.Builder builder = ToolRegistry.builder();
        for (LoadedTool t : tools) {
            builder.put(t);
        }
        ToolRegistry registry = builder.build(Comparator.comparingInt(ToolDescriptor::getNumericId));
        return new ToolRegistryCache(() -> registry);
    }

    @Test
    void dispatch_emptyRegistryReturnsGuidanceWithoutInvoking() {
        ToolDispatcher dispatcher = new ToolDispatcher(new ToolRegistryCache(ToolRegistry::empty));

        DispatchResult result = dispatcher.dispatch("Anything");

        assertEquals(DispatchStatus.NO_TOOLS, result.getStatus());
        assertEquals(ToolDispatcher.NO_TOOLS_GUIDANCE, result.getMessage());
        assertNull(result.getFailure());
        assertFalse(result.isSuccess());
    }

    @Test
    void dispatch_unknownSelectionInvokesNothing() {
        AtomicInteger runs = new AtomicInteger();
        ToolDispatcher dispatcher = new ToolDispatcher(cacheOf(tool("Alpha", 1, runs::incrementAndGet)));

        DispatchResult result = dispatcher.dispatch("Beta");

        assertEquals(DispatchStatus.UNKNOWN_SELECTION, result.getStatus());
        assertEquals("Beta", result.getSelection());
        assertEquals(0, runs.get());
    }

    @Test
    void dispatch_healthyToolCompletes() {
        AtomicInteger runs = new AtomicInteger();
        ToolDispatcher dispatcher = new ToolDispatcher(cacheOf(tool("Alpha", 1, runs::incrementAndGet)));

        DispatchResult result = dispatcher.dispatch("Alpha");

        assertTrue(result.isSuccess());
        assertEquals(DispatchStatus.COMPLETED, result.getStatus());
        assertEquals("Alpha", result.getSelection());
        assertTrue(result.getElapsedMillis() >= 0);
        assertEquals(1, runs.get());
    }

    @Test
    void dispatch_failureIsReportedAndHostKeepsServing() {
        AtomicInteger healthyRuns = new AtomicInteger();
        ToolDispatcher dispatcher = new ToolDispatcher(cacheOf(
                tool("Broken", 1, () -> {
                    throw new IllegalStateException("boom");
                }),
                tool("Healthy", 2, healthyRuns::incrementAndGet)));

        DispatchResult failed = dispatcher.dispatch("Broken");

        assertEquals(DispatchStatus.FAILED, failed.getStatus());
        DispatchFailureReport report = failed.getFailure();
        assertNotNull(report);
        assertEquals("Broken", report.getToolName());
        assertEquals("IllegalStateException", report.getErrorType());
        assertEquals("boom", report.getMessage());
        assertTrue(report.getStackTrace().contains("java.lang.IllegalStateException: boom"));
        assertEquals(DispatchFailureReport.HINT, report.getHint());
        assertEquals("Error running 'Broken'", failed.getMessage());

        assertTrue(dispatcher.dispatch("Healthy").isSuccess());
        assertEquals(1, healthyRuns.get());
        assertEquals(DispatchStatus.FAILED, dispatcher.dispatch("Broken").getStatus());
    }

    @Test
    void dispatch_containsErrorsAndCheckedExceptions() {
        ToolDispatcher dispatcher = new ToolDispatcher(cacheOf(
                tool("Assert", 1, () -> {
                    throw new AssertionError("bad state");
                }),
                tool("Checked", 2, () -> {
                    throw new java.io.IOException();
                })));

        DispatchResult asserted = dispatcher.dispatch("Assert");
        DispatchResult checked = dispatcher.dispatch("Checked");

        assertEquals("AssertionError", asserted.getFailure().getErrorType());
        assertEquals("IOException", checked.getFailure().getErrorType());
        assertEquals("", checked.getFailure().getMessage());
    }

    private static int recurse(int depth) {
        return recurse(depth + 1) + 1;
    }

    @Test
    void dispatch_runawayRecursionIsReportedAsFailure() {
        AtomicInteger healthyRuns = new AtomicInteger();
        ToolDispatcher dispatcher = new ToolDispatcher(cacheOf(
                tool("Recursive", 1, () -> recurse(0)),
                tool("Healthy", 2, healthyRuns::incrementAndGet)));

        DispatchResult result = dispatcher.dispatch("Recursive");

        assertEquals(DispatchStatus.FAILED, result.getStatus());
        assertEquals("StackOverflowError", result.getFailure().getErrorType());
        assertTrue(dispatcher.dispatch("Healthy").isSuccess());
        assertEquals(1, healthyRuns.get());
    }

    @Test
    void dispatch_rethrowsVirtualMachineErrors() {
        OutOfMemoryError oom = new OutOfMemoryError("test");
        ToolDispatcher dispatcher = new ToolDispatcher(cacheOf(tool("Hungry", 1, () -> {
            throw oom;
        })));

        OutOfMemoryError thrown = assertThrows(OutOfMemoryError.class, () -> dispatcher.dispatch("Hungry"));
        assertSame(oom, thrown);
    }

    @Test
    void dispatch_readsRegistryFromCacheOnce() {
        AtomicInteger discoveries = new AtomicInteger();
        ToolRegistry.Builder builder = ToolRegistry.builder();
        builder.put(tool("Alpha", 1, () -> { }));
        ToolRegistry registry = builder.build(Comparator.comparingInt(ToolDescriptor::getNumericId));
        ToolRegistryCache cache = new ToolRegistryCache(() -> {
            discoveries.incrementAndGet();
            return registry;
        });
        ToolDispatcher dispatcher = new ToolDispatcher(cache);

        for (int i = 0; i < 5; i++) {
            dispatcher.dispatch("Alpha");
        }

        assertEquals(1, discoveries.get());
    }
}
