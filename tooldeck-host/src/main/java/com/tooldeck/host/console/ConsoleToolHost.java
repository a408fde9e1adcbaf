package com.tooldeck.host.console;

import com.tooldeck.host.dispatch.DispatchResult;
import com.tooldeck.host.dispatch.DispatchStatus;
import com.tooldeck.host.dispatch.ToolDispatcher;
import com.tooldeck.registry.LoadedTool;
import com.tooldeck.registry.ToolRegistry;
import com.tooldeck.registry.ToolRegistryCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Line-oriented operator console. Each input line is one request cycle: a command, or a tool
 * selection dispatched through {@link ToolDispatcher}. The loop ends on {@code quit}, {@code exit}
 * or end of input.
 */
public final class ConsoleToolHost {

    private static final Logger log = LoggerFactory.getLogger(ConsoleToolHost.class);

    private final ToolRegistryCache registryCache;
    private final ToolDispatcher dispatcher;
    private final ConsoleRenderer renderer;

    /** Display name of the current selection; re-run on an empty line. */
    private String current;

    public ConsoleToolHost(ToolRegistryCache registryCache, ToolDispatcher dispatcher, ConsoleRenderer renderer) {
        this.registryCache = Objects.requireNonNull(registryCache, "registryCache");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    /**
     * Runs the loop until the operator quits or input ends.
     *
     * @throws IOException if reading the input fails
     */
    public void run(BufferedReader in) throws IOException {
        ToolRegistry registry = registryCache.get();
        renderer.renderBanner();
        renderer.renderToolList(registry);
        if (!registry.isEmpty()) {
            renderer.renderMessage("Type a number or name to run a tool, 'help' for commands.");
        }
        while (true) {
            renderer.renderPrompt(current);
            String line = in.readLine();
            if (line == null || !handle(line)) {
                break;
            }
        }
        log.info("Console session ended");
    }

    /**
     * Handles one input line.
     *
     * @return false when the operator asked to leave
     */
    boolean handle(String line) {
        String input = line.trim();
        ToolRegistry registry = registryCache.get();
        String lower = input.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "quit":
            case "exit":
                return false;
            case "help":
            case "?":
                renderer.renderHelp();
                return true;
            case "list":
                renderer.renderToolList(registry);
                return true;
            case "errors":
                renderer.renderErrors(registry);
                return true;
            case "info":
                renderer.renderMessage("Usage: info <n|name>");
                return true;
            case "":
                if (current == null) {
                    if (registry.isEmpty()) {
                        renderer.renderNoTools();
                    } else {
                        renderer.renderMessage("No tool selected. Type a number or name, or 'help'.");
                    }
                    return true;
                }
                runSelection(current);
                return true;
            default:
                break;
        }
        if (lower.startsWith("info ")) {
            String target = input.substring("info ".length()).trim();
            Optional<LoadedTool> tool = resolve(registry, target);
            if (tool.isPresent()) {
                renderer.renderInfo(tool.get());
            } else {
                renderer.renderMessage("No tool named '" + target + "'.");
            }
            return true;
        }
        String selection = resolve(registry, input).map(LoadedTool::getDisplayName).orElse(input);
        runSelection(selection);
        return true;
    }

    private void runSelection(String selection) {
        DispatchResult result = dispatcher.dispatch(selection);
        if (result.getStatus() == DispatchStatus.COMPLETED || result.getStatus() == DispatchStatus.FAILED) {
            current = result.getSelection();
        }
        renderer.renderResult(result);
    }

    /** Current selection, or null before the first tool ran. */
    String getCurrent() {
        return current;
    }

    /**
     * Resolves a list number (1-based), an exact display name or a case-insensitive display name.
     */
    static Optional<LoadedTool> resolve(ToolRegistry registry, String input) {
        if (input.isEmpty()) {
            return Optional.empty();
        }
        List<LoadedTool> tools = registry.getOrderedTools();
        if (input.chars().allMatch(Character::isDigit) && input.length() < 10) {
            int index = Integer.parseInt(input) - 1;
            if (index >= 0 && index < tools.size()) {
                return Optional.of(tools.get(index));
            }
        }
        Optional<LoadedTool> exact = registry.find(input);
        if (exact.isPresent()) {
            return exact;
        }
        return tools.stream()
                .filter(t -> t.getDisplayName().equalsIgnoreCase(input))
                .findFirst();
    }
}
