package com.tooldeck.host.console;

import com.tooldeck.config.ToolDeckConfig;
import com.tooldeck.host.dispatch.DispatchFailureReport;
import com.tooldeck.host.dispatch.DispatchResult;
import com.tooldeck.registry.LoadError;
import com.tooldeck.registry.LoadedTool;
import com.tooldeck.registry.ToolDescriptor;
import com.tooldeck.registry.ToolRegistry;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Writes operator-facing text to the console. Holds no state besides the output stream and the
 * configuration used for guidance text.
 */
public final class ConsoleRenderer {

    static final String RULE = "------------------------------------------------------------";

    private final PrintStream out;
    private final ToolDeckConfig config;

    public ConsoleRenderer(PrintStream out, ToolDeckConfig config) {
        this.out = Objects.requireNonNull(out, "out");
        this.config = Objects.requireNonNull(config, "config");
    }

    public void renderBanner() {
        out.println("Tool Deck");
        out.println(RULE);
    }

    /** Numbered tool list in registry order, followed by the collapsed error summary. */
    public void renderToolList(ToolRegistry registry) {
        if (registry.isEmpty()) {
            renderNoTools();
            renderErrorSummary(registry);
            return;
        }
        out.println("Available tools:");
        List<LoadedTool> tools = registry.getOrderedTools();
        for (int i = 0; i < tools.size(); i++) {
            ToolDescriptor d = tools.get(i).getDescriptor();
            if (d.getDescription().isEmpty()) {
                out.printf("  %2d. %s%n", i + 1, d.getDisplayName());
            } else {
                out.printf("  %2d. %s - %s%n", i + 1, d.getDisplayName(), d.getDescription());
            }
        }
        renderErrorSummary(registry);
    }

    /** One line when there were load errors, nothing otherwise. */
    public void renderErrorSummary(ToolRegistry registry) {
        int count = registry.getErrors().size();
        if (count > 0) {
            out.println("Tool loading issues (" + count + ") - type 'errors'");
        }
    }

    public void renderErrors(ToolRegistry registry) {
        List<LoadError> errors = registry.getErrors();
        if (errors.isEmpty()) {
            out.println("No tool loading issues.");
            return;
        }
        out.println("Tool loading issues (" + errors.size() + "):");
        for (LoadError error : errors) {
            out.println("  " + error.format());
        }
    }

    public void renderInfo(LoadedTool tool) {
        ToolDescriptor d = tool.getDescriptor();
        out.println(d.getDisplayName());
        out.println("  File:        " + tool.getFileName());
        out.println("  Order:       " + d.getPriority());
        out.println("  Numeric id:  " + (d.hasNumericId() ? String.valueOf(d.getNumericId()) : "-"));
        out.println("  Description: " + (d.getDescription().isEmpty() ? "-" : d.getDescription()));
    }

    public void renderNoTools() {
        out.println("No tools found");
        out.println();
        out.println("To add a tool:");
        out.println("  1. Package a class implementing com.tooldeck.tools.Tool (or exposing a public run() method) in a JAR.");
        out.println("  2. Name the entry class in the JAR manifest attribute 'Tool-Class'.");
        out.println("  3. Optionally annotate it with @DeckTool(name, description, order).");
        out.println("  4. Copy it to " + config.getToolsDir().toAbsolutePath()
                + " as " + config.getToolPrefix() + "<n>" + config.getToolSuffix()
                + " (e.g. " + config.getToolPrefix() + "1" + config.getToolSuffix() + ").");
        out.println("  5. Restart the host.");
    }

    public void renderResult(DispatchResult result) {
        switch (result.getStatus()) {
            case COMPLETED:
                out.println(RULE);
                out.println("'" + result.getSelection() + "' finished in " + result.getElapsedMillis() + " ms");
                break;
            case FAILED:
                renderFailure(result.getFailure());
                break;
            case NO_TOOLS:
                renderNoTools();
                break;
            case UNKNOWN_SELECTION:
                out.println(result.getMessage() + ". Type 'list' to see the available tools.");
                break;
            default:
                throw new IllegalStateException("Unhandled dispatch status " + result.getStatus());
        }
    }

    public void renderFailure(DispatchFailureReport report) {
        out.println(RULE);
        out.println("Error running '" + report.getToolName() + "'");
        out.println("Error type: " + report.getErrorType());
        out.println("Message: " + report.getMessage());
        out.println();
        out.print(report.getStackTrace());
        out.println(report.getHint());
    }

    public void renderHelp() {
        out.println("Commands:");
        out.println("  <n> | <name>      run a tool by list number or display name");
        out.println("  <empty line>      run the current tool again");
        out.println("  list              show the tools");
        out.println("  errors            show tool loading issues");
        out.println("  info <n|name>     show details of a tool");
        out.println("  help              show this help");
        out.println("  quit | exit       leave the host");
    }

    public void renderMessage(String message) {
        out.println(message);
    }

    public void renderPrompt(String current) {
        out.print(current != null ? "[" + current + "]> " : "> ");
        out.flush();
    }
}
