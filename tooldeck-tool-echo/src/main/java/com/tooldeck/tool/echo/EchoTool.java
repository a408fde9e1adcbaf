package com.tooldeck.tool.echo;

import com.tooldeck.annotations.DeckTool;
import com.tooldeck.annotations.ResourceCleanup;
import com.tooldeck.tools.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sample tool that prints "ECHO: " + text to the console. The text comes from the system property
 * {@code tooldeck.echo.text}, or the environment variable {@code TOOLDECK_ECHO_TEXT}.
 * Packaged as {@code code1_echo.jar}; copy it into the tools directory to try the host.
 */
@DeckTool(name = "Echo", description = "Prints a line of text back to the console", order = 1)
public final class EchoTool implements Tool, ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(EchoTool.class);

    static final String PROPERTY = "tooldeck.echo.text";
    static final String ENV = "TOOLDECK_ECHO_TEXT";
    static final String DEFAULT_TEXT = "Hello from Tool Deck";
    private static final String PREFIX = "ECHO: ";

    private final PrintStream out;
    private final AtomicInteger runs = new AtomicInteger();

    public EchoTool() {
        this(System.out);
    }

    EchoTool(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void run() {
        String text = text();
        out.println(PREFIX + text);
        log.debug("Echo run #{}", runs.incrementAndGet());
    }

    @Override
    public void onExit() {
        log.info("Echo tool ran {} time(s)", runs.get());
    }

    int getRuns() {
        return runs.get();
    }

    static String text() {
        String value = System.getProperty(PROPERTY);
        if (value == null || value.isBlank()) {
            value = System.getenv(ENV);
        }
        return value != null && !value.isBlank() ? value.trim() : DEFAULT_TEXT;
    }
}
