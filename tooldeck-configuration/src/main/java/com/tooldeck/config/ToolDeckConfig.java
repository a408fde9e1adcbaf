package com.tooldeck.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for the Tool Deck host, loaded from environment variables and an optional JSON file.
 * <p>
 * Tools: TOOLDECK_TOOLS_DIR, TOOLDECK_TOOL_PREFIX, TOOLDECK_TOOL_SUFFIX. Ordering: TOOLDECK_ORDERING
 * ({@code NUMERIC_ID} or {@code PRIORITY}). File: TOOLDECK_CONFIG_FILE; environment values override it.
 */
public final class ToolDeckConfig {

    private static final Logger log = LoggerFactory.getLogger(ToolDeckConfig.class);

    static final String ENV_TOOLS_DIR = "TOOLDECK_TOOLS_DIR";
    static final String ENV_TOOL_PREFIX = "TOOLDECK_TOOL_PREFIX";
    static final String ENV_TOOL_SUFFIX = "TOOLDECK_TOOL_SUFFIX";
    static final String ENV_ORDERING = "TOOLDECK_ORDERING";
    static final String ENV_CONFIG_FILE = "TOOLDECK_CONFIG_FILE";

    public static final String DEFAULT_TOOLS_DIR = "tools";
    public static final String DEFAULT_TOOL_PREFIX = "code";
    public static final String DEFAULT_TOOL_SUFFIX = ".jar";
    public static final OrderingMode DEFAULT_ORDERING = OrderingMode.NUMERIC_ID;

    private final Path toolsDir;
    private final String toolPrefix;
    private final String toolSuffix;
    private final OrderingMode ordering;

    private ToolDeckConfig(Builder b) {
        this.toolsDir = b.toolsDir;
        this.toolPrefix = b.toolPrefix;
        this.toolSuffix = b.toolSuffix;
        this.ordering = b.ordering;
    }

    /** Directory scanned for tool JARs (not recursive). Default {@value #DEFAULT_TOOLS_DIR}. */
    public Path getToolsDir() {
        return toolsDir;
    }

    /** File name prefix a tool JAR must start with. Default {@value #DEFAULT_TOOL_PREFIX}. */
    public String getToolPrefix() {
        return toolPrefix;
    }

    /** File name suffix a tool JAR must end with. Default {@value #DEFAULT_TOOL_SUFFIX}. */
    public String getToolSuffix() {
        return toolSuffix;
    }

    /** Ordering of the tool list. Default {@link OrderingMode#NUMERIC_ID}. */
    public OrderingMode getOrdering() {
        return ordering;
    }

    /** Returns a copy with a different tools directory (e.g. from the command line). */
    public ToolDeckConfig withToolsDir(Path dir) {
        return builder()
                .toolsDir(dir)
                .toolPrefix(toolPrefix)
                .toolSuffix(toolSuffix)
                .ordering(ordering)
                .build();
    }

    public static ToolDeckConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds the configuration from the given environment map. If TOOLDECK_CONFIG_FILE is set the file
     * is read first and environment values are applied on top of it.
     *
     * @throws ToolDeckConfigException if TOOLDECK_CONFIG_FILE is set but cannot be read
     */
    public static ToolDeckConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder builder = builder();

        String configFile = getEnv(env, ENV_CONFIG_FILE, null);
        if (configFile != null) {
            ToolDeckConfigFile file = ToolDeckConfigFile.read(Path.of(configFile));
            log.info("Loaded configuration file {}", configFile);
            applyFile(builder, file);
        }

        String toolsDir = getEnv(env, ENV_TOOLS_DIR, null);
        if (toolsDir != null) {
            builder.toolsDir(Path.of(toolsDir));
        }
        builder.toolPrefix(getEnv(env, ENV_TOOL_PREFIX, builder.toolPrefix));
        builder.toolSuffix(getEnv(env, ENV_TOOL_SUFFIX, builder.toolSuffix));
        builder.ordering(parseOrdering(getEnv(env, ENV_ORDERING, null), builder.ordering));
        return builder.build();
    }

    private static void applyFile(Builder builder, ToolDeckConfigFile file) {
        if (file.getToolsDir() != null && !file.getToolsDir().isBlank()) {
            builder.toolsDir(Path.of(file.getToolsDir().trim()));
        }
        if (file.getToolPrefix() != null && !file.getToolPrefix().isBlank()) {
            builder.toolPrefix(file.getToolPrefix().trim());
        }
        if (file.getToolSuffix() != null && !file.getToolSuffix().isBlank()) {
            builder.toolSuffix(file.getToolSuffix().trim());
        }
        builder.ordering(parseOrdering(file.getOrdering(), builder.ordering));
    }

    private static OrderingMode parseOrdering(String value, OrderingMode defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        OrderingMode mode = OrderingMode.parse(value);
        if (mode == null) {
            log.warn("Unknown ordering '{}'; using {}", value, defaultValue);
            return defaultValue;
        }
        return mode;
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path toolsDir = Path.of(DEFAULT_TOOLS_DIR);
        private String toolPrefix = DEFAULT_TOOL_PREFIX;
        private String toolSuffix = DEFAULT_TOOL_SUFFIX;
        private OrderingMode ordering = DEFAULT_ORDERING;

        public Builder toolsDir(Path toolsDir) {
            this.toolsDir = Objects.requireNonNull(toolsDir, "toolsDir");
            return this;
        }

        public Builder toolPrefix(String toolPrefix) {
            this.toolPrefix = toolPrefix != null ? toolPrefix : DEFAULT_TOOL_PREFIX;
            return this;
        }

        public Builder toolSuffix(String toolSuffix) {
            this.toolSuffix = toolSuffix != null ? toolSuffix : DEFAULT_TOOL_SUFFIX;
            return this;
        }

        public Builder ordering(OrderingMode ordering) {
            this.ordering = ordering != null ? ordering : DEFAULT_ORDERING;
            return this;
        }

        public ToolDeckConfig build() {
            return new ToolDeckConfig(this);
        }
    }
}
