package com.tooldeck.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Optional JSON configuration file. All keys are optional; environment variables win over file values.
 * <pre>
 * {"toolsDir": "/opt/tooldeck/tools", "toolPrefix": "code", "toolSuffix": ".jar", "ordering": "PRIORITY"}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ToolDeckConfigFile {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String toolsDir;
    private final String toolPrefix;
    private final String toolSuffix;
    private final String ordering;

    @JsonCreator
    public ToolDeckConfigFile(@JsonProperty("toolsDir") String toolsDir,
                              @JsonProperty("toolPrefix") String toolPrefix,
                              @JsonProperty("toolSuffix") String toolSuffix,
                              @JsonProperty("ordering") String ordering) {
        this.toolsDir = toolsDir;
        this.toolPrefix = toolPrefix;
        this.toolSuffix = toolSuffix;
        this.ordering = ordering;
    }

    /**
     * Reads and parses the given file.
     *
     * @throws ToolDeckConfigException if the file cannot be read or is not valid JSON
     */
    public static ToolDeckConfigFile read(Path file) {
        try {
            String json = Files.readString(file);
            if (json.isBlank()) {
                return new ToolDeckConfigFile(null, null, null, null);
            }
            return MAPPER.readValue(json, ToolDeckConfigFile.class);
        } catch (IOException e) {
            throw new ToolDeckConfigException("Failed to read config file " + file + ": " + e.getMessage(), e);
        }
    }

    public String getToolsDir() {
        return toolsDir;
    }

    public String getToolPrefix() {
        return toolPrefix;
    }

    public String getToolSuffix() {
        return toolSuffix;
    }

    public String getOrdering() {
        return ordering;
    }
}
