package com.tooldeck.registry;

import com.tooldeck.config.OrderingMode;
import com.tooldeck.config.ToolDeckConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One discovery pass: scan the tools directory, load and validate each candidate, extract metadata,
 * insert into a registry (last write wins on display name) and order the result.
 * <p>
 * Only a scan failure ({@link ToolScanException}) escapes; every per-candidate failure ends up in
 * {@link ToolRegistry#getErrors()}. Wrap in a {@link ToolRegistryCache} so the pass runs once.
 */
public final class ToolDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ToolDiscovery.class);

    private final Path toolsDir;
    private final ToolSourceScanner scanner;
    private final ToolLoader loader;
    private final ToolMetadataExtractor extractor;
    private final Comparator<ToolDescriptor> ordering;

    public ToolDiscovery(Path toolsDir,
                         ToolSourceScanner scanner,
                         ToolLoader loader,
                         ToolMetadataExtractor extractor,
                         Comparator<ToolDescriptor> ordering) {
        this.toolsDir = Objects.requireNonNull(toolsDir, "toolsDir");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.ordering = Objects.requireNonNull(ordering, "ordering");
    }

    /** Discovery over JAR files as configured. */
    public static ToolDiscovery fromConfig(ToolDeckConfig config) {
        return fromConfig(config, new JarUnitResolver());
    }

    /** Discovery with a custom resolver (e.g. for tests or in-process tools). */
    public static ToolDiscovery fromConfig(ToolDeckConfig config, UnitResolver resolver) {
        Objects.requireNonNull(config, "config");
        OrderingMode mode = config.getOrdering();
        return new ToolDiscovery(
                config.getToolsDir(),
                new ToolSourceScanner(config.getToolPrefix(), config.getToolSuffix()),
                new ToolLoader(resolver, config.getToolSuffix()),
                new ToolMetadataExtractor(config.getToolPrefix(), config.getToolSuffix()),
                OrderingPolicy.forMode(mode));
    }

    /**
     * Runs the pass.
     *
     * @return registry of the tools that loaded, with the errors of those that did not
     * @throws ToolScanException if the tools directory cannot be listed
     */
    public ToolRegistry discover() {
        log.info("Discovering tools in {}", toolsDir.toAbsolutePath());
        List<ToolCandidate> candidates = scanner.scan(toolsDir);
        ToolRegistry.Builder builder = ToolRegistry.builder();
        for (ToolCandidate candidate : candidates) {
            ToolLoadResult result = loader.load(candidate);
            if (!result.isLoaded()) {
                builder.addError(result.getError());
                continue;
            }
            ToolDescriptor descriptor = extractor.extract(result.getEntryClass(), candidate.getFileName());
            LoadedTool tool = new LoadedTool(descriptor, result.getTool(), candidate.getFileName(), result.getUnit());
            LoadedTool replaced = builder.put(tool);
            if (replaced != null) {
                log.warn("Tool name '{}' from {} replaces the one from {}",
                        descriptor.getDisplayName(), candidate.getFileName(), replaced.getFileName());
                replaced.close();
            }
            log.debug("Loaded tool {} from {} (order={}, id={})", descriptor.getDisplayName(),
                    candidate.getFileName(), descriptor.getPriority(), descriptor.getNumericId());
        }
        ToolRegistry registry = builder.build(ordering);
        log.info("Discovered {} tool(s) from {} candidate(s); {} load error(s)",
                registry.size(), candidates.size(), registry.getErrors().size());
        return registry;
    }

    public Path getToolsDir() {
        return toolsDir;
    }
}
