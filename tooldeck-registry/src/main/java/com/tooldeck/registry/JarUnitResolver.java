package com.tooldeck.registry;

import com.tooldeck.tools.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.jar.Attributes;
import java.util.jar.JarFile;
import java.util.jar.Manifest;

/**
 * Resolves a tool JAR: reads the entry class name from the manifest attribute
 * {@value Tool#MANIFEST_ATTRIBUTE}, loads it with a {@link URLClassLoader} whose parent is a
 * {@link RestrictedToolClassLoader}, and instantiates it through its public no-argument constructor.
 * Static initializers run here, so exceptions they throw surface as load failures of this candidate.
 */
public final class JarUnitResolver implements UnitResolver {

    private static final Logger log = LoggerFactory.getLogger(JarUnitResolver.class);

    @Override
    public ResolvedUnit resolve(ToolCandidate candidate) throws Exception {
        String className = readEntryClassName(candidate);
        URL jarUrl = candidate.getPath().toUri().toURL();
        URLClassLoader loader = new URLClassLoader(candidate.getFileName(), new URL[]{jarUrl},
                new RestrictedToolClassLoader());
        ResolvedUnit unit = null;
        try {
            Class<?> entryClass = Class.forName(className, true, loader);
            Object instance = entryClass.getDeclaredConstructor().newInstance();
            unit = new ResolvedUnit(instance, loader);
            return unit;
        } finally {
            if (unit == null) {
                closeLoader(candidate, loader);
            }
        }
    }

    private static void closeLoader(ToolCandidate candidate, URLClassLoader loader) {
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("Failed to close class loader for {}: {}", candidate, e.getMessage());
        }
    }

    private static String readEntryClassName(ToolCandidate candidate) throws IOException, ToolResolutionException {
        try (JarFile jar = new JarFile(candidate.getPath().toFile())) {
            Manifest manifest = jar.getManifest();
            if (manifest == null) {
                throw new ToolResolutionException("JAR has no manifest; expected attribute " + Tool.MANIFEST_ATTRIBUTE);
            }
            Attributes attributes = manifest.getMainAttributes();
            String className = attributes.getValue(Tool.MANIFEST_ATTRIBUTE);
            if (className == null || className.isBlank()) {
                throw new ToolResolutionException("JAR manifest has no " + Tool.MANIFEST_ATTRIBUTE + " attribute");
            }
            return className.trim();
        }
    }
}
