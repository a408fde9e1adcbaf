package com.tooldeck.registry;

import com.tooldeck.tools.Tool;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

/** Builds tool JARs from compiled test classes. */
final class TestJars {

    private TestJars() {
    }

    /**
     * Writes a JAR containing the bytecode of the given classes.
     *
     * @param toolClass value of the Tool-Class attribute; null = no attribute
     */
    static Path write(Path jar, String toolClass, Class<?>... classes) throws IOException {
        Manifest manifest = new Manifest();
        Attributes attributes = manifest.getMainAttributes();
        attributes.put(Attributes.Name.MANIFEST_VERSION, "1.0");
        if (toolClass != null) {
            attributes.putValue(Tool.MANIFEST_ATTRIBUTE, toolClass);
        }
        try (OutputStream out = Files.newOutputStream(jar);
             JarOutputStream jarOut = new JarOutputStream(out, manifest)) {
            for (Class<?> c : classes) {
                String resource = c.getName().replace('.', '/') + ".class";
                jarOut.putNextEntry(new JarEntry(resource));
                try (InputStream in = TestJars.class.getClassLoader().getResourceAsStream(resource)) {
                    if (in == null) {
                        throw new IOException("Class file not found: " + resource);
                    }
                    in.transferTo(jarOut);
                }
                jarOut.closeEntry();
            }
        }
        return jar;
    }
}
