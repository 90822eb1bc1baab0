package de.bsommerfeld.selfupdate.version;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Identifies the running build.
 *
 * <p>
 * Only {@link #code()} takes part in ordering; {@link #name()} is shown to
 * users and never compared. The values are stamped into
 * {@code selfupdate-version.properties} at build time via Maven resource
 * filtering, so they always match the artifact that is actually running.
 *
 * @param name human-readable version, e.g. {@code "1.1.0"}
 * @param code monotonically increasing release number
 */
public record VersionDescriptor(String name, long code) {

    static final String RESOURCE = "/selfupdate-version.properties";

    public VersionDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Version name must not be blank");
        }
    }

    /**
     * Loads the descriptor of the running build from the classpath.
     *
     * @throws IOException if the resource is missing or malformed
     */
    public static VersionDescriptor fromClasspath() throws IOException {
        try (InputStream in = VersionDescriptor.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing build version resource: " + RESOURCE);
            }
            return load(in);
        }
    }

    static VersionDescriptor load(InputStream in) throws IOException {
        Properties props = new Properties();
        props.load(in);

        String name = props.getProperty("version.name");
        String code = props.getProperty("version.code");
        if (name == null || code == null) {
            throw new IOException("Build version resource must define version.name and version.code");
        }
        try {
            return new VersionDescriptor(name.strip(), Long.parseLong(code.strip()));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid build version: " + name + " / " + code, e);
        }
    }
}
