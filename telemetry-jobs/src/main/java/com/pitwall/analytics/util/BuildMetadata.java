package com.pitwall.analytics.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version, commit and build time of the running replay, read from the filtered
 * {@code build-info.properties} resource.
 */
public final class BuildMetadata {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(BuildMetadata.class);

    static final String BUILD_INFO_RESOURCE = "build-info.properties";
    private static final BuildMetadata CURRENT = load(BuildMetadata.class.getClassLoader(), BUILD_INFO_RESOURCE);

    private final String version;
    private final String gitCommit;
    private final String builtAt;

    BuildMetadata(String version, String gitCommit, String builtAt) {
        this.version = normalize(version, "dev");
        this.gitCommit = normalize(gitCommit, "unknown");
        this.builtAt = normalize(builtAt, null);
    }

    public static BuildMetadata current() {
        return CURRENT;
    }

    static BuildMetadata fromProperties(Properties props) {
        return new BuildMetadata(
                props.getProperty("build.version"),
                props.getProperty("build.git.commit"),
                props.getProperty("build.timestamp"));
    }

    static BuildMetadata load(ClassLoader loader, String resource) {
        Properties props = new Properties();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                LOG.debug("No {} on the classpath, using development defaults", resource);
            } else {
                props.load(in);
            }
        } catch (IOException ex) {
            LOG.debug("Unreadable {}: {}", resource, ex.getMessage());
        }
        return fromProperties(props);
    }

    public String version() {
        return version;
    }

    public String gitCommit() {
        return gitCommit;
    }

    /** Build time as written by Maven, or {@code null} outside a packaged build. */
    public String builtAt() {
        return builtAt;
    }

    /** {@code version+commit}, with the build time appended when known. */
    public String identity() {
        String identity = version + "+" + gitCommit;
        return builtAt == null ? identity : identity + " (" + builtAt + ")";
    }

    static String normalize(String value, String fallback) {
        if (StringSemantics.isBlank(value)) {
            return fallback;
        }
        String trimmed = value.trim();
        // Unfiltered placeholder, e.g. when running from an IDE.
        if (trimmed.startsWith("${") && trimmed.endsWith("}")) {
            return fallback;
        }
        return trimmed;
    }
}
