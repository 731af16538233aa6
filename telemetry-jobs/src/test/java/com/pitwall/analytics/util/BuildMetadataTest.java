package com.pitwall.analytics.util;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuildMetadataTest {

    @Test
    void unfilteredPlaceholdersFallBackToDefaults() {
        BuildMetadata metadata = new BuildMetadata("${project.version}", "${git.commit}", "${build.timestamp}");

        assertEquals("dev", metadata.version());
        assertEquals("unknown", metadata.gitCommit());
        assertNull(metadata.builtAt());
        assertEquals("dev+unknown", metadata.identity());
    }

    @Test
    void identityIncludesBuildTimeWhenKnown() {
        Properties props = new Properties();
        props.setProperty("build.version", " 0.1.0 ");
        props.setProperty("build.git.commit", "abc1234\n");
        props.setProperty("build.timestamp", "2024-03-02T12:00:00Z");

        BuildMetadata metadata = BuildMetadata.fromProperties(props);

        assertEquals("0.1.0+abc1234 (2024-03-02T12:00:00Z)", metadata.identity());
    }

    @Test
    void missingResourceUsesDevelopmentDefaults() {
        BuildMetadata metadata = BuildMetadata.load(getClass().getClassLoader(), "no-such-build-info.properties");

        assertEquals("dev+unknown", metadata.identity());
    }

    @Test
    void currentIsAlwaysAvailable() {
        BuildMetadata current = BuildMetadata.current();

        assertNotNull(current);
        assertTrue(current.identity().contains("+"));
    }
}
