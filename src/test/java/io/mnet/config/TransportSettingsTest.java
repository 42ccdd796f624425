package io.mnet.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class TransportSettingsTest {

    @Test
    void missingSettingsFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("mnet-test-settings-missing-");
        try {
            TransportSettings settings = MnetConfig.fromRoot(root.toString()).loadSettings();

            Assertions.assertEquals(MnetConfig.DEFAULT_CHANNEL, settings.channel());
            Assertions.assertEquals(8042, settings.mtu());
            Assertions.assertEquals(3_000L, settings.retransmitIntervalMs());
            Assertions.assertEquals(12_000L, settings.dropTimeoutMs());
            Assertions.assertEquals(1L << 32, settings.maxSequence());
            Assertions.assertTrue(settings.forwarding());
            Assertions.assertFalse(settings.routeCache());
            Assertions.assertFalse(settings.hostname().isBlank());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreClampedInsteadOfRejected() throws Exception {
        Path root = Files.createTempDirectory("mnet-test-settings-clamp-");
        try {
            writeSettings(root, """
                    {
                      "hostname": "  node-7 ",
                      "channel": -3,
                      "mtu": 0,
                      "retransmitIntervalMs": 500,
                      "dropTimeoutMs": 100,
                      "maxSequence": 2,
                      "forwarding": false,
                      "routeCache": true,
                      "unknownKnob": 1
                    }
                    """);

            TransportSettings settings = MnetConfig.fromRoot(root.toString()).loadSettings();

            Assertions.assertEquals("node-7", settings.hostname());
            Assertions.assertEquals(0, settings.channel());
            Assertions.assertEquals(1, settings.mtu());
            Assertions.assertEquals(500L, settings.retransmitIntervalMs());
            Assertions.assertEquals(500L, settings.dropTimeoutMs());
            Assertions.assertEquals(4L, settings.maxSequence());
            Assertions.assertFalse(settings.forwarding());
            Assertions.assertTrue(settings.routeCache());
            Assertions.assertEquals(MnetConfig.DEFAULT_ROUTE_TIMEOUT_MS, settings.routeTimeoutMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reservedHostnameInFileFallsBackToDefault() throws Exception {
        Path root = Files.createTempDirectory("mnet-test-settings-reserved-");
        try {
            writeSettings(root, "{\"hostname\": \"*\"}");

            TransportSettings settings = MnetConfig.fromRoot(root.toString()).loadSettings();

            Assertions.assertNotEquals("*", settings.hostname());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreadableFileFailsLoudly() throws Exception {
        Path root = Files.createTempDirectory("mnet-test-settings-broken-");
        try {
            writeSettings(root, "{ not json");

            RuntimeException error = Assertions.assertThrows(RuntimeException.class,
                    () -> MnetConfig.fromRoot(root.toString()).loadSettings());
            Assertions.assertTrue(error.getMessage().startsWith("Failed to load transport settings"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void programmaticSettingsAreValidated() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> TransportSettings.defaults("localhost"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TransportSettings.defaults("*"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TransportSettings.defaults(" "));
        TransportSettings base = TransportSettings.defaults("a");
        Assertions.assertThrows(IllegalArgumentException.class, () -> base.withTimeouts(3_000L, 1_000L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> base.withMtu(0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> base.withMaxSequence(3));
        Assertions.assertEquals(9, base.withChannel(9).channel());
    }

    private static void writeSettings(Path root, String body) throws IOException {
        Files.writeString(root.resolve(MnetConfig.SETTINGS_FILE_NAME), body, StandardCharsets.UTF_8);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
