package com.example.socksrelay;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class ConfigTest {

    @TempDir
    Path dir;

    @Test
    public void defaults() {
        Config cfg = new Config();
        assertEquals("::", cfg.bindAddress);
        assertEquals(6000, cfg.port);
        assertEquals(10000, cfg.connectTimeout);
        assertEquals(10000L, cfg.shutdownTimeout);
        assertNull(cfg.acl);
    }

    @Test
    public void missingFileFallsBackToDefaults() throws Exception {
        Config cfg = Config.loadOrDefault(dir.resolve("absent.yaml").toString());
        assertEquals(6000, cfg.port);
    }

    @Test
    public void loadsYaml() throws Exception {
        Path file = dir.resolve("config.yaml");
        Files.write(file, String.join("\n",
                "bindAddress: 127.0.0.1",
                "port: 1080",
                "connectTimeout: 2500",
                "acl:",
                "  deny:",
                "    - ads.example.com",
                "unknownKey: ignored",
                "").getBytes(StandardCharsets.UTF_8));

        Config cfg = Config.loadOrDefault(file.toString());
        assertEquals("127.0.0.1", cfg.bindAddress);
        assertEquals(1080, cfg.port);
        assertEquals(2500, cfg.connectTimeout);
        assertEquals(10000L, cfg.shutdownTimeout);
        assertEquals(List.of("ads.example.com"), cfg.acl.deny);
        assertNull(cfg.acl.allow);
    }
}
