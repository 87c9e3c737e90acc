package me.golemcore.soundboard.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageConfigTest {

    @Test
    void shouldExpandUserHome() {
        Path resolved = StorageConfig.resolvePath("${user.home}/.soundboard/soundboard");

        assertEquals(Paths.get(System.getProperty("user.home"), ".soundboard", "soundboard").toAbsolutePath(),
                resolved);
    }

    @Test
    void shouldStripH2FileSuffix() {
        Path resolved = StorageConfig.resolvePath("/var/lib/soundboard/data.mv.db");

        assertEquals("data", resolved.getFileName().toString());
    }

    @Test
    void shouldCreateParentDirectoriesForStorage(@TempDir Path tempDir) throws Exception {
        SoundboardProperties properties = new SoundboardProperties();
        Path dbPath = tempDir.resolve("nested").resolve("sounds");
        properties.getStorage().setPath(dbPath.toString());

        new StorageConfig().storagePort(properties);

        assertTrue(Files.isDirectory(tempDir.resolve("nested")));
    }
}
