package cronarchy.scheduler.daemon;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentLocatorTest {

    @TempDir
    Path root;

    private final DaemonLog quiet = DaemonLog.open("locator-test", false, null);

    @Test
    void findsEntryFileInStartDirectory() throws Exception {
        Path entry = Files.writeString(root.resolve("cronarchy.conf"), "");

        assertEquals(Optional.of(entry), new EnvironmentLocator(1).locate(root, quiet));
    }

    @Test
    void walksUpToParent() throws Exception {
        Path entry = Files.writeString(root.resolve("cronarchy.conf"), "");
        Path start = Files.createDirectories(root.resolve("a").resolve("b"));

        assertEquals(Optional.of(entry), new EnvironmentLocator(3).locate(start, quiet));
    }

    @Test
    void searchIsBoundedByMaxLevels() throws Exception {
        Files.writeString(root.resolve("cronarchy.conf"), "");
        Path start = Files.createDirectories(root.resolve("a").resolve("b"));

        assertTrue(new EnvironmentLocator(2).locate(start, quiet).isEmpty());
    }

    @Test
    void triesKnownLayoutsInOrder() throws Exception {
        Path conf = Files.createDirectories(root.resolve("conf"));
        Path config = Files.createDirectories(root.resolve("config"));
        Files.writeString(config.resolve("cronarchy.conf"), "");
        Path preferred = Files.writeString(conf.resolve("cronarchy.conf"), "");

        assertEquals(Optional.of(preferred), new EnvironmentLocator(1).locate(root, quiet));
    }

    @Test
    void nearestLevelWins() throws Exception {
        Files.writeString(root.resolve("cronarchy.conf"), "");
        Path child = Files.createDirectories(root.resolve("site").resolve("config"));
        Path nearer = Files.writeString(child.resolve("cronarchy.conf"), "");

        assertEquals(Optional.of(nearer), new EnvironmentLocator(5).locate(root.resolve("site"), quiet));
    }

    @Test
    void directoryWithEntryNameIsIgnored() throws Exception {
        Files.createDirectories(root.resolve("cronarchy.conf"));

        assertTrue(new EnvironmentLocator(1).locate(root, quiet).isEmpty());
    }

    @Test
    void customEntryFileName() throws Exception {
        Path entry = Files.writeString(root.resolve("site.env"), "");

        assertEquals(Optional.of(entry), new EnvironmentLocator("site.env", 1).locate(root, quiet));
    }
}
