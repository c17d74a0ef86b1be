package cronarchy.scheduler.daemon;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Finds the environment entry file by walking up from a start directory.
 * At each level the known layouts are tried in order.
 */
public final class EnvironmentLocator {

    public static final String ENTRY_FILE = "cronarchy.conf";

    /** Layouts relative to each searched directory */
    static final List<String> LAYOUTS = List.of("", "conf", "config");

    private final String entryFile;
    private final int maxLevels;

    public EnvironmentLocator(int maxLevels) {
        this(ENTRY_FILE, maxLevels);
    }

    public EnvironmentLocator(String entryFile, int maxLevels) {
        this.entryFile = entryFile;
        this.maxLevels = maxLevels;
    }

    /**
     * Search {@code start} and at most {@code maxLevels - 1} of its parents.
     *
     * @return the readable entry file, or empty if none was found within the bound
     */
    public Optional<Path> locate(Path start, DaemonLog log) {
        Path directory = start.toAbsolutePath().normalize();
        int level = 0;

        do {
            log.line("Searching in \"" + directory + "\"");
            Optional<Path> found = locateIn(directory);
            if (found.isPresent()) {
                log.line("Found environment: \"" + found.get() + "\"");
                return found;
            }
            directory = directory.getParent();
            level++;
        } while (directory != null && Files.isDirectory(directory) && level < maxLevels);

        log.line("Could not find " + entryFile + " within " + maxLevels + " directories");
        return Optional.empty();
    }

    private Optional<Path> locateIn(Path directory) {
        for (String layout : LAYOUTS) {
            Path candidate = layout.isEmpty()
                    ? directory.resolve(entryFile)
                    : directory.resolve(layout).resolve(entryFile);
            if (Files.isRegularFile(candidate) && Files.isReadable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public int maxLevels() {
        return maxLevels;
    }
}
