package com.testament.core.logging;

import com.testament.core.config.TestamentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Creates one timestamped folder per run under the logs folder and keeps at most
 * {@code maxSubFolders} of them, deleting the oldest first.
 */
@Component
public class RunFolderManager {

    private static final Logger log = LoggerFactory.getLogger(RunFolderManager.class);

    public static final DateTimeFormatter FOLDER_FORMAT = DateTimeFormatter.ofPattern("MM-dd-yyyy_HH-mm-ss");

    private final Path logsFolder;

    @Autowired
    public RunFolderManager(TestamentProperties properties) {
        this(Path.of(properties.getLogs().getFolder()));
    }

    public RunFolderManager(Path logsFolder) {
        this.logsFolder = logsFolder;
    }

    public Path logsFolder() {
        return logsFolder;
    }

    /**
     * Creates the folder for a run started at {@code startedAt}, then rotates old folders.
     * Two runs in the same second get {@code _1}, {@code _2}... suffixes.
     */
    public Path create(LocalDateTime startedAt, int maxSubFolders) throws IOException {
        Files.createDirectories(logsFolder);
        String base = FOLDER_FORMAT.format(startedAt);
        Path folder = logsFolder.resolve(base);
        for (int i = 1; Files.exists(folder); i++) {
            folder = logsFolder.resolve(base + "_" + i);
        }
        Files.createDirectories(folder);
        rotate(maxSubFolders);
        log.debug("Run folder {}", folder);
        return folder;
    }

    /** Deletes the oldest run folders until at most {@code maxSubFolders} remain. */
    public void rotate(int maxSubFolders) throws IOException {
        if (maxSubFolders <= 0) {
            return;
        }
        List<Path> folders;
        try (Stream<Path> stream = Files.list(logsFolder)) {
            folders = stream.filter(Files::isDirectory)
                    .sorted(Comparator.comparing(RunFolderManager::lastModified).thenComparing(Path::toString))
                    .toList();
        }
        for (int i = 0; i < folders.size() - maxSubFolders; i++) {
            deleteRecursively(folders.get(i));
        }
    }

    private static long lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }

    private static void deleteRecursively(Path folder) throws IOException {
        log.debug("Removing old run folder {}", folder);
        try (Stream<Path> walk = Files.walk(folder)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }
}
