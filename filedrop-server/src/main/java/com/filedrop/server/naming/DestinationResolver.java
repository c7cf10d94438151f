package com.filedrop.server.naming;

import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.slf4j.Slf4j;

/**
 * Picks a destination path that does not clobber an existing file:
 * {@code a.txt}, then {@code a_1.txt}, {@code a_2.txt}, ...
 *
 * Probing is not atomic with file creation; two sessions resolving the same
 * name at the same time can end up on the same path.
 */
@Slf4j
public final class DestinationResolver {

    private DestinationResolver() {
    }

    /**
     * @param directory target directory
     * @param filename  an already sanitized filename
     * @return the first candidate path that does not exist
     */
    public static Path resolve(Path directory, String filename) {
        Path candidate = directory.resolve(filename);
        if (!Files.exists(candidate)) {
            return candidate;
        }

        int dot = FilenameSanitizer.extensionIndex(filename);
        String stem = dot >= 0 ? filename.substring(0, dot) : filename;
        String extension = dot >= 0 ? filename.substring(dot) : "";

        int counter = 1;
        do {
            candidate = directory.resolve(stem + "_" + counter + extension);
            counter++;
        } while (Files.exists(candidate));

        log.debug("{} exists in {}, using {}", filename, directory, candidate.getFileName());
        return candidate;
    }
}
