package ircube.convert.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Lists the regular files of one directory (not recursive) that pass an eligibility test.
 *
 * <p>Files are returned in directory-listing order, which depends on the file system and is
 * not sorted.</p>
 */
public class DirectoryPathProvider implements PathListProvider {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryPathProvider.class);

    private final Path directory;
    private final Predicate<Path> eligible;

    public DirectoryPathProvider(Path directory, Predicate<Path> eligible) {
        this.directory = directory;
        this.eligible = eligible;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public List<Path> listPaths() throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a directory: " + directory);
        }
        List<Path> paths = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry) && eligible.test(entry)) {
                    paths.add(entry);
                }
            }
        }
        logger.debug("Found {} eligible files in {}", paths.size(), directory);
        return paths;
    }
}
