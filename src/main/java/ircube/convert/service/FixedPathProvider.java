package ircube.convert.service;

import java.nio.file.Path;
import java.util.List;

/**
 * Provider for an explicit, pre-selected list of files.
 */
public class FixedPathProvider implements PathListProvider {

    private final List<Path> paths;

    public FixedPathProvider(List<Path> paths) {
        this.paths = List.copyOf(paths);
    }

    @Override
    public List<Path> listPaths() {
        return paths;
    }
}
