package ircube.convert.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Supplies the files a batch run should convert.
 *
 * <p>Keeps the batch loop independent of where the paths come from: a directory listing,
 * a command line, or an interactive chooser living outside this library.</p>
 */
@FunctionalInterface
public interface PathListProvider {

    /**
     * @return the files to convert, in the order they should be processed
     * @throws IOException if the paths cannot be enumerated
     */
    List<Path> listPaths() throws IOException;
}
