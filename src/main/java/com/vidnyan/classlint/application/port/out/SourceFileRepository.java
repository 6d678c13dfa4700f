package com.vidnyan.classlint.application.port.out;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port for reading, writing and discovering source files.
 */
public interface SourceFileRepository {

    /**
     * Discover the source files under a path. A regular file is returned as-is, a missing
     * path yields no files.
     */
    List<Path> scan(Path root) throws IOException;

    String read(Path file) throws IOException;

    void write(Path file, String contents) throws IOException;
}
