package com.ebdgraph.core.loader;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a table file cannot be read or does not describe a well-formed table.
 */
public class TableLoadException extends IOException {

    private final Path source;

    public TableLoadException(Path source, String message, Throwable cause) {
        super("Cannot load table " + source + ": " + message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
