package com.ebdgraph.core.generator;

import java.util.Objects;

/**
 * Represents a generated diagram.
 *
 * @param name diagram name, the EBD code
 * @param content diagram text (DOT, Mermaid, ...)
 * @param fileExtension file extension for this content
 */
public record GeneratedDiagram(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDiagram {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the file name this diagram is written to.
     *
     * @return e.g. {@code E_0003.dot}
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
