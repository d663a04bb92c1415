package com.ebdgraph.core.loader;

import com.ebdgraph.core.table.EbdTable;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads decision tables from JSON ({@code .json}) or YAML ({@code .yaml}, {@code .yml}) files.
 *
 * <p>Step results are discriminated by their {@code type} property:
 * <pre>{@code
 * {
 *   "metadata": {"ebdCode": "E_0003", "role": "ÜNB"},
 *   "rows": [
 *     {"stepNumber": "1", "description": "Erfolgt der Eingang ...?",
 *      "outcomes": {
 *        "ja":   {"type": "continue", "step": "2"},
 *        "nein": {"type": "terminal", "endCode": "A01", "label": "Fristüberschreitung"}}}
 *   ]
 * }
 * }</pre>
 */
public final class TableLoader {

    private static final Logger log = LoggerFactory.getLogger(TableLoader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private TableLoader() {
    }

    /**
     * Loads a table, choosing the format by file extension.
     *
     * @param file table file
     * @return table; structurally valid, references not yet checked
     * @throws TableLoadException if the file is unreadable, has an unknown extension or is malformed
     */
    public static EbdTable load(Path file) throws TableLoadException {
        ObjectMapper mapper = mapperFor(file);
        if (!Files.isRegularFile(file)) {
            throw new TableLoadException(file, "file not found", null);
        }
        try {
            log.debug("Loading table from: {}", file);
            EbdTable table = mapper.readValue(file.toFile(), EbdTable.class);
            if (table == null) {
                throw new TableLoadException(file, "file is empty", null);
            }
            log.info("Loaded table {} with {} rows", table.metadata().ebdCode(), table.rows().size());
            return table;
        } catch (JacksonException e) {
            throw new TableLoadException(file, rootMessage(e), e);
        } catch (TableLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new TableLoadException(file, e.getMessage(), e);
        }
    }

    private static ObjectMapper mapperFor(Path file) throws TableLoadException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return JSON_MAPPER;
        }
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return YAML_MAPPER;
        }
        throw new TableLoadException(file, "unsupported file type, expected .json, .yaml or .yml", null);
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
