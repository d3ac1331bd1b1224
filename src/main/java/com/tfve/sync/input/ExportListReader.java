package com.tfve.sync.input;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the export list, one mapping per line:
 *
 * <pre>
 * # output name, variable name, optional description
 * number_float,number_float_copy,number_float_description
 * set_of_object,set_of_object_copy
 * </pre>
 *
 * Blank lines and lines starting with {@code #} are skipped. The description is everything after the
 * second comma, so it may itself contain commas.
 */
public class ExportListReader {

    private static final Logger log = LoggerFactory.getLogger(ExportListReader.class);

    /**
     * @return entries keyed by source output name, in file order
     * @throws InputException when the file cannot be read, holds no entry, has a line without a destination,
     *                        or repeats a source or destination name
     */
    public Map<String, ExportListEntry> read(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InputException("Cannot read export list " + path, e);
        }

        Map<String, ExportListEntry> entries = new LinkedHashMap<>();
        Set<String> destinations = new HashSet<>();
        int lineNumber = 0;
        for (String raw : lines) {
            lineNumber++;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            String[] record = line.split(",", 3);
            String source = record[0].trim();
            String destination = record.length > 1 ? record[1].trim() : "";
            if (source.isEmpty() || destination.isEmpty()) {
                throw new InputException(path + ":" + lineNumber + ": expected 'source,destination[,description]'");
            }
            String description = record.length > 2 && !record[2].isBlank() ? record[2].trim() : null;

            if (entries.containsKey(source)) {
                throw new InputException(path + ":" + lineNumber + ": output '" + source + "' is listed twice");
            }
            if (!destinations.add(destination)) {
                throw new InputException(path + ":" + lineNumber + ": variable '" + destination + "' is listed twice");
            }
            entries.put(source, new ExportListEntry(source, destination, description));
        }

        if (entries.isEmpty()) {
            throw new InputException("No entry found in export list " + path);
        }
        log.info("Read {} entries from export list {}", entries.size(), path);
        return entries;
    }
}
