package com.tfve.sync.input;

/**
 * One line of the export list: {@code source,destination[,description]}.
 *
 * @param source output name in the output document
 * @param destination variable key in the workspace
 * @param description optional variable description, {@code null} when absent or empty
 */
public record ExportListEntry(String source, String destination, String description) {
}
