package com.bookkeeper.ingest.service;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * @param since          rows dated before this day are left out; {@code null} imports everything
 * @param sourceFrom     {@code filename} or the header of a column carrying the source label
 * @param assumeEncoding forced charset; {@code null} lets the reader sniff UTF-8 and fall back to Latin-1
 */
public record ImportOptions(
        Path inputDir,
        LocalDate since,
        boolean recursive,
        boolean dryRun,
        String sourceFrom,
        Charset assumeEncoding
) {
    public static final String SOURCE_FROM_FILENAME = "filename";

    public ImportOptions {
        Objects.requireNonNull(inputDir, "inputDir must be provided");
        if (sourceFrom == null || sourceFrom.isBlank()) {
            sourceFrom = SOURCE_FROM_FILENAME;
        } else {
            sourceFrom = sourceFrom.trim();
        }
    }

    /**
     * Header name to read the source label from, or {@code null} when it comes from the file name.
     */
    public String sourceColumn() {
        return SOURCE_FROM_FILENAME.equals(sourceFrom.toLowerCase(Locale.ROOT)) ? null : sourceFrom;
    }
}
