package com.bookkeeper.ingest.normalize;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads a statement export into its header and raw data rows. Files are decoded as UTF-8 and
 * fall back to ISO-8859-1 unless an encoding is forced.
 */
@Component
public class CsvStatementReader {

    private static final Logger log = LoggerFactory.getLogger(CsvStatementReader.class);
    private static final char BOM = '\uFEFF';

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .build();

    public ParsedStatement read(Path file, Charset forcedCharset) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new FileReadException(file, "cannot read file: " + ex.getMessage(), ex);
        }
        Charset charset = forcedCharset;
        String content;
        if (charset != null) {
            content = new String(bytes, charset);
        } else {
            try {
                content = StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
                charset = StandardCharsets.UTF_8;
            } catch (CharacterCodingException ex) {
                log.info("{} is not valid UTF-8; falling back to ISO-8859-1", file.getFileName());
                charset = StandardCharsets.ISO_8859_1;
                content = new String(bytes, charset);
            }
        }
        if (!content.isEmpty() && content.charAt(0) == BOM) {
            content = content.substring(1);
        }
        return parse(file, charset, content);
    }

    private ParsedStatement parse(Path file, Charset charset, String content) {
        List<String> headers = null;
        List<RawRow> rows = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(content, FORMAT)) {
            for (CSVRecord record : parser) {
                List<String> values = new ArrayList<>(record.size());
                record.forEach(values::add);
                if (values.stream().allMatch(v -> v == null || v.isBlank())) {
                    continue;
                }
                if (headers == null) {
                    headers = values;
                    continue;
                }
                rows.add(new RawRow(record.getRecordNumber(), values));
            }
        } catch (IOException | UncheckedIOException | IllegalStateException ex) {
            throw new FileReadException(file, "malformed CSV: " + ex.getMessage(), ex);
        }
        if (headers == null) {
            throw new FileReadException(file, "file has no header row");
        }
        log.debug("Read {} data rows from {} ({} columns, {})", rows.size(), file.getFileName(), headers.size(), charset);
        return new ParsedStatement(file, charset, headers, rows);
    }
}
