package com.bookkeeper.ingest.normalize;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;

public record ParsedStatement(Path file, Charset charset, List<String> headers, List<RawRow> rows) {

    public ParsedStatement {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }

    public String fileStem() {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
