package com.mossbauer.common.ingestion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses headerless delimited text whose delimiter is not known up front.
 *
 * <p>Delimiters are tried in order — tab, space, comma, semicolon — and the first one
 * that yields at least two columns wins. The column count is taken from the first
 * non-blank line; a delimiter under which a later line has more fields than that is
 * rejected outright. Shorter lines are padded with missing cells.
 */
final class DelimitedTextParser {

    private static final Logger log = LoggerFactory.getLogger(DelimitedTextParser.class);

    private static final List<Delimiter> DELIMITERS = List.of(
        new Delimiter("tab",       Pattern.compile("\t")),
        new Delimiter("space",     Pattern.compile(" +")),
        new Delimiter("comma",     Pattern.compile(",")),
        new Delimiter("semicolon", Pattern.compile(";"))
    );

    private record Delimiter(String name, Pattern pattern) {}

    private record SourceLine(int index, String text) {}

    private DelimitedTextParser() {}

    static RawTable parse(byte[] raw) {
        List<SourceLine> lines = lines(raw);
        RawTable last = RawTable.EMPTY;
        for (Delimiter delimiter : DELIMITERS) {
            RawTable table = split(lines, delimiter);
            if (table == null) {
                continue;
            }
            last = table;
            if (table.columnCount() >= 2) {
                log.debug("[Ingestion] Delimiter detected. delimiter={} columns={} rows={}",
                    delimiter.name(), table.columnCount(), table.rowCount());
                return table;
            }
        }
        return last;
    }

    /** Non-blank lines, each with its zero-based line number in the file. */
    private static List<SourceLine> lines(byte[] raw) {
        String text = new String(raw, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        List<SourceLine> lines = new ArrayList<>();
        String[] physical = text.split("\r\n|\r|\n");
        for (int i = 0; i < physical.length; i++) {
            if (!physical[i].isBlank()) {
                lines.add(new SourceLine(i, physical[i].strip()));
            }
        }
        return lines;
    }

    /** Returns {@code null} when a line has more fields than the first one. */
    private static RawTable split(List<SourceLine> lines, Delimiter delimiter) {
        if (lines.isEmpty()) {
            return RawTable.EMPTY;
        }
        int width = delimiter.pattern().split(lines.get(0).text(), -1).length;
        List<RawTable.Line> rows = new ArrayList<>(lines.size());
        for (SourceLine line : lines) {
            String[] fields = delimiter.pattern().split(line.text(), -1);
            if (fields.length > width) {
                return null;
            }
            String[] row = new String[width];
            for (int c = 0; c < fields.length; c++) {
                row[c] = fields[c].strip();
            }
            rows.add(new RawTable.Line(line.index(), row));
        }
        return new RawTable(rows, width);
    }
}
