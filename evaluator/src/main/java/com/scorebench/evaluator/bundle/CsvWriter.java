package com.scorebench.evaluator.bundle;

import java.util.Arrays;
import java.util.List;

/**
 * Minimal RFC 4180 writer: CRLF row terminator, cells quoted only when they
 * contain a comma, quote, CR or LF. Null cells are written empty.
 */
public final class CsvWriter {

    private final StringBuilder out = new StringBuilder();

    public CsvWriter row(Object... cells) {
        return row(Arrays.asList(cells));
    }

    public CsvWriter row(List<?> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) out.append(',');
            out.append(escape(cells.get(i)));
        }
        out.append("\r\n");
        return this;
    }

    static String escape(Object cell) {
        if (cell == null) return "";
        String s = cell.toString();
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0 && s.indexOf('\n') < 0 && s.indexOf('\r') < 0) {
            return s;
        }
        return '"' + s.replace("\"", "\"\"") + '"';
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
