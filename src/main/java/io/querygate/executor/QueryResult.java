package io.querygate.executor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record QueryResult(List<Map<String, Object>> rows, long bytesScanned) {
    public static final String ROWS = "rows";
    public static final String BYTES_SCANNED = "bytes_scanned";

    public QueryResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
        if (bytesScanned < 0L) {
            throw new IllegalArgumentException("bytesScanned must be non-negative: " + bytesScanned);
        }
    }

    /** Step output in its wire shape: {@code {"rows": [...], "bytes_scanned": n}}. */
    public Map<String, Object> toOutput() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(ROWS, rows);
        out.put(BYTES_SCANNED, bytesScanned);
        return out;
    }
}
