package io.querygate.model;

import java.util.List;

/**
 * Result of one static safety evaluation. Reasons are ordered by detection priority; a rejected
 * verdict never carries a rewrite.
 */
public record SqlVerdict(boolean allowed, List<String> reasons, String rewrittenSql) {
    public SqlVerdict {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        if (!allowed && rewrittenSql != null) {
            throw new IllegalArgumentException("rejected verdict cannot carry rewritten SQL");
        }
    }

    public static SqlVerdict reject(String reason) {
        return new SqlVerdict(false, List.of(reason), null);
    }

    public static SqlVerdict allow(List<String> notes, String rewrittenSql) {
        return new SqlVerdict(true, notes, rewrittenSql);
    }

    public boolean hasRewrite() {
        return rewrittenSql != null;
    }
}
