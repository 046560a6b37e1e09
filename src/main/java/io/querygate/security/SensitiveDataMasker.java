package io.querygate.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.querygate.safety.SqlScanner;
import io.querygate.safety.SqlToken;
import io.querygate.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credentials and literal values before they reach the audit log. SQL text keeps its shape
 * but every string literal is replaced, since filter values are the likeliest place for personal
 * data to appear.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final String SQL_LITERAL_MASK = "'***'";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "private_key", "credential"
    );
    private static final Set<String> SQL_KEYS = Set.of("sql", "rewritten_sql", "original_sql");
    private static final Pattern HEX_DIGEST = Pattern.compile("^[0-9a-f]{32,128}$");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{24,}$");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                String key = entry.getKey();
                JsonNode value = entry.getValue();
                if (isSensitiveKey(key)) {
                    out.put(key, MASK);
                } else if (isSqlKey(key)) {
                    out.set(key, maskedSql(value));
                } else {
                    out.set(key, masked(value));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual() && likelySecretValue(input.asText(""))) {
            return Jsons.mapper().valueToTree(MASK);
        }
        return input;
    }

    private static JsonNode maskedSql(JsonNode value) {
        if (value.isTextual()) {
            return Jsons.mapper().valueToTree(maskSqlLiterals(value.asText()));
        }
        if (value.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode item : value) {
                out.add(maskedSql(item));
            }
            return out;
        }
        return masked(value);
    }

    public static String maskSqlLiterals(String sql) {
        if (sql == null || sql.isEmpty()) {
            return sql;
        }
        StringBuilder out = new StringBuilder(sql.length());
        int cursor = 0;
        for (SqlToken token : SqlScanner.scan(sql).tokens()) {
            if (token.kind() != SqlToken.Kind.STRING) {
                continue;
            }
            out.append(sql, cursor, token.start()).append(SQL_LITERAL_MASK);
            cursor = token.end();
        }
        out.append(sql.substring(cursor));
        return out.toString();
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isSqlKey(String rawKey) {
        return rawKey != null && SQL_KEYS.contains(rawKey.toLowerCase(Locale.ROOT));
    }

    private static boolean likelySecretValue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        if (v.length() < 24 || HEX_DIGEST.matcher(v).matches()) {
            return false;
        }
        return OPAQUE_TOKEN.matcher(v).matches();
    }
}
