package io.querygate.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class JsonsTest {

    @Test
    void canonicalSortsKeysAtEveryLevel() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("z", 1);
        inner.put("a", 2);
        Map<String, Object> outer = new LinkedHashMap<>();
        outer.put("rows", List.of(inner));
        outer.put("bytes_scanned", 10);

        Assertions.assertEquals("{\"bytes_scanned\":10,\"rows\":[{\"a\":2,\"z\":1}]}", Jsons.canonical(outer));
    }

    @Test
    void hashingIsHexAndKeyed() {
        Assertions.assertEquals(
                "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                Hashing.sha256Hex("")
        );
        Assertions.assertNotEquals(Hashing.hmacSha256Hex("k1", "v"), Hashing.hmacSha256Hex("k2", "v"));
        Assertions.assertEquals(64, Hashing.hmacSha256Hex("k1", "v").length());
    }
}
