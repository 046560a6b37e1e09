package io.querygate.safety;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class SqlScannerTest {

    @Test
    void punctuationInsideLiteralsAndCommentsStaysInsideTheToken() {
        SqlScanner.Scan scan = SqlScanner.scan("SELECT 'it''s; fine' /* ; */ FROM t -- ;\n");
        List<SqlToken> code = scan.codeTokens();
        Assertions.assertEquals(4, code.size());
        Assertions.assertEquals(SqlToken.Kind.STRING, code.get(1).kind());
        Assertions.assertEquals("'it''s; fine'", code.get(1).text());
        Assertions.assertEquals(2, scan.comments().size());
        Assertions.assertTrue(code.stream().noneMatch(t -> t.isSymbol(';')));
        Assertions.assertFalse(scan.unterminatedString());
        Assertions.assertFalse(scan.unterminatedComment());
    }

    @Test
    void offsetsPointBackIntoTheText() {
        String sql = "SELECT  id FROM users";
        for (SqlToken token : SqlScanner.scan(sql).tokens()) {
            Assertions.assertEquals(token.text(), sql.substring(token.start(), token.end()));
        }
    }

    @Test
    void quotedIdentifiersAreUnquotedAndLowerCased() {
        List<SqlToken> tokens = SqlScanner.scan("SELECT * FROM \"Analytics.Events\"").codeTokens();
        SqlToken table = tokens.get(tokens.size() - 1);
        Assertions.assertEquals(SqlToken.Kind.QUOTED_IDENTIFIER, table.kind());
        Assertions.assertEquals("analytics.events", table.identifier());
    }

    @Test
    void unterminatedLiteralAndCommentAreFlagged() {
        Assertions.assertTrue(SqlScanner.scan("SELECT 'open").unterminatedString());
        Assertions.assertTrue(SqlScanner.scan("SELECT 1 /* open").unterminatedComment());
    }

    @Test
    void backslashEndsTheLiteralOnlyWhenEscapesAreOff() {
        String sql = "SELECT 'a\\' ; x'";
        SqlScanner.Scan escaped = SqlScanner.scan(sql);
        Assertions.assertEquals(2, escaped.codeTokens().size());
        Assertions.assertTrue(escaped.hasBackslashInLiteral());

        SqlScanner.Scan ansi = SqlScanner.scan(sql, false);
        List<SqlToken> code = ansi.codeTokens();
        Assertions.assertEquals("'a\\'", code.get(1).text());
        Assertions.assertTrue(code.get(2).isSymbol(';'));
        Assertions.assertTrue(ansi.unterminatedString());

        Assertions.assertFalse(SqlScanner.scan("SELECT 'plain'").hasBackslashInLiteral());
    }
}
