package io.lighting.metakit.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SqlScannerTest {

    @Test
    void findsFirstTopLevelKeyword() {
        assertEquals(20, SqlScanner.findTopLevelKeyword("SELECT * FROM users WHERE a = 1 WHERE", "WHERE"));
        assertEquals(20, SqlScanner.findTopLevelKeyword("SELECT * FROM users where a = 1", "WHERE"));
    }

    @Test
    void matchesWholeWordsOnly() {
        assertEquals(-1, SqlScanner.findTopLevelKeyword("SELECT nowhere, where_clause FROM t", "WHERE"));
    }

    @Test
    void skipsLiteralsIdentifiersAndComments() {
        assertEquals(-1, SqlScanner.findTopLevelKeyword("SELECT 'it''s WHERE' FROM t", "WHERE"));
        assertEquals(-1, SqlScanner.findTopLevelKeyword("SELECT \"WHERE\", `where` FROM t", "WHERE"));
        assertEquals(-1, SqlScanner.findTopLevelKeyword("SELECT a FROM t -- WHERE x\n", "WHERE"));
        assertEquals(-1, SqlScanner.findTopLevelKeyword("SELECT a /* WHERE */ FROM t", "WHERE"));
    }

    @Test
    void skipsNestedQueries() {
        String sql = "SELECT * FROM (SELECT id FROM t WHERE x = 1) s WHERE s.id > 2";

        assertEquals(sql.lastIndexOf("WHERE"), SqlScanner.findTopLevelKeyword(sql, "WHERE"));
    }
}
