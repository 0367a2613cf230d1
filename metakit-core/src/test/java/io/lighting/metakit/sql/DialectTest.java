package io.lighting.metakit.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.sql.Types;
import org.junit.jupiter.api.Test;

class DialectTest {

    @Test
    void placeholderStyles() {
        assertEquals("?", Dialect.MYSQL.placeholder(3));
        assertEquals("?", Dialect.SQLITE.placeholder(1));
        assertEquals("$3", Dialect.POSTGRESQL.placeholder(3));
        assertThrows(IllegalArgumentException.class, () -> Dialect.POSTGRESQL.placeholder(0));
    }

    @Test
    void sqliteHasNoHints() {
        assertEquals(Dialect.HintPlacement.NONE, Dialect.SQLITE.hintPlacement());
        assertEquals("", Dialect.SQLITE.queryIndexHint());
        assertEquals("", Dialect.SQLITE.materializedPrefix());
    }

    @Test
    void cursorValuesAreUntypedOnlyForPostgres() {
        assertEquals(new Bind.Value("42", Types.OTHER), Dialect.POSTGRESQL.cursorBind("42"));
        assertEquals(Bind.of("42"), Dialect.MYSQL.cursorBind("42"));
        assertEquals(Bind.of("42"), Dialect.SQLITE.cursorBind("42"));
        assertEquals(Bind.of(null), Dialect.POSTGRESQL.cursorBind(null));
    }
}
