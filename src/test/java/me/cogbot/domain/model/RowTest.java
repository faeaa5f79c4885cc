package me.cogbot.domain.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RowTest {

    private Row row() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", 7);
        values.put("name", "bot");
        values.put("ratio", "0.5");
        values.put("banned", 1);
        values.put("flag", "false");
        values.put("missing", null);
        return new Row(values);
    }

    @Test
    void columns_keepStatementOrder() {
        assertEquals(List.of("id", "name", "ratio", "banned", "flag", "missing"), row().columns());
    }

    @Test
    void typedGetters_coerceValues() {
        Row row = row();

        assertEquals(7L, row.getLong("id"));
        assertEquals(7, row.getInt("id"));
        assertEquals("7", row.getString("id"));
        assertEquals(0.5, row.getDouble("ratio"));
        assertTrue(row.getBoolean("banned"));
        assertFalse(row.getBoolean("flag"));
        assertNull(row.getLong("missing"));
        assertNull(row.getString("missing"));
    }

    @Test
    void get_fallsBackToCaseInsensitiveMatch() {
        Row row = row();

        assertTrue(row.has("NAME"));
        assertEquals("bot", row.get("Name"));
    }

    @Test
    void get_throwsOnUnknownColumn() {
        assertThrows(IllegalArgumentException.class, () -> row().get("unknown"));
    }

    @Test
    void asMap_isImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> row().asMap().put("x", 1));
    }
}
