package me.cogbot.domain.model;

import me.cogbot.domain.exception.SchemaDefinitionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TableSchemaTest {

    private static final String LOGS = "CREATE TABLE IF NOT EXISTS logs (id INTEGER PRIMARY KEY, text TEXT)";

    @Test
    void of_extractsTableName() {
        TableSchema schema = TableSchema.of(LOGS);

        assertEquals("logs", schema.getTableName());
        assertEquals(LOGS, schema.getCreationStatement());
        assertFalse(schema.hasDefaultRows());
        assertEquals(ReseedPolicy.ONCE, schema.getReseedPolicy());
        assertFalse(schema.isKeyValue());
    }

    @Test
    void of_acceptsStatementWithoutIfNotExists() {
        TableSchema schema = TableSchema.of("  create table Users(id INTEGER)");

        assertEquals("Users", schema.getTableName());
    }

    @Test
    void of_acceptsQuotedTableName() {
        assertEquals("quoted", TableSchema.of("CREATE TABLE \"quoted\" (id INTEGER)").getTableName());
        assertEquals("ticked", TableSchema.of("CREATE TABLE IF NOT EXISTS `ticked` (id INTEGER)").getTableName());
    }

    @Test
    void of_rejectsNonCreateStatement() {
        assertThrows(SchemaDefinitionException.class, () -> TableSchema.of("SELECT * FROM logs"));
        assertThrows(SchemaDefinitionException.class, () -> TableSchema.of("DROP TABLE logs"));
    }

    @Test
    void of_rejectsStatementWithoutReadableName() {
        assertThrows(SchemaDefinitionException.class, () -> TableSchema.of("CREATE TABLE (id INTEGER)"));
    }

    @Test
    void of_rejectsDefaultRowsWithDifferentColumns() {
        List<Map<String, Object>> rows = List.of(Map.of("id", 1), Map.of("text", "a"));

        assertThrows(SchemaDefinitionException.class, () -> TableSchema.of(LOGS, rows));
    }

    @Test
    void of_rejectsEmptyDefaultRow() {
        List<Map<String, Object>> rows = List.of(Map.of());

        assertThrows(SchemaDefinitionException.class, () -> TableSchema.of(LOGS, rows));
    }

    @Test
    void of_rejectsInvalidColumnName() {
        List<Map<String, Object>> rows = List.of(Map.of("id; DROP TABLE logs", 1));

        assertThrows(SchemaDefinitionException.class, () -> TableSchema.of(LOGS, rows));
    }

    @Test
    void defaultRows_areCopiedAndImmutable() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", 1);
        row.put("text", "hello");
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row);

        TableSchema schema = TableSchema.of(LOGS, rows, ReseedPolicy.ALWAYS);
        row.put("text", "changed");
        rows.clear();

        assertEquals(1, schema.getDefaultRows().size());
        assertEquals("hello", schema.getDefaultRows().get(0).get("text"));
        assertEquals(List.of("id", "text"), schema.getDefaultColumns());
        assertEquals(ReseedPolicy.ALWAYS, schema.getReseedPolicy());
        assertThrows(UnsupportedOperationException.class, () -> schema.getDefaultRows().clear());
        assertThrows(UnsupportedOperationException.class, () -> schema.getDefaultRows().get(0).put("id", 2));
    }

    @Test
    void isIdentifier_acceptsOnlyBareNames() {
        assertTrue(TableSchema.isIdentifier("settings"));
        assertTrue(TableSchema.isIdentifier("_x1"));
        assertFalse(TableSchema.isIdentifier("1abc"));
        assertFalse(TableSchema.isIdentifier("a b"));
        assertFalse(TableSchema.isIdentifier(null));
    }
}
