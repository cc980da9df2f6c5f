package com.bosdb.debugger.timetravel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TimeTravelEngineTest {

    private TimeTravelEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TimeTravelEngine();
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Test
    void insert_isUndoneByDeletingInsertedKeys() {
        DataChange change = DataChange.insert("users", List.of("id"), List.of(row("id", 1, "name", "a"), row("id", 2, "name", "b")));

        assertEquals("DELETE FROM \"users\" WHERE (\"id\" = 1) OR (\"id\" = 2);", engine.generateInverseSql(change));
    }

    @Test
    void insert_withCompositeKey() {
        DataChange change = DataChange.insert("line_items", List.of("order_id", "line"), List.of(row("order_id", 7, "line", 1)));

        assertEquals("DELETE FROM \"line_items\" WHERE (\"order_id\" = 7 AND \"line\" = 1);",
            engine.generateInverseSql(change));
    }

    @Test
    void update_restoresOldValues() {
        DataChange change = DataChange.update("users", List.of("id"),
            List.of(row("id", 1, "name", "O'Brien", "email", null), row("id", 2, "name", "b", "email", "b@x")));

        assertEquals(
            "UPDATE \"users\" SET \"name\" = 'O''Brien', \"email\" = NULL WHERE \"id\" = 1;\n"
                + "UPDATE \"users\" SET \"name\" = 'b', \"email\" = 'b@x' WHERE \"id\" = 2;",
            engine.generateInverseSql(change));
    }

    @Test
    void delete_reinsertsOldRows() {
        Instant created = Instant.parse("2024-03-01T10:15:30Z");
        DataChange change = DataChange.delete("users",
            List.of(row("id", 1, "active", true, "created", created), row("id", 2, "active", false, "created", null)));

        assertEquals(
            "INSERT INTO \"users\" (\"id\", \"active\", \"created\")\n"
                + "VALUES (1, true, '2024-03-01T10:15:30Z'),\n"
                + "(2, false, NULL);",
            engine.generateInverseSql(change));
    }

    @Test
    void emptyChanges_produceNoSql() {
        assertEquals("", engine.generateInverseSql(DataChange.insert("t", List.of("id"), List.of())));
        assertEquals("", engine.generateInverseSql(DataChange.update("t", List.of("id"), List.of())));
        assertEquals("", engine.generateInverseSql(DataChange.delete("t", List.of())));
    }

    @Test
    void rowsMayContainNulls() {
        DataChange change = DataChange.delete("t", Arrays.asList(row("a", null)));

        assertEquals("INSERT INTO \"t\" (\"a\")\nVALUES (NULL);", engine.generateInverseSql(change));
    }
}
