package me.ymssd.tsync.config;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import me.ymssd.tsync.schema.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for SyncConfig loading and table selection.
 */
@DisplayName("SyncConfig Tests")
class SyncConfigTest {

    @Test
    @DisplayName("Should load settings from a yaml resource")
    void testLoadResource() {
        SyncConfig syncConfig = SyncConfig.loadResource("tsync-test.yaml");

        assertEquals(3, syncConfig.getWorkers());
        assertEquals(64, syncConfig.getInitialRowsToHash());
        assertEquals("00000003-0000001B-1", syncConfig.getSnapshot());
        assertEquals(List.of("public.orders", "customers"), syncConfig.getOnly());
        assertEquals(List.of("customers"), syncConfig.getIgnore());
    }

    @Test
    @DisplayName("Should load the bundled default configuration")
    void testLoadDefault() {
        SyncConfig syncConfig = SyncConfig.loadDefault();

        assertEquals(4, syncConfig.getWorkers());
        assertEquals(256, syncConfig.getInitialRowsToHash());
        assertNull(syncConfig.getSnapshot());
        assertEquals(List.of("schema_migrations"), syncConfig.getIgnore());
        assertFalse(syncConfig.isSelected(new Table("public", "schema_migrations")));
    }

    @Test
    @DisplayName("Should fail clearly when the resource is missing")
    void testMissingResource() {
        assertThrows(IllegalArgumentException.class, () -> SyncConfig.loadResource("no-such-file.yaml"));
    }

    @Test
    @DisplayName("Should keep defaults for settings not given")
    void testDefaults() {
        SyncConfig syncConfig = SyncConfig.load(
            new ByteArrayInputStream("workers: 2\n".getBytes(StandardCharsets.UTF_8)));

        assertEquals(2, syncConfig.getWorkers());
        assertEquals(256, syncConfig.getInitialRowsToHash());
        assertNull(syncConfig.getSnapshot());
        assertTrue(syncConfig.getOnly().isEmpty());
        assertTrue(syncConfig.getIgnore().isEmpty());
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void testEmptyDocument() {
        SyncConfig syncConfig = SyncConfig.load(new ByteArrayInputStream(new byte[0]));

        assertEquals(Runtime.getRuntime().availableProcessors(), syncConfig.getWorkers());
    }

    @Test
    @DisplayName("Should select every table when no lists are given")
    void testSelectAll() {
        SyncConfig syncConfig = new SyncConfig();

        assertTrue(syncConfig.isSelected(new Table("public", "orders")));
        assertTrue(syncConfig.isSelected(new Table(null, "orders")));
    }

    @Test
    @DisplayName("Should honour only and ignore lists by bare or qualified name")
    void testSelection() {
        SyncConfig syncConfig = SyncConfig.loadResource("tsync-test.yaml");

        assertTrue(syncConfig.isSelected(new Table("public", "orders")));
        assertFalse(syncConfig.isSelected(new Table("archive", "orders")));
        assertFalse(syncConfig.isSelected(new Table("public", "customers")));
        assertFalse(syncConfig.isSelected(new Table("public", "audit")));
    }
}
