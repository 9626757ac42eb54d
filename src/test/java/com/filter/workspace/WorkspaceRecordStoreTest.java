package com.filter.workspace;

import com.filter.core.error.StateConflictException;
import com.filter.core.model.ProvisioningStatus;
import com.filter.core.model.WorkspaceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceRecordStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("save and load a record as JSON under .records")
    void saveAndLoad() {
        var store = new WorkspaceRecordStore(tempDir);
        WorkspaceRecord record = WorkspaceRecord.unprovisioned("ibstr-1", tempDir.resolve("ibstr-1").toString(),
                "https://example.com/r.git", "story/ibstr-1").cloning();

        store.save(record);

        assertTrue(Files.isRegularFile(tempDir.resolve(".records/ibstr-1.json")));
        WorkspaceRecord loaded = store.load("ibstr-1").orElseThrow();
        assertEquals(ProvisioningStatus.CLONING, loaded.status());
        assertEquals(1, loaded.attempts());
        assertEquals(record.updatedAt(), loaded.updatedAt());
    }

    @Test
    @DisplayName("a record owned by another story is a state conflict")
    void foreignRecord() throws Exception {
        var store = new WorkspaceRecordStore(tempDir);
        store.save(WorkspaceRecord.unprovisioned("ibstr-2", "/x", "u", "b"));
        Files.createDirectories(tempDir.resolve(".records"));
        Files.copy(tempDir.resolve(".records/ibstr-2.json"), tempDir.resolve(".records/ibstr-1.json"));

        assertThrows(StateConflictException.class, () -> store.load("ibstr-1"));
    }

    @Test
    @DisplayName("delete removes the record and missing records load as empty")
    void delete() {
        var store = new WorkspaceRecordStore(tempDir);
        store.save(WorkspaceRecord.unprovisioned("ibstr-1", "/x", "u", "b"));

        store.delete("ibstr-1");

        assertTrue(store.load("ibstr-1").isEmpty());
    }
}
