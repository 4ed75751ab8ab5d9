package com.taskenv.store;

import com.taskenv.core.TaskFixtures;
import com.taskenv.core.TaskPriority;
import com.taskenv.core.TaskRecord;
import com.taskenv.core.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryTaskStore and its input records.
 */
class InMemoryTaskStoreTest {

    private InMemoryTaskStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTaskStore(TaskFixtures.CLOCK);
    }

    // ==================== Create ====================

    @Test
    @DisplayName("Created tasks get sequential ids and clock timestamps")
    void createAssignsIds() {
        TaskRecord first = store.create(TaskDraft.of("First", null, null));
        TaskRecord second = store.create(TaskDraft.of("Second", TaskStatus.IN_PROGRESS, TaskPriority.HIGH));

        assertEquals(1, first.id());
        assertEquals(2, second.id());
        assertEquals(TaskStatus.TODO, first.status());
        assertEquals(TaskPriority.MEDIUM, first.priority());
        assertEquals(TaskFixtures.NOW, first.createdAt());
        assertEquals(TaskFixtures.NOW, first.updatedAt());
    }

    @Test
    @DisplayName("Ids are not reused after delete")
    void idsNotReused() {
        TaskRecord task = store.create(TaskDraft.of("Gone", null, null));
        store.delete(task.id());

        assertEquals(2, store.create(TaskDraft.of("Next", null, null)).id());
    }

    @Test
    @DisplayName("Draft title must be present and at most 200 characters")
    void draftValidation() {
        assertThrows(IllegalArgumentException.class, () -> TaskDraft.of(" ", null, null));
        assertThrows(IllegalArgumentException.class, () -> TaskDraft.of(null, null, null));
        assertThrows(IllegalArgumentException.class, () -> TaskDraft.of("x".repeat(201), null, null));
        assertDoesNotThrow(() -> TaskDraft.of("x".repeat(200), null, null));
    }

    // ==================== Query ====================

    @Test
    @DisplayName("Fetch filters by status and priority, ordered by id")
    void fetchWithFilters() {
        store.create(TaskDraft.of("a", TaskStatus.TODO, TaskPriority.HIGH));
        store.create(TaskDraft.of("b", TaskStatus.TODO, TaskPriority.LOW));
        store.create(TaskDraft.of("c", TaskStatus.COMPLETED, TaskPriority.HIGH));

        assertEquals(3, store.fetchTasks().size());
        assertEquals(List.of("a", "b"),
                store.fetchTasks(TaskStatus.TODO, null).stream().map(TaskRecord::title).toList());
        assertEquals(List.of("a", "c"),
                store.fetchTasks(null, TaskPriority.HIGH).stream().map(TaskRecord::title).toList());
        assertEquals(1, store.fetchTasks(TaskStatus.COMPLETED, TaskPriority.HIGH).size());
    }

    // ==================== Update / delete ====================

    @Test
    @DisplayName("Patch changes only the fields it sets")
    void patchPartial() {
        TaskRecord task = store.create(new TaskDraft("Write docs", "desc", null, TaskPriority.LOW,
                List.of("doc"), "Alice", null));

        Optional<TaskRecord> updated = store.update(task.id(), TaskPatch.status(TaskStatus.COMPLETED));

        assertTrue(updated.isPresent());
        assertEquals(TaskStatus.COMPLETED, updated.get().status());
        assertEquals("Write docs", updated.get().title());
        assertEquals(TaskPriority.LOW, updated.get().priority());
        assertEquals(List.of("doc"), updated.get().tags());
        assertEquals("Alice", updated.get().assignee());
        assertEquals(updated.get(), store.findById(task.id()).orElseThrow());
    }

    @Test
    @DisplayName("Update and delete of unknown ids report absence")
    void unknownIds() {
        assertTrue(store.update(99, TaskPatch.assignee("Bob")).isEmpty());
        assertFalse(store.delete(99));
        assertTrue(store.findById(99).isEmpty());
    }

    @Test
    @DisplayName("Patch clears optional fields only when asked to")
    void patchClearsFields() {
        TaskRecord task = store.create(new TaskDraft("Triage", "old notes", null, null,
                List.of("bug"), "Alice", TaskFixtures.NOW));

        TaskRecord unassigned = store.update(task.id(), TaskPatch.unassign()).orElseThrow();
        assertNull(unassigned.assignee());
        assertFalse(unassigned.isAssigned());
        assertEquals("old notes", unassigned.description());
        assertEquals(TaskFixtures.NOW, unassigned.dueDate());

        TaskRecord cleared = store.update(task.id(), new TaskPatch(null, null, null, null, null, null, null,
                true, false, true)).orElseThrow();
        assertNull(cleared.description());
        assertNull(cleared.dueDate());
        assertEquals(List.of("bug"), cleared.tags());
    }

    @Test
    @DisplayName("Null patch fields leave values unchanged")
    void nullFieldsUnchanged() {
        TaskRecord task = store.create(new TaskDraft("Keep", "desc", null, null, null, "Bob", TaskFixtures.NOW));

        TaskRecord updated = store.update(task.id(), new TaskPatch(null, null, null, null, null, null, null))
                .orElseThrow();

        assertEquals("desc", updated.description());
        assertEquals("Bob", updated.assignee());
        assertEquals(TaskFixtures.NOW, updated.dueDate());
    }

    @Test
    @DisplayName("Patch title is validated like a draft title")
    void patchTitleValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new TaskPatch(" ", null, null, null, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new TaskPatch("x".repeat(201), null, null, null, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new TaskPatch("x".repeat(500), null, null, null, null, null, null));
        assertDoesNotThrow(() -> new TaskPatch("x".repeat(200), null, null, null, null, null, null));
    }

    @Test
    @DisplayName("A field cannot be set and cleared in the same patch")
    void setAndClearRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TaskPatch(null, null, null, null, null, "Alice", null, false, true, false));
        assertThrows(IllegalArgumentException.class,
                () -> new TaskPatch(null, null, null, null, null, null, TaskFixtures.NOW, false, false, true));
    }

    @Test
    @DisplayName("Clear removes everything and reports the count")
    void clear() {
        store.create(TaskDraft.of("a", null, null));
        store.create(TaskDraft.of("b", null, null));

        assertEquals(2, store.clear());
        assertTrue(store.isEmpty());
        assertEquals(0, store.size());
    }
}
