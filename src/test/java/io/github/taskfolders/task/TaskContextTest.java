package io.github.taskfolders.task;

import static io.github.taskfolders.storage.Tables.TASKS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.taskfolders.ddd.authorization.TaskOwner;
import io.github.taskfolders.ddd.error.ValidationException;
import io.github.taskfolders.ddd.jooq.StorageBindings;
import io.github.taskfolders.model.Task;
import io.github.taskfolders.model.TaskStatus;
import io.github.taskfolders.test.TestStorage;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TaskContextTest {
  StorageBindings storage;
  TaskContext tasks;
  TaskOwner owner;
  TaskOwner stranger;

  @BeforeEach
  void setUp() {
    storage = TestStorage.open();
    tasks = new TaskContext(storage.dslContextProvider(), storage.dslContextProvider());
    owner = TestStorage.owner();
    stranger = TestStorage.owner();
  }

  @AfterEach
  void tearDown() {
    storage.close();
  }

  Task create(final TaskOwner taskOwner, final String title, final UUID folder) {
    return tasks.create(taskOwner, TaskContext.validate(title, null, null), folder);
  }

  void backdate(final Task task, final int minutes) {
    storage
        .dsl()
        .update(TASKS)
        .set(TASKS.CREATED_AT, LocalDateTime.of(2024, 1, 1, 12, 0).plusMinutes(minutes))
        .where(TASKS.ID.eq(task.id()))
        .execute();
  }

  @Nested
  class Validation {
    @Test
    void title_is_trimmed_and_status_defaults_to_pending() {
      final TaskContext.Draft draft = TaskContext.validate("  Buy milk ", null, null);

      assertEquals("Buy milk", draft.title());
      assertEquals(TaskStatus.PENDING, draft.status());
      assertNull(draft.dueDate());
    }

    @Test
    void status_and_due_date_are_parsed() {
      final TaskContext.Draft draft = TaskContext.validate("Buy milk", "Working", "2025-03-01");

      assertEquals(TaskStatus.WORKING, draft.status());
      assertEquals(LocalDate.of(2025, 3, 1), draft.dueDate());
    }

    @Test
    void invalid_input_is_rejected() {
      final var blank =
          assertThrows(ValidationException.class, () -> TaskContext.validate(" ", null, null));
      assertEquals("Title is required.", blank.getMessage());

      final var status =
          assertThrows(ValidationException.class, () -> TaskContext.validate("a", "Done", null));
      assertEquals("Invalid status value.", status.getMessage());

      final var date =
          assertThrows(
              ValidationException.class, () -> TaskContext.validate("a", null, "tomorrow"));
      assertEquals("Invalid date format.", date.getMessage());
    }
  }

  @Nested
  class Lifecycle {
    @Test
    void created_task_carries_owner_folder_and_creation_time() {
      final UUID folder = UUID.randomUUID();
      final Task task =
          tasks.create(owner, TaskContext.validate("Report", "Completed", "2025-01-31"), folder);

      assertNotNull(task.id());
      assertEquals("Report", task.title());
      assertEquals(TaskStatus.COMPLETED, task.status());
      assertEquals(LocalDate.of(2025, 1, 31), task.dueDate());
      assertEquals(folder, task.folder());
      assertEquals(owner.userId(), task.owner());
      assertNotNull(task.createdAt());
      assertEquals(task, tasks.findById(owner, task.id()).orElseThrow());
    }

    @Test
    void tasks_of_other_owners_are_invisible() {
      final Task task = create(owner, "Mine", null);

      assertTrue(tasks.findById(stranger, task.id()).isEmpty());
      assertTrue(tasks.updateFields(stranger, task.id(), null, "Theirs", null, null).isEmpty());
      assertTrue(tasks.deleteById(stranger, task.id(), null).isEmpty());
      assertTrue(tasks.listForOwner(stranger).isEmpty());
      assertEquals("Mine", tasks.findById(owner, task.id()).orElseThrow().title());
    }

    @Test
    void update_changes_present_fields_only() {
      final Task task =
          tasks.create(owner, TaskContext.validate("Report", null, "2025-01-31"), null);

      final Task updated =
          tasks
              .updateFields(owner, task.id(), null, null, TaskStatus.WORKING, null)
              .orElseThrow();

      assertEquals("Report", updated.title());
      assertEquals(TaskStatus.WORKING, updated.status());
      assertEquals(LocalDate.of(2025, 1, 31), updated.dueDate());
      assertEquals(task.createdAt(), updated.createdAt());
      assertEquals(updated, tasks.findById(owner, task.id()).orElseThrow());
    }

    @Test
    void folder_scoped_update_and_delete_ignore_tasks_filed_elsewhere() {
      final UUID folder = UUID.randomUUID();
      final Task task = create(owner, "Filed", folder);

      assertTrue(
          tasks.updateFields(owner, task.id(), UUID.randomUUID(), "x", null, null).isEmpty());
      assertTrue(tasks.deleteById(owner, task.id(), UUID.randomUUID()).isEmpty());
      assertTrue(tasks.deleteById(owner, task.id(), folder).isPresent());
      assertTrue(tasks.findById(owner, task.id()).isEmpty());
    }
  }

  @Nested
  class Listings {
    @Test
    void owner_listing_is_newest_first() {
      final Task older = create(owner, "Older", null);
      final Task newer = create(owner, "Newer", UUID.randomUUID());
      backdate(older, 0);
      backdate(newer, 5);
      create(stranger, "Theirs", null);

      final List<Task> listed = tasks.listForOwner(owner);

      assertEquals(List.of(newer.id(), older.id()), listed.stream().map(Task::id).toList());
    }

    @Test
    void folder_and_unfiled_listings_partition_owned_tasks() {
      final UUID folder = UUID.randomUUID();
      final Task filed = create(owner, "Filed", folder);
      final Task unfiled = create(owner, "Unfiled", null);
      create(stranger, "Theirs", folder);

      assertEquals(List.of(filed), tasks.listInFolder(owner, folder));
      assertEquals(List.of(unfiled), tasks.listUnfiled(owner));
      assertTrue(tasks.listInFolder(owner, UUID.randomUUID()).isEmpty());
    }
  }

  @Nested
  class FolderBatches {
    @Test
    void reset_sets_every_task_of_the_folder_to_pending() {
      final UUID folder = UUID.randomUUID();
      final Task first = tasks.create(owner, TaskContext.validate("a", "Completed", null), folder);
      tasks.create(owner, TaskContext.validate("b", "Working", null), folder);
      final Task elsewhere =
          tasks.create(owner, TaskContext.validate("c", "Completed", null), null);
      final Task foreign =
          tasks.create(stranger, TaskContext.validate("d", "Completed", null), folder);

      final List<Task> reset = tasks.resetByFolder(owner, folder);

      assertEquals(2, reset.size());
      assertTrue(reset.stream().allMatch(task -> task.status() == TaskStatus.PENDING));
      assertEquals(
          TaskStatus.PENDING, tasks.findById(owner, first.id()).orElseThrow().status());
      assertEquals(
          TaskStatus.COMPLETED, tasks.findById(owner, elsewhere.id()).orElseThrow().status());
      assertEquals(
          TaskStatus.COMPLETED, tasks.findById(stranger, foreign.id()).orElseThrow().status());
    }

    @Test
    void delete_by_folder_removes_owned_tasks_of_the_folder_only() {
      final UUID folder = UUID.randomUUID();
      create(owner, "a", folder);
      create(owner, "b", folder);
      final Task elsewhere = create(owner, "c", null);
      final Task foreign = create(stranger, "d", folder);

      assertEquals(2, tasks.deleteByFolder(owner, folder).size());
      assertTrue(tasks.deleteByFolder(owner, folder).isEmpty());
      assertEquals(List.of(elsewhere), tasks.listForOwner(owner));
      assertEquals(List.of(foreign), tasks.listForOwner(stranger));
    }
  }
}
