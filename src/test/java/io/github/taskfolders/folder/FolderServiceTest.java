package io.github.taskfolders.folder;

import static io.github.taskfolders.storage.Tables.FOLDER_TASK_REFS;
import static io.github.taskfolders.storage.Tables.TASKS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.taskfolders.ddd.authorization.TaskOwner;
import io.github.taskfolders.ddd.error.NotFoundException;
import io.github.taskfolders.ddd.error.ValidationException;
import io.github.taskfolders.ddd.jooq.DslContextProvider;
import io.github.taskfolders.ddd.jooq.StorageBindings;
import io.github.taskfolders.model.Folder;
import io.github.taskfolders.model.FolderDetails;
import io.github.taskfolders.model.Task;
import io.github.taskfolders.model.TaskPatch;
import io.github.taskfolders.model.TaskStatus;
import io.github.taskfolders.task.TaskContext;
import io.github.taskfolders.test.TestStorage;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FolderServiceTest {
  StorageBindings storage;
  TaskContext tasks;
  FolderService folders;
  TaskOwner owner;
  TaskOwner stranger;

  @BeforeEach
  void setUp() {
    storage = TestStorage.open();
    final DslContextProvider provider = storage.dslContextProvider();
    tasks = new TaskContext(provider, provider);
    folders =
        new FolderService(
            tasks, new FolderContext(provider, provider), new TaskRefContext(provider, provider));
    owner = TestStorage.owner();
    stranger = TestStorage.owner();
  }

  @AfterEach
  void tearDown() {
    storage.close();
  }

  int refCount(final UUID folderId) {
    return storage.dsl().fetchCount(FOLDER_TASK_REFS, FOLDER_TASK_REFS.FOLDER_ID.eq(folderId));
  }

  @Test
  void when_collaborators_are_null_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new FolderService(null, null, null));
  }

  @Nested
  class Folders {
    @Test
    void created_folder_is_trimmed_and_empty() {
      final Folder folder = folders.create(owner, "  Work ");

      assertEquals("Work", folder.name());
      assertEquals(owner.userId(), folder.owner());
      assertTrue(folder.taskRefs().isEmpty());
      assertEquals(folder, folders.requireOwned(owner, folder.id()));
    }

    @Test
    void blank_name_is_rejected() {
      final var e = assertThrows(ValidationException.class, () -> folders.create(owner, " "));
      assertEquals("Folder name is required.", e.getMessage());
    }

    @Test
    void folders_are_listed_by_name_with_their_refs() {
      final Folder work = folders.create(owner, "Work");
      final Folder chores = folders.create(owner, "Chores");
      folders.create(stranger, "Alpha");
      final Task task = folders.addTask(owner, work.id(), "Report", null);

      final List<Folder> listed = folders.listForOwner(owner);

      assertEquals(List.of(chores.id(), work.id()), listed.stream().map(Folder::id).toList());
      assertEquals(List.of(task.id()), listed.get(1).taskRefs());
      assertTrue(listed.get(0).taskRefs().isEmpty());
    }

    @Test
    void foreign_folder_is_not_found() {
      final Folder folder = folders.create(owner, "Work");

      assertTrue(folders.find(stranger, folder.id()).isEmpty());
      assertThrows(NotFoundException.class, () -> folders.requireOwned(stranger, folder.id()));
      assertThrows(NotFoundException.class, () -> folders.getWithTasks(stranger, folder.id()));
      assertTrue(folders.rename(stranger, folder.id(), "Mine").isEmpty());
      assertEquals("Work", folders.requireOwned(owner, folder.id()).name());
    }

    @Test
    void rename_keeps_refs() {
      final Folder folder = folders.create(owner, "Work");
      final Task task = folders.addTask(owner, folder.id(), "Report", null);

      final Folder renamed = folders.rename(owner, folder.id(), "Office").orElseThrow();

      assertEquals("Office", renamed.name());
      assertEquals(
          "o".repeat(300),
          folders.rename(owner, folder.id(), "o".repeat(300)).orElseThrow().name());
      assertEquals(List.of(task.id()), renamed.taskRefs());
    }
  }

  @Nested
  class FolderTasks {
    Folder folder;

    @BeforeEach
    void setUp() {
      folder = folders.create(owner, "Work");
    }

    @Test
    void added_task_is_filed_pending_and_referenced() {
      final Task task = folders.addTask(owner, folder.id(), "Report", "2025-02-01");

      assertEquals(folder.id(), task.folder());
      assertEquals(TaskStatus.PENDING, task.status());
      assertEquals(LocalDate.of(2025, 2, 1), task.dueDate());
      assertEquals(List.of(task.id()), folders.requireOwned(owner, folder.id()).taskRefs());
      assertEquals(List.of(task), folders.listTasks(owner, folder.id()));
    }

    @Test
    void long_titles_are_accepted_when_adding_and_updating() {
      final String title = "t".repeat(1025);
      final Task task = folders.addTask(owner, folder.id(), title, null);

      final Task updated =
          folders.updateTask(
              owner, folder.id(), task.id(), new TaskPatch("u".repeat(2048), null, null));

      assertEquals(title, task.title());
      assertEquals(2048, updated.title().length());
    }

    @Test
    void refs_keep_the_order_they_were_added_in() {
      final UUID first = UUID.fromString("ffffffff-ffff-4fff-bfff-ffffffffffff");
      final UUID second = UUID.fromString("00000000-0000-4000-8000-000000000000");
      final LocalDateTime sameInstant = LocalDateTime.of(2025, 1, 1, 9, 0);
      for (UUID task : List.of(first, second)) {
        storage
            .dsl()
            .insertInto(
                FOLDER_TASK_REFS,
                FOLDER_TASK_REFS.FOLDER_ID,
                FOLDER_TASK_REFS.TASK_ID,
                FOLDER_TASK_REFS.ADDED_AT)
            .values(folder.id(), task, sameInstant)
            .execute();
      }

      assertEquals(List.of(first, second), folders.requireOwned(owner, folder.id()).taskRefs());
      assertEquals(
          List.of(first, second), folders.getWithTasks(owner, folder.id()).folder().taskRefs());
    }

    @Test
    void adding_to_foreign_folder_writes_nothing() {
      final var e =
          assertThrows(
              NotFoundException.class, () -> folders.addTask(stranger, folder.id(), "x", null));

      assertEquals("Folder not found.", e.getMessage());
      assertEquals(0, storage.dsl().fetchCount(TASKS));
      assertEquals(0, refCount(folder.id()));
    }

    @Test
    void invalid_task_input_is_rejected_before_folder_lookup() {
      final UUID absent = UUID.randomUUID();

      assertThrows(ValidationException.class, () -> folders.addTask(owner, absent, " ", null));
      assertThrows(
          ValidationException.class, () -> folders.addTask(owner, absent, "x", "someday"));
    }

    @Test
    void folder_details_carry_tasks_and_progress() {
      final Task first = folders.addTask(owner, folder.id(), "a", null);
      final Task second = folders.addTask(owner, folder.id(), "b", null);
      folders.addTask(owner, folder.id(), "c", null);
      folders.updateTaskStatus(owner, folder.id(), first.id(), "Completed");

      final FolderDetails details = folders.getWithTasks(owner, folder.id());

      assertEquals(folder.id(), details.folder().id());
      assertEquals(3, details.tasks().size());
      assertEquals(3, details.folder().taskRefs().size());
      assertEquals(new FolderDetails.Progress(3, 1, 33), details.progress());
      assertTrue(details.tasks().stream().anyMatch(task -> task.id().equals(second.id())));
    }

    @Test
    void empty_folder_details_have_zero_progress() {
      final FolderDetails details = folders.getWithTasks(owner, folder.id());

      assertTrue(details.tasks().isEmpty());
      assertEquals(new FolderDetails.Progress(0, 0, 0), details.progress());
    }

    @Test
    void update_task_applies_patch() {
      final Task task = folders.addTask(owner, folder.id(), "Report", null);

      final Task updated =
          folders.updateTask(
              owner, folder.id(), task.id(), new TaskPatch(" Final ", "Working", "2025-05-05"));

      assertEquals("Final", updated.title());
      assertEquals(TaskStatus.WORKING, updated.status());
      assertEquals(LocalDate.of(2025, 5, 5), updated.dueDate());
    }

    @Test
    void update_task_rejects_empty_or_invalid_patches() {
      final Task task = folders.addTask(owner, folder.id(), "Report", null);
      final UUID id = task.id();
      final UUID folderId = folder.id();

      final var empty =
          assertThrows(
              ValidationException.class,
              () -> folders.updateTask(owner, folderId, id, new TaskPatch(null, null, null)));
      assertEquals("Provide at least title, status or dueDate to update.", empty.getMessage());
      assertThrows(
          ValidationException.class,
          () -> folders.updateTask(owner, folderId, id, new TaskPatch(" ", null)));
      assertThrows(
          ValidationException.class,
          () -> folders.updateTask(owner, folderId, id, new TaskPatch(null, "Done")));
      final var missing =
          assertThrows(
              ValidationException.class, () -> folders.updateTaskStatus(owner, folderId, id, ""));
      assertEquals("Status is required.", missing.getMessage());
    }

    @Test
    void task_filed_elsewhere_is_not_found() {
      final Task unfiled = tasks.create(owner, TaskContext.validate("x", null, null), null);
      final UUID folderId = folder.id();
      final UUID id = unfiled.id();

      final var e =
          assertThrows(
              NotFoundException.class,
              () -> folders.updateTaskStatus(owner, folderId, id, "Completed"));
      assertEquals("Task not found.", e.getMessage());
      assertThrows(NotFoundException.class, () -> folders.deleteTask(owner, folderId, id));
    }

    @Test
    void delete_task_drops_its_ref() {
      final Task task = folders.addTask(owner, folder.id(), "Report", null);

      assertEquals(task.id(), folders.deleteTask(owner, folder.id(), task.id()).id());
      assertEquals(0, refCount(folder.id()));
      assertTrue(tasks.findById(owner, task.id()).isEmpty());
    }

    @Test
    void removing_absent_ref_is_a_no_op() {
      folders.removeTaskRef(owner, folder.id(), UUID.randomUUID());
      assertEquals(0, refCount(folder.id()));
    }
  }

  @Nested
  class ProgressActions {
    Folder folder;
    Task first;
    Task second;

    @BeforeEach
    void setUp() {
      folder = folders.create(owner, "Work");
      first = folders.addTask(owner, folder.id(), "a", null);
      second = folders.addTask(owner, folder.id(), "b", null);
      folders.updateTaskStatus(owner, folder.id(), first.id(), "Completed");
      folders.updateTaskStatus(owner, folder.id(), second.id(), "Working");
    }

    @Test
    void reset_keeps_tasks_and_refs() {
      final List<Task> reset = folders.resetProgress(owner, folder.id());

      assertEquals(2, reset.size());
      final FolderDetails details = folders.getWithTasks(owner, folder.id());
      assertEquals(2, details.tasks().size());
      assertTrue(details.tasks().stream().allMatch(task -> task.status() == TaskStatus.PENDING));
      assertEquals(new FolderDetails.Progress(2, 0, 0), details.progress());
      assertEquals(2, refCount(folder.id()));
    }

    @Test
    void clear_deletes_tasks_and_refs_but_keeps_the_folder() {
      final List<Task> deleted = folders.clearProgress(owner, folder.id());

      assertEquals(2, deleted.size());
      assertTrue(folders.listTasks(owner, folder.id()).isEmpty());
      assertEquals(0, refCount(folder.id()));
      assertTrue(folders.requireOwned(owner, folder.id()).taskRefs().isEmpty());
    }

    @Test
    void progress_of_foreign_folder_is_not_found() {
      final UUID folderId = folder.id();

      assertThrows(NotFoundException.class, () -> folders.resetProgress(stranger, folderId));
      assertThrows(NotFoundException.class, () -> folders.clearProgress(stranger, folderId));
      assertEquals(2, folders.listTasks(owner, folderId).size());
    }

    @Test
    void cascade_deletes_folder_tasks_and_refs() {
      final Task unfiled = tasks.create(owner, TaskContext.validate("x", null, null), null);

      final Folder deleted = folders.deleteCascade(owner, folder.id());

      assertEquals(folder.id(), deleted.id());
      assertTrue(folders.find(owner, folder.id()).isEmpty());
      assertTrue(folders.listTasks(owner, folder.id()).isEmpty());
      assertEquals(0, refCount(folder.id()));
      assertEquals(List.of(unfiled), tasks.listForOwner(owner));
    }

    @Test
    void cascade_of_foreign_folder_is_not_found_and_keeps_everything() {
      final UUID folderId = folder.id();

      assertThrows(NotFoundException.class, () -> folders.deleteCascade(stranger, folderId));
      assertEquals(2, folders.listTasks(owner, folderId).size());
      assertEquals(2, refCount(folderId));
      assertEquals(2, folders.requireOwned(owner, folderId).taskRefs().size());
    }
  }
}
