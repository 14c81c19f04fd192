package io.github.taskfolders.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FolderDetailsTest {
  private static Task task(final TaskStatus status) {
    return new Task(
        UUID.randomUUID(), "title", null, status, null, UUID.randomUUID(), LocalDateTime.now());
  }

  @Nested
  class Progress {
    @Test
    void empty_folder_has_zero_progress() {
      assertEquals(new FolderDetails.Progress(0, 0, 0), FolderDetails.Progress.of(List.of()));
    }

    @Test
    void percentage_is_rounded_down() {
      final var progress =
          FolderDetails.Progress.of(
              List.of(
                  task(TaskStatus.COMPLETED), task(TaskStatus.WORKING), task(TaskStatus.PENDING)));

      assertEquals(3, progress.total());
      assertEquals(1, progress.completed());
      assertEquals(33, progress.percent());
    }

    @Test
    void fully_completed_folder_reports_one_hundred_percent() {
      final var progress =
          FolderDetails.Progress.of(
              List.of(task(TaskStatus.COMPLETED), task(TaskStatus.COMPLETED)));
      assertEquals(100, progress.percent());
    }
  }

  @Test
  void folder_references_are_never_null() {
    final var folder = new Folder(UUID.randomUUID(), "name", UUID.randomUUID(), null, null);
    assertEquals(List.of(), folder.taskRefs());
  }
}
