package io.github.taskfolders.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.taskfolders.ddd.error.ValidationException;
import org.junit.jupiter.api.Test;

class TaskStatusTest {
  @Test
  void every_label_resolves_to_its_status() {
    for (TaskStatus status : TaskStatus.values()) {
      assertEquals(status, TaskStatus.fromLabel(status.label()));
    }
  }

  @Test
  void labels_are_case_sensitive() {
    assertThrows(ValidationException.class, () -> TaskStatus.fromLabel("pending"));
    assertThrows(ValidationException.class, () -> TaskStatus.fromLabel("Done"));
    assertThrows(ValidationException.class, () -> TaskStatus.fromLabel(null));
  }
}
