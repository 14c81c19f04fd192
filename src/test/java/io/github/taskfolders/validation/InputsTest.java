package io.github.taskfolders.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.taskfolders.ddd.error.ValidationException;
import io.github.taskfolders.model.TaskStatus;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InputsTest {
  @Nested
  class Ids {
    @Test
    void surrounding_whitespace_is_ignored() {
      final UUID id = UUID.randomUUID();
      assertEquals(id, Inputs.parseId("  " + id + "\n", "folder"));
    }

    @Test
    void missing_id_is_a_validation_error() {
      final var e = assertThrows(ValidationException.class, () -> Inputs.parseId(" ", "folder"));
      assertEquals("Missing folder id.", e.getMessage());
    }

    @Test
    void malformed_id_is_a_validation_error() {
      final var e =
          assertThrows(ValidationException.class, () -> Inputs.parseId("not-an-id", "folder"));
      assertEquals("Invalid folder id format.", e.getMessage());
      assertThrows(ValidationException.class, () -> Inputs.parseId("1-1-1-1-1", "task"));
    }

    @Test
    void id_check_does_not_throw() {
      assertTrue(Inputs.isId(UUID.randomUUID().toString()));
      assertFalse(Inputs.isId("task"));
      assertFalse(Inputs.isId(null));
    }
  }

  @Nested
  class Text {
    @Test
    void text_is_trimmed() {
      assertEquals("Groceries", Inputs.requireText(" Groceries ", "required"));
    }

    @Test
    void blank_text_is_rejected_with_the_given_message() {
      final var e =
          assertThrows(ValidationException.class, () -> Inputs.requireText("  ", "required"));
      assertEquals("required", e.getMessage());
      assertThrows(ValidationException.class, () -> Inputs.requireText(null, "required"));
    }
  }

  @Nested
  class Statuses {
    @Test
    void absent_status_stays_absent() {
      assertNull(Inputs.parseStatus(null));
    }

    @Test
    void known_labels_are_accepted() {
      assertEquals(TaskStatus.WORKING, Inputs.parseStatus("Working"));
    }

    @Test
    void unknown_labels_are_rejected() {
      final var e = assertThrows(ValidationException.class, () -> Inputs.parseStatus("Done"));
      assertEquals("Invalid status value.", e.getMessage());
    }
  }

  @Nested
  class DueDates {
    @Test
    void absent_or_blank_date_stays_absent() {
      assertNull(Inputs.parseDueDate(null));
      assertNull(Inputs.parseDueDate(""));
    }

    @Test
    void plain_dates_are_accepted() {
      assertEquals(LocalDate.of(2025, 3, 14), Inputs.parseDueDate("2025-03-14"));
    }

    @Test
    void date_times_contribute_their_date_part() {
      assertEquals(LocalDate.of(2025, 3, 14), Inputs.parseDueDate("2025-03-14T10:15:30Z"));
      assertEquals(LocalDate.of(2025, 3, 14), Inputs.parseDueDate("2025-03-14T23:00:00+02:00"));
    }

    @Test
    void invalid_calendar_dates_are_rejected() {
      final var e =
          assertThrows(ValidationException.class, () -> Inputs.parseDueDate("2025-02-30"));
      assertEquals("Invalid date format.", e.getMessage());
      assertThrows(ValidationException.class, () -> Inputs.parseDueDate("tomorrow"));
    }
  }
}
