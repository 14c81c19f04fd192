package io.github.taskfolders.ddd.jooq;

import static io.github.taskfolders.storage.Tables.FOLDERS;
import static io.github.taskfolders.storage.Tables.FOLDER_TASK_REFS;
import static io.github.taskfolders.storage.Tables.TASKS;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.taskfolders.test.EmptyDomainMessage;
import io.github.taskfolders.test.TestStorage;
import org.junit.jupiter.api.Test;

class StorageBindingsTest {
  @Test
  void when_url_is_blank_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> StorageBindings.open(null, "sa", ""));
    assertThrows(IllegalArgumentException.class, () -> StorageBindings.open(" ", "sa", ""));
  }

  @Test
  void when_credentials_are_null_illegal_argument_exception_is_thrown() {
    final String url = TestStorage.url();
    assertThrows(IllegalArgumentException.class, () -> StorageBindings.open(url, null, ""));
    assertThrows(IllegalArgumentException.class, () -> StorageBindings.open(url, "sa", null));
  }

  @Test
  void when_opened_every_table_exists_and_is_empty() {
    try (StorageBindings storage = TestStorage.open()) {
      assertEquals(0, storage.dsl().fetchCount(TASKS));
      assertEquals(0, storage.dsl().fetchCount(FOLDERS));
      assertEquals(0, storage.dsl().fetchCount(FOLDER_TASK_REFS));
    }
  }

  @Test
  void statements_with_semicolons_inside_literals_are_applied_whole() {
    try (StorageBindings storage = TestStorage.open()) {
      final Object remarks =
          storage
              .dsl()
              .fetchValue(
                  "SELECT REMARKS FROM INFORMATION_SCHEMA.TABLES"
                      + " WHERE UPPER(TABLE_NAME) = 'FOLDER_TASK_REFS'");

      assertEquals("Task ids per folder; seq keeps the order they were added in", remarks);
    }
  }

  @Test
  void when_opened_twice_on_the_same_database_schema_is_not_recreated() {
    final String url = TestStorage.url();
    try (StorageBindings first = StorageBindings.open(url, "sa", "")) {
      assertDoesNotThrow(() -> StorageBindings.open(url, "sa", "").close());
      assertEquals(0, first.dsl().fetchCount(TASKS));
    }
  }

  @Test
  void provider_returns_the_shared_context() {
    try (StorageBindings storage = TestStorage.open()) {
      assertSame(
          storage.dsl(), storage.dslContextProvider().apply(EmptyDomainMessage.getInstance()));
    }
  }
}
