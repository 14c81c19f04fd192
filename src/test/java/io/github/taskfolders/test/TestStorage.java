package io.github.taskfolders.test;

import io.github.taskfolders.ddd.authorization.TaskOwner;
import io.github.taskfolders.ddd.jooq.StorageBindings;
import java.util.UUID;

/** Fresh in-memory databases and owners for storage-backed tests. */
public final class TestStorage {
  private TestStorage() {
    // Cannot be instantiated
  }

  /**
   * @return bindings to a new, empty database with the schema applied
   */
  public static StorageBindings open() {
    return StorageBindings.open(url(), "sa", "");
  }

  /**
   * @return URL of a new in-memory database, unique per call
   */
  public static String url() {
    return "jdbc:h2:mem:test_%s;MODE=PostgreSQL;DB_CLOSE_DELAY=-1"
        .formatted(UUID.randomUUID().toString().replace("-", ""));
  }

  public static TaskOwner owner() {
    return new TaskOwner(UUID.randomUUID());
  }
}
