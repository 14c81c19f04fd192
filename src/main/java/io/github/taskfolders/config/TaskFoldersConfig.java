/*
 * Copyright 2026 The Task Folders Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.taskfolders.config;

import java.util.Map;

/**
 * Start-up configuration, read from environment variables.
 *
 * @param port HTTP port, {@code 0} picks a free one
 * @param databaseUrl JDBC URL of the H2 database
 * @param databaseUser to connect with
 * @param databasePassword to connect with, can be empty
 * @param identityHeader carrying the identifier of the authenticated user
 */
public record TaskFoldersConfig(
    int port,
    String databaseUrl,
    String databaseUser,
    String databasePassword,
    String identityHeader) {

  /** HTTP port. */
  public static final String ENV_PORT = "TASK_FOLDERS_PORT";

  /** JDBC URL of the database. */
  public static final String ENV_DATABASE_URL = "TASK_FOLDERS_DATABASE_URL";

  public static final String ENV_DATABASE_USER = "TASK_FOLDERS_DATABASE_USER";
  public static final String ENV_DATABASE_PASSWORD = "TASK_FOLDERS_DATABASE_PASSWORD";

  /** Header set by the upstream authenticator. */
  public static final String ENV_IDENTITY_HEADER = "TASK_FOLDERS_IDENTITY_HEADER";

  public static final int DEFAULT_PORT = 3000;
  public static final String DEFAULT_DATABASE_URL =
      "jdbc:h2:mem:task_folders;MODE=PostgreSQL;DB_CLOSE_DELAY=-1";
  public static final String DEFAULT_DATABASE_USER = "sa";
  public static final String DEFAULT_IDENTITY_HEADER = "X-User-Id";

  public TaskFoldersConfig {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Port must be within 0..65535, got " + port);
    }

    if (databaseUrl == null || databaseUrl.isBlank()) {
      throw new IllegalArgumentException("Database URL cannot be blank");
    }

    if (databaseUser == null || databasePassword == null) {
      throw new IllegalArgumentException("Database credentials cannot be null");
    }

    if (identityHeader == null || identityHeader.isBlank()) {
      throw new IllegalArgumentException("Identity header cannot be blank");
    }
  }

  /**
   * @return configuration of the current process
   */
  public static TaskFoldersConfig fromEnvironment() {
    return from(System.getenv());
  }

  /**
   * @param environment variables, missing ones fall back to defaults
   * @return configuration
   * @throws IllegalArgumentException if a value is present but invalid
   */
  public static TaskFoldersConfig from(final Map<String, String> environment) {
    return new TaskFoldersConfig(
        parsePort(environment.get(ENV_PORT)),
        environment.getOrDefault(ENV_DATABASE_URL, DEFAULT_DATABASE_URL),
        environment.getOrDefault(ENV_DATABASE_USER, DEFAULT_DATABASE_USER),
        environment.getOrDefault(ENV_DATABASE_PASSWORD, ""),
        environment.getOrDefault(ENV_IDENTITY_HEADER, DEFAULT_IDENTITY_HEADER));
  }

  private static int parsePort(final String raw) {
    if (raw == null || raw.isBlank()) {
      return DEFAULT_PORT;
    }

    try {
      return Integer.parseInt(raw.strip());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("%s is not a number: '%s'".formatted(ENV_PORT, raw), e);
    }
  }
}
