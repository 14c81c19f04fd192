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

package io.github.taskfolders.ddd.jooq;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.h2.jdbcx.JdbcConnectionPool;
import org.jooq.DSLContext;
import org.jooq.Queries;
import org.jooq.SQLDialect;
import org.jooq.conf.RenderQuotedNames;
import org.jooq.conf.Settings;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-time binding between the application and its database.
 *
 * <p>Opening the bindings creates the connection pool, the shared {@link DSLContext} and applies
 * {@value #SCHEMA_RESOURCE} once. Every {@link io.github.taskfolders.ddd.cqrs.BoundedContext} of
 * the application is then constructed with {@link #dslContextProvider()}.
 */
public final class StorageBindings implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(StorageBindings.class);

  static final String SCHEMA_RESOURCE = "db/schema.sql";

  private final JdbcConnectionPool connectionPool;
  private final DSLContext dslContext;

  private StorageBindings(final JdbcConnectionPool connectionPool, final DSLContext dslContext) {
    this.connectionPool = connectionPool;
    this.dslContext = dslContext;
  }

  /**
   * @param url JDBC URL of the H2 database
   * @param user to connect with
   * @param password to connect with, can be empty
   * @return bindings with the schema applied
   * @throws IllegalArgumentException if any argument is {@code null} or the URL is blank
   */
  public static StorageBindings open(final String url, final String user, final String password) {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("Database URL cannot be blank");
    }

    if (user == null || password == null) {
      throw new IllegalArgumentException("Database credentials cannot be null");
    }

    final JdbcConnectionPool connectionPool = JdbcConnectionPool.create(url, user, password);
    final DSLContext dslContext =
        DSL.using(
            connectionPool,
            SQLDialect.H2,
            new Settings()
                .withRenderSchema(false)
                .withRenderQuotedNames(RenderQuotedNames.NEVER));

    final StorageBindings bindings = new StorageBindings(connectionPool, dslContext);
    try {
      bindings.applySchema();
    } catch (RuntimeException e) {
      connectionPool.dispose();
      throw e;
    }

    LOGGER.info("Storage bound to '{}'", url);
    return bindings;
  }

  /**
   * @return the shared {@link DSLContext}
   */
  public DSLContext dsl() {
    return dslContext;
  }

  /**
   * @return provider returning the shared {@link DSLContext} for reads and writes alike
   */
  public DslContextProvider dslContextProvider() {
    return DslContextProvider.dslContextIdentity(dslContext);
  }

  @Override
  public void close() {
    connectionPool.dispose();
    LOGGER.debug("Storage connection pool disposed");
  }

  private void applySchema() {
    final Queries statements = dslContext.parser().parse(readSchema());
    statements.executeBatch();
    LOGGER.debug("Applied {} schema statements", statements.queries().length);
  }

  private static String readSchema() {
    try (InputStream input =
        StorageBindings.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
      if (input == null) {
        throw new IllegalStateException("'%s' is not on the classpath".formatted(SCHEMA_RESOURCE));
      }

      return new String(input.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
