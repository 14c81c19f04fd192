package io.github.taskfolders.ddd.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class DomainExceptionTest {
  @Test
  void every_exception_reports_its_own_http_status_code() {
    assertEquals(400, new ValidationException("message").getStatusCode());
    assertEquals(404, new NotFoundException("message").getStatusCode());
    assertEquals(500, new InternalException("message", null).getStatusCode());
  }

  @Test
  void causes_are_preserved() {
    final IllegalStateException cause = new IllegalStateException();
    assertSame(cause, new ValidationException("message", cause).getCause());
    assertSame(cause, new InternalException("message", cause).getCause());
  }
}
