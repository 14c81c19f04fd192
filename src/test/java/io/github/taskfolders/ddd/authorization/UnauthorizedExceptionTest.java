package io.github.taskfolders.ddd.authorization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import io.github.taskfolders.ddd.error.DomainException;
import org.junit.jupiter.api.Test;

class UnauthorizedExceptionTest {
  @Test
  void is_a_domain_exception_keeping_its_message() {
    final var e = new UnauthorizedException("message");

    assertInstanceOf(DomainException.class, e);
    assertEquals("message", e.getMessage());
  }

  @Test
  void must_have_unauthorized_http_status_code() {
    assertEquals(401, new UnauthorizedException("message").getStatusCode());
  }
}
