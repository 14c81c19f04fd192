package io.github.taskfolders.ddd.jooq;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.taskfolders.test.EmptyDomainMessage;
import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.Test;

class DslContextProviderTest {
  @Test
  void identity_provider_rejects_missing_context() {
    assertThrows(IllegalArgumentException.class, () -> DslContextProvider.dslContextIdentity(null));
  }

  @Test
  void identity_provider_hands_out_the_same_context_for_every_message() {
    final DSLContext dsl = DSL.using(SQLDialect.H2);
    final DslContextProvider provider = DslContextProvider.dslContextIdentity(dsl);

    assertSame(dsl, provider.apply(EmptyDomainMessage.getInstance()));
    assertSame(dsl, provider.apply(EmptyDomainMessage.getInstance()));
  }
}
