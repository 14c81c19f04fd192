package io.github.taskfolders.test;

import io.github.taskfolders.ddd.authorization.DomainClient;
import java.io.Serial;

/** Client which none of the handlers accept. */
public final class AnotherDomainClient implements DomainClient {
  @Serial private static final long serialVersionUID = 4721398217645391107L;

  private static final AnotherDomainClient INSTANCE = new AnotherDomainClient();

  private AnotherDomainClient() {}

  public static AnotherDomainClient getInstance() {
    return INSTANCE;
  }

  @Override
  public String domainRole() {
    return "ANOTHER";
  }
}
