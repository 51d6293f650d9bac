package com.acme.voice.audit;

import com.acme.voice.domain.CommandEnvelope;
import org.slf4j.MDC;

/** Puts the identity of the command being processed into the SLF4J MDC for the current thread. */
public final class CommandMdc implements AutoCloseable {
  public static final String TENANT = "tenant";
  public static final String USER = "user";
  public static final String RECORD = "record";

  private CommandMdc() {}

  public static CommandMdc open(CommandEnvelope envelope) {
    MDC.put(TENANT, envelope.tenantId());
    MDC.put(USER, envelope.userId());
    MDC.put(RECORD, String.valueOf(envelope.recordId()));
    return new CommandMdc();
  }

  @Override
  public void close() {
    MDC.remove(TENANT);
    MDC.remove(USER);
    MDC.remove(RECORD);
  }
}
