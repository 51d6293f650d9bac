package com.acme.voice.spi;

import com.acme.voice.audit.AuditEvent;

public interface AuditLog {
  void record(AuditEvent event);
}
