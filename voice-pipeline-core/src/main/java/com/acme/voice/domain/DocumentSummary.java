package com.acme.voice.domain;

import java.time.Instant;

public record DocumentSummary(long id, String name, String fileType, Instant createdAt) {}
