package com.acme.voice.repository;

import com.acme.voice.domain.DocumentSummary;
import java.util.List;

public interface DocumentRepository {

  List<DocumentSummary> findByUser(String userId, int limit);

  /** Documents whose name contains any of the terms, case-insensitively. */
  List<DocumentSummary> searchByUser(String userId, List<String> terms, int limit);
}
