package com.acme.voice.dispatch.handler;

import com.acme.voice.dispatch.ActionHandler;
import com.acme.voice.domain.DocumentSummary;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.repository.DocumentRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DocumentListHandler implements ActionHandler<Actions.DocumentList> {

  private final DocumentRepository documentRepository;
  private final int limit;

  public DocumentListHandler(DocumentRepository documentRepository, int limit) {
    this.documentRepository = documentRepository;
    this.limit = limit;
  }

  @Override
  public ActionType type() {
    return ActionType.DOCUMENT_LIST;
  }

  @Override
  public Class<Actions.DocumentList> actionClass() {
    return Actions.DocumentList.class;
  }

  @Override
  public Map<String, Object> execute(Actions.DocumentList action, CommandContext context) {
    List<DocumentSummary> documents = documentRepository.findByUser(action.userId(), limit);
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("count", documents.size());
    payload.put("documents", summarize(documents));
    return payload;
  }

  static List<Map<String, Object>> summarize(List<DocumentSummary> documents) {
    return documents.stream()
        .map(d -> Map.<String, Object>of("id", d.id(), "name", d.name()))
        .toList();
  }
}
