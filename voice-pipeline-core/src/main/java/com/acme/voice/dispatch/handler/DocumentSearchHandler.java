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

/** Name search over the user's documents; without usable terms nothing is searched. */
public class DocumentSearchHandler implements ActionHandler<Actions.DocumentSearch> {

  private final DocumentRepository documentRepository;
  private final int limit;

  public DocumentSearchHandler(DocumentRepository documentRepository, int limit) {
    this.documentRepository = documentRepository;
    this.limit = limit;
  }

  @Override
  public ActionType type() {
    return ActionType.DOCUMENT_SEARCH;
  }

  @Override
  public Class<Actions.DocumentSearch> actionClass() {
    return Actions.DocumentSearch.class;
  }

  @Override
  public Map<String, Object> execute(Actions.DocumentSearch action, CommandContext context) {
    List<DocumentSummary> documents =
        action.terms().isEmpty()
            ? List.of()
            : documentRepository.searchByUser(action.userId(), action.terms(), limit);
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("terms", action.terms());
    payload.put("count", documents.size());
    payload.put("documents", DocumentListHandler.summarize(documents));
    return payload;
  }
}
