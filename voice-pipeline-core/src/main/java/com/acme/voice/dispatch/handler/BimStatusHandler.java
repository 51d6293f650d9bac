package com.acme.voice.dispatch.handler;

import com.acme.voice.dispatch.ActionHandler;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.repository.BimModelRepository;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

public class BimStatusHandler implements ActionHandler<Actions.BimStatus> {

  private final BimModelRepository bimModelRepository;

  public BimStatusHandler(BimModelRepository bimModelRepository) {
    this.bimModelRepository = bimModelRepository;
  }

  @Override
  public ActionType type() {
    return ActionType.BIM_STATUS;
  }

  @Override
  public Class<Actions.BimStatus> actionClass() {
    return Actions.BimStatus.class;
  }

  @Override
  public Map<String, Object> execute(Actions.BimStatus action, CommandContext context) {
    Map<String, Integer> byStatus = new TreeMap<>(bimModelRepository.countByStatus(action.userId()));
    int total = byStatus.values().stream().mapToInt(Integer::intValue).sum();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("count", total);
    payload.put("by_status", byStatus);
    return payload;
  }
}
