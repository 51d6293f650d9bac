package com.acme.voice.dispatch.handler;

import com.acme.voice.dispatch.ActionHandler;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.repository.MaintenanceRepository;
import com.acme.voice.repository.NodeRepository;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

public class SystemStatusHandler implements ActionHandler<Actions.SystemStatus> {

  private final NodeRepository nodeRepository;
  private final MaintenanceRepository maintenanceRepository;
  private final Clock clock;

  public SystemStatusHandler(
      NodeRepository nodeRepository, MaintenanceRepository maintenanceRepository, Clock clock) {
    this.nodeRepository = nodeRepository;
    this.maintenanceRepository = maintenanceRepository;
    this.clock = clock;
  }

  @Override
  public ActionType type() {
    return ActionType.SYSTEM_STATUS;
  }

  @Override
  public Class<Actions.SystemStatus> actionClass() {
    return Actions.SystemStatus.class;
  }

  @Override
  public Map<String, Object> execute(Actions.SystemStatus action, CommandContext context) {
    Long houseId = action.houseId();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("active_nodes", houseId == null ? 0 : nodeRepository.countActiveByHouse(houseId));
    payload.put(
        "pending_maintenance",
        houseId == null ? 0 : maintenanceRepository.countPendingByHouse(houseId));
    payload.put("system_status", "operational");
    payload.put("timestamp", clock.instant().toString());
    return payload;
  }
}
