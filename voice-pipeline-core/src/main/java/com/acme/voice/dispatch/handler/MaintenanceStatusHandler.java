package com.acme.voice.dispatch.handler;

import com.acme.voice.dispatch.ActionHandler;
import com.acme.voice.domain.MaintenanceRecord;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.repository.MaintenanceRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MaintenanceStatusHandler implements ActionHandler<Actions.MaintenanceStatus> {

  private final MaintenanceRepository maintenanceRepository;
  private final int limit;

  public MaintenanceStatusHandler(MaintenanceRepository maintenanceRepository, int limit) {
    this.maintenanceRepository = maintenanceRepository;
    this.limit = limit;
  }

  @Override
  public ActionType type() {
    return ActionType.MAINTENANCE_STATUS;
  }

  @Override
  public Class<Actions.MaintenanceStatus> actionClass() {
    return Actions.MaintenanceStatus.class;
  }

  @Override
  public Map<String, Object> execute(Actions.MaintenanceStatus action, CommandContext context) {
    List<MaintenanceRecord> records = maintenanceRepository.findByUser(action.userId(), limit);
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("count", records.size());
    payload.put("pending", countWithStatus(records, MaintenanceRecord.STATUS_PENDING));
    payload.put("in_progress", countWithStatus(records, "in_progress"));
    return payload;
  }

  private static long countWithStatus(List<MaintenanceRecord> records, String status) {
    return records.stream().filter(r -> status.equals(r.status())).count();
  }
}
