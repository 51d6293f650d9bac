package com.acme.voice.dispatch.handler;

import com.acme.voice.dispatch.ActionHandler;
import com.acme.voice.domain.MaintenanceRecord;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import com.acme.voice.repository.MaintenanceRepository;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/** Opens a pending maintenance request for the command's house. */
public class MaintenanceCreateHandler implements ActionHandler<Actions.MaintenanceCreate> {

  private final MaintenanceRepository maintenanceRepository;
  private final Clock clock;

  public MaintenanceCreateHandler(MaintenanceRepository maintenanceRepository, Clock clock) {
    this.maintenanceRepository = maintenanceRepository;
    this.clock = clock;
  }

  @Override
  public ActionType type() {
    return ActionType.MAINTENANCE_CREATE;
  }

  @Override
  public Class<Actions.MaintenanceCreate> actionClass() {
    return Actions.MaintenanceCreate.class;
  }

  @Override
  public Map<String, Object> execute(Actions.MaintenanceCreate action, CommandContext context) {
    if (action.houseId() == null) {
      throw new IllegalStateException("Nessuna casa associata al comando");
    }
    long id =
        maintenanceRepository.create(
            new MaintenanceRecord(
                null,
                context.tenantId(),
                action.userId(),
                action.houseId(),
                action.request(),
                MaintenanceRecord.STATUS_PENDING,
                clock.instant()));
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("maintenance_id", id);
    payload.put("status", MaintenanceRecord.STATUS_PENDING);
    return payload;
  }
}
