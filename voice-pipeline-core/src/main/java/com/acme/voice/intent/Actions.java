package com.acme.voice.intent;

import java.util.List;

/** The action variants, one record per {@link ActionType}. */
public final class Actions {

  private Actions() {}

  public record IotControl(IotOperation operation, long nodeId, String nodeName) implements Action {
    @Override
    public ActionType type() {
      return ActionType.IOT_CONTROL;
    }

    @Override
    public String description() {
      return operation.verb() + " " + nodeName;
    }
  }

  public record BimConversion(long modelId, String modelName, String conversionType)
      implements Action {
    public static final String AUTO = "auto";

    @Override
    public ActionType type() {
      return ActionType.BIM_CONVERSION;
    }

    @Override
    public String description() {
      return "Converte modello BIM " + modelName;
    }
  }

  public record BimStatus(String userId) implements Action {
    @Override
    public ActionType type() {
      return ActionType.BIM_STATUS;
    }

    @Override
    public String description() {
      return "Controlla stato modelli BIM";
    }
  }

  public record DocumentList(String userId) implements Action {
    @Override
    public ActionType type() {
      return ActionType.DOCUMENT_LIST;
    }

    @Override
    public String description() {
      return "Lista documenti disponibili";
    }
  }

  public record DocumentSearch(String userId, String query, List<String> terms) implements Action {
    public DocumentSearch {
      terms = List.copyOf(terms);
    }

    @Override
    public ActionType type() {
      return ActionType.DOCUMENT_SEARCH;
    }

    @Override
    public String description() {
      return "Cerca documenti con: " + query;
    }
  }

  public record MaintenanceStatus(String userId) implements Action {
    @Override
    public ActionType type() {
      return ActionType.MAINTENANCE_STATUS;
    }

    @Override
    public String description() {
      return "Controlla stato manutenzioni";
    }
  }

  public record MaintenanceCreate(String userId, Long houseId, String request) implements Action {
    @Override
    public ActionType type() {
      return ActionType.MAINTENANCE_CREATE;
    }

    @Override
    public String description() {
      return "Crea nuova manutenzione";
    }
  }

  public record BookingCreate(String userId, Long houseId, String request) implements Action {
    @Override
    public ActionType type() {
      return ActionType.BOOKING_CREATE;
    }

    @Override
    public String description() {
      return "Crea nuova prenotazione stanza";
    }
  }

  public record BookingList(String userId) implements Action {
    @Override
    public ActionType type() {
      return ActionType.BOOKING_LIST;
    }

    @Override
    public String description() {
      return "Lista prenotazioni";
    }
  }

  public record SensorRead(SensorKind sensor, Long houseId) implements Action {
    @Override
    public ActionType type() {
      return ActionType.SENSOR_READ;
    }

    @Override
    public String description() {
      return "Legge " + sensor.italianName() + " casa";
    }
  }

  public record SystemStatus(Long houseId) implements Action {
    @Override
    public ActionType type() {
      return ActionType.SYSTEM_STATUS;
    }

    @Override
    public String description() {
      return "Stato generale sistema";
    }
  }

  public record Help() implements Action {
    @Override
    public ActionType type() {
      return ActionType.HELP;
    }

    @Override
    public String description() {
      return "Mostra comandi disponibili";
    }
  }
}
