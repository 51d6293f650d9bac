package com.acme.voice.response;

import com.acme.voice.dispatch.ActionResult;
import com.acme.voice.intent.SensorKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns action results into the Italian sentence stored as the command's response. Depends only
 * on each result's type, outcome and payload, so the same results always give the same text.
 */
public class ResponseSynthesizer {

  public static final String NOT_RECOGNIZED =
      "Nessuna azione eseguita. Prova a riformulare il comando.";
  public static final String NO_TEXT = "Nessun testo da elaborare. Riprova il comando.";
  public static final String BLOCKED = "Comando rifiutato per motivi di sicurezza.";
  public static final String PROCESSING_ERROR =
      "Si è verificato un errore durante l'elaborazione del comando.";

  static final int HELP_PREVIEW = 3;

  public String synthesize(List<ActionResult> results) {
    if (results == null || results.isEmpty()) {
      return NOT_RECOGNIZED;
    }
    List<String> parts = new ArrayList<>(results.size());
    for (ActionResult result : results) {
      parts.add(fragment(result));
    }
    return String.join(" ", parts);
  }

  private String fragment(ActionResult result) {
    if (!result.success()) {
      return "Errore: " + result.error();
    }
    String description = result.action().description();
    Map<String, Object> payload = result.payload();
    return switch (result.action().type()) {
      case BIM_CONVERSION -> description + " avviata.";
      case SENSOR_READ -> sensorFragment(payload, description);
      case HELP -> helpFragment(payload, description);
      default -> description + " completato.";
    };
  }

  private static String sensorFragment(Map<String, Object> payload, String description) {
    Object unit = payload.getOrDefault("unit", "");
    if (payload.containsKey(SensorKind.TEMPERATURE.wire())) {
      return "Temperatura: " + payload.get(SensorKind.TEMPERATURE.wire()) + unit;
    }
    if (payload.containsKey(SensorKind.HUMIDITY.wire())) {
      return "Umidità: " + payload.get(SensorKind.HUMIDITY.wire()) + unit;
    }
    return description + " completato.";
  }

  private static String helpFragment(Map<String, Object> payload, String description) {
    if (!(payload.get("commands") instanceof List<?> commands) || commands.isEmpty()) {
      return description + " completato.";
    }
    List<String> preview = new ArrayList<>();
    for (Object command : commands.subList(0, Math.min(HELP_PREVIEW, commands.size()))) {
      preview.add(String.valueOf(command));
    }
    return "Comandi disponibili: " + String.join(", ", preview) + "...";
  }
}
