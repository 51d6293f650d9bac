package com.acme.voice.dispatch.handler;

import com.acme.voice.dispatch.ActionHandler;
import com.acme.voice.intent.ActionType;
import com.acme.voice.intent.Actions;
import com.acme.voice.intent.CommandContext;
import java.util.List;
import java.util.Map;

public class HelpHandler implements ActionHandler<Actions.Help> {

  static final List<String> COMMANDS =
      List.of(
          "Accendi/spegni luci - Controllo illuminazione",
          "Stato temperatura/umidità - Lettura sensori",
          "Converti BIM - Conversione modelli BIM",
          "Lista documenti - Visualizza documenti",
          "Stato manutenzione - Controlla manutenzioni",
          "Prenota stanza - Gestione prenotazioni",
          "Stato sistema - Panoramica sistema");

  @Override
  public ActionType type() {
    return ActionType.HELP;
  }

  @Override
  public Class<Actions.Help> actionClass() {
    return Actions.Help.class;
  }

  @Override
  public Map<String, Object> execute(Actions.Help action, CommandContext context) {
    return Map.of("commands", COMMANDS);
  }
}
