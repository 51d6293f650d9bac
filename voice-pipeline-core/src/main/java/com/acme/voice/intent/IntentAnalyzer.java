package com.acme.voice.intent;

import com.acme.voice.domain.BimModel;
import com.acme.voice.domain.IotNode;
import com.acme.voice.repository.BimModelRepository;
import com.acme.voice.repository.NodeRepository;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule-based interpretation of a command text. The rule table is evaluated top to bottom and
 * every matching category contributes its actions, so one sentence can yield several actions.
 * Within a category only the first matching sub-case applies.
 */
public class IntentAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(IntentAnalyzer.class);

  private static final Set<String> SEARCH_STOP_WORDS =
      Set.of(
          "cerca", "cercami", "trova", "documento", "documenti", "file", "il", "lo", "la", "i",
          "gli", "le", "un", "uno", "una", "del", "dello", "della", "dei", "degli", "delle", "di",
          "da", "per", "con", "su", "sul", "sulla", "che", "mi", "me", "e");

  private final NodeRepository nodeRepository;
  private final BimModelRepository bimModelRepository;
  private final List<IntentRule> rules;

  public IntentAnalyzer(NodeRepository nodeRepository, BimModelRepository bimModelRepository) {
    this.nodeRepository = nodeRepository;
    this.bimModelRepository = bimModelRepository;
    this.rules =
        List.of(
            new IntentRule("iot", Set.of("accendi", "spegni", "luci", "luce"), this::iotActions),
            new IntentRule("bim", Set.of("bim", "modello", "converti", "carica"), this::bimActions),
            new IntentRule(
                "documents",
                Set.of("documento", "documenti", "file", "carica", "scarica"),
                this::documentActions),
            new IntentRule(
                "maintenance",
                Set.of("manutenzione", "ripara", "controlla", "stato"),
                this::maintenanceActions),
            new IntentRule(
                "bookings",
                Set.of("prenota", "prenotazione", "stanza", "camera"),
                this::bookingActions),
            new IntentRule(
                "info",
                Set.of("stato", "temperatura", "umidità", "informazioni"),
                this::infoActions),
            new IntentRule(
                "help", Set.of("aiuto", "help", "comandi"), (text, ctx) -> List.of(new Actions.Help())));
  }

  /** @return the actions in rule table order, empty when nothing matched */
  public List<Action> analyze(String text, CommandContext context) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    String normalized = normalize(text);
    List<Action> actions = new ArrayList<>();
    for (IntentRule rule : rules) {
      if (rule.matches(normalized)) {
        List<Action> produced = rule.builder().build(normalized, context);
        log.debug("Rule {} matched, {} action(s)", rule.category(), produced.size());
        actions.addAll(produced);
      }
    }
    log.info("Analyzed command {}: {} action(s)", context.recordId(), actions.size());
    return List.copyOf(actions);
  }

  /** Lower case, NFC composed, whitespace collapsed. */
  static String normalize(String text) {
    return Normalizer.normalize(text, Normalizer.Form.NFC)
        .toLowerCase(Locale.ROOT)
        .replaceAll("\\s+", " ")
        .trim();
  }

  List<IntentRule> rules() {
    return rules;
  }

  private List<Action> iotActions(String text, CommandContext ctx) {
    boolean lights = text.contains("luci") || text.contains("luce");
    IotOperation operation;
    if (text.contains("accendi") && lights) {
      operation = IotOperation.TURN_ON;
    } else if (text.contains("spegni") && lights) {
      operation = IotOperation.TURN_OFF;
    } else {
      return List.of();
    }
    if (ctx.houseId() == null) {
      log.info("Command {} has no house, no IoT node to control", ctx.recordId());
      return List.of();
    }
    List<Action> actions = new ArrayList<>();
    for (IotNode node : nodeRepository.findByHouseAndUser(ctx.houseId(), ctx.userId())) {
      if (isLight(node)) {
        actions.add(new Actions.IotControl(operation, node.id(), node.name()));
      }
    }
    return actions;
  }

  private static boolean isLight(IotNode node) {
    String name = node.name() == null ? "" : node.name().toLowerCase(Locale.ROOT);
    return name.contains("luce") || name.contains("luci") || name.contains("light");
  }

  private List<Action> bimActions(String text, CommandContext ctx) {
    if (text.contains("converti") && text.contains("bim")) {
      List<Action> actions = new ArrayList<>();
      for (BimModel model : bimModelRepository.findPendingByUser(ctx.userId())) {
        actions.add(
            new Actions.BimConversion(model.id(), model.name(), Actions.BimConversion.AUTO));
      }
      return actions;
    }
    if (text.contains("stato") && text.contains("bim")) {
      return List.of(new Actions.BimStatus(ctx.userId()));
    }
    return List.of();
  }

  private List<Action> documentActions(String text, CommandContext ctx) {
    if (text.contains("lista") && text.contains("documenti")) {
      return List.of(new Actions.DocumentList(ctx.userId()));
    }
    if (text.contains("cerca") && text.contains("document")) {
      return List.of(new Actions.DocumentSearch(ctx.userId(), text, searchTerms(text)));
    }
    return List.of();
  }

  static List<String> searchTerms(String text) {
    Set<String> terms = new LinkedHashSet<>();
    for (String word : text.split("[^\\p{L}\\p{N}]+")) {
      if (word.length() >= 3 && !SEARCH_STOP_WORDS.contains(word)) {
        terms.add(word);
      }
    }
    return List.copyOf(terms);
  }

  private List<Action> maintenanceActions(String text, CommandContext ctx) {
    if (text.contains("stato") && text.contains("manutenzione")) {
      return List.of(new Actions.MaintenanceStatus(ctx.userId()));
    }
    if (text.contains("nuova") && text.contains("manutenzione")) {
      return List.of(new Actions.MaintenanceCreate(ctx.userId(), ctx.houseId(), text));
    }
    return List.of();
  }

  private List<Action> bookingActions(String text, CommandContext ctx) {
    if (text.contains("prenota") && text.contains("stanza")) {
      return List.of(new Actions.BookingCreate(ctx.userId(), ctx.houseId(), text));
    }
    if (text.contains("prenotazioni")) {
      return List.of(new Actions.BookingList(ctx.userId()));
    }
    return List.of();
  }

  private List<Action> infoActions(String text, CommandContext ctx) {
    if (text.contains("temperatura")) {
      return List.of(new Actions.SensorRead(SensorKind.TEMPERATURE, ctx.houseId()));
    }
    if (text.contains("umidità")) {
      return List.of(new Actions.SensorRead(SensorKind.HUMIDITY, ctx.houseId()));
    }
    if (text.contains("stato") && text.contains("sistema")) {
      return List.of(new Actions.SystemStatus(ctx.houseId()));
    }
    return List.of();
  }
}
