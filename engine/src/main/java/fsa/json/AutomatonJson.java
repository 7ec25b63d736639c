package fsa.json;

import fsa.Automaton;
import fsa.AutomatonKind;
import fsa.Symbols;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonical JSON serialization of automata.
 *
 * <pre>{@code
 * {
 *   "kind" : "NFA",
 *   "states" : [ "q0", "q1" ],
 *   "alphabet" : [ "a" ],
 *   "initialState" : "q0",
 *   "finalStates" : [ "q1" ],
 *   "transitions" : { "q0" : { "a" : [ "q1" ], "ε" : [ "q1" ] } }
 * }
 * }</pre>
 *
 * <p>In a DFA, each symbol maps to a single state name instead of a list.
 * Reading accepts {@code "type"} in place of {@code "kind"}. Reading back a
 * written automaton yields an automaton equal to the original.
 */
public final class AutomatonJson {

  private static final Logger LOG = LoggerFactory.getLogger(AutomatonJson.class);

  private static final ObjectMapper MAPPER = new ObjectMapper()
    .enable(SerializationFeature.INDENT_OUTPUT)
    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private AutomatonJson() { }

  /**
   * Serialize an automaton.
   *
   * @param automaton automaton to serialize
   * @return JSON text
   */
  public static String write(Automaton automaton) {
    try {
      return MAPPER.writeValueAsString(toDocument(automaton));
    } catch (JsonProcessingException error) {
      throw new IllegalStateException("failed to serialize automaton", error);
    }
  }

  /**
   * Serialize an automaton into a file.
   *
   * @param automaton automaton to serialize
   * @param file destination (overwritten if it exists)
   * @throws IOException if the file cannot be written
   */
  public static void write(Automaton automaton, Path file) throws IOException {
    Files.writeString(file, write(automaton));
  }

  /**
   * Deserialize an automaton.
   *
   * @param json JSON text
   * @return automaton described by the text
   * @throws AutomatonFormatException if the text is not a valid automaton
   */
  public static Automaton read(String json) {
    final AutomatonDocument document;
    try {
      document = MAPPER.readValue(json, AutomatonDocument.class);
    } catch (JsonProcessingException error) {
      throw new AutomatonFormatException("malformed automaton JSON: " + error.getOriginalMessage(), error);
    }
    if (document == null) {
      throw new AutomatonFormatException("expected an automaton object, found null");
    }
    return fromDocument(document);
  }

  /**
   * Deserialize an automaton from a file.
   *
   * @param file file holding the JSON text
   * @return automaton described by the file
   * @throws IOException if the file cannot be read
   * @throws AutomatonFormatException if the file is not a valid automaton
   */
  public static Automaton read(Path file) throws IOException {
    LOG.debug("reading automaton from {}", file);
    return read(Files.readString(file));
  }

  static AutomatonDocument toDocument(Automaton automaton) {
    final var document = new AutomatonDocument();
    document.kind = automaton.kind().name();
    document.states = new ArrayList<>(automaton.states());
    document.alphabet = automaton
      .alphabet()
      .stream()
      .map(String::valueOf)
      .collect(Collectors.toList());
    document.initialState = automaton.initialState().orElse(null);
    document.finalStates = new ArrayList<>(automaton.finalStates());

    final var transitions = new LinkedHashMap<String, Map<String, JsonNode>>();
    for (String from : automaton.states()) {
      final Map<Character, Set<String>> outgoing = automaton.outgoing(from);
      if (outgoing.isEmpty()) {
        continue;
      }

      final var row = new LinkedHashMap<String, JsonNode>();
      for (Map.Entry<Character, Set<String>> entry : outgoing.entrySet()) {
        final String symbol = String.valueOf(entry.getKey());
        if (automaton.isDfa()) {
          row.put(symbol, TextNode.valueOf(entry.getValue().iterator().next()));
        } else {
          final ArrayNode targets = JsonNodeFactory.instance.arrayNode();
          entry.getValue().forEach(target -> targets.add(target));
          row.put(symbol, targets);
        }
      }
      transitions.put(from, row);
    }
    document.transitions = transitions;

    return document;
  }

  static Automaton fromDocument(AutomatonDocument document) {
    if (document.kind == null) {
      throw new AutomatonFormatException("missing automaton kind");
    }
    final AutomatonKind kind;
    try {
      kind = AutomatonKind.valueOf(document.kind);
    } catch (IllegalArgumentException error) {
      throw new AutomatonFormatException("unknown automaton kind: " + document.kind, error);
    }
    final var automaton = new Automaton(kind);

    for (String state : nonNull(document.states)) {
      if (state == null || state.isEmpty()) {
        throw new AutomatonFormatException("state names must be non-empty strings");
      }
      automaton.addState(state);
    }

    final List<Character> alphabet = new ArrayList<>();
    for (String symbol : nonNull(document.alphabet)) {
      alphabet.add(symbol(symbol));
    }
    automaton.setAlphabet(alphabet);

    if (document.initialState != null && !automaton.setInitialState(document.initialState)) {
      throw new AutomatonFormatException("initial state is not a declared state: " + document.initialState);
    }

    for (String state : nonNull(document.finalStates)) {
      if (!automaton.toggleFinalState(state, true)) {
        throw new AutomatonFormatException("final state is not a declared state: " + state);
      }
    }

    if (document.transitions != null) {
      for (Map.Entry<String, Map<String, JsonNode>> row : document.transitions.entrySet()) {
        final String from = row.getKey();
        if (!automaton.hasState(from)) {
          throw new AutomatonFormatException("transition source is not a declared state: " + from);
        }
        if (row.getValue() == null) {
          continue;
        }
        for (Map.Entry<String, JsonNode> entry : row.getValue().entrySet()) {
          final char symbol = symbol(entry.getKey());
          for (String to : targets(kind, from, entry.getKey(), entry.getValue())) {
            if (!automaton.addTransition(from, symbol, to)) {
              throw new AutomatonFormatException("invalid transition " + from + " -" + symbol + "-> " + to);
            }
          }
        }
      }
    }

    return automaton;
  }

  // Target state names of a transition entry, checking the shape against the kind
  private static List<String> targets(AutomatonKind kind, String from, String symbol, JsonNode node) {
    if (node != null && node.isTextual()) {
      return List.of(node.asText());
    }
    if (kind == AutomatonKind.NFA && node != null && node.isArray()) {
      final List<String> targets = new ArrayList<>();
      for (JsonNode target : node) {
        if (!target.isTextual()) {
          throw new AutomatonFormatException("transition target must be a state name: " + target);
        }
        targets.add(target.asText());
      }
      return targets;
    }
    throw new AutomatonFormatException(
      "unexpected " + kind + " transition target for " + from + " on " + symbol + ": " + node
    );
  }

  private static char symbol(String text) {
    try {
      return Symbols.parse(text);
    } catch (IllegalArgumentException error) {
      throw new AutomatonFormatException(error.getMessage(), error);
    }
  }

  private static <T> List<T> nonNull(List<T> list) {
    return list == null ? List.of() : list;
  }
}
