package fsa.json;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of an automaton.
 *
 * <p>Transition targets are kept as raw JSON nodes: a DFA maps each symbol to
 * a single state name while an NFA maps it to a list of state names.
 */
@JsonPropertyOrder({"kind", "states", "alphabet", "initialState", "finalStates", "transitions"})
class AutomatonDocument {

  @JsonProperty("kind")
  @JsonAlias("type")
  String kind;

  @JsonProperty("states")
  List<String> states = new ArrayList<>();

  @JsonProperty("alphabet")
  List<String> alphabet = new ArrayList<>();

  @JsonProperty("initialState")
  String initialState;

  @JsonProperty("finalStates")
  List<String> finalStates = new ArrayList<>();

  @JsonProperty("transitions")
  Map<String, Map<String, JsonNode>> transitions = new LinkedHashMap<>();

  AutomatonDocument() { }
}
