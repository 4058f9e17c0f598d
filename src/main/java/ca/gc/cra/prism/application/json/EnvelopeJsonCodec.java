package ca.gc.cra.prism.application.json;

import static ca.gc.cra.prism.application.json.JsonTree.array;
import static ca.gc.cra.prism.application.json.JsonTree.asObject;
import static ca.gc.cra.prism.application.json.JsonTree.booleanValue;
import static ca.gc.cra.prism.application.json.JsonTree.doubleValue;
import static ca.gc.cra.prism.application.json.JsonTree.enumValue;
import static ca.gc.cra.prism.application.json.JsonTree.intValue;
import static ca.gc.cra.prism.application.json.JsonTree.longValue;
import static ca.gc.cra.prism.application.json.JsonTree.optionalObject;
import static ca.gc.cra.prism.application.json.JsonTree.string;

import ca.gc.cra.prism.domain.clock.ClockState;
import ca.gc.cra.prism.domain.clock.GatingState;
import ca.gc.cra.prism.domain.payload.Envelope;
import ca.gc.cra.prism.domain.payload.EnvelopeContent;
import ca.gc.cra.prism.domain.payload.ErrorKind;
import ca.gc.cra.prism.domain.payload.Graph;
import ca.gc.cra.prism.domain.payload.GraphEdge;
import ca.gc.cra.prism.domain.payload.GraphKind;
import ca.gc.cra.prism.domain.payload.GraphNode;
import ca.gc.cra.prism.domain.payload.IntegratedResult;
import ca.gc.cra.prism.domain.payload.IntegrationFocus;
import ca.gc.cra.prism.domain.payload.Payload;
import ca.gc.cra.prism.domain.payload.PayloadError;
import ca.gc.cra.prism.domain.payload.PayloadKind;
import ca.gc.cra.prism.domain.payload.PerspectiveResult;
import ca.gc.cra.prism.domain.payload.PipelineState;
import ca.gc.cra.prism.domain.payload.StageSlots;
import ca.gc.cra.prism.domain.payload.TemporalScopeResult;
import ca.gc.cra.prism.domain.payload.Token;
import ca.gc.cra.prism.domain.payload.TokenKind;
import ca.gc.cra.prism.domain.stage.TemporalScope;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Serializes envelopes to JSON and reads them back.
 * <p><strong>Why:</strong> Emitted envelopes are handed to consumers outside the process (logs, queues,
 * files); the document carries everything needed to rebuild an equivalent envelope.</p>
 * <p><strong>Role:</strong> Application-level codec over the domain model. Written with a streaming
 * {@link JsonGenerator}; read through {@link JsonTree}.</p>
 * <p>The document holds id, kind, priority, route, errors, entry snapshot and stage, exit step and time,
 * and per payload its fields, state, branch slots and integrated result. Empty slots are omitted. A
 * failed slot keeps its message; the original exception is not serialized.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. Encode envelopes after they were emitted;
 * an envelope still in flight may be captured mid-stage.</p>
 *
 * @since 0.1.0
 */
public final class EnvelopeJsonCodec {
  /** Version written to and required from every document. */
  public static final int SCHEMA_VERSION = 1;

  private static final String TYPE_TOKEN = "token";
  private static final String TYPE_GRAPH = "graph";

  private final JsonFactory factory = new JsonFactory();
  private final JsonTree tree = new JsonTree(factory);

  /**
   * Writes {@code envelope} as a JSON document.
   *
   * @param envelope envelope to serialize
   * @return JSON text
   */
  public String encode(Envelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("id", envelope.id());
      gen.writeStringField("kind", envelope.kind().name());
      gen.writeNumberField("priority", envelope.priority());
      gen.writeNumberField("createdAtMillis", envelope.createdAtMillis());
      gen.writeStringField("stage", envelope.stage());
      Optional<ClockState> entry = envelope.entryState();
      if (entry.isPresent()) {
        gen.writeObjectFieldStart("entry");
        gen.writeNumberField("step", entry.get().step());
        gen.writeBooleanField("holdA", entry.get().holdA());
        gen.writeBooleanField("holdB", entry.get().holdB());
        gen.writeEndObject();
      }
      gen.writeNumberField("exitStep", envelope.exitStep());
      gen.writeNumberField("exitAtMillis", envelope.exitAtMillis());
      gen.writeArrayFieldStart("route");
      for (String hop : envelope.route()) {
        gen.writeString(hop);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("errors");
      for (PayloadError error : envelope.errors()) {
        writeError(gen, error);
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("payloads");
      for (Payload payload : envelope.payloads()) {
        writePayload(gen, payload);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to encode envelope " + envelope.id(), ex);
    }
    return out.toString();
  }

  private static void writeError(JsonGenerator gen, PayloadError error) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("timestampMillis", error.timestampMillis());
    gen.writeStringField("component", error.component());
    gen.writeStringField("kind", error.kind().name());
    gen.writeNumberField("step", error.step());
    gen.writeStringField("message", error.message());
    gen.writeEndObject();
  }

  private static void writePayload(JsonGenerator gen, Payload payload) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("id", payload.id());
    gen.writeNumberField("createdAtMillis", payload.createdAtMillis());
    gen.writeStringField("state", payload.state().name());
    if (payload instanceof Token token) {
      gen.writeStringField("type", TYPE_TOKEN);
      gen.writeStringField("content", token.content());
      gen.writeStringField("tokenKind", token.tokenKind().name());
      gen.writeStringField("source", token.source());
      gen.writeNumberField("salience", token.salience());
      gen.writeNumberField("relevance", token.relevance());
      gen.writeNumberField("confidence", token.confidence());
      gen.writeNumberField("valence", token.valence());
    } else if (payload instanceof Graph graph) {
      gen.writeStringField("type", TYPE_GRAPH);
      gen.writeStringField("graphKind", graph.graphKind().name());
      gen.writeStringField("rootNodeId", graph.rootNodeId());
      gen.writeArrayFieldStart("nodes");
      for (GraphNode node : graph.nodes()) {
        gen.writeStartObject();
        gen.writeStringField("id", node.id());
        gen.writeStringField("label", node.label());
        gen.writeStringField("nodeType", node.nodeType());
        gen.writeStringField("content", node.content());
        gen.writeNumberField("activation", node.activation());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeArrayFieldStart("edges");
      for (GraphEdge edge : graph.edges()) {
        gen.writeStartObject();
        gen.writeStringField("id", edge.id());
        gen.writeStringField("sourceId", edge.sourceId());
        gen.writeStringField("targetId", edge.targetId());
        gen.writeStringField("edgeType", edge.edgeType());
        gen.writeNumberField("weight", edge.weight());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }

    gen.writeArrayFieldStart("branchA");
    StageSlots<PerspectiveResult> branchA = payload.branchA();
    for (int i = 0; i < branchA.width(); i++) {
      Optional<PerspectiveResult> result = branchA.result(i);
      if (result.isPresent()) {
        PerspectiveResult perspective = result.get();
        gen.writeStartObject();
        gen.writeNumberField("index", i);
        gen.writeStringField("descriptorName", perspective.descriptorName());
        gen.writeStringField("binaryCode", perspective.binaryCode());
        gen.writeStringField("text", perspective.text());
        gen.writeNumberField("confidence", perspective.confidence());
        gen.writeEndObject();
      } else {
        writeFailure(gen, branchA.failure(i));
      }
    }
    gen.writeEndArray();

    gen.writeArrayFieldStart("branchB");
    StageSlots<TemporalScopeResult> branchB = payload.branchB();
    for (int i = 0; i < branchB.width(); i++) {
      Optional<TemporalScopeResult> result = branchB.result(i);
      if (result.isPresent()) {
        TemporalScopeResult cell = result.get();
        gen.writeStartObject();
        gen.writeNumberField("index", i);
        gen.writeStringField("descriptorName", cell.descriptorName());
        gen.writeStringField("temporal", cell.temporal().name());
        gen.writeStringField("scope", cell.scope().name());
        gen.writeNumberField("row", cell.row());
        gen.writeNumberField("column", cell.column());
        gen.writeStringField("text", cell.text());
        gen.writeNumberField("weight", cell.weight());
        gen.writeEndObject();
      } else {
        writeFailure(gen, branchB.failure(i));
      }
    }
    gen.writeEndArray();

    Optional<IntegratedResult> integrated = payload.integrated();
    if (integrated.isPresent()) {
      IntegratedResult result = integrated.get();
      gen.writeObjectFieldStart("integrated");
      gen.writeNumberField("step", result.step());
      gen.writeBooleanField("holdA", result.gating().holdA());
      gen.writeBooleanField("holdB", result.gating().holdB());
      gen.writeStringField("focus", result.focus().name());
      gen.writeNumberField("branchAUsed", result.branchAUsed());
      gen.writeNumberField("branchBUsed", result.branchBUsed());
      gen.writeStringField("text", result.text());
      gen.writeEndObject();
    }
    gen.writeEndObject();
  }

  private static void writeFailure(JsonGenerator gen, Optional<StageSlots.SlotFailure> failure)
      throws IOException {
    if (failure.isEmpty()) {
      return;
    }
    gen.writeStartObject();
    gen.writeNumberField("index", failure.get().index());
    gen.writeStringField("descriptorName", failure.get().descriptorName());
    gen.writeStringField("failure", failure.get().message());
    gen.writeEndObject();
  }

  /**
   * Rebuilds an envelope from a document written by {@link #encode(Envelope)}. The result is detached
   * from any controller. Payloads that carry recorded output are refused if submitted again.
   *
   * @param json JSON text
   * @return reconstructed envelope
   * @throws IllegalArgumentException when the document is malformed, of another schema version, or
   *     inconsistent with its declared kind
   */
  public Envelope decode(String json) {
    Map<String, Object> root = tree.parseObject(json);
    int version = intValue(root, "schemaVersion");
    if (version != SCHEMA_VERSION) {
      throw new IllegalArgumentException("unsupported envelope schema version " + version);
    }
    PayloadKind kind = enumValue(root, "kind", PayloadKind.class);
    List<Payload> payloads = new ArrayList<>();
    for (Object item : array(root, "payloads")) {
      payloads.add(readPayload(asObject(item, "payloads[]")));
    }

    Envelope envelope = new Envelope(
        string(root, "id"), content(kind, payloads), intValue(root, "priority"), longValue(root, "createdAtMillis"));
    Map<String, Object> entry = optionalObject(root, "entry");
    if (entry != null) {
      envelope.enter(
          new ClockState(intValue(entry, "step"), booleanValue(entry, "holdA"), booleanValue(entry, "holdB")),
          string(root, "stage"));
    }
    for (Object hop : array(root, "route")) {
      if (!(hop instanceof String text)) {
        throw new IllegalArgumentException("route entries must be strings");
      }
      envelope.appendRoute(text);
    }
    for (Object item : array(root, "errors")) {
      Map<String, Object> error = asObject(item, "errors[]");
      envelope.recordError(new PayloadError(
          longValue(error, "timestampMillis"),
          string(error, "component"),
          enumValue(error, "kind", ErrorKind.class),
          intValue(error, "step"),
          string(error, "message")));
    }
    envelope.exit(intValue(root, "exitStep"), longValue(root, "exitAtMillis"));
    return envelope;
  }

  private static EnvelopeContent content(PayloadKind kind, List<Payload> payloads) {
    return switch (kind) {
      case TOKEN -> new EnvelopeContent.SingleToken(single(payloads, Token.class, kind));
      case GRAPH -> new EnvelopeContent.SingleGraph(single(payloads, Graph.class, kind));
      case TOKEN_BATCH -> new EnvelopeContent.TokenBatch(all(payloads, Token.class, kind));
      case GRAPH_BATCH -> new EnvelopeContent.GraphBatch(all(payloads, Graph.class, kind));
    };
  }

  private static <P extends Payload> P single(List<Payload> payloads, Class<P> type, PayloadKind kind) {
    if (payloads.size() != 1) {
      throw new IllegalArgumentException(kind + " envelope must hold exactly one payload, found " + payloads.size());
    }
    return all(payloads, type, kind).get(0);
  }

  private static <P extends Payload> List<P> all(List<Payload> payloads, Class<P> type, PayloadKind kind) {
    List<P> typed = new ArrayList<>(payloads.size());
    for (Payload payload : payloads) {
      if (!type.isInstance(payload)) {
        throw new IllegalArgumentException(kind + " envelope cannot hold " + payload);
      }
      typed.add(type.cast(payload));
    }
    return typed;
  }

  private static Payload readPayload(Map<String, Object> map) {
    String type = string(map, "type");
    String id = string(map, "id");
    long createdAtMillis = longValue(map, "createdAtMillis");
    Payload payload;
    if (TYPE_TOKEN.equals(type)) {
      payload = new Token(id, createdAtMillis,
          string(map, "content"),
          enumValue(map, "tokenKind", TokenKind.class),
          string(map, "source"),
          doubleValue(map, "salience"),
          doubleValue(map, "relevance"),
          doubleValue(map, "confidence"),
          doubleValue(map, "valence"));
    } else if (TYPE_GRAPH.equals(type)) {
      List<GraphNode> nodes = new ArrayList<>();
      for (Object item : array(map, "nodes")) {
        Map<String, Object> node = asObject(item, "nodes[]");
        nodes.add(new GraphNode(string(node, "id"), string(node, "label"), string(node, "nodeType"),
            string(node, "content"), doubleValue(node, "activation")));
      }
      List<GraphEdge> edges = new ArrayList<>();
      for (Object item : array(map, "edges")) {
        Map<String, Object> edge = asObject(item, "edges[]");
        edges.add(new GraphEdge(string(edge, "id"), string(edge, "sourceId"), string(edge, "targetId"),
            string(edge, "edgeType"), doubleValue(edge, "weight")));
      }
      payload = new Graph(id, createdAtMillis, enumValue(map, "graphKind", GraphKind.class), nodes, edges,
          string(map, "rootNodeId"));
    } else {
      throw new IllegalArgumentException("unknown payload type '" + type + "'");
    }

    for (Object item : array(map, "branchA")) {
      Map<String, Object> cell = asObject(item, "branchA[]");
      int index = slotIndex(cell, payload.branchA());
      if (cell.containsKey("failure")) {
        payload.branchA().fail(index, string(cell, "descriptorName"), string(cell, "failure"));
      } else {
        payload.branchA().complete(index, new PerspectiveResult(index,
            string(cell, "descriptorName"),
            string(cell, "binaryCode"),
            string(cell, "text"),
            doubleValue(cell, "confidence")));
      }
    }
    for (Object item : array(map, "branchB")) {
      Map<String, Object> cell = asObject(item, "branchB[]");
      int index = slotIndex(cell, payload.branchB());
      if (cell.containsKey("failure")) {
        payload.branchB().fail(index, string(cell, "descriptorName"), string(cell, "failure"));
      } else {
        payload.branchB().complete(index, new TemporalScopeResult(index,
            string(cell, "descriptorName"),
            enumValue(cell, "temporal", TemporalScope.Temporal.class),
            enumValue(cell, "scope", TemporalScope.Scope.class),
            intValue(cell, "row"),
            intValue(cell, "column"),
            string(cell, "text"),
            doubleValue(cell, "weight")));
      }
    }
    Map<String, Object> integrated = optionalObject(map, "integrated");
    if (integrated != null) {
      payload.integrate(new IntegratedResult(
          intValue(integrated, "step"),
          new GatingState(booleanValue(integrated, "holdA"), booleanValue(integrated, "holdB")),
          enumValue(integrated, "focus", IntegrationFocus.class),
          intValue(integrated, "branchAUsed"),
          intValue(integrated, "branchBUsed"),
          string(integrated, "text")));
    }
    payload.transitionTo(enumValue(map, "state", PipelineState.class));
    return payload;
  }

  private static int slotIndex(Map<String, Object> cell, StageSlots<?> slots) {
    int index = intValue(cell, "index");
    if (index < 0 || index >= slots.width()) {
      throw new IllegalArgumentException(slots.stage() + " index " + index + " outside [0, " + slots.width() + ")");
    }
    return index;
  }
}
