package ca.gc.cra.prism.domain.payload;

import java.util.List;
import java.util.Objects;

/**
 * Node/edge structure with a category and an optional root node.
 */
public final class Graph extends Payload {
  private final GraphKind graphKind;
  private final List<GraphNode> nodes;
  private final List<GraphEdge> edges;
  private final String rootNodeId;

  public Graph(
      String id,
      long createdAtMillis,
      GraphKind graphKind,
      List<GraphNode> nodes,
      List<GraphEdge> edges,
      String rootNodeId) {
    super(id, createdAtMillis);
    this.graphKind = Objects.requireNonNull(graphKind, "graphKind");
    this.nodes = List.copyOf(nodes);
    this.edges = List.copyOf(edges);
    this.rootNodeId = rootNodeId == null ? "" : rootNodeId;
  }

  public GraphKind graphKind() {
    return graphKind;
  }

  public List<GraphNode> nodes() {
    return nodes;
  }

  public List<GraphEdge> edges() {
    return edges;
  }

  public String rootNodeId() {
    return rootNodeId;
  }

  /**
   * Renders nodes then edges as indented text for Reasoner prompts.
   *
   * @return multi-line description
   */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    sb.append("Nodes (").append(nodes.size()).append("):\n");
    for (GraphNode node : nodes) {
      sb.append("  - ").append(node.id()).append(" (").append(node.nodeType()).append("): ")
          .append(node.label()).append('\n');
    }
    sb.append("\nEdges (").append(edges.size()).append("):\n");
    for (GraphEdge edge : edges) {
      sb.append("  - ").append(edge.sourceId()).append(" -[").append(edge.edgeType()).append("]-> ")
          .append(edge.targetId()).append('\n');
    }
    return sb.toString();
  }

  @Override
  public PayloadKind kind() {
    return PayloadKind.GRAPH;
  }

  @Override
  public String summary() {
    return graphKind.label() + " graph with " + nodes.size() + " nodes and " + edges.size() + " edges";
  }

  @Override
  public String toString() {
    return "Graph{" + id() + ", " + graphKind.label() + "}";
  }
}
