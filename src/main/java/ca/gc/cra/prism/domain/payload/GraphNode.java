package ca.gc.cra.prism.domain.payload;

import java.util.Objects;

/**
 * Node of a {@link Graph}.
 *
 * @param id node id, unique within the graph
 * @param label display label
 * @param nodeType free-form node type
 * @param content optional node content
 * @param activation activation level
 */
public record GraphNode(String id, String label, String nodeType, String content, double activation) {
  public GraphNode {
    Objects.requireNonNull(id, "id");
    label = label == null ? "" : label;
    nodeType = nodeType == null ? "" : nodeType;
    content = content == null ? "" : content;
  }
}
