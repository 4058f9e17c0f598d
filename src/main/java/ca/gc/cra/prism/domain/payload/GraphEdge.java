package ca.gc.cra.prism.domain.payload;

import java.util.Objects;

/**
 * Directed edge of a {@link Graph}.
 *
 * @param id edge id
 * @param sourceId source node id
 * @param targetId target node id
 * @param edgeType free-form relation type
 * @param weight edge weight
 */
public record GraphEdge(String id, String sourceId, String targetId, String edgeType, double weight) {
  public GraphEdge {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(targetId, "targetId");
    edgeType = edgeType == null ? "" : edgeType;
  }
}
