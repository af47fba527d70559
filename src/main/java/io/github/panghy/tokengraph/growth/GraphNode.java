package io.github.panghy.tokengraph.growth;

/**
 * A node of the working graph. Mutated only by the run that owns the graph.
 */
public final class GraphNode {
  private final String id;
  private final String label;
  private final double weight;
  private final Layer layer;
  private final boolean synthetic;
  private int appearanceFrequency;
  // null until embedding was attempted; empty if it failed
  private float[] embedding;

  public GraphNode(String id, String label, double weight, Layer layer, boolean synthetic) {
    this.id = id;
    this.label = label;
    this.weight = weight;
    this.layer = layer;
    this.synthetic = synthetic;
    this.appearanceFrequency = 1;
  }

  GraphNode copy() {
    GraphNode c = new GraphNode(id, label, weight, layer, synthetic);
    c.appearanceFrequency = appearanceFrequency;
    c.embedding = embedding;
    return c;
  }

  public String getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  public double getWeight() {
    return weight;
  }

  public Layer getLayer() {
    return layer;
  }

  /** Whether the node came from a synthetic fallback delta. */
  public boolean isSynthetic() {
    return synthetic;
  }

  /** How many applied deltas mentioned this node. */
  public int getAppearanceFrequency() {
    return appearanceFrequency;
  }

  void incrementAppearance() {
    appearanceFrequency++;
  }

  public float[] getEmbedding() {
    return embedding;
  }

  void setEmbedding(float[] embedding) {
    this.embedding = embedding;
  }

  /** Whether an embedding attempt was made, successful or not. */
  public boolean embeddingAttempted() {
    return embedding != null;
  }

  /** Whether the node holds a usable embedding. */
  public boolean hasEmbedding() {
    return embedding != null && embedding.length > 0;
  }

  @Override
  public String toString() {
    return "GraphNode{" + id + ", label='" + label + "', layer=" + layer + ", freq=" + appearanceFrequency + "}";
  }
}
