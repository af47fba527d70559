package io.github.panghy.tokengraph.growth;

/**
 * Blend weights for {@link Salience} and {@link ContextSalience}.
 *
 * @param degree       weight of the incident edge count
 * @param weightSum    weight of the summed incident edge weight
 * @param frequency    weight of the appearance frequency
 * @param baseline     contextual blend: normalized baseline salience
 * @param intertwining contextual blend: share of contexts containing the token
 * @param peakiness    contextual blend: sharpness of the token's projection onto a context
 */
public record SalienceWeights(
    double degree, double weightSum, double frequency, double baseline, double intertwining, double peakiness) {

  public static final SalienceWeights DEFAULT = new SalienceWeights(0.6, 0.3, 0.1, 0.55, 0.30, 0.15);
}
