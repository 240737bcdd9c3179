package outreach.model;

/**
 * Product-line fit derived from the gate-automation and truck-parking fit scores.
 *
 * <p>A product line fits when its score reaches the threshold (inclusive).
 */
public enum FitCategory {
  GATE,
  TRUCK,
  BOTH,
  NONE;

  /**
   * Derives the category from two 0-100 fit scores.
   *
   * @param gateFit   gate-automation fit score
   * @param truckFit  truck-parking fit score
   * @param threshold minimum score for a product line to count as a fit
   * @return the fit category, never {@code null}
   */
  public static FitCategory of(int gateFit, int truckFit, int threshold) {
    boolean gate = gateFit >= threshold;
    boolean truck = truckFit >= threshold;
    if (gate && truck) {
      return BOTH;
    }
    if (gate) {
      return GATE;
    }
    if (truck) {
      return TRUCK;
    }
    return NONE;
  }

  public boolean fits() {
    return this != NONE;
  }
}
