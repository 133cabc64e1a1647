package com.flamingo.ai.docinsight.service.persona;

/**
 * How much a persona values depth, numbers and introductory material, each in [0, 1].
 *
 * @param technicalDepth target for the measured content depth of a section
 * @param quantitativeFocus target for the measured quantitative density of a section
 * @param introductoryFocus preference for introductory and conceptual sections
 */
public record ContentPreferences(
    double technicalDepth, double quantitativeFocus, double introductoryFocus) {

  public ContentPreferences {
    requireUnit("technicalDepth", technicalDepth);
    requireUnit("quantitativeFocus", quantitativeFocus);
    requireUnit("introductoryFocus", introductoryFocus);
  }

  public static ContentPreferences balanced() {
    return new ContentPreferences(0.5, 0.5, 0.5);
  }

  private static void requireUnit(String name, double value) {
    if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
      throw new IllegalArgumentException(name + " must be in [0, 1]: " + value);
    }
  }
}
