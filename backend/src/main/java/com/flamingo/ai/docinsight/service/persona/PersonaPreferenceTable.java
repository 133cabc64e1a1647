package com.flamingo.ai.docinsight.service.persona;

import com.flamingo.ai.docinsight.service.structure.model.SectionType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Persona-keyed lookup of content preferences and section-type affinities.
 *
 * <p>The constructor rejects a table that misses any {@link PersonaType} or, for a persona, any
 * {@link SectionType}, so adding a persona type fails fast until its rows are filled in.
 */
public final class PersonaPreferenceTable {

  private final Map<PersonaType, ContentPreferences> preferences;
  private final Map<PersonaType, Map<SectionType, Double>> affinities;

  public PersonaPreferenceTable(
      Map<PersonaType, ContentPreferences> preferences,
      Map<PersonaType, Map<SectionType, Double>> affinities) {
    EnumMap<PersonaType, ContentPreferences> prefCopy = new EnumMap<>(PersonaType.class);
    EnumMap<PersonaType, Map<SectionType, Double>> affinityCopy = new EnumMap<>(PersonaType.class);
    for (PersonaType type : PersonaType.values()) {
      ContentPreferences pref = preferences.get(type);
      Map<SectionType, Double> row = affinities.get(type);
      if (pref == null || row == null) {
        throw new IllegalArgumentException("Missing preference table entry for " + type);
      }
      EnumMap<SectionType, Double> rowCopy = new EnumMap<>(SectionType.class);
      for (SectionType sectionType : SectionType.values()) {
        Double value = row.get(sectionType);
        if (value == null || value < 0.0 || value > 1.0) {
          throw new IllegalArgumentException(
              "Affinity of " + type + " for " + sectionType + " must be in [0, 1]: " + value);
        }
        rowCopy.put(sectionType, value);
      }
      prefCopy.put(type, pref);
      affinityCopy.put(type, Collections.unmodifiableMap(rowCopy));
    }
    this.preferences = Collections.unmodifiableMap(prefCopy);
    this.affinities = Collections.unmodifiableMap(affinityCopy);
  }

  public static PersonaPreferenceTable defaults() {
    Map<PersonaType, ContentPreferences> preferences = new EnumMap<>(PersonaType.class);
    preferences.put(PersonaType.ACADEMIC_RESEARCHER, new ContentPreferences(0.8, 0.5, 0.1));
    preferences.put(PersonaType.BUSINESS_ANALYST, new ContentPreferences(0.4, 0.9, 0.3));
    preferences.put(PersonaType.STUDENT, new ContentPreferences(0.2, 0.2, 0.8));
    preferences.put(PersonaType.TECHNICAL_PROFESSIONAL, new ContentPreferences(0.7, 0.4, 0.3));

    Map<PersonaType, Map<SectionType, Double>> affinities = new EnumMap<>(PersonaType.class);
    affinities.put(
        PersonaType.ACADEMIC_RESEARCHER,
        row(0.9, 0.9, 0.5, 0.8, 0.3, 0.6, 0.4));
    affinities.put(
        PersonaType.BUSINESS_ANALYST,
        row(0.4, 0.8, 0.4, 0.7, 1.0, 0.4, 0.4));
    affinities.put(
        PersonaType.STUDENT,
        row(0.5, 0.4, 0.9, 0.5, 0.3, 0.9, 0.4));
    affinities.put(
        PersonaType.TECHNICAL_PROFESSIONAL,
        row(0.9, 0.6, 0.5, 0.5, 0.3, 0.7, 0.5));
    return new PersonaPreferenceTable(preferences, affinities);
  }

  public ContentPreferences preferences(PersonaType type) {
    return preferences.get(type);
  }

  public double affinity(PersonaType type, SectionType sectionType) {
    return affinities.get(type).get(sectionType);
  }

  // Values in SectionType declaration order
  private static Map<SectionType, Double> row(
      double methodology,
      double results,
      double introduction,
      double discussion,
      double financial,
      double conceptual,
      double other) {
    Map<SectionType, Double> row = new EnumMap<>(SectionType.class);
    row.put(SectionType.METHODOLOGY, methodology);
    row.put(SectionType.RESULTS, results);
    row.put(SectionType.INTRODUCTION, introduction);
    row.put(SectionType.DISCUSSION, discussion);
    row.put(SectionType.FINANCIAL, financial);
    row.put(SectionType.CONCEPTUAL, conceptual);
    row.put(SectionType.OTHER, other);
    return row;
  }
}
