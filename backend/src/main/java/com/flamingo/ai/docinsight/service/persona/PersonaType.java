package com.flamingo.ai.docinsight.service.persona;

import java.util.Locale;
import java.util.Set;

/**
 * Persona categories with the vocabulary that identifies each.
 *
 * <p>Declaration order breaks ties between equally matching vocabularies. {@link
 * #TECHNICAL_PROFESSIONAL} is the default when nothing matches.
 */
public enum PersonaType {
  ACADEMIC_RESEARCHER(
      Set.of(
          "researcher", "research", "phd", "scientist", "academic", "professor", "postdoc",
          "postdoctoral", "scholar", "lecturer", "doctoral", "literature")),
  BUSINESS_ANALYST(
      Set.of(
          "analyst", "investment", "investor", "financial", "finance", "business", "market",
          "revenue", "banker", "consultant", "economist", "accountant", "manager")),
  STUDENT(
      Set.of(
          "student", "undergraduate", "course", "exam", "exams", "learner", "pupil", "freshman",
          "homework", "coursework", "semester", "beginner")),
  TECHNICAL_PROFESSIONAL(
      Set.of(
          "engineer", "developer", "technical", "architect", "programmer", "administrator",
          "devops", "technician", "practitioner"));

  private final Set<String> vocabulary;

  PersonaType(Set<String> vocabulary) {
    this.vocabulary = vocabulary;
  }

  public Set<String> vocabulary() {
    return vocabulary;
  }

  /** Lower-case tag used in logs and responses, e.g. {@code academic_researcher}. */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
