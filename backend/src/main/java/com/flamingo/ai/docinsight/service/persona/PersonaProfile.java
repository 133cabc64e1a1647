package com.flamingo.ai.docinsight.service.persona;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Structured view of who is asking and what they need.
 *
 * @param type persona category
 * @param expertiseKeywords domain terms from the persona description
 * @param jobPriorities terms from the job-to-be-done description
 * @param preferences content preference targets
 */
public record PersonaProfile(
    PersonaType type,
    Set<String> expertiseKeywords,
    Set<String> jobPriorities,
    ContentPreferences preferences) {

  public static PersonaProfile neutral() {
    return new PersonaProfile(
        PersonaType.TECHNICAL_PROFESSIONAL, Set.of(), Set.of(), ContentPreferences.balanced());
  }

  /** Expertise keywords followed by job priorities, without duplicates. */
  public Set<String> allKeywords() {
    Set<String> all = new LinkedHashSet<>(expertiseKeywords);
    all.addAll(jobPriorities);
    return all;
  }
}
