package com.flamingo.ai.docinsight.service.structure.model;

/** Coarse content type of a section. Declaration order is the classification precedence. */
public enum SectionType {
  METHODOLOGY,
  RESULTS,
  INTRODUCTION,
  DISCUSSION,
  FINANCIAL,
  CONCEPTUAL,
  OTHER
}
