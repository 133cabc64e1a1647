package com.flamingo.ai.docinsight.service.relevance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The five relevance factors behind a composite score, each in [0, 1].
 *
 * @param keywordMatch share of profile keywords found in the section, saturating
 * @param sectionType persona affinity for the section's content type
 * @param contentDepth closeness of the section's depth to the persona's target
 * @param quantitativeContent closeness of the section's numeric density to the persona's target
 * @param positionImportance earlier sections score higher
 */
public record ScoreBreakdown(
    @JsonProperty("keyword_match") double keywordMatch,
    @JsonProperty("section_type") double sectionType,
    @JsonProperty("content_depth") double contentDepth,
    @JsonProperty("quantitative_content") double quantitativeContent,
    @JsonProperty("position_importance") double positionImportance) {}
