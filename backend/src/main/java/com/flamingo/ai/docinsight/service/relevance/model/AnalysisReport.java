package com.flamingo.ai.docinsight.service.relevance.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of ranking a document collection for one persona and job.
 *
 * @param inputDocuments document ids in input order
 * @param persona persona text as given
 * @param jobToBeDone job text as given
 * @param processedAt local processing time
 * @param sections selected sections ordered by rank
 */
public record AnalysisReport(
    List<String> inputDocuments,
    String persona,
    String jobToBeDone,
    LocalDateTime processedAt,
    List<RankedSection> sections) {}
