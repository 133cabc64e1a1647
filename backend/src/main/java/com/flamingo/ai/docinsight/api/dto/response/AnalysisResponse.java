package com.flamingo.ai.docinsight.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.docinsight.service.relevance.model.AnalysisReport;
import com.flamingo.ai.docinsight.service.relevance.model.RankedSection;
import java.time.format.DateTimeFormatter;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for persona-driven section ranking. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {

  private Metadata metadata;

  @JsonProperty("extracted_sections")
  private List<ExtractedSection> extractedSections;

  @JsonProperty("sub_section_analysis")
  private List<SubSectionAnalysis> subSectionAnalysis;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Metadata {
    @JsonProperty("input_documents")
    private List<String> inputDocuments;

    private String persona;

    @JsonProperty("job_to_be_done")
    private String jobToBeDone;

    @JsonProperty("processing_timestamp")
    private String processingTimestamp;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ExtractedSection {
    private String document;

    @JsonProperty("section_title")
    private String sectionTitle;

    @JsonProperty("importance_rank")
    private int importanceRank;

    @JsonProperty("page_number")
    private int pageNumber;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class SubSectionAnalysis {
    private String document;

    @JsonProperty("refined_text")
    private String refinedText;

    @JsonProperty("page_number")
    private int pageNumber;
  }

  /** Creates an AnalysisResponse from a ranking report. */
  public static AnalysisResponse from(AnalysisReport report) {
    List<RankedSection> sections = report.sections();
    return AnalysisResponse.builder()
        .metadata(
            Metadata.builder()
                .inputDocuments(report.inputDocuments())
                .persona(report.persona())
                .jobToBeDone(report.jobToBeDone())
                .processingTimestamp(
                    report.processedAt().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
                .build())
        .extractedSections(
            sections.stream()
                .map(
                    s ->
                        ExtractedSection.builder()
                            .document(s.scored().documentId())
                            .sectionTitle(s.scored().displayTitle())
                            .importanceRank(s.rank())
                            .pageNumber(s.scored().page())
                            .build())
                .toList())
        .subSectionAnalysis(
            sections.stream()
                .map(
                    s ->
                        SubSectionAnalysis.builder()
                            .document(s.scored().documentId())
                            .refinedText(s.refinedText())
                            .pageNumber(s.scored().page())
                            .build())
                .toList())
        .build();
  }
}
