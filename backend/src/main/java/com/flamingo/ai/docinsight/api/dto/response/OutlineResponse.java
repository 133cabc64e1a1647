package com.flamingo.ai.docinsight.api.dto.response;

import com.flamingo.ai.docinsight.service.structure.model.DocumentStructure;
import com.flamingo.ai.docinsight.service.structure.model.HeadingCandidate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a document outline. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutlineResponse {

  private String title;
  private List<OutlineEntry> outline;

  /** One heading of the outline. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class OutlineEntry {
    private String level;
    private String text;
    private int page;

    static OutlineEntry from(HeadingCandidate heading) {
      return OutlineEntry.builder()
          .level(heading.level().name())
          .text(heading.line().text())
          .page(heading.line().pageIndex())
          .build();
    }
  }

  /** Creates an OutlineResponse from an extracted document structure. */
  public static OutlineResponse from(DocumentStructure structure) {
    return OutlineResponse.builder()
        .title(structure.title().isPresent() ? structure.title().text() : "")
        .outline(structure.outline().stream().map(OutlineEntry::from).toList())
        .build();
  }

  /** Output written for a document that could not be processed. */
  public static OutlineResponse empty() {
    return OutlineResponse.builder().title("").outline(List.of()).build();
  }
}
