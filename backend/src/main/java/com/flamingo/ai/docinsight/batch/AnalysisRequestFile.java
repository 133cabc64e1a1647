package com.flamingo.ai.docinsight.batch;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Collection request read from the batch input directory.
 *
 * <p>Accepts plain strings or the object form used by challenge inputs: {@code documents} entries
 * as {@code {"filename": ...}}, {@code persona} as {@code {"role": ...}} and {@code
 * job_to_be_done} as {@code {"task": ...}}.
 *
 * @param documents PDF file names relative to the input directory
 * @param persona persona text, empty if absent
 * @param jobToBeDone job text, empty if absent
 */
public record AnalysisRequestFile(List<String> documents, String persona, String jobToBeDone) {

  public static AnalysisRequestFile from(JsonNode root) {
    List<String> documents = new ArrayList<>();
    JsonNode docs = root.path("documents");
    if (docs.isArray()) {
      for (JsonNode doc : docs) {
        String name = doc.isTextual() ? doc.asText() : doc.path("filename").asText("");
        if (!name.isBlank()) {
          documents.add(name);
        }
      }
    }
    return new AnalysisRequestFile(
        List.copyOf(documents),
        text(root.path("persona"), "role"),
        text(root.path("job_to_be_done"), "task"));
  }

  private static String text(JsonNode node, String field) {
    if (node.isTextual()) {
      return node.asText();
    }
    return node.path(field).asText("");
  }
}
