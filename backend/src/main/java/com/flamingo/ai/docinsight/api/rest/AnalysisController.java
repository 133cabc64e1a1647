package com.flamingo.ai.docinsight.api.rest;

import com.flamingo.ai.docinsight.api.dto.response.AnalysisResponse;
import com.flamingo.ai.docinsight.exception.NoDocumentsException;
import com.flamingo.ai.docinsight.service.PersonaAnalysisService;
import com.flamingo.ai.docinsight.service.extraction.model.DocumentSource;
import com.flamingo.ai.docinsight.service.relevance.model.AnalysisReport;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for persona-driven section ranking over a document collection. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AnalysisController {

  private final PersonaAnalysisService analysisService;

  /** Ranks the sections of the uploaded PDFs for a persona and job-to-be-done. */
  @PostMapping(value = "/analysis", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<AnalysisResponse> analyze(
      @RequestParam(value = "files", required = false) List<MultipartFile> files,
      @RequestParam(value = "persona", required = false) @Size(max = 2000) String persona,
      @RequestParam(value = "jobToBeDone", required = false) @Size(max = 2000)
          String jobToBeDone) {
    if (files == null || files.isEmpty()) {
      throw new NoDocumentsException("At least one file is required");
    }
    List<DocumentSource> sources = files.stream().map(OutlineController::toSource).toList();
    AnalysisReport report = analysisService.analyze(sources, persona, jobToBeDone);
    return ResponseEntity.ok(AnalysisResponse.from(report));
  }
}
