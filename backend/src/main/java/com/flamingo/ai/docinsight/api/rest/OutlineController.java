package com.flamingo.ai.docinsight.api.rest;

import com.flamingo.ai.docinsight.api.dto.response.OutlineResponse;
import com.flamingo.ai.docinsight.exception.DocumentProcessingException;
import com.flamingo.ai.docinsight.service.OutlineService;
import com.flamingo.ai.docinsight.service.extraction.model.DocumentSource;
import com.flamingo.ai.docinsight.service.structure.model.DocumentStructure;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for single-document outline extraction. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class OutlineController {

  private final OutlineService outlineService;

  /** Extracts the title and heading outline of an uploaded PDF. */
  @PostMapping(value = "/outline", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<OutlineResponse> outline(@RequestParam("file") MultipartFile file) {
    DocumentStructure structure = outlineService.outline(toSource(file));
    return ResponseEntity.ok(OutlineResponse.from(structure));
  }

  static DocumentSource toSource(MultipartFile file) {
    String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();
    try {
      return new DocumentSource(name, file.getBytes());
    } catch (IOException e) {
      throw new DocumentProcessingException(name, "Failed to read upload: " + e.getMessage(), e);
    }
  }
}
