package com.flamingo.ai.docinsight.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.docinsight.exception.ApiError;
import com.flamingo.ai.docinsight.exception.DocumentProcessingException;
import com.flamingo.ai.docinsight.exception.GlobalExceptionHandler;
import com.flamingo.ai.docinsight.service.OutlineService;
import com.flamingo.ai.docinsight.service.extraction.model.DocumentSource;
import com.flamingo.ai.docinsight.service.structure.model.DetectedTitle;
import com.flamingo.ai.docinsight.service.structure.model.DocumentStats;
import com.flamingo.ai.docinsight.service.structure.model.DocumentStructure;
import com.flamingo.ai.docinsight.service.structure.model.HeadingCandidate;
import com.flamingo.ai.docinsight.service.structure.model.HeadingLevel;
import com.flamingo.ai.docinsight.support.TestStructures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutlineController Tests")
class OutlineControllerTest {

  private MockMvc mockMvc;

  @Mock private OutlineService outlineService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new OutlineController(outlineService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  private static MockMultipartFile pdf(String name) {
    return new MockMultipartFile(
        "file", name, MediaType.APPLICATION_PDF_VALUE, "%PDF-1.7".getBytes());
  }

  private static DocumentStructure structure() {
    return new DocumentStructure(
        "report.pdf",
        new DetectedTitle("Market Report", TestStructures.line("Market Report", 0), 0.9),
        List.of(
            new HeadingCandidate(TestStructures.line("1. Introduction", 0), HeadingLevel.H1, 0.9),
            new HeadingCandidate(TestStructures.line("Revenue growth.", 0), HeadingLevel.NONE, 0),
            new HeadingCandidate(TestStructures.line("1.1 Scope", 1), HeadingLevel.H2, 0.8)),
        List.of(),
        DocumentStats.empty());
  }

  @Test
  @DisplayName("should return the title and heading outline")
  void shouldReturnOutline() throws Exception {
    when(outlineService.outline(any(DocumentSource.class))).thenReturn(structure());

    mockMvc
        .perform(multipart("/api/outline").file(pdf("report.pdf")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.title").value("Market Report"))
        .andExpect(jsonPath("$.outline.length()").value(2))
        .andExpect(jsonPath("$.outline[0].level").value("H1"))
        .andExpect(jsonPath("$.outline[0].text").value("1. Introduction"))
        .andExpect(jsonPath("$.outline[0].page").value(0))
        .andExpect(jsonPath("$.outline[1].level").value("H2"))
        .andExpect(jsonPath("$.outline[1].page").value(1));

    verify(outlineService).outline(argThat(s -> s.name().equals("report.pdf")));
  }

  @Test
  @DisplayName("should return an empty title when none was detected")
  void shouldReturnEmptyTitle() throws Exception {
    when(outlineService.outline(any(DocumentSource.class)))
        .thenReturn(DocumentStructure.empty("scan.pdf"));

    mockMvc
        .perform(multipart("/api/outline").file(pdf("scan.pdf")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.title").value(""))
        .andExpect(jsonPath("$.outline").isEmpty());
  }

  @Test
  @DisplayName("should return 422 when the document cannot be processed")
  void shouldReturnUnprocessableForBadPdf() throws Exception {
    when(outlineService.outline(any(DocumentSource.class)))
        .thenThrow(new DocumentProcessingException("bad.pdf", "Failed to parse PDF: EOF"));

    mockMvc
        .perform(multipart("/api/outline").file(pdf("bad.pdf")))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value(ApiError.DOCUMENT_PROCESSING_ERROR))
        .andExpect(jsonPath("$.message").value("Failed to process document"))
        .andExpect(jsonPath("$.path").value("/api/outline"));
  }

  @Test
  @DisplayName("should return 400 when no file part is sent")
  void shouldRejectMissingFile() throws Exception {
    mockMvc
        .perform(multipart("/api/outline"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
  }
}
