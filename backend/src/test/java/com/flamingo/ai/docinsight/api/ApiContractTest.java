package com.flamingo.ai.docinsight.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docinsight.api.rest.AnalysisController;
import com.flamingo.ai.docinsight.api.rest.OutlineController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.multipart.MultipartFile;

/**
 * Contract tests for the HTTP surface.
 *
 * <ul>
 *   <li>POST /api/outline - Title and heading outline of one PDF
 *   <li>POST /api/analysis - Persona-driven section ranking over several PDFs
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("OutlineController API contract")
  class OutlineControllerContract {

    @Test
    @DisplayName("should be mapped to POST /api/outline")
    void shouldBeMappedToApiOutline() throws Exception {
      RequestMapping mapping = OutlineController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");

      PostMapping post =
          OutlineController.class
              .getMethod("outline", MultipartFile.class)
              .getAnnotation(PostMapping.class);
      assertThat(post.value()).containsExactly("/outline");
    }
  }

  @Nested
  @DisplayName("AnalysisController API contract")
  class AnalysisControllerContract {

    @Test
    @DisplayName("should be mapped under /api prefix")
    void shouldBeMappedUnderApiPrefix() {
      RequestMapping mapping = AnalysisController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
    }
  }
}
