package com.flamingo.ai.docinsight.service.structure;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docinsight.service.structure.model.SectionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SectionTypeClassifier Tests")
class SectionTypeClassifierTest {

  private final SectionTypeClassifier classifier = new SectionTypeClassifier();

  @Test
  @DisplayName("should classify by title keywords")
  void shouldClassifyByTitle() {
    assertThat(classifier.classify("Research Methods", "")).isEqualTo(SectionType.METHODOLOGY);
    assertThat(classifier.classify("Experimental Results", "")).isEqualTo(SectionType.RESULTS);
    assertThat(classifier.classify("Introduction", "")).isEqualTo(SectionType.INTRODUCTION);
    assertThat(classifier.classify("Conclusions and Limitations", ""))
        .isEqualTo(SectionType.DISCUSSION);
    assertThat(classifier.classify("Revenue and Profit", "")).isEqualTo(SectionType.FINANCIAL);
    assertThat(classifier.classify("Core Concepts", "")).isEqualTo(SectionType.CONCEPTUAL);
    assertThat(classifier.classify("Acknowledgements", "")).isEqualTo(SectionType.OTHER);
  }

  @Test
  @DisplayName("should let the title win over the body")
  void shouldPreferTitle() {
    assertThat(classifier.classify("Methodology", "revenue profit budget sales income"))
        .isEqualTo(SectionType.METHODOLOGY);
  }

  @Test
  @DisplayName("should fall back to the body when it has at least two hits")
  void shouldFallBackToBody() {
    assertThat(
            classifier.classify(
                "Part Two", "Quarterly revenue grew while the budget and costs stayed flat."))
        .isEqualTo(SectionType.FINANCIAL);
    assertThat(classifier.classify("Part Two", "Revenue is mentioned once here."))
        .isEqualTo(SectionType.OTHER);
  }

  @Test
  @DisplayName("should handle blank input")
  void shouldHandleBlankInput() {
    assertThat(classifier.classify("", "")).isEqualTo(SectionType.OTHER);
    assertThat(classifier.classify(null, null)).isEqualTo(SectionType.OTHER);
  }
}
