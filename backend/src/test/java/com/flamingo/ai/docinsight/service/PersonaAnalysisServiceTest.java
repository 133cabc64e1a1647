package com.flamingo.ai.docinsight.service;

import static com.flamingo.ai.docinsight.support.TestStructures.document;
import static com.flamingo.ai.docinsight.support.TestStructures.section;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docinsight.config.DocInsightConfig;
import com.flamingo.ai.docinsight.exception.NoDocumentsException;
import com.flamingo.ai.docinsight.service.extraction.model.DocumentSource;
import com.flamingo.ai.docinsight.service.persona.KeywordExtractor;
import com.flamingo.ai.docinsight.service.persona.PersonaAnalyzer;
import com.flamingo.ai.docinsight.service.persona.PersonaPreferenceTable;
import com.flamingo.ai.docinsight.service.relevance.DiversityAwareSelector;
import com.flamingo.ai.docinsight.service.relevance.ExcerptRefiner;
import com.flamingo.ai.docinsight.service.relevance.RelevanceScorer;
import com.flamingo.ai.docinsight.service.relevance.model.AnalysisReport;
import com.flamingo.ai.docinsight.service.relevance.model.RankedSection;
import com.flamingo.ai.docinsight.service.structure.model.DocumentStructure;
import com.flamingo.ai.docinsight.service.structure.model.SectionType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("PersonaAnalysisService Tests")
class PersonaAnalysisServiceTest {

  private static final Instant NOW = Instant.parse("2025-03-14T09:26:53Z");

  private static final String METHODS_TEXT =
      "We trained the model on three public datasets and measured accuracy on held out splits. "
          + "The evaluation protocol follows prior benchmarks for graph neural networks.";

  private static final String RESULTS_TEXT =
      "The model reached 91.2% accuracy on the first dataset and 87.5% on the second one. "
          + "Performance improved by 4% over the strongest baseline in every benchmark.";

  private static final String DISCUSSION_TEXT =
      "These findings suggest that pretraining on molecular graphs transfers well to new tasks. "
          + "Limitations remain for very small datasets with noisy labels and few examples.";

  @Mock private OutlineService outlineService;

  private DocInsightConfig config;
  private PersonaAnalysisService service;

  @BeforeEach
  void setUp() {
    config = new DocInsightConfig();
    config.getSelection().setMinScore(0.0);
    config.getProcessing().setParallel(false);

    PersonaPreferenceTable table = PersonaPreferenceTable.defaults();
    service =
        new PersonaAnalysisService(
            outlineService,
            new PersonaAnalyzer(new KeywordExtractor(), table),
            new RelevanceScorer(config, table),
            new DiversityAwareSelector(config, new SimpleMeterRegistry()),
            new ExcerptRefiner(config),
            config,
            Runnable::run,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static DocumentStructure paper(String id, String title) {
    return document(
        id,
        title,
        section(0, "Methodology", METHODS_TEXT, 0, SectionType.METHODOLOGY),
        section(1, "Results", RESULTS_TEXT, 1, SectionType.RESULTS),
        section(2, "Discussion", DISCUSSION_TEXT, 2, SectionType.DISCUSSION));
  }

  private static DocumentSource source(String name) {
    return new DocumentSource(name, new byte[] {1, 2, 3});
  }

  private void stubOutlines(Map<String, DocumentStructure> structures) {
    when(outlineService.outlineOrEmpty(any(DocumentSource.class)))
        .thenAnswer(
            inv -> {
              DocumentSource src = inv.getArgument(0);
              return structures.getOrDefault(src.name(), DocumentStructure.empty(src.name()));
            });
  }

  @Nested
  @DisplayName("analyze")
  class Analyze {

    @Test
    @DisplayName("should rank at most top-k sections and represent every document")
    void shouldRankAcrossDocuments() {
      stubOutlines(
          Map.of("a.pdf", paper("a.pdf", "Paper A"), "b.pdf", paper("b.pdf", "Paper B")));

      AnalysisReport report =
          service.analyze(
              List.of(source("a.pdf"), source("b.pdf")),
              "PhD Researcher in Computational Biology",
              "Prepare a literature review focusing on methodologies and datasets");

      assertThat(report.inputDocuments()).containsExactly("a.pdf", "b.pdf");
      assertThat(report.sections()).hasSize(5);
      assertThat(report.sections()).extracting(RankedSection::rank).containsExactly(1, 2, 3, 4, 5);
      assertThat(report.sections())
          .extracting(r -> r.scored().documentId())
          .contains("a.pdf", "b.pdf");
      assertThat(report.sections())
          .allSatisfy(r -> assertThat(r.refinedText()).isNotBlank());
      assertThat(report.persona()).isEqualTo("PhD Researcher in Computational Biology");
    }

    @Test
    @DisplayName("should stamp the report with the injected clock")
    void shouldUseClock() {
      stubOutlines(Map.of("a.pdf", paper("a.pdf", "Paper A")));

      AnalysisReport report = service.analyze(List.of(source("a.pdf")), "Student", "Revise");

      assertThat(report.processedAt()).isEqualTo(LocalDateTime.of(2025, 3, 14, 9, 26, 53));
    }

    @Test
    @DisplayName("should fill every slot under the default quality threshold without a persona")
    void shouldFillTopKWithDefaultMinScore() {
      double defaultMinScore = new DocInsightConfig().getSelection().getMinScore();
      config.getSelection().setMinScore(defaultMinScore);
      stubOutlines(
          Map.of("a.pdf", paper("a.pdf", "Paper A"), "b.pdf", paper("b.pdf", "Paper B")));

      AnalysisReport report = service.analyze(List.of(source("a.pdf"), source("b.pdf")), "", "");

      assertThat(defaultMinScore).isEqualTo(0.25);
      assertThat(report.sections()).hasSize(config.getSelection().getTopK()).hasSize(5);
      assertThat(report.sections())
          .allSatisfy(r -> assertThat(r.scored().score()).isGreaterThanOrEqualTo(0.25));
      assertThat(report.sections())
          .extracting(r -> r.scored().documentId())
          .contains("a.pdf", "b.pdf");
    }

    @Test
    @DisplayName("should keep going when one document cannot be read")
    void shouldIsolateFailedDocument() {
      stubOutlines(Map.of("good.pdf", paper("good.pdf", "Good Paper")));

      AnalysisReport report =
          service.analyze(List.of(source("broken.pdf"), source("good.pdf")), "", "");

      assertThat(report.inputDocuments()).containsExactly("broken.pdf", "good.pdf");
      assertThat(report.sections())
          .isNotEmpty()
          .allSatisfy(r -> assertThat(r.scored().documentId()).isEqualTo("good.pdf"));
    }

    @Test
    @DisplayName("should run extraction on the executor when parallel processing is enabled")
    void shouldExtractInParallel() {
      config.getProcessing().setParallel(true);
      stubOutlines(
          Map.of("a.pdf", paper("a.pdf", "Paper A"), "b.pdf", paper("b.pdf", "Paper B")));

      AnalysisReport report = service.analyze(List.of(source("a.pdf"), source("b.pdf")), "", "");

      assertThat(report.inputDocuments()).containsExactly("a.pdf", "b.pdf");
      assertThat(report.sections()).hasSize(5);
    }

    @Test
    @DisplayName("should reject an empty document list")
    void shouldRejectEmptyInput() {
      assertThatThrownBy(() -> service.analyze(List.of(), "Analyst", "Compare revenue"))
          .isInstanceOf(NoDocumentsException.class);
      verify(outlineService, never()).outlineOrEmpty(any());
    }
  }

  @Nested
  @DisplayName("analyzeStructures")
  class AnalyzeStructures {

    @Test
    @DisplayName("should return no sections when every section is too short")
    void shouldReturnEmptyForShortSections() {
      DocumentStructure tiny =
          document(
              "tiny.pdf",
              "Tiny",
              section(0, "Intro", "Short text.", 0, SectionType.INTRODUCTION),
              section(1, "End", "Also short.", 0, SectionType.DISCUSSION));

      AnalysisReport report = service.analyzeStructures(List.of(tiny), null, null);

      assertThat(report.sections()).isEmpty();
      assertThat(report.persona()).isEmpty();
      assertThat(report.jobToBeDone()).isEmpty();
    }

    @Test
    @DisplayName("should title a preamble section with the document title")
    void shouldRefinePreamble() {
      DocumentStructure doc =
          document("notes.pdf", "Field Notes", section(0, "", METHODS_TEXT, 0, SectionType.OTHER));

      AnalysisReport report = service.analyzeStructures(List.of(doc), "", "");

      assertThat(report.sections()).hasSize(1);
      assertThat(report.sections().get(0).scored().displayTitle()).isEqualTo("Field Notes");
      assertThat(report.sections().get(0).refinedText()).startsWith("We trained the model");
    }
  }
}
