package com.flamingo.ai.docinsight.service;

import com.flamingo.ai.docinsight.config.DocInsightConfig;
import com.flamingo.ai.docinsight.exception.NoDocumentsException;
import com.flamingo.ai.docinsight.service.extraction.model.DocumentSource;
import com.flamingo.ai.docinsight.service.persona.PersonaAnalyzer;
import com.flamingo.ai.docinsight.service.persona.PersonaProfile;
import com.flamingo.ai.docinsight.service.relevance.DiversityAwareSelector;
import com.flamingo.ai.docinsight.service.relevance.ExcerptRefiner;
import com.flamingo.ai.docinsight.service.relevance.RelevanceScorer;
import com.flamingo.ai.docinsight.service.relevance.model.AnalysisReport;
import com.flamingo.ai.docinsight.service.relevance.model.RankedSection;
import com.flamingo.ai.docinsight.service.relevance.model.ScoredSection;
import com.flamingo.ai.docinsight.service.structure.model.DocumentStructure;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Ranks the sections of a document collection for a persona and job-to-be-done.
 *
 * <p>Documents are extracted independently, on the document processing executor when parallel
 * processing is enabled, and joined in input order before scoring. A document that cannot be read
 * contributes no sections but does not fail the collection.
 */
@Service
@Slf4j
public class PersonaAnalysisService {

  private final OutlineService outlineService;
  private final PersonaAnalyzer personaAnalyzer;
  private final RelevanceScorer relevanceScorer;
  private final DiversityAwareSelector selector;
  private final ExcerptRefiner excerptRefiner;
  private final DocInsightConfig config;
  private final Executor documentProcessingExecutor;
  private final Clock clock;

  public PersonaAnalysisService(
      OutlineService outlineService,
      PersonaAnalyzer personaAnalyzer,
      RelevanceScorer relevanceScorer,
      DiversityAwareSelector selector,
      ExcerptRefiner excerptRefiner,
      DocInsightConfig config,
      @Qualifier("documentProcessingExecutor") Executor documentProcessingExecutor,
      Clock clock) {
    this.outlineService = outlineService;
    this.personaAnalyzer = personaAnalyzer;
    this.relevanceScorer = relevanceScorer;
    this.selector = selector;
    this.excerptRefiner = excerptRefiner;
    this.config = config;
    this.documentProcessingExecutor = documentProcessingExecutor;
    this.clock = clock;
  }

  /**
   * Extracts every document and ranks its sections.
   *
   * @param sources documents in input order
   * @param persona persona description, may be blank
   * @param jobToBeDone job description, may be blank
   * @return the ranked report
   * @throws NoDocumentsException if {@code sources} is empty
   */
  @Timed(value = "docinsight.analysis", description = "Time to rank a document collection")
  public AnalysisReport analyze(List<DocumentSource> sources, String persona, String jobToBeDone) {
    if (sources == null || sources.isEmpty()) {
      throw new NoDocumentsException("At least one document is required");
    }
    log.info(
        "Analyzing {} documents (parallel={})",
        sources.size(),
        config.getProcessing().isParallel());
    return analyzeStructures(extractAll(sources), persona, jobToBeDone);
  }

  /**
   * Ranks the sections of already extracted documents.
   *
   * @param documents document structures in input order
   * @param persona persona description, may be blank
   * @param jobToBeDone job description, may be blank
   * @return the ranked report
   */
  public AnalysisReport analyzeStructures(
      List<DocumentStructure> documents, String persona, String jobToBeDone) {
    PersonaProfile profile = personaAnalyzer.analyze(persona, jobToBeDone);
    List<ScoredSection> scored = relevanceScorer.score(documents, profile);
    List<RankedSection> ranked =
        selector.select(scored).stream()
            .map(r -> r.withRefinedText(refine(r.scored())))
            .toList();

    log.info(
        "Persona {}: {} candidate sections, {} selected",
        profile.type().tag(),
        scored.size(),
        ranked.size());

    return new AnalysisReport(
        documents.stream().map(DocumentStructure::documentId).toList(),
        persona != null ? persona : "",
        jobToBeDone != null ? jobToBeDone : "",
        LocalDateTime.now(clock),
        ranked);
  }

  private List<DocumentStructure> extractAll(List<DocumentSource> sources) {
    if (!config.getProcessing().isParallel() || sources.size() == 1) {
      return sources.stream().map(outlineService::outlineOrEmpty).toList();
    }
    List<CompletableFuture<DocumentStructure>> futures =
        sources.stream()
            .map(
                source ->
                    CompletableFuture.supplyAsync(
                        () -> outlineService.outlineOrEmpty(source), documentProcessingExecutor))
            .toList();
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private String refine(ScoredSection scored) {
    String body = scored.section().rawText();
    return excerptRefiner.refine(body.isBlank() ? scored.displayTitle() : body);
  }
}
