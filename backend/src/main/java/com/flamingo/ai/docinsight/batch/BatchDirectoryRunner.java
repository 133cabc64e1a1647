package com.flamingo.ai.docinsight.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flamingo.ai.docinsight.api.dto.response.AnalysisResponse;
import com.flamingo.ai.docinsight.api.dto.response.OutlineResponse;
import com.flamingo.ai.docinsight.config.DocInsightConfig;
import com.flamingo.ai.docinsight.exception.DocumentProcessingException;
import com.flamingo.ai.docinsight.service.OutlineService;
import com.flamingo.ai.docinsight.service.PersonaAnalysisService;
import com.flamingo.ai.docinsight.service.extraction.model.DocumentSource;
import com.flamingo.ai.docinsight.service.relevance.model.AnalysisReport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Processes a directory of PDFs once on startup.
 *
 * <p>In {@code outline} mode every PDF gets a {@code <name>.json} outline; a document that cannot
 * be processed gets an empty outline. In {@code analysis} mode the first {@code *.json} request in
 * the input directory names the documents, persona and job, and one ranked result file is written.
 */
@Component
@ConditionalOnProperty(prefix = "docinsight.batch", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BatchDirectoryRunner implements CommandLineRunner {

  private final DocInsightConfig config;
  private final OutlineService outlineService;
  private final PersonaAnalysisService analysisService;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Override
  public void run(String... args) throws IOException {
    DocInsightConfig.Batch batch = config.getBatch();
    Path inputDir = Path.of(batch.getInputDir());
    Path outputDir = Path.of(batch.getOutputDir());
    if (!Files.isDirectory(inputDir)) {
      log.error("Batch input directory {} does not exist", inputDir.toAbsolutePath());
      return;
    }
    Files.createDirectories(outputDir);

    long start = System.currentTimeMillis();
    if (batch.getMode() == DocInsightConfig.Batch.Mode.ANALYSIS) {
      runAnalysis(inputDir, outputDir.resolve(batch.getOutputFile()));
    } else {
      runOutline(inputDir, outputDir);
    }
    log.info("Batch {} completed in {} ms", batch.getMode(), System.currentTimeMillis() - start);
  }

  void runOutline(Path inputDir, Path outputDir) throws IOException {
    List<Path> pdfs = listFiles(inputDir, ".pdf");
    log.info("Extracting outlines for {} PDFs in {}", pdfs.size(), inputDir);
    for (Path pdf : pdfs) {
      String fileName = pdf.getFileName().toString();
      OutlineResponse response;
      try {
        response = OutlineResponse.from(outlineService.outline(read(pdf)));
      } catch (DocumentProcessingException | UncheckedIOException e) {
        log.warn("Writing empty outline for {}: {}", fileName, e.getMessage());
        response = OutlineResponse.empty();
      }
      Path target = outputDir.resolve(baseName(fileName) + ".json");
      write(target, response);
      log.debug("Wrote {}", target);
    }
  }

  void runAnalysis(Path inputDir, Path outputFile) throws IOException {
    AnalysisRequestFile request = loadRequest(inputDir);
    List<DocumentSource> sources = new ArrayList<>();
    for (String name : request.documents()) {
      Path pdf = inputDir.resolve(name);
      if (!Files.isRegularFile(pdf) || !name.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
        log.warn("Skipping missing or non-PDF document {}", name);
        continue;
      }
      try {
        sources.add(read(pdf));
      } catch (UncheckedIOException e) {
        log.warn("Skipping unreadable document {}: {}", name, e.getMessage());
      }
    }

    AnalysisResponse response;
    if (sources.isEmpty()) {
      log.warn("No readable documents in {}, writing empty analysis", inputDir);
      response =
          AnalysisResponse.from(
              new AnalysisReport(
                  request.documents(),
                  request.persona(),
                  request.jobToBeDone(),
                  LocalDateTime.now(clock),
                  List.of()));
    } else {
      AnalysisReport report =
          analysisService.analyze(sources, request.persona(), request.jobToBeDone());
      response = AnalysisResponse.from(report);
      log.info(
          "Selected {} sections from {} documents",
          response.getExtractedSections().size(),
          sources.size());
    }
    write(outputFile, response);
  }

  AnalysisRequestFile loadRequest(Path inputDir) throws IOException {
    Optional<Path> requestFile = listFiles(inputDir, ".json").stream().findFirst();
    if (requestFile.isPresent()) {
      log.info("Using request file {}", requestFile.get().getFileName());
      JsonNode root = objectMapper.readTree(requestFile.get().toFile());
      return AnalysisRequestFile.from(root);
    }
    List<String> pdfs =
        listFiles(inputDir, ".pdf").stream().map(p -> p.getFileName().toString()).toList();
    log.info("No request file in {}, analyzing all {} PDFs", inputDir, pdfs.size());
    return new AnalysisRequestFile(pdfs, "", "");
  }

  private static List<Path> listFiles(Path dir, String extension) throws IOException {
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(extension))
          .sorted()
          .toList();
    }
  }

  private static DocumentSource read(Path file) {
    try {
      return new DocumentSource(file.getFileName().toString(), Files.readAllBytes(file));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + file, e);
    }
  }

  private void write(Path target, Object value) throws IOException {
    objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(target.toFile(), value);
  }

  static String baseName(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
