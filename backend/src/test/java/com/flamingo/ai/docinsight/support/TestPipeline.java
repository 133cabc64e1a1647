package com.flamingo.ai.docinsight.support;

import com.flamingo.ai.docinsight.config.DocInsightConfig;
import com.flamingo.ai.docinsight.service.structure.AdaptiveHeadingPolicy;
import com.flamingo.ai.docinsight.service.structure.DocumentStructureExtractor;
import com.flamingo.ai.docinsight.service.structure.HeadingClassifier;
import com.flamingo.ai.docinsight.service.structure.LayoutNormalizer;
import com.flamingo.ai.docinsight.service.structure.SectionSegmenter;
import com.flamingo.ai.docinsight.service.structure.SectionTypeClassifier;
import com.flamingo.ai.docinsight.service.structure.TitleDetector;
import io.micrometer.core.instrument.MeterRegistry;

/** Wires the structure pipeline without a Spring context. */
public final class TestPipeline {

  private TestPipeline() {}

  public static DocumentStructureExtractor structureExtractor(
      DocInsightConfig config, MeterRegistry meterRegistry) {
    return new DocumentStructureExtractor(
        new LayoutNormalizer(config),
        new TitleDetector(config),
        new HeadingClassifier(new AdaptiveHeadingPolicy(config), config),
        new SectionSegmenter(new SectionTypeClassifier()),
        meterRegistry);
  }
}
