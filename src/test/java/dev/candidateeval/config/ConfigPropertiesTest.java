package dev.candidateeval.config;

import dev.candidateeval.ExitManager;
import dev.candidateeval.PipelineRunner;
import dev.candidateeval.generator.CategoryScoreGenerator;
import dev.candidateeval.generator.NoOpCategoryScoreGenerator;
import dev.candidateeval.model.MatchCategory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ConfigPropertiesTest {

  @MockitoBean
  private PipelineRunner pipelineRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private MatchingWeights matchingWeights;

  @Autowired
  private DecisionConfig decisionConfig;

  @Autowired
  private AssessmentConfig assessmentConfig;

  @Autowired
  private GeneratorConfig generatorConfig;

  @Autowired
  private RetryPolicy generatorRetryPolicy;

  @Autowired
  private PipelineConfig pipelineConfig;

  @Autowired
  private CategoryScoreGenerator categoryScoreGenerator;

  @Test
  void shouldBuildMatchingWeights() {
    assertThat(matchingWeights.weight(MatchCategory.SKILLS)).isEqualTo(0.40);
    assertThat(matchingWeights.weight(MatchCategory.ADDITIONAL)).isEqualTo(0.10);
  }

  @Test
  void shouldLoadDecisionConfig() {
    assertThat(decisionConfig.getProceedThreshold()).isEqualTo(70);
    assertThat(decisionConfig.getHoldThreshold()).isEqualTo(40);
    assertThat(decisionConfig.getFullLoopConfidence()).isEqualTo(85);
  }

  @Test
  void shouldLoadAssessmentConfig() {
    assertThat(assessmentConfig.getPassThreshold()).isEqualTo(60);
  }

  @Test
  void shouldUseTestRetrySettings() {
    assertThat(generatorConfig.getProvider()).isEqualTo("none");
    assertThat(generatorRetryPolicy.maxAttempts()).isEqualTo(2);
    assertThat(generatorRetryPolicy.initialBackoff()).isEqualTo(Duration.ofMillis(10));
    assertThat(generatorRetryPolicy.timeout()).isEqualTo(Duration.ofSeconds(2));
  }

  @Test
  void shouldWireNoOpGeneratorWithoutProvider() {
    assertThat(categoryScoreGenerator).isInstanceOf(NoOpCategoryScoreGenerator.class);
    assertThat(pipelineConfig.getConcurrency()).isEqualTo(2);
  }
}
