package com.flamingo.ai.chunker.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

@DisplayName("ChunkingConfig Tests")
class ChunkingConfigTest {

  private static ValidatorFactory validatorFactory;
  private static Validator validator;

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
          .withUserConfiguration(ChunkingConfig.class);

  @BeforeAll
  static void setUpValidator() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
    validator = validatorFactory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    validatorFactory.close();
  }

  @Test
  @DisplayName("should accept the defaults")
  void shouldAcceptDefaults() {
    assertThat(validator.validate(new ChunkingConfig())).isEmpty();
  }

  @Test
  @DisplayName("should reject a non-positive target and a negative overlap")
  void shouldRejectInvalidWordCounts() {
    ChunkingConfig config = new ChunkingConfig();
    config.setTargetWords(0);
    config.setOverlapWords(-1);

    Set<ConstraintViolation<ChunkingConfig>> violations = validator.validate(config);

    assertThat(violations)
        .extracting(violation -> violation.getPropertyPath().toString())
        .containsExactlyInAnyOrder("targetWords", "overlapWords");
  }

  @Test
  @DisplayName("should reject nested settings out of range")
  void shouldRejectInvalidNestedSettings() {
    ChunkingConfig config = new ChunkingConfig();
    config.getSections().setMinConfidence(1.5);
    config.getPdf().setHeaderScanLines(0);

    assertThat(validator.validate(config))
        .extracting(violation -> violation.getPropertyPath().toString())
        .containsExactlyInAnyOrder("sections.minConfidence", "pdf.headerScanLines");
  }

  @Test
  @DisplayName("should bind chunking properties")
  void shouldBindProperties() {
    contextRunner
        .withPropertyValues("chunking.target-words=250", "chunking.sections.min-confidence=0.7")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              ChunkingConfig config = context.getBean(ChunkingConfig.class);
              assertThat(config.getTargetWords()).isEqualTo(250);
              assertThat(config.getSections().getMinConfidence()).isEqualTo(0.7);
            });
  }

  @Test
  @DisplayName("should fail startup when a bound property is invalid")
  void shouldFailStartup_whenPropertyInvalid() {
    contextRunner
        .withPropertyValues("chunking.overflow-factor=0.5")
        .run(context -> assertThat(context).hasFailed());
  }
}
