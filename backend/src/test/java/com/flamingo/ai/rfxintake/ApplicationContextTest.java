package com.flamingo.ai.rfxintake;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.rfxintake.config.IntakeConfig;
import com.flamingo.ai.rfxintake.service.pipeline.RfxIntakePipeline;
import dev.langchain4j.model.chat.ChatModel;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The chat model is mocked so the test runs without
 * an API key.
 */
@SpringBootTest(properties = "intake.features.use-zip=false")
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;

  @Autowired private ApplicationContext applicationContext;

  @Autowired private IntakeConfig intakeConfig;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext.getBean(RfxIntakePipeline.class)).isNotNull();
  }

  @Test
  @DisplayName("Intake properties should bind from application.yml and overrides")
  void intakePropertiesShouldBind() {
    assertThat(intakeConfig.getCorpus().getMaxChars()).isEqualTo(120_000);
    assertThat(intakeConfig.getExtraction().getInitialBackoff()).isEqualTo(Duration.ofSeconds(2));
    assertThat(intakeConfig.getOcr().getLanguage()).isEqualTo("spa+eng");
    assertThat(intakeConfig.featureFlags().useOcr()).isTrue();
    assertThat(intakeConfig.featureFlags().useZip()).isFalse();
  }

  @Test
  @DisplayName("Worker pool should be sized from the pipeline settings")
  void workerPoolShouldUseConfiguredSize() {
    ThreadPoolTaskExecutor executor =
        applicationContext.getBean("intakeExecutor", ThreadPoolTaskExecutor.class);

    assertThat(executor.getCorePoolSize()).isEqualTo(intakeConfig.getPipeline().getWorkerThreads());
    assertThat(executor.getThreadNamePrefix()).isEqualTo("rfx-intake-");
  }
}
