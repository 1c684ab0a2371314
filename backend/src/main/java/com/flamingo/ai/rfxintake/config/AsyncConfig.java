package com.flamingo.ai.rfxintake.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Bounded worker pool shared by all intake requests. */
@Configuration
public class AsyncConfig {

  @Bean(name = "intakeExecutor")
  public ThreadPoolTaskExecutor intakeExecutor(IntakeConfig intakeConfig) {
    IntakeConfig.Pipeline pipeline = intakeConfig.getPipeline();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(pipeline.getWorkerThreads());
    executor.setMaxPoolSize(pipeline.getWorkerThreads());
    executor.setQueueCapacity(pipeline.getQueueCapacity());
    executor.setThreadNamePrefix("rfx-intake-");
    // work never runs on the request thread; the pipeline resubmits until its deadline
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.initialize();
    return executor;
  }
}
