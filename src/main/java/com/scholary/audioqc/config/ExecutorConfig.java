package com.scholary.audioqc.config;

import com.scholary.audioqc.logging.MdcTaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools behind the CPU pool and the GPU gate.
 *
 * <p>Both are fixed-size with an unbounded FIFO queue, so a task submitted for an admitted request
 * always waits for a worker instead of being rejected. The VAD pool has one thread per VAD worker;
 * admission to the GPU is bounded by the gate's permits, not by the queue.
 */
@Configuration
public class ExecutorConfig {

  @Bean(name = "cpuTaskExecutor")
  public ThreadPoolTaskExecutor cpuTaskExecutor(AudioQcProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.threadpoolWorkers());
    executor.setMaxPoolSize(properties.threadpoolWorkers());
    executor.setThreadNamePrefix("qc-cpu-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }

  @Bean(name = "vadTaskExecutor")
  public ThreadPoolTaskExecutor vadTaskExecutor(AudioQcProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.vadNumWorkers());
    executor.setMaxPoolSize(properties.vadNumWorkers());
    executor.setThreadNamePrefix("qc-vad-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
