package com.mysocial.relay.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pool that runs the channels of one delivery job concurrently. */
@Configuration
public class DeliveryExecutorConfig {

  @Bean
  ThreadPoolTaskExecutor deliveryChannelExecutor(DeliveryProperties properties) {
    final DeliveryProperties.Executor settings = properties.executor();
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("relay-delivery-");
    executor.setCorePoolSize(settings.corePoolSize());
    executor.setMaxPoolSize(settings.maxPoolSize());
    executor.setQueueCapacity(settings.queueCapacity());
    // a saturated pool runs the channel on the consumer thread
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    // in-flight sends finish during shutdown, bounded by await-termination
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(settings.awaitTermination().toMillis());
    return executor;
  }
}
