package io.b2mash.collab.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulingConfig {

  /**
   * Shared scheduler for {@code @Scheduled} jobs, realtime session lookups and auth timeouts.
   * Registered under the bean name the scheduling infrastructure resolves first.
   */
  @Bean(name = "taskScheduler")
  public ThreadPoolTaskScheduler taskScheduler() {
    var scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(4);
    scheduler.setThreadNamePrefix("collab-sched-");
    return scheduler;
  }
}
