package com.mk.fx.qa.synthetic.execution.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Starts the scheduler loop once the application is up. */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "synthetic.scheduler",
    name = "auto-start",
    havingValue = "true",
    matchIfMissing = true)
public class SchedulerAutoStart implements ApplicationRunner {

  private final MonitorScheduler scheduler;

  @Override
  public void run(ApplicationArguments args) {
    if (!scheduler.start()) {
      log.warn("Scheduler auto-start skipped, loop already active");
    }
  }
}
