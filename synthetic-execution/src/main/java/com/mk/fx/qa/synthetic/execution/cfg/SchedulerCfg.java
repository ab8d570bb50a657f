package com.mk.fx.qa.synthetic.execution.cfg;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Scheduler loop settings, bound from {@code synthetic.scheduler.*}.
 *
 * <pre>{@code
 * synthetic:
 *   scheduler:
 *     tick-interval: 60s
 *     recovery-interval: 10s
 *     shutdown-timeout: 30s
 *     auto-start: true
 * }</pre>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "synthetic.scheduler")
public class SchedulerCfg {

  /** Pause between the end of one tick and the next snapshot. */
  @NotNull
  @DurationMin(millis = 1)
  private Duration tickInterval = Duration.ofSeconds(60);

  /** Pause after a tick failed unexpectedly, before the loop tries again. */
  @NotNull
  @DurationMin(millis = 1)
  private Duration recoveryInterval = Duration.ofSeconds(10);

  /** How long context shutdown waits for an in-flight tick to drain. */
  @NotNull
  private Duration shutdownTimeout = Duration.ofSeconds(30);

  /** Whether the loop starts once the application is ready. */
  private boolean autoStart = true;
}
