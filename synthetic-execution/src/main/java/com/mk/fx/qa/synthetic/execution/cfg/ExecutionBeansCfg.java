package com.mk.fx.qa.synthetic.execution.cfg;

import com.mk.fx.qa.synthetic.execution.browser.BrowserSessionFactory;
import com.mk.fx.qa.synthetic.execution.browser.PlaywrightBrowserSessionFactory;
import com.mk.fx.qa.synthetic.execution.scheduler.Sleeper;
import com.mk.fx.qa.synthetic.execution.scheduler.WakeableSleeper;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Infrastructure beans that tests replace with deterministic fakes. */
@Configuration
public class ExecutionBeansCfg {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper sleeper() {
    return new WakeableSleeper();
  }

  @Bean
  public BrowserSessionFactory browserSessionFactory() {
    return new PlaywrightBrowserSessionFactory();
  }
}
