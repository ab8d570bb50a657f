package com.mk.fx.qa.synthetic.execution.cfg;

import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "synthetic.browser")
public class BrowserCfg {

  private boolean headless = true;

  @NotNull
  private List<String> launchArgs =
      new ArrayList<>(List.of("--no-sandbox", "--disable-setuid-sandbox"));

  /** Directory for per-check HAR files; defaults to {@code <java.io.tmpdir>/synthetic-traces}. */
  private String traceDirectory;
}
