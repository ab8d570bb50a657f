package com.mk.fx.qa.synthetic.execution.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI syntheticExecutionOpenApi(
      @Value("${spring.application.name:synthetic-execution-runner}") String applicationName) {
    return new OpenAPI()
        .info(
            new Info()
                .title(applicationName)
                .version("v1")
                .description(
                    "Runs headless-browser checks against registered monitors, records page"
                        + " timings and HAR traces, and controls the periodic check loop."));
  }
}
