package com.mk.fx.qa.synthetic.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SyntheticExecutionApplication {

  public static void main(String[] args) {
    SpringApplication.run(SyntheticExecutionApplication.class, args);
  }
}
