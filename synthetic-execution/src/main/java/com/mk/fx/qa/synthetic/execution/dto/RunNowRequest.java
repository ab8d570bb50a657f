package com.mk.fx.qa.synthetic.execution.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of an on-demand execution request. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunNowRequest {

  @NotNull
  @Positive
  @JsonProperty("monitorId")
  private Long monitorId;
}
