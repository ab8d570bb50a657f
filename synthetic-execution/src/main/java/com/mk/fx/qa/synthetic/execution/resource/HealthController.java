package com.mk.fx.qa.synthetic.execution.resource;

import com.mk.fx.qa.synthetic.execution.dto.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Health")
@RestController
@RequiredArgsConstructor
public class HealthController {

  private final Clock clock;

  @Operation(summary = "Health check", description = "Liveness of the service.")
  @GetMapping("/health")
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(new HealthResponse("healthy", clock.instant()));
  }
}
