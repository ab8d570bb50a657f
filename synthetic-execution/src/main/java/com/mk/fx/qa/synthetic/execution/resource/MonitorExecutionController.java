package com.mk.fx.qa.synthetic.execution.resource;

import com.mk.fx.qa.synthetic.execution.dto.ExecutionLogResponse;
import com.mk.fx.qa.synthetic.execution.dto.RunNowRequest;
import com.mk.fx.qa.synthetic.execution.dto.RunNowResponse;
import com.mk.fx.qa.synthetic.execution.persistence.ExecutionStore;
import com.mk.fx.qa.synthetic.execution.registry.MonitorNotFoundException;
import com.mk.fx.qa.synthetic.execution.registry.MonitorRegistry;
import com.mk.fx.qa.synthetic.execution.scheduler.MonitorScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Monitor Executions", description = "On-demand checks and execution history")
@RestController
@RequestMapping("/api/monitors")
@Validated
@RequiredArgsConstructor
public class MonitorExecutionController {

  private final MonitorScheduler scheduler;
  private final MonitorRegistry registry;
  private final ExecutionStore executionStore;
  private final ExecutionMapper executionMapper;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Execute a monitor",
      description = "Runs one check immediately, persists it and returns the result.")
  @PostMapping("/execute")
  public ResponseEntity<RunNowResponse> execute(@Valid @RequestBody RunNowRequest request) {
    log.info("Received on-demand execution for monitor {}", request.getMonitorId());
    return run(request.getMonitorId());
  }

  @Operation(summary = "Run a monitor", description = "Same as execute, with the id in the path.")
  @PostMapping("/{monitorId}/run")
  public ResponseEntity<RunNowResponse> runMonitor(@PathVariable long monitorId) {
    log.info("Received on-demand run for monitor {}", monitorId);
    return run(monitorId);
  }

  @Operation(
      summary = "Recent executions",
      description = "Returns the latest execution records of a monitor, newest first.")
  @GetMapping("/{monitorId}/logs")
  public ResponseEntity<List<ExecutionLogResponse>> getLogs(
      @PathVariable long monitorId,
      @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
    if (registry.getMonitor(monitorId).isEmpty()) {
      throw new MonitorNotFoundException(monitorId);
    }
    var records = executionStore.findRecentExecutions(monitorId, limit);
    return responseFactory.ok(executionMapper.toLogResponses(records));
  }

  private ResponseEntity<RunNowResponse> run(long monitorId) {
    var outcome = scheduler.runNow(monitorId);
    log.info(
        "Monitor {} on-demand run logged as {} with status {}",
        monitorId,
        outcome.recordId(),
        outcome.result().status().value());
    return responseFactory.ok(executionMapper.toRunNowResponse(outcome));
  }
}
