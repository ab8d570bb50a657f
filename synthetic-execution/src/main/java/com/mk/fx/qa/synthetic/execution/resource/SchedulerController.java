package com.mk.fx.qa.synthetic.execution.resource;

import com.mk.fx.qa.synthetic.execution.dto.ExecutionMetricsResponse;
import com.mk.fx.qa.synthetic.execution.dto.SchedulerStatusResponse;
import com.mk.fx.qa.synthetic.execution.metrics.ExecutionStatistics;
import com.mk.fx.qa.synthetic.execution.scheduler.MonitorScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Scheduler", description = "Control and inspect the periodic check loop")
@RestController
@RequiredArgsConstructor
public class SchedulerController {

  private final MonitorScheduler scheduler;
  private final ExecutionStatistics statistics;
  private final ExecutionMapper executionMapper;
  private final ApiResponseFactory responseFactory;

  @Operation(summary = "Scheduler status", description = "Returns the loop state and counters.")
  @GetMapping("/api/scheduler")
  public ResponseEntity<SchedulerStatusResponse> status() {
    return responseFactory.ok(executionMapper.toStatusResponse(scheduler.status()));
  }

  @Operation(
      summary = "Start scheduler",
      description = "Starts the loop. Rejected while a loop thread is still running or draining.")
  @PostMapping("/api/scheduler/start")
  public ResponseEntity<?> start() {
    if (!scheduler.start()) {
      return responseFactory.error(
          HttpStatus.CONFLICT, "Conflict", "Scheduler loop is already running or still draining");
    }
    return responseFactory.ok(executionMapper.toStatusResponse(scheduler.status()));
  }

  @Operation(
      summary = "Stop scheduler",
      description = "Requests a graceful stop; the current tick finishes in the background.")
  @PostMapping("/api/scheduler/stop")
  public ResponseEntity<SchedulerStatusResponse> stop() {
    boolean stopped = scheduler.stop();
    log.info("Scheduler stop via API (wasRunning={})", stopped);
    return responseFactory.ok(executionMapper.toStatusResponse(scheduler.status()));
  }

  @Operation(
      summary = "Execution metrics",
      description = "Returns in-memory counters for checks, traces and persistence.")
  @GetMapping("/api/executions/metrics")
  public ResponseEntity<ExecutionMetricsResponse> metrics() {
    return responseFactory.ok(statistics.snapshot());
  }
}
