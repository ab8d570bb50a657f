package com.mk.fx.qa.synthetic.execution.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.synthetic.execution.dto.ExecutionLogResponse;
import com.mk.fx.qa.synthetic.execution.dto.RunNowResponse;
import com.mk.fx.qa.synthetic.execution.dto.SchedulerStatusResponse;
import com.mk.fx.qa.synthetic.execution.model.ExecutionOutcome;
import com.mk.fx.qa.synthetic.execution.model.ExecutionRecord;
import com.mk.fx.qa.synthetic.execution.model.ExecutionStatus;
import com.mk.fx.qa.synthetic.execution.model.LoopState;
import com.mk.fx.qa.synthetic.execution.model.SchedulerStatus;
import java.util.List;
import java.util.Locale;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper(componentModel = "spring")
public interface ExecutionMapper {

  @Mapping(target = "logId", source = "recordId")
  @Mapping(target = "status", source = "result.status", qualifiedByName = "statusValue")
  @Mapping(target = "errorMessage", source = "result.errorMessage")
  @Mapping(target = "ttfbMs", source = "result.ttfbMs")
  @Mapping(target = "domContentLoadedMs", source = "result.domContentLoadedMs")
  @Mapping(target = "pageLoadMs", source = "result.pageLoadMs")
  @Mapping(target = "startedAt", source = "result.startedAt")
  @Mapping(target = "completedAt", source = "result.completedAt")
  @Mapping(target = "trace", source = "result.trace", qualifiedByName = "trace")
  RunNowResponse toRunNowResponse(ExecutionOutcome outcome);

  @Mapping(target = "status", source = "status", qualifiedByName = "statusValue")
  @Mapping(target = "trace", source = "trace", qualifiedByName = "trace")
  ExecutionLogResponse toLogResponse(ExecutionRecord record);

  List<ExecutionLogResponse> toLogResponses(List<ExecutionRecord> records);

  @Mapping(target = "state", source = "state", qualifiedByName = "loopState")
  SchedulerStatusResponse toStatusResponse(SchedulerStatus status);

  @Named("statusValue")
  default String statusValue(ExecutionStatus status) {
    return status != null ? status.value() : null;
  }

  @Named("loopState")
  default String loopState(LoopState state) {
    return state != null ? state.name().toLowerCase(Locale.ROOT) : null;
  }

  // JsonNode is Iterable; pass it through as is instead of letting it be treated as a collection
  @Named("trace")
  default JsonNode trace(JsonNode trace) {
    return trace;
  }
}
