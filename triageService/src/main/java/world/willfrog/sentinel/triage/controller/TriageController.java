package world.willfrog.sentinel.triage.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import world.willfrog.sentinel.common.dto.ResponseWrapper;
import world.willfrog.sentinel.triage.model.AlertActionRequest;
import world.willfrog.sentinel.triage.model.AlertActionResult;
import world.willfrog.sentinel.triage.model.TriageRunDetail;
import world.willfrog.sentinel.triage.model.TriageStartRequest;
import world.willfrog.sentinel.triage.model.TriageStartResponse;
import world.willfrog.sentinel.triage.resilience.CircuitBreakerState;
import world.willfrog.sentinel.triage.resilience.ToolCircuitBreaker;
import world.willfrog.sentinel.triage.service.AlertActionService;
import world.willfrog.sentinel.triage.service.TriageRunService;
import world.willfrog.sentinel.triage.service.TriageStreamService;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/triage")
@RequiredArgsConstructor
@Slf4j
public class TriageController {

    private final TriageStreamService streamService;
    private final TriageRunService runService;
    private final AlertActionService alertActionService;
    private final ToolCircuitBreaker circuitBreaker;

    @PostMapping
    public ResponseWrapper<TriageStartResponse> start(@Valid @RequestBody TriageStartRequest request) {
        return ResponseWrapper.success(streamService.start(request.alertId()));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(value = "alertId", required = false) String alertId) {
        return streamService.stream(alertId);
    }

    @GetMapping("/circuits")
    public ResponseWrapper<Map<String, CircuitBreakerState>> circuits() {
        return ResponseWrapper.success(circuitBreaker.snapshot());
    }

    @GetMapping("/{runId}")
    public ResponseWrapper<TriageRunDetail> getRun(@PathVariable("runId") String runId) {
        return ResponseWrapper.success(runService.getRunDetail(runId));
    }

    @PostMapping("/update-alert-status")
    public ResponseWrapper<Map<String, Object>> updateAlertStatus(@Valid @RequestBody AlertActionRequest request) {
        alertActionService.updateAlertStatusAfterAction(request.alertId(), request.actionType());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("alertId", request.alertId());
        data.put("actionType", request.actionType());
        return ResponseWrapper.success(data);
    }

    @PostMapping("/execute-action")
    public ResponseWrapper<AlertActionResult> executeAction(@Valid @RequestBody AlertActionRequest request) {
        AlertActionResult result = alertActionService.executeActionAndUpdateAlert(
                request.alertId(), request.actionType(), request.actionParams());
        log.info("Action executed via api: alertId={}, actionType={}, alertStatus={}",
                result.getAlertId(), result.getActionType(), result.getAlertStatus());
        return ResponseWrapper.success(result);
    }
}
