package com.z254.lazarus.api.v1;

import com.z254.lazarus.api.dto.FailureSignalRequest;
import com.z254.lazarus.api.dto.TriggerDecisionDto;
import com.z254.lazarus.api.mapper.SignalMapper;
import com.z254.lazarus.detection.DetectorPool;
import com.z254.lazarus.trigger.FailureDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

/**
 * Ingress for failure signals raised outside the detector pool, and for heartbeats.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Signals", description = "External failure signals and heartbeats")
public class SignalController {

    static final String API_SOURCE = "api";

    private final FailureDispatcher dispatcher;
    private final DetectorPool detectorPool;

    public SignalController(FailureDispatcher dispatcher, DetectorPool detectorPool) {
        this.dispatcher = dispatcher;
        this.detectorPool = detectorPool;
    }

    @PostMapping("/signals")
    @Operation(summary = "Submit failure signal",
               description = "Evaluate a failure through the trigger engine and report the decision")
    public Mono<ResponseEntity<TriggerDecisionDto>> submitSignal(
            @Validated @RequestBody FailureSignalRequest request) {

        return Mono.fromCallable(() -> SignalMapper.toFailure(request, API_SOURCE))
                .flatMap(failure -> dispatcher.dispatch(failure)
                        .map(decision -> SignalMapper.toDto(failure, decision)))
                .map(dto -> ResponseEntity.status(HttpStatus.ACCEPTED).body(dto));
    }

    @PostMapping("/heartbeats/{detectorId}")
    @Operation(summary = "Record heartbeat", description = "Reset the silence timer of a heartbeat detector")
    public Mono<ResponseEntity<Map<String, Object>>> heartbeat(
            @Parameter(description = "Heartbeat detector ID") @PathVariable String detectorId) {

        return Mono.fromCallable(() -> {
            detectorPool.heartbeat(detectorId);
            return ResponseEntity.ok(Map.<String, Object>of(
                    "detectorId", detectorId,
                    "receivedAt", Instant.now().toString()));
        });
    }
}
