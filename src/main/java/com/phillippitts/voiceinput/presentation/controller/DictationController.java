package com.phillippitts.voiceinput.presentation.controller;

import com.phillippitts.voiceinput.domain.AppState;
import com.phillippitts.voiceinput.domain.event.AppEvent;
import com.phillippitts.voiceinput.service.lifecycle.DictationRuntime;
import com.phillippitts.voiceinput.service.model.ModelCatalog;
import com.phillippitts.voiceinput.service.ui.DictationStatusView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Operator control surface for the dictation pipeline.
 *
 * <p>Every write endpoint only submits an event to the state machine and answers
 * 202; the outcome shows up in {@code GET /api/state} once the UI sink has rendered it.
 */
@RestController
@RequestMapping("/api")
class DictationController {

    private static final Logger LOG = LogManager.getLogger(DictationController.class);

    private final DictationRuntime runtime;
    private final DictationStatusView statusView;

    DictationController(DictationRuntime runtime, DictationStatusView statusView) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.statusView = Objects.requireNonNull(statusView, "statusView");
    }

    @GetMapping("/state")
    ResponseEntity<StateResponse> state() {
        DictationStatusView.Status status = statusView.current();
        AppState state = status.state();
        return ResponseEntity.ok(new StateResponse(
                state.kind().name(),
                state.recoverable(),
                state.message(),
                status.translate(),
                status.progressModel(),
                status.progressPercent(),
                status.lastError(),
                status.updatedAt()));
    }

    @PostMapping("/model")
    ResponseEntity<Map<String, Object>> changeModel(@Valid @RequestBody ModelRequest request) {
        String family = requireKnown(request.name());
        LOG.info("Model change requested: {}", family);
        runtime.submit(new AppEvent.ChangeModel(family));
        return ResponseEntity.accepted().body(Map.of("accepted", "ChangeModel", "name", family));
    }

    @PostMapping("/model/load")
    ResponseEntity<Map<String, Object>> loadModel(@Valid @RequestBody LoadModelRequest request) {
        String family = requireKnown(request.name());
        LOG.info("Model load requested: {} (redownload={})", family, request.redownload());
        runtime.submit(new AppEvent.LoadModel(family, request.redownload()));
        return ResponseEntity.accepted().body(Map.of(
                "accepted", "LoadModel", "name", family, "redownload", request.redownload()));
    }

    @PostMapping("/shutdown")
    ResponseEntity<Map<String, Object>> shutdown() {
        LOG.info("Shutdown requested over HTTP");
        runtime.submit(new AppEvent.Shutdown());
        return ResponseEntity.accepted().body(Map.of("accepted", "Shutdown"));
    }

    private static String requireKnown(String name) {
        String family = ModelCatalog.normalize(name);
        if (!ModelCatalog.isKnown(family)) {
            throw new IllegalArgumentException("Unknown model '" + name + "'");
        }
        return family;
    }

    record ModelRequest(@NotBlank(message = "name must not be blank") String name) {}

    record LoadModelRequest(@NotBlank(message = "name must not be blank") String name, boolean redownload) {}

    /** @param progressPercent -1 when no download is running */
    record StateResponse(String state,
                         boolean recoverable,
                         String message,
                         boolean translate,
                         String progressModel,
                         int progressPercent,
                         String lastError,
                         Instant updatedAt) {}
}
