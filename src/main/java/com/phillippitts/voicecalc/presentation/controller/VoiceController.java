package com.phillippitts.voicecalc.presentation.controller;

import com.phillippitts.voicecalc.domain.IntentLabel;
import com.phillippitts.voicecalc.domain.IntentResult;
import com.phillippitts.voicecalc.domain.SessionState;
import com.phillippitts.voicecalc.domain.TrainingSample;
import com.phillippitts.voicecalc.exception.MicrophoneUnavailableException;
import com.phillippitts.voicecalc.presentation.dto.InterpretRequest;
import com.phillippitts.voicecalc.presentation.dto.TrainingSampleRequest;
import com.phillippitts.voicecalc.presentation.stream.VoiceEventBroadcaster;
import com.phillippitts.voicecalc.service.session.SessionStatus;
import com.phillippitts.voicecalc.service.session.VoiceEvent;
import com.phillippitts.voicecalc.service.session.VoiceSession;
import com.phillippitts.voicecalc.service.training.TrainingCorpusRepository;
import com.phillippitts.voicecalc.util.TimeUtils;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Control boundary of the voice calculator.
 */
@RestController
@RequestMapping("/voice")
class VoiceController {

    private final VoiceSession session;
    private final TrainingCorpusRepository corpus;
    private final VoiceEventBroadcaster broadcaster;
    private final Clock clock;

    VoiceController(VoiceSession session,
                    TrainingCorpusRepository corpus,
                    VoiceEventBroadcaster broadcaster,
                    Clock clock) {
        this.session = session;
        this.corpus = corpus;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    /**
     * Starts capture. Responds 503 when the host has no usable microphone; the session still
     * records the failure as ERROR.
     */
    @PostMapping("/start")
    ResponseEntity<Map<String, Object>> start() {
        SessionState state = session.start();
        SessionStatus status = session.status();
        if (state == SessionState.ERROR && !status.micAvailable()) {
            throw new MicrophoneUnavailableException(status.micError());
        }
        return ResponseEntity.ok(Map.of("status", state.wireName()));
    }

    @PostMapping("/stop")
    ResponseEntity<Map<String, Object>> stop() {
        return ResponseEntity.ok(Map.of("status", session.stop().wireName()));
    }

    @PostMapping("/reload-model")
    ResponseEntity<Map<String, Object>> reloadModel() {
        session.reloadModel();
        return ResponseEntity.ok(Map.of("status", "model reloaded"));
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        SessionStatus status = session.status();
        // micError may be null, so no Map.of
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.state().wireName());
        body.put("supported_intents", IntentLabel.wireNames());
        body.put("micAvailable", status.micAvailable());
        body.put("micError", status.micError());
        return ResponseEntity.ok(body);
    }

    /**
     * Interprets a typed transcript without touching the capture loop or its fragment buffer.
     */
    @PostMapping("/interpret")
    ResponseEntity<VoiceEvent.ResultEvent> interpret(@Valid @RequestBody InterpretRequest request) {
        IntentResult result = session.interpret(request.transcript().strip());
        return ResponseEntity.ok(VoiceEvent.ResultEvent.of(result, TimeUtils.epochSeconds(clock)));
    }

    @GetMapping("/training-samples")
    ResponseEntity<List<Map<String, String>>> trainingSamples() {
        List<Map<String, String>> body = corpus.list().stream()
                .map(VoiceController::toBody)
                .toList();
        return ResponseEntity.ok(body);
    }

    /**
     * Appends one labeled sample. The model is not retrained until {@code /voice/reload-model}.
     */
    @PostMapping("/training-samples")
    ResponseEntity<Map<String, String>> addTrainingSample(@Valid @RequestBody TrainingSampleRequest request) {
        TrainingSample saved = corpus.append(request.text(), request.label());
        return ResponseEntity.status(HttpStatus.CREATED).body(toBody(saved));
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    SseEmitter stream() {
        return broadcaster.subscribe();
    }

    private static Map<String, String> toBody(TrainingSample sample) {
        return Map.of("text", sample.text(), "label", sample.label().wireName());
    }
}
