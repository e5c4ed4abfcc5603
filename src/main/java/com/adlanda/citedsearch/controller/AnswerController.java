package com.adlanda.citedsearch.controller;

import com.adlanda.citedsearch.model.AnswerEvent;
import com.adlanda.citedsearch.model.AnswerRequest;
import com.adlanda.citedsearch.model.AnswerResponse;
import com.adlanda.citedsearch.service.AnswerService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;

import java.io.IOException;

/**
 * REST controller for citation-grounded answers.
 */
@RestController
@RequestMapping("/api/v1")
public class AnswerController {

    private final AnswerService answerService;

    public AnswerController(AnswerService answerService) {
        this.answerService = answerService;
    }

    @PostMapping("/answer")
    public ResponseEntity<AnswerResponse> answer(@Valid @RequestBody AnswerRequest request) {
        return ResponseEntity.ok(answerService.answer(request));
    }

    /**
     * Streams the answer as server-sent events named after the event stage
     * ({@code sources}, {@code delta}, {@code done}, {@code error}).
     */
    @PostMapping(value = "/answer/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamAnswer(@Valid @RequestBody AnswerRequest request) {
        // The generation timeout bounds the stream, so the emitter itself never times out
        SseEmitter emitter = new SseEmitter(0L);

        Disposable subscription = answerService.streamAnswer(request).subscribe(
                event -> send(emitter, event),
                emitter::completeWithError,
                emitter::complete
        );

        // Closing the connection cancels the generation request
        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return emitter;
    }

    private void send(SseEmitter emitter, AnswerEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.stage())
                    .data(event));
        } catch (IOException e) {
            emitter.completeWithError(e);
        }
    }
}
