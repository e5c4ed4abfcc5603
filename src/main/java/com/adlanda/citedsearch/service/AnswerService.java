package com.adlanda.citedsearch.service;

import com.adlanda.citedsearch.config.GenerationProperties;
import com.adlanda.citedsearch.exception.CitedSearchException;
import com.adlanda.citedsearch.exception.CollaboratorTimeoutException;
import com.adlanda.citedsearch.model.AnswerEvent;
import com.adlanda.citedsearch.model.AnswerRequest;
import com.adlanda.citedsearch.model.AnswerResponse;
import com.adlanda.citedsearch.model.Citation;
import com.adlanda.citedsearch.model.SearchResult;
import com.adlanda.citedsearch.service.citation.CitationExtractor;
import com.adlanda.citedsearch.service.citation.StreamSession;
import com.adlanda.citedsearch.service.generation.AnswerPromptBuilder;
import com.adlanda.citedsearch.service.generation.GenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Service responsible for answering questions from the indexed documents.
 *
 * Retrieves passages, streams a grounded answer from the generation model and attaches the
 * page citations found in the answer. Citations are verified against the retrieved passages:
 * a citation naming a document that was not retrieved is reported separately.
 */
@Service
public class AnswerService {

    private static final Logger log = LoggerFactory.getLogger(AnswerService.class);

    static final String NO_RESULTS_ANSWER =
            "No relevant documents were found for this question. Try rephrasing it or removing the filters.";

    private final RetrievalService retrievalService;
    private final GenerationClient generationClient;
    private final AnswerPromptBuilder promptBuilder;
    private final CitationExtractor citationExtractor;
    private final Duration generationTimeout;

    public AnswerService(RetrievalService retrievalService,
                         GenerationClient generationClient,
                         AnswerPromptBuilder promptBuilder,
                         CitationExtractor citationExtractor,
                         GenerationProperties generationProperties) {
        this.retrievalService = retrievalService;
        this.generationClient = generationClient;
        this.promptBuilder = promptBuilder;
        this.citationExtractor = citationExtractor;
        this.generationTimeout = generationProperties.getTimeout();
    }

    /**
     * Answers a question and waits for the full answer.
     *
     * Search failures are thrown. A generation failure returns the partial answer with
     * {@code complete = false}.
     */
    public AnswerResponse answer(AnswerRequest request) {
        List<SearchResult> sources = retrievalService.search(request.toSearchQuery()).results();
        AnswerEvent last = generate(request.question(), sources).blockLast();
        return (AnswerResponse) last.payload();
    }

    /**
     * Streams an answer as events.
     *
     * Order: one {@code sources} event, zero or more {@code delta} events, then either
     * {@code done} or {@code error}. The {@code error} event carries the partial text and the
     * citations found in it. Nothing happens until subscription; disposing the subscription
     * cancels the generation request.
     */
    public Flux<AnswerEvent> streamAnswer(AnswerRequest request) {
        return Mono.fromCallable(() -> retrievalService.search(request.toSearchQuery()).results())
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(sources -> Flux.concat(
                        Flux.just(AnswerEvent.sources(sources)),
                        generate(request.question(), sources)))
                .onErrorResume(CitedSearchException.class, e -> {
                    log.warn("Answer stream failed before generation: {}", e.getMessage());
                    return Flux.just(AnswerEvent.error(new AnswerResponse(
                            "", List.of(), List.of(), List.of(), false, e.getMessage(), 0)));
                });
    }

    private Flux<AnswerEvent> generate(String question, List<SearchResult> sources) {
        if (sources.isEmpty()) {
            return Flux.just(AnswerEvent.done(new AnswerResponse(
                    NO_RESULTS_ANSWER, List.of(), List.of(), sources, true, null, 0)));
        }

        return Flux.defer(() -> {
            StreamSession session = new StreamSession();
            long startTime = System.currentTimeMillis();
            String prompt = promptBuilder.build(question, sources);

            Flux<AnswerEvent> deltas = generationClient.generate(prompt)
                    .timeout(generationTimeout)
                    .onErrorMap(TimeoutException.class,
                            e -> new CollaboratorTimeoutException("generation", generationTimeout))
                    .map(delta -> {
                        session.append(delta);
                        return AnswerEvent.delta(delta);
                    });

            Flux<AnswerEvent> done = Flux.defer(() -> {
                session.complete();
                return Flux.just(AnswerEvent.done(toResponse(session, sources, startTime)));
            });

            return deltas.concatWith(done)
                    .onErrorResume(e -> {
                        session.fail(e);
                        log.warn("Generation stream failed after {} characters: {}",
                                session.current().length(), e.getMessage());
                        return Flux.just(AnswerEvent.error(toResponse(session, sources, startTime)));
                    });
        });
    }

    private AnswerResponse toResponse(StreamSession session, List<SearchResult> sources, long startTime) {
        String text = session.current();
        Set<String> retrievedFiles = sources.stream()
                .map(SearchResult::source)
                .collect(Collectors.toSet());

        List<Citation> verified = new ArrayList<>();
        List<Citation> unverified = new ArrayList<>();
        for (Citation citation : citationExtractor.extract(text)) {
            if (retrievedFiles.contains(citation.filename())) {
                verified.add(citation);
            } else {
                unverified.add(citation);
            }
        }
        if (!unverified.isEmpty()) {
            log.warn("Answer cites {} documents that were not retrieved: {}", unverified.size(), unverified);
        }

        Throwable error = session.error();
        return new AnswerResponse(
                text,
                verified,
                unverified,
                sources,
                error == null,
                error != null ? error.getMessage() : null,
                System.currentTimeMillis() - startTime
        );
    }
}
