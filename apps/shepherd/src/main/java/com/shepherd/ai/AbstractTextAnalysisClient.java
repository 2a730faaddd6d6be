package com.shepherd.ai;

import com.shepherd.api.dto.AnalysisRequest;
import com.shepherd.api.dto.Verdict;
import com.shepherd.error.AnalysisServiceException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared flow of the text based backends: render the prompt, ask once, parse, and when the
 * answer mentions an alert but breaks the format, ask once more to reformat it.
 */
@Slf4j
public abstract class AbstractTextAnalysisClient implements AnalysisClient {

    private final boolean reformatMalformed;
    private final boolean verbose;
    private final Set<String> promptShown = ConcurrentHashMap.newKeySet();

    protected AbstractTextAnalysisClient(boolean reformatMalformed, boolean verbose) {
        this.reformatMalformed = reformatMalformed;
        this.verbose = verbose;
    }

    /** One round trip to the reasoning service. Errors surface as {@link AnalysisServiceException}. */
    protected abstract Mono<String> complete(String persona, String prompt);

    protected abstract String backendName();

    @Override
    public Mono<List<Verdict>> analyze(AnalysisRequest request) {
        if (request.snapshot().isEmpty()) {
            return Mono.just(List.of());
        }
        String persona = request.ruleSet().persona();
        String prompt = AnalysisPromptBuilder.build(request);
        if (verbose && promptShown.add(request.projectId())) {
            log.info("[{}] {}: first prompt ({} chars)\n{}\n{}", backendName(), request.projectId(),
                    prompt.length(), persona, prompt);
        } else {
            log.debug("[{}] {}: prompt for #{} ({} chars)", backendName(), request.projectId(),
                    request.snapshot().latestIndex(), prompt.length());
        }

        return complete(persona, prompt)
                .flatMap(answer -> interpret(request, persona, answer))
                .onErrorMap(e -> !(e instanceof AnalysisServiceException),
                        e -> new AnalysisServiceException(backendName() + " call failed: " + e.getMessage(), e));
    }

    private Mono<List<Verdict>> interpret(AnalysisRequest request, String persona, String answer) {
        VerdictParser.Parsed parsed = VerdictParser.parse(answer, request.ruleSet());
        if (parsed.wellFormed()) {
            return Mono.just(parsed.verdicts());
        }
        if (!reformatMalformed) {
            return Mono.error(new AnalysisServiceException("Malformed analysis response: " + abbreviate(answer)));
        }
        log.debug("[{}] {}: malformed answer, asking for a reformat", backendName(), request.projectId());
        return complete(persona, AnalysisPromptBuilder.buildReformat(answer, request.ruleSet()))
                .flatMap(again -> {
                    VerdictParser.Parsed second = VerdictParser.parse(again, request.ruleSet());
                    if (!second.wellFormed()) {
                        return Mono.error(new AnalysisServiceException(
                                "Malformed analysis response after reformat: " + abbreviate(again)));
                    }
                    return Mono.just(second.verdicts());
                });
    }

    protected static String abbreviate(String s) {
        if (s == null) return "<null>";
        String oneLine = s.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= 200 ? oneLine : oneLine.substring(0, 200) + "...";
    }
}
