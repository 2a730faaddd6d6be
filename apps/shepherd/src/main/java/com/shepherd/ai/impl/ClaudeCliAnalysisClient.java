package com.shepherd.ai.impl;

import com.shepherd.ai.AbstractTextAnalysisClient;
import com.shepherd.error.AnalysisServiceException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Asks the locally installed assistant CLI in print mode: {@code <command> -p <prompt>}.
 * The persona is prepended to the prompt since the CLI has no separate system slot.
 */
@Slf4j
public class ClaudeCliAnalysisClient extends AbstractTextAnalysisClient {

    public static final Duration READY_TIMEOUT = Duration.ofSeconds(10);

    private final String command;
    private final Duration timeout;
    private final CliProcessRunner runner;

    public ClaudeCliAnalysisClient(String command, Duration timeout, boolean reformatMalformed,
                                   boolean verbose, CliProcessRunner runner) {
        super(reformatMalformed, verbose);
        this.command = command;
        this.timeout = timeout;
        this.runner = runner;
    }

    @Override
    protected String backendName() {
        return "ClaudeCli";
    }

    /** Runs {@code <command> --version}; a missing binary or a failing exit means the backend is unusable. */
    @Override
    public Mono<String> checkReady() {
        return Mono.fromCallable(this::version)
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String version() throws InterruptedException {
        CliProcessRunner.ExecResult r;
        try {
            r = runner.run(List.of(command, "--version"), READY_TIMEOUT);
        } catch (IOException e) {
            throw new AnalysisServiceException("Cannot start '" + command + "': " + e.getMessage(), e);
        }
        if (!r.ok()) {
            String detail = r.timedOut() ? "timed out after " + READY_TIMEOUT
                    : "exited with " + r.exitCode() + ": " + abbreviate(r.stderr().isBlank() ? r.stdout() : r.stderr());
            throw new AnalysisServiceException("'" + command + " --version' " + detail);
        }
        String version = r.stdout().strip();
        log.info("[ClaudeCli] {} version: {}", command, version);
        return version;
    }

    @Override
    protected Mono<String> complete(String persona, String prompt) {
        return Mono.fromCallable(() -> invoke(persona + "\n\n" + prompt))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String invoke(String fullPrompt) throws InterruptedException {
        CliProcessRunner.ExecResult r;
        try {
            r = runner.run(List.of(command, "-p", fullPrompt), timeout);
        } catch (IOException e) {
            throw new AnalysisServiceException("Cannot start '" + command + "': " + e.getMessage(), e);
        }
        if (r.timedOut()) {
            throw new AnalysisServiceException("'" + command + "' timed out after " + timeout);
        }
        if (r.exitCode() != 0) {
            throw new AnalysisServiceException("'" + command + "' exited with " + r.exitCode()
                    + ": " + abbreviate(r.stderr().isBlank() ? r.stdout() : r.stderr()));
        }
        log.debug("[ClaudeCli] answer ({} chars)", r.stdout().length());
        return r.stdout().strip();
    }
}
