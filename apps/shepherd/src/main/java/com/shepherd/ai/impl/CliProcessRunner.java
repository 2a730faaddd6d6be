package com.shepherd.ai.impl;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** Runs a child process to completion and captures both streams. */
@Slf4j
public class CliProcessRunner {

    public record ExecResult(int exitCode, String stdout, String stderr, boolean timedOut) {
        public boolean ok() { return !timedOut && exitCode == 0; }
    }

    /**
     * @throws IOException when the process cannot be started
     * @throws InterruptedException when the calling thread is interrupted; the process is killed
     */
    public ExecResult run(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        log.debug("[Cli] $ {} ({} args)", cmd.get(0), cmd.size() - 1);
        ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.redirectErrorStream(false);
        pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
        StringBuilder outSb = new StringBuilder();
        StringBuilder errSb = new StringBuilder();
        Process p = pb.start();
        try {
            Thread tOut = new Thread(() -> readAll(p.getInputStream(), outSb), "cli-stdout");
            Thread tErr = new Thread(() -> readAll(p.getErrorStream(), errSb), "cli-stderr");
            tOut.setDaemon(true); tErr.setDaemon(true);
            tOut.start(); tErr.start();

            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                p.destroyForcibly();
                tOut.join(200);
                tErr.join(200);
                return new ExecResult(124, snapshot(outSb), "timeout after " + timeout, true);
            }
            tOut.join(1000);
            tErr.join(1000);
            return new ExecResult(p.exitValue(), snapshot(outSb), snapshot(errSb), false);
        } finally {
            if (p.isAlive()) p.destroyForcibly();
        }
    }

    private static java.io.File nullDevice() {
        boolean windows = System.getProperty("os.name", "").toLowerCase().startsWith("windows");
        return new java.io.File(windows ? "NUL" : "/dev/null");
    }

    private static String snapshot(StringBuilder sb) {
        synchronized (sb) {
            return sb.toString();
        }
    }

    private static void readAll(InputStream in, StringBuilder out) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                synchronized (out) {
                    out.append(line).append('\n');
                }
            }
        } catch (IOException e) {
            // 进程被杀时流会被关闭
            log.debug("[Cli] stream closed: {}", e.toString());
        }
    }
}
