package com.openforge.memorylane.extraction.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memorylane.extraction.ExtractionException.ProviderFailureException;
import com.openforge.memorylane.extraction.ExtractionProperties;
import com.openforge.memorylane.extraction.LocalAgentProvider;
import com.openforge.memorylane.extraction.ProviderKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs extraction prompts through the locally installed assistant CLI.
 *
 * Capability probe (bounded by the probe timeout):
 *   {@code <cli> --version}     exit 0          → installed
 *   {@code <cli> auth status}   "Authenticated as: ..." → logged in
 *
 * Request:
 *   {@code <cli> -p --output-format json}, combined prompt on stdin.
 *   The reply is read from the JSON envelope ({@code result}, {@code content},
 *   {@code message}), falling back to raw stdout when stdout is not JSON.
 */
@Slf4j
@Component
public class ClaudeCliProvider implements LocalAgentProvider {

    private static final Pattern AUTHENTICATED =
            Pattern.compile("Authenticated as:\\s*(.+)", Pattern.CASE_INSENSITIVE);

    private static final List<String> REPLY_FIELDS = List.of("result", "content", "message");

    private final ObjectMapper                   objectMapper;
    private final ExtractionProperties.CliConfig config;
    private final Executor                       ioExecutor;

    public ClaudeCliProvider(ObjectMapper objectMapper,
                             ExtractionProperties properties,
                             @Qualifier("cliIoExecutor") Executor ioExecutor) {
        this.objectMapper = objectMapper;
        this.config       = properties.cli();
        this.ioExecutor   = ioExecutor;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.CLI;
    }

    // ── Capability ───────────────────────────────────────────────────────────

    @Override
    public Status checkStatus() {
        Duration probeTimeout = Duration.ofSeconds(config.probeTimeoutSeconds());

        ProcessResult version;
        try {
            version = run(List.of(config.command(), "--version"), null, probeTimeout);
        } catch (ProviderFailureException e) {
            log.debug("[ClaudeCli] Version probe failed: {}", e.getMessage());
            return Status.unavailable("not installed: " + e.getMessage());
        }
        if (version.exitCode() != 0) {
            return Status.unavailable("version probe exited with " + version.exitCode());
        }

        ProcessResult auth;
        try {
            auth = run(List.of(config.command(), "auth", "status"), null, probeTimeout);
        } catch (ProviderFailureException e) {
            log.debug("[ClaudeCli] Auth probe failed: {}", e.getMessage());
            return new Status(true, false, "auth probe failed: " + e.getMessage());
        }

        Matcher m = AUTHENTICATED.matcher(auth.stdout() + "\n" + auth.stderr());
        if (m.find()) {
            return new Status(true, true, m.group(1).trim());
        }
        return new Status(true, false, "not authenticated (" + version.stdout().trim() + ")");
    }

    // ── Request ──────────────────────────────────────────────────────────────

    @Override
    public String send(String systemPrompt, String userPrompt, Duration timeout) {
        String prompt = systemPrompt + "\n\n" + userPrompt;
        log.debug("[ClaudeCli] → prompt length={} timeout={}s", prompt.length(), timeout.toSeconds());

        ProcessResult result = run(
                List.of(config.command(), "-p", "--output-format", "json"), prompt, timeout);

        if (result.exitCode() != 0) {
            String stderr = result.stderr().isBlank() ? "unknown error" : result.stderr().trim();
            throw new ProviderFailureException(
                    "CLI exited with code %d: %s".formatted(result.exitCode(), stderr));
        }
        log.debug("[ClaudeCli] ← stdout length={}", result.stdout().length());
        return unwrapEnvelope(result.stdout());
    }

    String unwrapEnvelope(String stdout) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(stdout);
        } catch (JsonProcessingException e) {
            return stdout.trim();
        }
        if (envelope != null && envelope.isObject()) {
            for (String field : REPLY_FIELDS) {
                JsonNode value = envelope.get(field);
                if (value != null && value.isTextual() && !value.asText().isBlank()) {
                    return value.asText();
                }
            }
        }
        return stdout.trim();
    }

    // ── Process plumbing ─────────────────────────────────────────────────────

    /**
     * Starts the command, optionally feeding {@code stdin}, and waits up to
     * {@code timeout}. The process is destroyed when the timeout expires.
     */
    protected ProcessResult run(List<String> command, String stdin, Duration timeout) {
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ProviderFailureException("Cannot start " + command.get(0) + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> out =
                CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()), ioExecutor);
        CompletableFuture<String> err =
                CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()), ioExecutor);

        try (OutputStream in = process.getOutputStream()) {
            if (stdin != null) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            process.destroyForcibly();
            throw new ProviderFailureException("Failed to write prompt to CLI: " + e.getMessage(), e);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ProviderFailureException(
                        "CLI timed out after %ds".formatted(timeout.toSeconds()));
            }
            return new ProcessResult(process.exitValue(),
                    out.get(timeout.toMillis(), TimeUnit.MILLISECONDS),
                    err.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ProviderFailureException("Interrupted while waiting for CLI", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ProviderFailureException("Failed to read CLI output: " + e.getMessage(), e);
        }
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    protected record ProcessResult(int exitCode, String stdout, String stderr) {}
}
