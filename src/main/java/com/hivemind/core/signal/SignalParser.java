package com.hivemind.core.signal;

import com.hivemind.core.model.CompletionSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the completion signal from an agent's final output.
 * <p>
 * Recognized markers, in priority order when several appear in the same output:
 * <pre>
 *   TASK_FAILED: &lt;taskId&gt;     ERROR: ...
 *   TASK_BLOCKED: &lt;taskId&gt;    BLOCKER: ...
 *   TASK_COMPLETE: &lt;taskId&gt;   ARTIFACTS: [a, b]   SUMMARY: ...
 *   L3_RESULT: &lt;taskId&gt;       DATA: ...
 * </pre>
 * Output without markers but with a generic error line ("Error:", "Exception:", ...) is
 * reported as a failure with no task id. Anything else yields an empty result.
 * Never throws.
 */
@Component
public class SignalParser {

    private static final Logger log = LoggerFactory.getLogger(SignalParser.class);

    static final int MAX_INFERRED_ERROR_LENGTH = 200;

    private static final Pattern FAILED = Pattern.compile("TASK_FAILED:\\s*(\\S+)");
    private static final Pattern BLOCKED = Pattern.compile("TASK_BLOCKED:\\s*(\\S+)");
    private static final Pattern COMPLETE = Pattern.compile("TASK_COMPLETE:\\s*(\\S+)");
    private static final Pattern PARTIAL = Pattern.compile("L3_RESULT:\\s*(\\S+)");

    private static final Pattern ARTIFACTS = Pattern.compile("ARTIFACTS:\\s*\\[([^\\]]*)\\]");
    private static final Pattern SUMMARY = Pattern.compile("SUMMARY:[ \\t]*(.+)");
    private static final Pattern BLOCKER = Pattern.compile("BLOCKER:[ \\t]*(.+)");
    private static final Pattern ERROR = Pattern.compile("ERROR:[ \\t]*(.+)");
    private static final Pattern DATA = Pattern.compile("DATA:[ \\t]*(.+)");

    private static final List<String> GENERIC_ERROR_INDICATORS = List.of("error:", "exception:", "failed:", "fatal:");

    public Optional<CompletionSignal> parse(String output) {
        if (output == null || output.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(parseMarkers(output))
                    .or(() -> inferFailure(output));
        } catch (RuntimeException e) {
            // regex engines can overflow on pathological input; treat as unparseable
            log.warn("Could not parse agent output: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private CompletionSignal parseMarkers(String output) {
        Matcher m = FAILED.matcher(output);
        if (m.find()) {
            return CompletionSignal.failed(m.group(1), extract(ERROR, output, "Unknown error"));
        }
        m = BLOCKED.matcher(output);
        if (m.find()) {
            return CompletionSignal.blocked(m.group(1), extract(BLOCKER, output, "Unknown blocker"));
        }
        m = COMPLETE.matcher(output);
        if (m.find()) {
            return CompletionSignal.completed(m.group(1), extractArtifacts(output), extract(SUMMARY, output, ""));
        }
        m = PARTIAL.matcher(output);
        if (m.find()) {
            return CompletionSignal.partialResult(m.group(1), extract(DATA, output, ""));
        }
        return null;
    }

    private Optional<CompletionSignal> inferFailure(String output) {
        for (String line : output.split("\\R")) {
            String lower = line.toLowerCase(Locale.ROOT);
            for (String indicator : GENERIC_ERROR_INDICATORS) {
                if (lower.contains(indicator)) {
                    String error = line.trim();
                    if (error.length() > MAX_INFERRED_ERROR_LENGTH) {
                        error = error.substring(0, MAX_INFERRED_ERROR_LENGTH);
                    }
                    log.debug("No completion marker, inferred failure from line: {}", error);
                    return Optional.of(CompletionSignal.failed(null, error));
                }
            }
        }
        log.debug("No completion signal in agent output ({} chars)", output.length());
        return Optional.empty();
    }

    private static String extract(Pattern pattern, String output, String fallback) {
        Matcher m = pattern.matcher(output);
        if (m.find()) {
            String value = m.group(1).trim();
            return value.isEmpty() ? fallback : value;
        }
        return fallback;
    }

    private static List<String> extractArtifacts(String output) {
        Matcher m = ARTIFACTS.matcher(output);
        if (!m.find()) {
            return List.of();
        }
        return Arrays.stream(m.group(1).split(","))
                .map(String::trim)
                .map(s -> s.replaceAll("^[\"']|[\"']$", ""))
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
