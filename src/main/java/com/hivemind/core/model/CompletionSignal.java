package com.hivemind.core.model;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * A structured event parsed from an agent's terminal output. Ephemeral: consumed
 * immediately by the progress aggregator or the recovery service.
 *
 * @param kind      what the agent reported
 * @param taskId    the task the signal is about; null when the failure was inferred from
 *                  generic error text and the task must be resolved from the agent
 * @param artifacts files or outputs the agent produced (COMPLETED only)
 * @param summary   one-line summary (COMPLETED only)
 * @param detail    error text (FAILED), blocker text (BLOCKED) or worker data (PARTIAL_RESULT)
 */
public record CompletionSignal(
    SignalKind kind,
    String taskId,
    List<String> artifacts,
    String summary,
    String detail
) implements Serializable {

    public CompletionSignal {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public static CompletionSignal completed(String taskId, List<String> artifacts, String summary) {
        return new CompletionSignal(SignalKind.COMPLETED, taskId, artifacts, summary, null);
    }

    public static CompletionSignal failed(String taskId, String error) {
        return new CompletionSignal(SignalKind.FAILED, taskId, List.of(), null, error);
    }

    public static CompletionSignal blocked(String taskId, String blocker) {
        return new CompletionSignal(SignalKind.BLOCKED, taskId, List.of(), null, blocker);
    }

    public static CompletionSignal partialResult(String taskId, String data) {
        return new CompletionSignal(SignalKind.PARTIAL_RESULT, taskId, List.of(), null, data);
    }

    public String error() {
        return kind == SignalKind.FAILED ? detail : null;
    }

    public String blocker() {
        return kind == SignalKind.BLOCKED ? detail : null;
    }

    /**
     * Stable identity of this signal as emitted by {@code agentId}; replaying the same
     * output from the same agent yields the same fingerprint.
     */
    public String fingerprint(String agentId) {
        String material = String.join("\u001f",
                Objects.toString(agentId, Agent.MAIN),
                kind.name(),
                Objects.toString(taskId, ""),
                Objects.toString(summary, ""),
                Objects.toString(detail, ""),
                String.join(",", artifacts));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(material.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
