package com.hivemind.core.recovery;

import com.hivemind.core.model.ErrorKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sorts error text into a failure family by keyword. Families are checked in the
 * order transient, fatal, recoverable; the first hit wins.
 */
@Component
public class ErrorClassifier {

    private static final List<Map.Entry<ErrorKind, List<String>>> FAMILIES = List.of(
            Map.entry(ErrorKind.TRANSIENT,
                    List.of("timeout", "network", "connection", "rate limit", "temporarily unavailable")),
            Map.entry(ErrorKind.FATAL,
                    List.of("permission denied", "not found", "syntax error", "invalid")),
            Map.entry(ErrorKind.RECOVERABLE,
                    List.of("lint error", "test fail", "type error"))
    );

    public ErrorKind classify(String error) {
        if (error == null || error.isBlank()) {
            return ErrorKind.UNKNOWN;
        }
        String lower = error.toLowerCase(Locale.ROOT);
        for (Map.Entry<ErrorKind, List<String>> family : FAMILIES) {
            for (String keyword : family.getValue()) {
                if (lower.contains(keyword)) {
                    return family.getKey();
                }
            }
        }
        return ErrorKind.UNKNOWN;
    }
}
