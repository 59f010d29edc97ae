package com.hivemind.core.recovery;

import com.hivemind.core.model.ErrorKind;
import com.hivemind.core.model.RecoveryAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryPolicyTest {

    @Nested
    @DisplayName("ErrorClassifier")
    class ClassifierTests {

        private final ErrorClassifier classifier = new ErrorClassifier();

        @ParameterizedTest(name = "\"{0}\" -> {1}")
        @CsvSource({
                "Connection timeout after 30s, TRANSIENT",
                "Rate limit exceeded, TRANSIENT",
                "Service temporarily unavailable, TRANSIENT",
                "Permission denied: /etc/hosts, FATAL",
                "Module not found, FATAL",
                "Syntax error on line 3, FATAL",
                "Lint error in Foo.java, RECOVERABLE",
                "3 tests failed: test failure in BarTest, RECOVERABLE",
                "Type error: expected int, RECOVERABLE",
                "Something odd happened, UNKNOWN"
        })
        @DisplayName("classifies by keyword family")
        void classifies(String error, ErrorKind expected) {
            assertEquals(expected, classifier.classify(error));
        }

        @Test
        @DisplayName("transient wins when families overlap")
        void transientFirst() {
            assertEquals(ErrorKind.TRANSIENT, classifier.classify("Invalid response: network unreachable"));
        }

        @Test
        @DisplayName("empty text is unknown")
        void emptyIsUnknown() {
            assertEquals(ErrorKind.UNKNOWN, classifier.classify(null));
            assertEquals(ErrorKind.UNKNOWN, classifier.classify("  "));
        }
    }

    @Nested
    @DisplayName("decide")
    class DecideTests {

        @Test
        @DisplayName("retries transient and recoverable failures below the ceiling")
        void retries() {
            assertEquals(RecoveryAction.RETRY, RecoveryPolicy.decide(ErrorKind.TRANSIENT, 1, 3));
            assertEquals(RecoveryAction.RETRY, RecoveryPolicy.decide(ErrorKind.RECOVERABLE, 2, 3));
        }

        @Test
        @DisplayName("escalates fatal and unknown failures below the ceiling")
        void escalates() {
            assertEquals(RecoveryAction.ESCALATE, RecoveryPolicy.decide(ErrorKind.FATAL, 1, 3));
            assertEquals(RecoveryAction.ESCALATE, RecoveryPolicy.decide(ErrorKind.UNKNOWN, 1, 3));
        }

        @ParameterizedTest
        @EnumSource(ErrorKind.class)
        @DisplayName("aborts at the ceiling whatever the family")
        void abortsAtCeiling(ErrorKind kind) {
            assertEquals(RecoveryAction.ABORT, RecoveryPolicy.decide(kind, 3, 3));
            assertEquals(RecoveryAction.ABORT, RecoveryPolicy.decide(kind, 4, 3));
        }
    }
}
