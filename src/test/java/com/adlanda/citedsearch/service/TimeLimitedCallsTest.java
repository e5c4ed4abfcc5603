package com.adlanda.citedsearch.service;

import com.adlanda.citedsearch.exception.CitedSearchException;
import com.adlanda.citedsearch.exception.CollaboratorTimeoutException;
import com.adlanda.citedsearch.exception.IndexQueryException;
import com.adlanda.citedsearch.exception.OperationCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeLimitedCallsTest {

    private final TimeLimitedCalls calls = new TimeLimitedCalls();

    @AfterEach
    void tearDown() {
        calls.shutdown();
        // Clear any interrupt flag left by the cancellation test
        Thread.interrupted();
    }

    @Test
    void call_completesInTime_returnsResult() {
        assertThat(calls.call("index query", Duration.ofSeconds(5), () -> 42)).isEqualTo(42);
    }

    @Test
    void call_exceedsDeadline_throwsTimeoutNamingCollaborator() {
        assertThatThrownBy(() -> calls.call("embedding", Duration.ofMillis(50), () -> {
            Thread.sleep(5_000);
            return "late";
        }))
                .isInstanceOf(CollaboratorTimeoutException.class)
                .hasMessageContaining("embedding")
                .hasMessageContaining("50ms");
    }

    @Test
    void call_taskThrowsRuntimeException_rethrowsItUnchanged() {
        IndexQueryException failure = new IndexQueryException("index down");

        assertThatThrownBy(() -> calls.call("index query", Duration.ofSeconds(5), () -> {
            throw failure;
        })).isSameAs(failure);
    }

    @Test
    void call_taskThrowsCheckedException_wrapsIt() {
        assertThatThrownBy(() -> calls.call("index query", Duration.ofSeconds(5), () -> {
            throw new IOException("socket closed");
        }))
                .isInstanceOf(CitedSearchException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void call_callerInterrupted_throwsCancelledAndKeepsInterruptFlag() {
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> calls.call("generation", Duration.ofSeconds(5), () -> {
            Thread.sleep(5_000);
            return "never";
        })).isInstanceOf(OperationCancelledException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}
