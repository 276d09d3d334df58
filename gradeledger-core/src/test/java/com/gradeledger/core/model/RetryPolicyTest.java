package com.gradeledger.core.model;

import com.gradeledger.core.exception.OptimisticLockException;
import com.gradeledger.core.exception.TransactionContentionException;
import com.gradeledger.core.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    @DisplayName("Transaction defaults retry lock conflicts and nothing else")
    void transactionDefaults() {
        RetryPolicy policy = RetryPolicy.transactions();

        assertThat(policy.maxAttempts()).isEqualTo(5);
        assertThat(policy.initialBackoff()).isEqualTo(Duration.ofMillis(20));
        assertThat(policy.maxBackoff()).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.retries(OptimisticLockException.ERROR_CODE)).isTrue();
        assertThat(policy.retries(ValidationException.ERROR_CODE)).isFalse();
        assertThat(policy.retries(TransactionContentionException.ERROR_CODE)).isFalse();
        assertThat(policy.retries(null)).isFalse();
    }

    @Test
    @DisplayName("Backoff doubles per failed attempt up to the cap")
    void exponentialBackoffIsCapped() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(10))
            .maxBackoff(Duration.ofMillis(50))
            .jitterFactor(0.0)
            .build();

        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofMillis(10));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofMillis(20));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofMillis(40));
        assertThat(policy.backoffAfter(4)).isEqualTo(Duration.ofMillis(50));
        assertThat(policy.backoffAfter(12)).isEqualTo(Duration.ofMillis(50));
    }

    @Test
    @DisplayName("Jitter keeps the wait within the configured band")
    void jitterBand() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialBackoff(Duration.ofMillis(100))
            .maxBackoff(Duration.ofMillis(100))
            .jitterFactor(0.5)
            .build();

        for (int i = 0; i < 200; i++) {
            assertThat(policy.backoffAfter(1).toMillis()).isBetween(50L, 150L);
        }
    }

    @Test
    void rejectsAttemptNumbersBelowOne() {
        assertThatThrownBy(() -> RetryPolicy.transactions().backoffAfter(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void attemptLimit() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(3).build();

        assertThat(policy.allowsAnotherAttempt(1)).isTrue();
        assertThat(policy.allowsAnotherAttempt(2)).isTrue();
        assertThat(policy.allowsAnotherAttempt(3)).isFalse();
    }

    @Test
    @DisplayName("Single attempt never waits and never retries")
    void singleAttempt() {
        RetryPolicy policy = RetryPolicy.singleAttempt();

        assertThat(policy.allowsAnotherAttempt(1)).isFalse();
        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Retried codes are copied at build time")
    void customRetryCodes() {
        Set<String> codes = new HashSet<>(Set.of("A"));
        RetryPolicy policy = RetryPolicy.builder().retryOn(codes).build();
        codes.add("B");

        assertThat(policy.retries("A")).isTrue();
        assertThat(policy.retries("B")).isFalse();
        assertThat(policy.retries(OptimisticLockException.ERROR_CODE)).isFalse();
    }

    @Test
    void rejectsInconsistentSettings() {
        assertThatThrownBy(() -> RetryPolicy.builder().maxAttempts(0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder()
                .initialBackoff(Duration.ofSeconds(2)).maxBackoff(Duration.ofSeconds(1)).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().backoffMultiplier(0.5).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.builder().jitterFactor(1.5).build())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
