package com.fintech.expensereconciliation.service;

import com.fintech.expensereconciliation.dto.ReconciliationConfig;
import com.fintech.expensereconciliation.entity.LogbookEntry;
import com.fintech.expensereconciliation.entity.Transaction;
import com.fintech.expensereconciliation.entity.TransactionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoringEngineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 15, 10, 0);

    private final ScoringEngine scoringEngine = new ScoringEngine();

    private final ReconciliationConfig defaults = ReconciliationConfig.builder()
            .timeWindowMinutes(10)
            .amountTolerancePercent(0.0)
            .minimumMatchScore(0.8)
            .autoMatchThreshold(0.95)
            .build();

    @Test
    @DisplayName("Exact amount at the same instant scores the maximum")
    void exactMatchScoresOne() {
        double score = scoringEngine.calculateMatchScore(tx("user-1", "USD"), entry("user-1", "USD"), 0, 0, defaults);

        assertThat(score).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("A two minute gap loses a fifth of the time weight")
    void twoMinuteGapScores094() {
        double score = scoringEngine.calculateMatchScore(tx("user-1", "USD"), entry("user-1", "USD"), 2, 0, defaults);

        assertThat(score).isCloseTo(0.94, within(1e-9));
        assertThat(score).isLessThan(defaults.getAutoMatchThreshold());
    }

    @Test
    @DisplayName("Amount difference is scored linearly against the tolerance")
    void amountComponentIsLinearInTolerance() {
        ReconciliationConfig tolerant = defaults.toBuilder().amountTolerancePercent(1.0).build();

        // 1% of 10000 is 100 minor units
        assertThat(scoringEngine.amountComponent(10_000, 50, tolerant)).isCloseTo(0.5, within(1e-9));
        assertThat(scoringEngine.amountComponent(10_000, 100, tolerant)).isCloseTo(0.0, within(1e-9));
        assertThat(scoringEngine.amountComponent(10_000, 0, tolerant)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Any amount difference scores zero without tolerance")
    void amountComponentWithoutTolerance() {
        assertThat(scoringEngine.amountComponent(10_000, 1, defaults)).isZero();
    }

    @Test
    @DisplayName("Time component bottoms out at zero beyond the window")
    void timeComponentClampsAtZero() {
        assertThat(scoringEngine.timeComponent(5, defaults)).isCloseTo(0.5, within(1e-9));
        assertThat(scoringEngine.timeComponent(25, defaults)).isZero();
    }

    @Test
    @DisplayName("User and currency mismatches cost their weights")
    void userAndCurrencyWeights() {
        double otherUser = scoringEngine.calculateMatchScore(tx("user-1", "USD"), entry("user-2", "USD"), 0, 0, defaults);
        double otherCurrency = scoringEngine.calculateMatchScore(tx("user-1", "USD"), entry("user-1", "EUR"), 0, 0, defaults);

        assertThat(otherUser).isCloseTo(0.8, within(1e-9));
        assertThat(otherCurrency).isCloseTo(0.9, within(1e-9));
    }

    @Test
    @DisplayName("Minimum score is inclusive")
    void minimumIsInclusive() {
        assertThat(scoringEngine.meetsMinimum(0.8, defaults)).isTrue();
        assertThat(scoringEngine.meetsMinimum(0.79, defaults)).isFalse();
    }

    private Transaction tx(String userId, String currency) {
        return Transaction.builder()
                .id("tx-1")
                .userId(userId)
                .amountMinor(10_000)
                .currency(currency)
                .status(TransactionStatus.SUCCESS)
                .createdAt(NOW)
                .build();
    }

    private LogbookEntry entry(String userId, String currency) {
        return LogbookEntry.builder()
                .id("entry-1")
                .userId(userId)
                .type("expense")
                .amountMinor(10_000)
                .currency(currency)
                .createdAt(NOW)
                .build();
    }
}
