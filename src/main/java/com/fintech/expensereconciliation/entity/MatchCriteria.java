package com.fintech.expensereconciliation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which of the matching conditions held when a match was created.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchCriteria {

    @Column(name = "amount_match", nullable = false)
    private boolean amountMatch;

    @Column(name = "time_match", nullable = false)
    private boolean timeMatch;

    @Column(name = "currency_match", nullable = false)
    private boolean currencyMatch;

    @Column(name = "user_match", nullable = false)
    private boolean userMatch;
}
