package com.fintech.expensereconciliation.entity;

public enum MatchType {
    /**
     * Created by a reconciliation run because the score reached the auto-match threshold.
     */
    AUTOMATIC,

    /**
     * Created by a reviewer pairing a transaction and an entry by hand.
     */
    MANUAL
}
