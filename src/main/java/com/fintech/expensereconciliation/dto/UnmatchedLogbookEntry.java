package com.fintech.expensereconciliation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnmatchedLogbookEntry {

    private String id;
    private String userId;
    private String type;
    private long amountMinor;
    private String currency;
    private String note;
    private LocalDateTime createdAt;

    @Builder.Default
    private List<ReconciliationCandidate> possibleMatches = new ArrayList<>();
}
