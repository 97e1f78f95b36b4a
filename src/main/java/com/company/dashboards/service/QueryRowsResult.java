package com.company.dashboards.service;

import com.company.dashboards.domain.QueryResult;
import com.company.dashboards.guardrail.GuardrailOutcome;
import lombok.Value;

@Value
class QueryRowsResult {
    GuardrailOutcome outcome;
    boolean cacheHit;

    static QueryRowsResult cached(QueryResult result) {
        return new QueryRowsResult(GuardrailOutcome.success(result), true);
    }

    static QueryRowsResult computed(GuardrailOutcome outcome) {
        return new QueryRowsResult(outcome, false);
    }
}
