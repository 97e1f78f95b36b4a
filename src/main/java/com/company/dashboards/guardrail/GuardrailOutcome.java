package com.company.dashboards.guardrail;

import com.company.dashboards.domain.QueryResult;

/**
 * Either the rows of a query that ran, or the reason it was rejected. Rejections are values,
 * not exceptions, so every caller has to decide what a rejection means for it.
 */
public final class GuardrailOutcome {

    private final QueryResult result;
    private final GuardrailError error;

    private GuardrailOutcome(QueryResult result, GuardrailError error) {
        this.result = result;
        this.error = error;
    }

    public static GuardrailOutcome success(QueryResult result) {
        return new GuardrailOutcome(result, null);
    }

    public static GuardrailOutcome rejected(GuardrailError error) {
        return new GuardrailOutcome(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public QueryResult getResult() {
        if (error != null) {
            throw new IllegalStateException("Query was rejected: " + error.getMessage());
        }
        return result;
    }

    public GuardrailError getError() {
        if (error == null) {
            throw new IllegalStateException("Query succeeded; there is no error");
        }
        return error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "GuardrailOutcome[success, rows=" + result.getTotalRows() + "]"
                : "GuardrailOutcome[" + error.getKind() + ": " + error.getMessage() + "]";
    }
}
