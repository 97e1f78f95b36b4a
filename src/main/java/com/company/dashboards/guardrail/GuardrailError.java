package com.company.dashboards.guardrail;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Locale;

/**
 * Why a query was not run, or did not finish. Byte counts are only set for
 * {@link GuardrailErrorKind#BYTES_LIMIT_EXCEEDED}.
 */
@Value
@AllArgsConstructor
public class GuardrailError {
    GuardrailErrorKind kind;
    String message;
    Long bytesAttempted;
    Long bytesAllowed;

    public static GuardrailError dangerousSql(String keyword) {
        return new GuardrailError(GuardrailErrorKind.DANGEROUS_SQL,
                "Query contains forbidden keyword: " + keyword, null, null);
    }

    public static GuardrailError validationFailed(String message) {
        return new GuardrailError(GuardrailErrorKind.QUERY_VALIDATION_FAILED, message, null, null);
    }

    public static GuardrailError bytesLimitExceeded(long attempted, long allowed) {
        return new GuardrailError(GuardrailErrorKind.BYTES_LIMIT_EXCEEDED,
                String.format(Locale.ROOT, "Query would process %,d bytes, limit is %,d bytes", attempted, allowed),
                attempted, allowed);
    }

    public static GuardrailError engineFailure(String message) {
        return new GuardrailError(GuardrailErrorKind.ENGINE_EXECUTION_ERROR, message, null, null);
    }
}
