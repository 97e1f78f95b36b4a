package com.company.dashboards.guardrail;

import com.company.dashboards.config.DashboardProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static checks run before the engine is contacted.
 */
@Component
@RequiredArgsConstructor
public class SqlGuard {

    static final List<String> FORBIDDEN_KEYWORDS = List.of(
            "DROP", "DELETE", "TRUNCATE", "ALTER", "CREATE",
            "GRANT", "REVOKE", "INSERT", "UPDATE", "MERGE");

    // Whole words only, so columns like last_update or created_at pass
    private static final Pattern FORBIDDEN = Pattern.compile(
            "\\b(" + String.join("|", FORBIDDEN_KEYWORDS) + ")\\b", Pattern.CASE_INSENSITIVE);

    private final DashboardProperties properties;

    public Optional<GuardrailError> check(String sql) {
        if (sql == null || sql.isBlank()) {
            return Optional.of(GuardrailError.validationFailed("Query is empty"));
        }

        Matcher matcher = FORBIDDEN.matcher(sql);
        if (matcher.find()) {
            return Optional.of(GuardrailError.dangerousSql(matcher.group(1).toUpperCase(Locale.ROOT)));
        }

        List<String> allowed = properties.getEngine().getAllowedDatasets();
        if (allowed != null && !allowed.isEmpty() && allowed.stream().noneMatch(ds -> sql.contains(ds + "."))) {
            return Optional.of(GuardrailError.validationFailed(
                    "Query must reference one of the allowed datasets: " + String.join(", ", allowed)));
        }
        return Optional.empty();
    }
}
