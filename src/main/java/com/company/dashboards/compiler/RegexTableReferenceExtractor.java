package com.company.dashboards.compiler;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches {@code project.dataset.table} triples, optionally backtick-quoted. Triples inside
 * string literals or comments are matched too, and two-part references are missed.
 */
@Component
public class RegexTableReferenceExtractor implements TableReferenceExtractor {

    private static final Pattern TABLE_REFERENCE = Pattern.compile(
            "`?([a-zA-Z0-9_-]+\\.[a-zA-Z0-9_-]+\\.[a-zA-Z0-9_-]+)`?");

    @Override
    public List<String> extract(String sql) {
        if (sql == null || sql.isBlank()) {
            return List.of();
        }
        Set<String> tables = new LinkedHashSet<>();
        Matcher matcher = TABLE_REFERENCE.matcher(sql);
        while (matcher.find()) {
            tables.add(matcher.group(1));
        }
        return new ArrayList<>(tables);
    }
}
