package com.company.dashboards.service;

import com.company.dashboards.domain.DashboardDefinition;
import com.company.dashboards.domain.GridPosition;
import com.company.dashboards.domain.LayoutItem;
import com.company.dashboards.domain.QueryDefinition;
import com.company.dashboards.exception.DefinitionValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural checks a definition must pass before it is saved. Collects every problem rather
 * than stopping at the first one.
 */
@Component
public class DashboardDefinitionValidator {

    private static final Pattern SLUG = Pattern.compile("^[a-z0-9]+(-[a-z0-9]+)*$");

    public List<String> validate(DashboardDefinition definition) {
        List<String> errors = new ArrayList<>();

        if (definition.getMetadata() == null) {
            errors.add("metadata is required");
            return errors;
        }
        String slug = definition.getSlug();
        if (slug == null || !SLUG.matcher(slug).matches()) {
            errors.add("slug must be lowercase kebab-case: " + slug);
        }
        if (definition.getMetadata().getName() == null || definition.getMetadata().getName().isBlank()) {
            errors.add("name is required");
        }
        if (definition.getQueries().isEmpty()) {
            errors.add("at least one query is required");
        }

        Set<String> queryIds = new HashSet<>();
        for (QueryDefinition query : definition.getQueries()) {
            if (!queryIds.add(query.getId())) {
                errors.add("duplicate query id: " + query.getId());
            }
            if (query.getSql() == null || query.getSql().isBlank()) {
                errors.add("query " + query.getId() + " has no SQL");
            }
            if (query.getMaxBytesBilled() != null && query.getMaxBytesBilled() <= 0) {
                errors.add("query " + query.getId() + " has a non-positive byte cap");
            }
        }

        Set<String> chartIds = new HashSet<>();
        for (LayoutItem item : definition.getLayout()) {
            if (!chartIds.add(item.getId())) {
                errors.add("duplicate layout item id: " + item.getId());
            }
            if (item.getType() == null) {
                errors.add("layout item " + item.getId() + " has no chart type");
            }
            if (!queryIds.contains(item.getQueryRef())) {
                errors.add("layout item " + item.getId() + " references unknown query: " + item.getQueryRef());
            }
            if (item.getPosition() == null) {
                errors.add("layout item " + item.getId() + " has no grid position");
            } else {
                validatePosition(item.getId(), item.getPosition(), errors);
            }
        }

        List<LayoutItem> layout = definition.getLayout();
        for (int i = 0; i < layout.size(); i++) {
            for (int j = i + 1; j < layout.size(); j++) {
                GridPosition a = layout.get(i).getPosition();
                GridPosition b = layout.get(j).getPosition();
                if (a != null && b != null && a.overlaps(b)) {
                    int[] columns = a.sharedColumns(b);
                    int[] rows = a.sharedRows(b);
                    errors.add(String.format(
                            "layout items %s and %s overlap at columns %d-%d, rows %d-%d",
                            layout.get(i).getId(), layout.get(j).getId(),
                            columns[0], columns[1], rows[0], rows[1]));
                }
            }
        }
        return errors;
    }

    public void validateOrThrow(DashboardDefinition definition) {
        List<String> errors = validate(definition);
        if (!errors.isEmpty()) {
            String slug = definition.getMetadata() != null ? definition.getSlug() : null;
            throw new DefinitionValidationException(slug, errors);
        }
    }

    private static void validatePosition(String id, GridPosition p, List<String> errors) {
        if (p.getX() < 0 || p.getX() >= GridPosition.GRID_COLUMNS) {
            errors.add("layout item " + id + ": x must be in [0, 11], was " + p.getX());
        }
        if (p.getW() < 1 || p.getW() > GridPosition.GRID_COLUMNS) {
            errors.add("layout item " + id + ": w must be in [1, 12], was " + p.getW());
        }
        if (p.getX() + p.getW() > GridPosition.GRID_COLUMNS) {
            errors.add("layout item " + id + ": x + w exceeds grid width (" + (p.getX() + p.getW()) + ")");
        }
        if (p.getY() < 0) {
            errors.add("layout item " + id + ": y must be non-negative, was " + p.getY());
        }
        if (p.getH() < 1 || p.getH() > GridPosition.MAX_HEIGHT) {
            errors.add("layout item " + id + ": h must be in [1, 20], was " + p.getH());
        }
    }
}
