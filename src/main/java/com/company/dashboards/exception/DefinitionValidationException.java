package com.company.dashboards.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class DefinitionValidationException extends RuntimeException {
    private final String slug;
    private final List<String> errors;

    public DefinitionValidationException(String slug, List<String> errors) {
        super("Dashboard " + slug + " failed validation: " + String.join("; ", errors));
        this.slug = slug;
        this.errors = List.copyOf(errors);
    }
}
