package com.company.dashboards.compiler;

import java.util.List;

/**
 * Finds the source tables a SQL statement reads from. Implementations may be approximate;
 * the compiler only relies on the returned order being stable for the same input.
 */
public interface TableReferenceExtractor {

    List<String> extract(String sql);
}
