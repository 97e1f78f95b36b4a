package com.company.dashboards.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of one compile: the plan plus the lineage seeds for the same dashboard version.
 */
@Value
@Builder
public class CompilationResult {
    ExecutionPlan plan;
    List<LineageNode> lineageNodes;
    List<LineageEdge> lineageEdges;

    public String getDashboardSlug() {
        return plan.getDashboardSlug();
    }

    public int getVersion() {
        return plan.getVersion();
    }
}
