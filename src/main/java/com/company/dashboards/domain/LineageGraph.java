package com.company.dashboards.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(value = {"nodeCount", "edgeCount"}, allowGetters = true)
public class LineageGraph implements Serializable {
    private static final long serialVersionUID = 1L;

    private String dashboardSlug;
    @Builder.Default
    private List<LineageNode> nodes = new ArrayList<>();
    @Builder.Default
    private List<LineageEdge> edges = new ArrayList<>();

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        return edges.size();
    }
}
