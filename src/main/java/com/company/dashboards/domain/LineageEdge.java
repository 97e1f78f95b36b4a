package com.company.dashboards.domain;

import com.company.dashboards.domain.enums.EdgeType;
import com.company.dashboards.domain.enums.NodeType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

@Value
@Builder
@Jacksonized
public class LineageEdge implements Serializable {
    private static final long serialVersionUID = 1L;

    NodeType sourceType;
    String sourceId;
    NodeType targetType;
    String targetId;
    EdgeType edgeType;

    public static LineageEdge of(LineageNode source, LineageNode target, EdgeType edgeType) {
        return new LineageEdge(source.getNodeType(), source.getNodeId(),
                target.getNodeType(), target.getNodeId(), edgeType);
    }
}
