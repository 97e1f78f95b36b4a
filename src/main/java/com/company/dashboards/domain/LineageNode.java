package com.company.dashboards.domain;

import com.company.dashboards.domain.enums.NodeType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.util.Map;

/**
 * Node of the lineage graph. (nodeType, nodeId) is unique across the store.
 */
@Value
@Builder
@Jacksonized
public class LineageNode implements Serializable {
    private static final long serialVersionUID = 1L;

    NodeType nodeType;
    String nodeId;
    Map<String, Object> metadata;

    public static LineageNode of(NodeType nodeType, String nodeId, Map<String, Object> metadata) {
        return new LineageNode(nodeType, nodeId, metadata);
    }
}
