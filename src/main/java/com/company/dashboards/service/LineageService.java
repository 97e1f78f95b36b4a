package com.company.dashboards.service;

import com.company.dashboards.cache.CacheKeys;
import com.company.dashboards.cache.CacheLayer;
import com.company.dashboards.compiler.DashboardCompiler;
import com.company.dashboards.config.DashboardProperties;
import com.company.dashboards.domain.CompilationResult;
import com.company.dashboards.domain.DashboardDefinition;
import com.company.dashboards.domain.LineageEdge;
import com.company.dashboards.domain.LineageGraph;
import com.company.dashboards.domain.LineageNode;
import com.company.dashboards.event.DashboardSavedEvent;
import com.company.dashboards.exception.LineageNotFoundException;
import com.company.dashboards.repository.LineageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Dashboard to chart to query to table graph. Reads of a full graph go through the cache under
 * {@code lineage:{slug}}; every rebuild drops that entry once the new graph is committed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LineageService {

    private final LineageRepository lineageRepository;
    private final DashboardCompiler compiler;
    private final CacheLayer cache;
    private final DashboardProperties properties;

    public void rebuild(String slug, List<LineageNode> nodes, List<LineageEdge> edges) {
        lineageRepository.replaceDashboardLineage(slug, nodes, edges);
        cache.delete(CacheKeys.lineage(slug));
    }

    public CompilationResult rebuildFromDefinition(DashboardDefinition definition) {
        CompilationResult compiled = compiler.compile(definition);
        rebuild(definition.getSlug(), compiled.getLineageNodes(), compiled.getLineageEdges());
        return compiled;
    }

    public LineageGraph getGraph(String slug) {
        String key = CacheKeys.lineage(slug);
        Optional<LineageGraph> cached = cache.get(key, LineageGraph.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        LineageGraph graph = lineageRepository.findGraph(slug)
                .orElseThrow(() -> new LineageNotFoundException(slug));
        cache.set(key, graph, properties.getCache().getLineageTtl());
        return graph;
    }

    public List<String> upstreamTables(String slug) {
        if (!lineageRepository.dashboardExists(slug)) {
            throw new LineageNotFoundException(slug);
        }
        return lineageRepository.findUpstreamTables(slug);
    }

    /**
     * Dashboards that would be affected by a change to {@code tableId}. Empty for an unknown table.
     */
    public List<String> downstreamDashboards(String tableId) {
        return lineageRepository.findDownstreamDashboards(tableId);
    }

    public void deleteLineage(String slug) {
        lineageRepository.deleteDashboardLineage(slug);
        cache.delete(CacheKeys.lineage(slug));
    }

    @EventListener
    @Async
    public void onDashboardSaved(DashboardSavedEvent event) {
        if (!properties.getLineage().isRebuildOnSave()) {
            return;
        }
        String slug = event.getDefinition().getSlug();
        try {
            CompilationResult compiled = rebuildFromDefinition(event.getDefinition());
            log.info("Lineage rebuilt for {} v{} ({} nodes, {} edges)", slug, compiled.getVersion(),
                    compiled.getLineageNodes().size(), compiled.getLineageEdges().size());
        } catch (Exception e) {
            log.error("Failed to rebuild lineage for {} after save", slug, e);
        }
    }
}
