package com.z254.forge.vigil.topology;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.forge.vigil.domain.model.Criticality;
import com.z254.forge.vigil.domain.model.NodeContext;
import com.z254.forge.vigil.domain.model.UpstreamNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Read-only directed graph of plant nodes used for root-cause context.
 * <p>
 * Edges point from an upstream node to the node it feeds. Lookups are keyed by physical
 * (machine) id and never fail: unmapped ids yield no ancestors and a default context.
 */
@Slf4j
public class PlantGraph {

    private final Map<String, PlantNode> nodesById;
    private final Map<String, String> logicalIdByPhysicalId;
    private final Map<String, List<String>> incomingEdges;
    private final int edgeCount;
    private final Cache<String, List<UpstreamNode>> ancestorCache;

    private PlantGraph(Map<String, PlantNode> nodesById,
                       Map<String, String> logicalIdByPhysicalId,
                       Map<String, List<String>> incomingEdges,
                       int edgeCount,
                       int cacheSize) {
        this.nodesById = nodesById;
        this.logicalIdByPhysicalId = logicalIdByPhysicalId;
        this.incomingEdges = incomingEdges;
        this.edgeCount = edgeCount;
        this.ancestorCache = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .build();
    }

    public static PlantGraph empty() {
        return new PlantGraph(Map.of(), Map.of(), Map.of(), 0, 1);
    }

    /**
     * Build the graph from a topology description. Edges that reference undeclared nodes
     * are skipped.
     */
    public static PlantGraph fromTopology(PlantTopology topology, int cacheSize) {
        Map<String, PlantNode> nodes = new HashMap<>();
        Map<String, String> physicalToLogical = new HashMap<>();
        for (PlantTopology.NodeDefinition def : topology.getNodes()) {
            if (def.getId() == null) {
                log.warn("Skipping topology node without id: {}", def);
                continue;
            }
            PlantNode node = new PlantNode(def.getId(), def.getPhysicalId(), def.getLabel(),
                    Criticality.parse(def.getCriticality()));
            nodes.put(node.logicalId(), node);
            if (def.getPhysicalId() != null) {
                physicalToLogical.put(def.getPhysicalId(), def.getId());
            }
        }

        Map<String, List<String>> incoming = new HashMap<>();
        int edges = 0;
        for (List<String> edge : topology.getEdges()) {
            if (edge == null || edge.size() != 2) {
                log.warn("Skipping malformed topology edge: {}", edge);
                continue;
            }
            String from = edge.get(0);
            String to = edge.get(1);
            if (!nodes.containsKey(from) || !nodes.containsKey(to)) {
                log.warn("Skipping topology edge with undeclared endpoint: {} -> {}", from, to);
                continue;
            }
            incoming.computeIfAbsent(to, k -> new ArrayList<>()).add(from);
            edges++;
        }

        return new PlantGraph(Map.copyOf(nodes), Map.copyOf(physicalToLogical),
                Map.copyOf(incoming), edges, cacheSize);
    }

    /**
     * Every strict ancestor of the node mapped from {@code physicalId}, nearest first.
     * The node itself is never included, even on a cycle.
     *
     * @param physicalId machine id as carried by sensor messages
     * @return ancestor descriptors, empty for unmapped ids or root nodes
     */
    public List<UpstreamNode> getUpstreamDependencies(String physicalId) {
        if (physicalId == null) {
            return Collections.emptyList();
        }
        String logicalId = logicalIdByPhysicalId.get(physicalId);
        if (logicalId == null) {
            return Collections.emptyList();
        }
        return ancestorCache.get(logicalId, this::collectAncestors);
    }

    /**
     * Local metadata of the node mapped from {@code physicalId}.
     */
    public NodeContext getContext(String physicalId) {
        String logicalId = physicalId != null ? logicalIdByPhysicalId.get(physicalId) : null;
        if (logicalId == null) {
            return NodeContext.UNKNOWN;
        }
        PlantNode node = nodesById.get(logicalId);
        return new NodeContext(node.criticality(), node.label());
    }

    public int nodeCount() {
        return nodesById.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return nodesById.isEmpty();
    }

    private List<UpstreamNode> collectAncestors(String logicalId) {
        Set<String> visited = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(logicalId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String source : incomingEdges.getOrDefault(current, Collections.emptyList())) {
                if (!source.equals(logicalId) && visited.add(source)) {
                    queue.add(source);
                }
            }
        }

        List<UpstreamNode> ancestors = new ArrayList<>(visited.size());
        for (String id : visited) {
            PlantNode node = nodesById.get(id);
            ancestors.add(new UpstreamNode(node.logicalId(), node.label(), node.physicalId(), node.criticality()));
        }
        return List.copyOf(ancestors);
    }

    private record PlantNode(String logicalId, String physicalId, String label, Criticality criticality) {
    }
}
