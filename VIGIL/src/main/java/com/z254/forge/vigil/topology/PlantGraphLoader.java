package com.z254.forge.vigil.topology;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.InputStream;

/**
 * Loads the plant graph once at startup.
 */
@Slf4j
public class PlantGraphLoader {

    private final ObjectMapper objectMapper;

    public PlantGraphLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load the topology at {@code location}. Any failure yields an empty graph so that
     * lookups degrade to "no context".
     */
    public PlantGraph load(Resource location, int cacheSize) {
        try (InputStream in = location.getInputStream()) {
            PlantTopology topology = objectMapper.readValue(in, PlantTopology.class);
            PlantGraph graph = PlantGraph.fromTopology(topology, cacheSize);
            log.info("Plant graph loaded from {}: {} nodes, {} edges",
                    location.getDescription(), graph.nodeCount(), graph.edgeCount());
            return graph;
        } catch (Exception e) {
            log.warn("Failed to load plant graph from {}, continuing without topology context: {}",
                    location.getDescription(), e.getMessage());
            return PlantGraph.empty();
        }
    }
}
