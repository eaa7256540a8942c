package com.z254.forge.vigil.topology;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Static topology description as written by the plant modelling tools.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlantTopology {

    private List<NodeDefinition> nodes = new ArrayList<>();

    /** Directed pairs {@code [from, to]}: {@code from} feeds into {@code to} */
    private List<List<String>> edges = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NodeDefinition {
        private String id;

        @JsonProperty("physical_id")
        private String physicalId;

        private String label;

        private String criticality;
    }
}
