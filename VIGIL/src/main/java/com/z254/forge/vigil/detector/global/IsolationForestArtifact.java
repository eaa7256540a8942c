package com.z254.forge.vigil.detector.global;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON export of a trained isolation forest.
 * <p>
 * Feature indices in split nodes refer to the global feature order listed in
 * {@code features}. Leaves carry no feature (or a negative one) and the number of
 * training samples that reached them.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationForestArtifact {

    @JsonProperty("model_version")
    private String modelVersion;

    private List<String> features = new ArrayList<>();

    @JsonProperty("max_samples")
    private int maxSamples;

    /** Decision offset; -0.5 for an automatically calibrated forest */
    private double offset = -0.5;

    private List<Tree> trees = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Tree {
        private List<Node> nodes = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Node {
        private Integer feature;
        private Double threshold;
        private Integer left;
        private Integer right;

        @JsonProperty("n_samples")
        private Integer samples;

        public boolean isLeaf() {
            return feature == null || feature < 0;
        }
    }
}
