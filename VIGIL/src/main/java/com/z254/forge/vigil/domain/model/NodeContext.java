package com.z254.forge.vigil.domain.model;

/**
 * Local metadata of a plant node.
 */
public record NodeContext(Criticality criticality, String label) {

    public static final NodeContext UNKNOWN = new NodeContext(Criticality.C, "Unknown");
}
