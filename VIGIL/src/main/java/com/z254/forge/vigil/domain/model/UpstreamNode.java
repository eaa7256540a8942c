package com.z254.forge.vigil.domain.model;

import org.springframework.data.mongodb.core.mapping.Field;

/**
 * Ancestor descriptor attached to alerts as root-cause context.
 */
public record UpstreamNode(
        @Field("logical_id") String logicalId,
        @Field("label") String label,
        @Field("physical_id") String physicalId,
        @Field("criticality") Criticality criticality) {
}
