package com.z254.forge.vigil.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.List;

/**
 * Immutable alert produced by one detector for one message.
 * <p>
 * Global and local outlier alerts carry a {@code score}; SPC alerts carry the offending
 * {@code value}, the breached {@code limit} and the monitored {@code feature}.
 */
@Value
@Builder(toBuilder = true)
public class Alert {

    AlertType type;

    AlertSeverity severity;

    String message;

    Double score;

    Double value;

    Double limit;

    /** SPC signal label, null for outlier alerts */
    String feature;

    /** Upstream ancestors of the machine, filled in by fusion */
    @Singular("upstreamNode")
    @Field("rca_context")
    List<UpstreamNode> upstreamContext;

    /**
     * Copy of this alert with the given upstream context.
     */
    public Alert withUpstreamContext(List<UpstreamNode> context) {
        return toBuilder()
                .clearUpstreamContext()
                .upstreamContext(context)
                .build();
    }
}
