package com.z254.forge.vigil.config;

import com.z254.forge.vigil.domain.model.AlertSeverity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MongoConfigTest {

    @Test
    void severityIsWrittenAsLabel() {
        MongoConfig.AlertSeverityWriter writer = new MongoConfig.AlertSeverityWriter();

        assertThat(writer.convert(AlertSeverity.CRITICAL)).isEqualTo("critical");
        assertThat(writer.convert(AlertSeverity.INFO)).isEqualTo("info");
    }

    @Test
    void customConversionsKnowSeverityTarget() {
        assertThat(new MongoConfig().mongoCustomConversions().hasCustomWriteTarget(AlertSeverity.class)).isTrue();
    }
}
