package com.z254.forge.vigil.detector.global;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.forge.vigil.detector.ModelLoadException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.FileSystemResource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IsolationForestLoaderTest {

    private static final String FEATURES =
            "[\"vibration_rms\", \"temperature\", \"torque\", \"pressure\", \"rotational_speed\", \"tool_wear\"]";

    private final IsolationForestLoader loader = new IsolationForestLoader(new ObjectMapper());

    @Test
    void rejectsFeatureOrderMismatch() {
        String json = """
                {"features": ["torque", "temperature", "vibration_rms", "pressure", "rotational_speed", "tool_wear"],
                 "max_samples": 256, "trees": [{"nodes": [{"n_samples": 256}]}]}
                """;

        assertThatThrownBy(() -> loader.load(resource(json)))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("order mismatch");
    }

    @Test
    void rejectsForestWithoutTrees() {
        String json = "{\"features\": " + FEATURES + ", \"max_samples\": 256, \"trees\": []}";

        assertThatThrownBy(() -> loader.load(resource(json)))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("no trees");
    }

    @Test
    void rejectsChildPointingBackwards() {
        String json = "{\"features\": " + FEATURES + ", \"max_samples\": 256, \"trees\": [{\"nodes\": ["
                + "{\"feature\": 2, \"threshold\": 1.0, \"left\": 0, \"right\": 1},"
                + "{\"n_samples\": 3}]}]}";

        assertThatThrownBy(() -> loader.load(resource(json)))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("not a valid split");
    }

    @Test
    void rejectsUnreadableFile() {
        assertThatThrownBy(() -> loader.load(new FileSystemResource("does/not/exist.json")))
                .isInstanceOf(ModelLoadException.class)
                .hasMessageContaining("Cannot read");
    }

    private ByteArrayResource resource(String json) {
        return new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8));
    }
}
