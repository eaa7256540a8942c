package com.z254.forge.vigil.detector.spc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.forge.vigil.detector.ModelLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads {@link BaselineConfig} from the model directory.
 */
@Slf4j
public class BaselineConfigLoader {

    private final ObjectMapper objectMapper;

    public BaselineConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public BaselineConfig load(Resource location) throws ModelLoadException {
        BaselineConfig config;
        try (InputStream in = location.getInputStream()) {
            config = objectMapper.readValue(in, BaselineConfig.class);
        } catch (IOException e) {
            throw new ModelLoadException("Cannot read baseline config from "
                    + location.getDescription() + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ModelLoadException("Baseline config at " + location.getDescription() + " is empty");
        }
        log.info("Baseline config loaded from {}: spc={}, threshold={}",
                location.getDescription(), config.getSpc(), config.getThreshold());
        return config;
    }
}
