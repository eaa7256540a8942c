package com.z254.forge.vigil;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * VIGIL - Real-time hybrid anomaly detector for the FORGE plant.
 *
 * <p>VIGIL provides:
 * <ul>
 *   <li>Global outlier scoring with a pre-trained isolation forest</li>
 *   <li>Local outlier tracking over a sliding window</li>
 *   <li>Statistical process control with debounced alerts</li>
 *   <li>Root-cause context from the plant dependency graph</li>
 * </ul>
 *
 * <p>Sensor messages arrive over Kafka; alerts and audit records go to MongoDB.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class VigilApplication {

    public static void main(String[] args) {
        SpringApplication.run(VigilApplication.class, args);
    }
}
