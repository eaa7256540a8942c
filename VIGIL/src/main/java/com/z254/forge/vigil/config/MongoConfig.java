package com.z254.forge.vigil.config;

import com.z254.forge.vigil.domain.model.AlertSeverity;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.List;

/**
 * MongoDB document mapping.
 */
@Configuration
public class MongoConfig {

    /**
     * Severities are stored by their lower-case label.
     */
    @Bean
    public MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(List.of(new AlertSeverityWriter()));
    }

    @WritingConverter
    static class AlertSeverityWriter implements Converter<AlertSeverity, String> {

        @Override
        public String convert(AlertSeverity source) {
            return source.label();
        }
    }
}
