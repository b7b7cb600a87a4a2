package com.architecture.dotspace.config;

import com.architecture.dotspace.service.diagram.layout.LayoutSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Layout constants read from application.yml.
 */
@Configuration
@Slf4j
public class DiagramConfig {

    @Value("${dotspace.layout.vertical-spacing:2.0}")
    private double verticalSpacing;

    @Value("${dotspace.layout.base-radius:5.0}")
    private double baseRadius;

    @Value("${dotspace.layout.radius-growth:1.5}")
    private double radiusGrowth;

    @Bean
    public LayoutSettings layoutSettings() {
        log.info("[Diagram Config] Layout settings: verticalSpacing={}, baseRadius={}, radiusGrowth={}",
                verticalSpacing, baseRadius, radiusGrowth);
        return new LayoutSettings(verticalSpacing, baseRadius, radiusGrowth);
    }
}
