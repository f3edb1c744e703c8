package com.metascan.explorer.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the browser explorer and wallet front ends.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    /**
     * Comma-delimited origin patterns.
     */
    @Value("${EXPLORER_CORS_ALLOWED_ORIGINS:http://localhost:*,http://127.0.0.1:*}")
    private String allowedOriginPatterns;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = StringUtils.commaDelimitedListToStringArray(allowedOriginPatterns);
        registry.addMapping("/api/**")
                .allowedOriginPatterns(origins)
                .allowedMethods("GET", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Cache")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
