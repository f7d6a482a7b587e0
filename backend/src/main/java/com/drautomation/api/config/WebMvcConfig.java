package com.drautomation.api.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Request logging for the automation API. Status and statistics endpoints are polled by
 * dashboards every few seconds and are left out.
 */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    static final String API_PATHS = "/api/v1/**";

    static final String[] POLLED_PATHS = {
            "/api/v1/automation/status",
            "/api/v1/*/statistics",
            "/api/v1/recovery-tests/active"
    };

    private final RequestLoggingInterceptor requestLoggingInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(requestLoggingInterceptor)
                .addPathPatterns(API_PATHS)
                .excludePathPatterns(POLLED_PATHS);
    }
}
