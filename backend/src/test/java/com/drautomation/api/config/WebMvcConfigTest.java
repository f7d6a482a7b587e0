package com.drautomation.api.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.servlet.HandlerExecutionChain;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;
import org.springframework.web.util.ServletRequestPathUtils;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("WebMvcConfig")
class WebMvcConfigTest {

    @Autowired
    @Qualifier("requestMappingHandlerMapping")
    private RequestMappingHandlerMapping handlerMapping;

    @Autowired
    private RequestLoggingInterceptor requestLoggingInterceptor;

    private boolean logged(String method, String path) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest(method, path);
        ServletRequestPathUtils.parseAndCache(request);
        HandlerExecutionChain chain = handlerMapping.getHandler(request);
        assertThat(chain).as("handler for %s %s", method, path).isNotNull();
        return chain.getInterceptorList().contains(requestLoggingInterceptor);
    }

    @Test
    @DisplayName("should log calls that start or stop automation work")
    void shouldLogApiCalls() throws Exception {
        assertThat(logged("POST", "/api/v1/backups")).isTrue();
        assertThat(logged("POST", "/api/v1/automation/disaster-recovery")).isTrue();
        assertThat(logged("GET", "/api/v1/restores/restore_1")).isTrue();
    }

    @Test
    @DisplayName("should skip endpoints that dashboards poll")
    void shouldSkipPolledEndpoints() throws Exception {
        assertThat(logged("GET", "/api/v1/automation/status")).isFalse();
        assertThat(logged("GET", "/api/v1/backups/statistics")).isFalse();
        assertThat(logged("GET", "/api/v1/recovery-tests/active")).isFalse();
    }
}
