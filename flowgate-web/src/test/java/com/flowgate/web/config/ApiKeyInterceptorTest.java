package com.flowgate.web.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class ApiKeyInterceptorTest {

    private ApiKeyInterceptor interceptor(String key) {
        ApiKeyInterceptor interceptor = new ApiKeyInterceptor(new ObjectMapper());
        ReflectionTestUtils.setField(interceptor, "apiKey", key);
        return interceptor;
    }

    private static MockHttpServletRequest request(String uri, String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", uri);
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        return request;
    }

    @Test
    @DisplayName("未配置 api-key 时放行")
    void blankKeyAllowsAll() throws Exception {
        assertThat(interceptor("").preHandle(request("/v1/chat/completions", null),
                new MockHttpServletResponse(), new Object())).isTrue();
    }

    @Test
    @DisplayName("Bearer 与配置一致时放行")
    void matchingBearerPasses() throws Exception {
        assertThat(interceptor("sk-test").preHandle(request("/v1/models", "Bearer sk-test"),
                new MockHttpServletResponse(), new Object())).isTrue();
    }

    @Test
    @DisplayName("/v1 下校验失败返回 OpenAI 错误结构")
    void openAiEnvelopeOnV1() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        boolean passed = interceptor("sk-test").preHandle(request("/v1/models", "Bearer wrong"), response, new Object());

        assertThat(passed).isFalse();
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString(StandardCharsets.UTF_8))
                .contains("\"code\":\"invalid_api_key\"")
                .contains("\"type\":\"invalid_request_error\"");
    }

    @Test
    @DisplayName("管理接口校验失败返回统一响应结构")
    void apiResponseOnAdmin() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        boolean passed = interceptor("sk-test").preHandle(request("/api/admin/tokens", null), response, new Object());

        assertThat(passed).isFalse();
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString(StandardCharsets.UTF_8))
                .contains("\"success\":false")
                .contains("\"code\":\"invalid_api_key\"");
    }
}
