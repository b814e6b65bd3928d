package com.flowgate.web.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgate.common.dto.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * 校验 Authorization: Bearer &lt;api-key&gt;。未配置 api-key 时放行。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyInterceptor implements HandlerInterceptor {

    private static final String BEARER = "Bearer ";

    private final ObjectMapper objectMapper;

    @Value("${flowgate.api-key:}")
    private String apiKey;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        if (apiKey == null || apiKey.isBlank()) {
            return true;
        }
        String header = request.getHeader("Authorization");
        String presented = header != null && header.startsWith(BEARER) ? header.substring(BEARER.length()).trim() : "";
        if (MessageDigest.isEqual(apiKey.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8))) {
            return true;
        }

        log.warn("API Key 校验失败: {} {}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        Object body = request.getRequestURI().startsWith("/v1/")
                ? Map.of("error", Map.of(
                        "message", "无效的 API Key",
                        "type", "invalid_request_error",
                        "code", "invalid_api_key"))
                : ApiResponse.error("invalid_api_key", "无效的 API Key");
        objectMapper.writeValue(response.getOutputStream(), body);
        return false;
    }
}
