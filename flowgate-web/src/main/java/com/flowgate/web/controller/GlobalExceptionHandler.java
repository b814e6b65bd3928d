package com.flowgate.web.controller;

import com.flowgate.ai.generation.CompletionFormatter;
import com.flowgate.common.dto.ApiResponse;
import com.flowgate.common.exception.AdmissionRejectedException;
import com.flowgate.common.exception.CredentialException;
import com.flowgate.common.exception.FlowgateException;
import com.flowgate.common.exception.GenerationFailedException;
import com.flowgate.common.exception.PollTimeoutException;
import com.flowgate.common.exception.PoolExhaustedException;
import com.flowgate.common.exception.UpstreamException;
import com.flowgate.common.exception.UpstreamRateLimitedException;
import com.flowgate.common.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 全局异常处理器。
 * <p>
 * /v1 下的接口返回 OpenAI 错误结构，管理接口返回 {@link ApiResponse}。
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final CompletionFormatter formatter;

    @ExceptionHandler(FlowgateException.class)
    public ResponseEntity<Object> handleFlowgateException(FlowgateException e, HttpServletRequest request) {
        HttpStatus status = statusOf(e);
        if (status.is5xxServerError()) {
            log.error("业务异常: [{}] {}", e.getErrorCode(), e.getMessage());
        } else {
            log.warn("业务异常: [{}] {}", e.getErrorCode(), e.getMessage());
        }
        return respond(request, status, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleUnreadableBody(HttpMessageNotReadableException e, HttpServletRequest request) {
        log.warn("请求体解析失败: {}", e.getMessage());
        return respond(request, HttpStatus.BAD_REQUEST, "invalid_request", "请求体不是合法的 JSON");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiResponse<Void> handleNoResourceFound(NoResourceFoundException e) {
        // 缓存文件过期被清理后的访问也会走到这里
        log.debug("静态资源未找到: {}", e.getResourcePath());
        return ApiResponse.error("NOT_FOUND", "资源不存在");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGenericException(Exception e, HttpServletRequest request) {
        log.error("系统异常", e);
        return respond(request, HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "系统内部错误，请稍后重试");
    }

    static HttpStatus statusOf(FlowgateException e) {
        if (e instanceof ValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof AdmissionRejectedException || e instanceof UpstreamRateLimitedException) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        if (e instanceof PoolExhaustedException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (e instanceof PollTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        if (e instanceof CredentialException || e instanceof UpstreamException
                || e instanceof GenerationFailedException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private ResponseEntity<Object> respond(HttpServletRequest request, HttpStatus status, String code, String message) {
        if (request.getRequestURI().startsWith("/v1/")) {
            return ResponseEntity.status(status).body(formatter.error(message, code));
        }
        return ResponseEntity.status(status).body(ApiResponse.error(code, message));
    }
}
