package com.accountbroker.exception;

import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * 全局异常处理器
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<String> handleConfiguration(ConfigurationException e) {
        log.warn("配置校验失败: {}", e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "validation_error", e.getMessage());
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<String> handleNotFound(AccountNotFoundException e) {
        log.warn("{}", e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "not_found_error", e.getMessage());
    }

    @ExceptionHandler(UsageSyncException.class)
    public ResponseEntity<String> handleUsageSync(UsageSyncException e) {
        log.warn("配额同步失败: {}", e.getMessage());
        return buildErrorResponse(e.getStatusCode(), "usage_sync_error", e.getMessage());
    }

    @ExceptionHandler(BrokerException.class)
    public ResponseEntity<String> handleBroker(BrokerException e) {
        log.error("Broker 异常: {}", e.getMessage(), e);
        return buildErrorResponse(e.getStatusCode(), "broker_error", e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e) {
        int statusCode = e.getStatusCode().value();
        log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        return buildErrorResponse(statusCode, statusCode == 404 ? "not_found_error" : "http_error", e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("未预期异常: {}", e.getMessage(), e);
        return buildErrorResponse(500, "internal_error", "服务器内部错误");
    }

    private ResponseEntity<String> buildErrorResponse(int statusCode, String errorType, String message) {
        JSONObject body = JSONObject.of(
                "success", false, //
                "error", JSONObject.of( //
                        "type", errorType, //
                        "message", message //
                ) //
        );
        return ResponseEntity
                .status(HttpStatus.valueOf(Math.min(statusCode, 599)))
                .contentType(MediaType.APPLICATION_JSON)
                .body(body.toJSONString());
    }
}
