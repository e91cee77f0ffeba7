package com.example.research_insights_backend.exception;

import com.example.research_insights_backend.util.ResponseUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 查询参数异常
     */
    @ExceptionHandler(InsightQueryException.class)
    public ResponseEntity<Map<String, Object>> handleInsightQueryException(InsightQueryException e) {
        log.warn("查询参数异常: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ResponseUtil.error(e.getMessage()));
    }

    /**
     * 参数绑定 / 校验异常
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<Map<String, Object>> handleBindException(BindException e) {
        String message = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("参数绑定异常: {}", message);
        return ResponseEntity.badRequest().body(ResponseUtil.error(message));
    }

    /**
     * 其他未捕获的异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("系统异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ResponseUtil.error("服务器内部错误: " + e.getMessage()));
    }
}
