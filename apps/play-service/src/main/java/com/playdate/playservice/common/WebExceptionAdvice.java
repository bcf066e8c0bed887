package com.playdate.playservice.common;

import com.playdate.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 *
 * <ul>
 *   <li>IllegalArgumentException / 请求体校验失败 → 400（参数缺失或不合法）</li>
 *   <li>ResourceNotFoundException → 404</li>
 *   <li>IllegalStateException → 409（会话已满、已结束、重复挑战等状态冲突）</li>
 *   <li>其他异常 → 500，只返回通用提示，细节写日志</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /** 对外统一的内部错误提示，不暴露异常细节 */
    public static final String INTERNAL_ERROR_MESSAGE = "服务器内部错误，请稍后再试";

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> invalidBody(MethodArgumentNotValidException e) {
        FieldError first = e.getBindingResult().getFieldError();
        String message = first != null ? first.getDefaultMessage() : "请求参数不合法";
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(message));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> notFound(ResourceNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(e.getMessage()));
    }

    /**
     * 业务状态不允许当前操作，例如会话已满、会话已结束、挑战已被响应。
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> internal(Exception e) {
        log.error("HTTP 请求处理异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.serverError(INTERNAL_ERROR_MESSAGE));
    }
}
