package com.playdate.web.common;

import java.io.Serializable;

/**
 * HTTP 接口统一返回体。
 *
 * <p>code 与 HTTP 状态码保持一致：200 成功，400 参数不合法，404 资源不存在，
 * 409 状态冲突，500 服务端异常。
 *
 * @param code    状态码
 * @param message 提示信息（失败时为可直接展示给用户的原因）
 * @param data    业务数据，失败时为 null
 * @param <T>     数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(200, message, data);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null);
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return new ApiResponse<>(404, message, null);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, message, null);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(500, message, null);
    }

    /** 远程调用方判断结果是否可用 */
    public boolean isSuccess() {
        return code == 200;
    }
}
