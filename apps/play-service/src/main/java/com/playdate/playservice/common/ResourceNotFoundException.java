package com.playdate.playservice.common;

/**
 * 资源不存在（会话、挑战、用户）。HTTP 映射为 404，WebSocket 下转为 error 事件。
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
