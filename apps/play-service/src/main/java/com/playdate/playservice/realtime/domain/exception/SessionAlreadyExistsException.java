package com.playdate.playservice.realtime.domain.exception;

import com.playdate.playservice.realtime.domain.constants.PlayMessages;
import lombok.Getter;

/**
 * 创建会话时 ID 冲突。
 */
@Getter
public class SessionAlreadyExistsException extends IllegalStateException {

    private final String sessionId;

    public SessionAlreadyExistsException(String sessionId) {
        super(PlayMessages.SESSION_ID_TAKEN + ": " + sessionId);
        this.sessionId = sessionId;
    }
}
