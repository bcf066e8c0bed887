package com.playdate.playservice.realtime.domain.exception;

import com.playdate.playservice.common.ResourceNotFoundException;
import com.playdate.playservice.realtime.domain.constants.PlayMessages;
import lombok.Getter;

/**
 * 会话不存在或已被移除。
 */
@Getter
public class SessionNotFoundException extends ResourceNotFoundException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(PlayMessages.SESSION_NOT_FOUND + ": " + sessionId);
        this.sessionId = sessionId;
    }
}
