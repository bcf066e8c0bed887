package com.playdate.playservice.challenge.domain.exception;

import com.playdate.playservice.common.ResourceNotFoundException;

public class ChallengeNotFoundException extends ResourceNotFoundException {

    public ChallengeNotFoundException(String sessionId) {
        super("挑战不存在: " + sessionId);
    }
}
