package com.playdate.playservice.challenge.service.dto;

import java.util.List;

public record PendingChallenges(List<ChallengeView> sentChallenges, List<ChallengeView> receivedChallenges) {
}
