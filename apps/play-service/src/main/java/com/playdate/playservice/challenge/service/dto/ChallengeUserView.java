package com.playdate.playservice.challenge.service.dto;

public record ChallengeUserView(String id, String name) {
}
