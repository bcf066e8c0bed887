package com.playdate.playservice.application.user;

/**
 * 会话内使用的玩家档案：ID + 展示名。
 */
public record PlayerProfile(String id, String name) {
}
