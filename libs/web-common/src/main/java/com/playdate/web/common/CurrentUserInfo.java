package com.playdate.web.common;

/**
 * 调用方身份（从 JWT 解析）。
 *
 * @param userId   JWT subject，即平台内的玩家 ID
 * @param username preferred_username，缺省时等于 userId
 * @param nickname name 声明，可能为 null
 */
public record CurrentUserInfo(String userId, String username, String nickname) {

    /** 展示名：昵称 > 用户名 > userId */
    public String getDisplayName() {
        if (nickname != null && !nickname.isBlank()) {
            return nickname;
        }
        if (username != null && !username.isBlank()) {
            return username;
        }
        return userId;
    }
}
