package com.playdate.web.common;

import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Optional;

/**
 * 从 JWT 中提取当前调用方信息。
 *
 * <pre>
 * {@code
 * @PostMapping("/sessions")
 * public ApiResponse<?> create(@AuthenticationPrincipal Jwt jwt) {
 *     String playerId = CurrentUserHelper.requireUserId(jwt);
 *     ...
 * }
 * }
 * </pre>
 */
public final class CurrentUserHelper {

    private CurrentUserHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return 调用方信息；jwt 为 null 时返回 null
     */
    public static CurrentUserInfo from(Jwt jwt) {
        if (jwt == null) {
            return null;
        }
        String userId = jwt.getSubject();
        String username = Optional.ofNullable(jwt.getClaimAsString("preferred_username"))
                .filter(s -> !s.isBlank())
                .orElse(userId);
        String nickname = Optional.ofNullable(jwt.getClaimAsString("name"))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .orElse(null);
        return new CurrentUserInfo(userId, username, nickname);
    }

    /**
     * 取调用方 ID；未认证时抛出 IllegalArgumentException（映射为 400）。
     */
    public static String requireUserId(Jwt jwt) {
        String userId = jwt != null ? jwt.getSubject() : null;
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("缺少调用方身份");
        }
        return userId;
    }

    public static String getDisplayName(Jwt jwt) {
        CurrentUserInfo user = from(jwt);
        return user != null ? user.getDisplayName() : null;
    }
}
