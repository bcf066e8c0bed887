package com.playdate.playservice.application.user;

import java.util.Optional;

/**
 * 玩家身份查询（用户域的只读视图）。
 * 查不到或用户域不可用时返回 empty，不抛异常。
 */
public interface IdentityService {

    Optional<PlayerProfile> resolveProfile(String playerId);
}
