package com.playdate.playservice.application.user;

import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * IdentityService 默认实现：先查展示名缓存，未命中再走远程目录并回填。
 * 目录里查不到的用户不回填，下次仍会查远程。
 */
@Service
@RequiredArgsConstructor
public class CachedIdentityService implements IdentityService {

    private final PlayerProfileCache profileCache;
    private final UserDirectoryService userDirectory;

    @Override
    public Optional<PlayerProfile> resolveProfile(String playerId) {
        if (StringUtils.isBlank(playerId)) {
            return Optional.empty();
        }
        Optional<PlayerProfile> cached = profileCache.get(playerId);
        if (cached.isPresent()) {
            return cached;
        }
        UserProfileView remote = userDirectory.getUserInfo(playerId);
        if (remote == null) {
            return Optional.empty();
        }
        PlayerProfile profile = new PlayerProfile(playerId, StringUtils.defaultIfBlank(remote.getDisplayName(), playerId));
        profileCache.put(profile);
        return Optional.of(profile);
    }
}
