package com.playdate.playservice.application.user;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachedIdentityServiceTest {

    @Mock
    PlayerProfileCache profileCache;
    @Mock
    UserDirectoryService userDirectory;

    private CachedIdentityService identityService;

    @BeforeEach
    void setUp() {
        identityService = new CachedIdentityService(profileCache, userDirectory);
    }

    @Test
    void cacheHitSkipsRemoteDirectory() {
        when(profileCache.get("u1")).thenReturn(Optional.of(new PlayerProfile("u1", "爱丽丝")));

        assertThat(identityService.resolveProfile("u1")).contains(new PlayerProfile("u1", "爱丽丝"));
        verify(userDirectory, never()).getUserInfo(anyString());
    }

    @Test
    void cacheMissLoadsFromDirectoryAndBackfillsDisplayName() {
        UserProfileView remote = UserProfileView.builder().userId("u2").username("bob").nickname("鲍勃").build();
        when(profileCache.get("u2")).thenReturn(Optional.empty());
        when(userDirectory.getUserInfo("u2")).thenReturn(remote);

        assertThat(identityService.resolveProfile("u2")).contains(new PlayerProfile("u2", "鲍勃"));
        verify(profileCache).put(new PlayerProfile("u2", "鲍勃"));
    }

    @Test
    void profileWithoutNamesFallsBackToId() {
        when(profileCache.get("u3")).thenReturn(Optional.empty());
        when(userDirectory.getUserInfo("u3")).thenReturn(UserProfileView.builder().userId("u3").build());

        assertThat(identityService.resolveProfile("u3")).contains(new PlayerProfile("u3", "u3"));
    }

    @Test
    void unknownUserResolvesToEmptyAndIsNotCached() {
        when(profileCache.get("ghost")).thenReturn(Optional.empty());
        when(userDirectory.getUserInfo("ghost")).thenReturn(null);

        assertThat(identityService.resolveProfile("ghost")).isEmpty();
        verify(profileCache, never()).put(any());
    }

    @Test
    void blankIdIsNotLookedUp() {
        assertThat(identityService.resolveProfile(" ")).isEmpty();
        verifyNoInteractions(profileCache, userDirectory);
    }
}
