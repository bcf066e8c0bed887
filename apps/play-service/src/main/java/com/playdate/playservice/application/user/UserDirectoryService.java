package com.playdate.playservice.application.user;

import com.playdate.playservice.infrastructure.client.system.SystemUserClient;
import com.playdate.web.common.ApiResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 远程用户目录（system-service），统一在这里做熔断与兜底。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserDirectoryService {

    private final SystemUserClient systemUserClient;

    /**
     * @return 用户档案；不存在、调用失败或熔断打开时返回 null
     */
    @CircuitBreaker(name = "systemUserClient", fallbackMethod = "fallbackUserInfo")
    public UserProfileView getUserInfo(String userId) {
        ApiResponse<UserProfileView> resp = systemUserClient.getUserInfo(userId);
        if (resp == null || !resp.isSuccess() || resp.data() == null) {
            log.debug("用户档案不存在: userId={}, response={}", userId, resp);
            return null;
        }
        return resp.data();
    }

    @SuppressWarnings("unused")
    private UserProfileView fallbackUserInfo(String userId, Throwable ex) {
        log.warn("调用 system-service 失败，走兜底: userId={}, ex={}", userId, ex.toString());
        return null;
    }
}
