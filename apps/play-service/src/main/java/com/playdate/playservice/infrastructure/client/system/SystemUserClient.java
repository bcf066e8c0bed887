package com.playdate.playservice.infrastructure.client.system;

import com.playdate.playservice.application.user.UserProfileView;
import com.playdate.web.common.ApiResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

/**
 * 用户域（system-service）用户档案接口。
 * 本地开发通过 spring.cloud.openfeign.client.config.system-service.url 指定地址，
 * 容器环境由 LoadBalancer 按服务名解析。
 */
@FeignClient(name = "system-service", path = "/api/users")
public interface SystemUserClient {

    /**
     * 按玩家 ID（JWT sub）查询用户档案。
     */
    @GetMapping("/users/{userId}")
    ApiResponse<UserProfileView> getUserInfo(@PathVariable("userId") String userId);
}
