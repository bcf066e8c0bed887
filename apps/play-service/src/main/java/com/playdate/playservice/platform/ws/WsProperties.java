package com.playdate.playservice.platform.ws;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * WebSocket 接入配置（playdate.ws.*）。
 */
@Component
@ConfigurationProperties(prefix = "playdate.ws")
public class WsProperties {

    /**
     * CONNECT 帧是否必须携带有效 JWT。
     * 关闭后允许匿名连接，玩家 ID 取消息体中的 playerId（仅用于本地联调）。
     */
    private boolean requireAuth = true;

    /**
     * 允许的跨域来源，默认全部放行
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    public boolean isRequireAuth() {
        return requireAuth;
    }

    public void setRequireAuth(boolean requireAuth) {
        this.requireAuth = requireAuth;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }
}
