package com.playdate.playservice.realtime.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 会话在线判定与回收参数（playdate.session.*）。
 */
@Data
@Component
@ConfigurationProperties(prefix = "playdate.session")
public class SessionProperties {

    /** 超过该时长未收到玩家任何消息（含 heartbeat）即判定掉线 */
    private Duration heartbeatTimeout = Duration.ofSeconds(30);

    /** 清扫间隔 */
    private Duration sweepInterval = Duration.ofSeconds(5);

    /** 会话进入终态后在内存中保留的时长，供断线玩家重连取最终状态 */
    private Duration finishedGrace = Duration.ofSeconds(60);

    /** 未结束的会话无人在线、且成员无活动超过该时长，判为 abandoned */
    private Duration idleTimeout = Duration.ofMinutes(10);
}
