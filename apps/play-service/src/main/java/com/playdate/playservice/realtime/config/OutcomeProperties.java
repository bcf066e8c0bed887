package com.playdate.playservice.realtime.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 对局结果落库参数（playdate.outcome.*）。
 */
@Data
@Component
@ConfigurationProperties(prefix = "playdate.outcome")
public class OutcomeProperties {

    /** 最多尝试次数（含首次） */
    private int maxAttempts = 3;

    /** 第 n 次重试前等待 n × retryBackoff */
    private Duration retryBackoff = Duration.ofSeconds(2);

    /** Redis 中对局结果保留时长 */
    private Duration ttl = Duration.ofDays(30);
}
