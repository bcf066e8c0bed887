package com.playdate.playservice.realtime.application;

import com.playdate.playservice.realtime.config.SessionProperties;
import com.playdate.playservice.realtime.domain.model.GameSession;
import com.playdate.playservice.realtime.domain.model.PlayerMembership;
import com.playdate.playservice.realtime.domain.repository.SessionStore;
import com.playdate.playservice.realtime.service.SessionProtocolService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 在线清扫任务。
 *
 * 应用就绪后按 sweepInterval 周期执行，每轮对每个会话：
 * <ol>
 *   <li>在线成员 lastSeenAt 超过 heartbeatTimeout：按断线移出（player_leave, reason=disconnect）；</li>
 *   <li>未结束的会话无人在线且成员无活动超过 idleTimeout：判为 abandoned；</li>
 *   <li>终态会话超过 finishedGrace：从内存回收。</li>
 * </ol>
 * 这里只根据副本筛选候选，真正的判定和修改都在引擎里、会话锁内再做一次。
 */
@Slf4j
@Component
public class PresenceSweeper {

    private final SessionStore store;
    private final SessionProtocolService sessions;
    private final SessionProperties properties;
    private final ScheduledExecutorService presenceScheduler;
    private final Clock clock;

    private volatile ScheduledFuture<?> task;

    public PresenceSweeper(SessionStore store,
                           SessionProtocolService sessions,
                           SessionProperties properties,
                           @Qualifier("presenceScheduler") ScheduledExecutorService presenceScheduler,
                           Clock clock) {
        this.store = store;
        this.sessions = sessions;
        this.properties = properties;
        this.presenceScheduler = presenceScheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        long interval = properties.getSweepInterval().toMillis();
        task = presenceScheduler.scheduleWithFixedDelay(this::sweepQuietly, interval, interval, TimeUnit.MILLISECONDS);
        log.info("在线清扫已启动: interval={}ms, heartbeatTimeout={}s, finishedGrace={}s",
                interval, properties.getHeartbeatTimeout().toSeconds(), properties.getFinishedGrace().toSeconds());
    }

    @PreDestroy
    public void stop() {
        ScheduledFuture<?> t = task;
        if (t != null) {
            t.cancel(false);
        }
    }

    /**
     * 执行一轮清扫。
     *
     * @return 本轮发生变化（移出玩家 / 放弃 / 回收）的次数
     */
    public int sweep() {
        Instant now = clock.instant();
        Instant staleBefore = now.minus(properties.getHeartbeatTimeout());
        Instant idleBefore = now.minus(properties.getIdleTimeout());
        Instant finishedBefore = now.minus(properties.getFinishedGrace());

        int changes = 0;
        for (String sessionId : store.sessionIds()) {
            GameSession session = store.get(sessionId).orElse(null);
            if (session == null) {
                continue;
            }
            try {
                changes += sweepSession(session, staleBefore, idleBefore, finishedBefore);
            } catch (RuntimeException e) {
                log.error("清扫会话失败: sessionId={}", sessionId, e);
            }
        }
        if (changes > 0) {
            log.debug("本轮清扫完成: changes={}", changes);
        }
        return changes;
    }

    private int sweepSession(GameSession session, Instant staleBefore, Instant idleBefore, Instant finishedBefore) {
        String sessionId = session.getId();
        if (session.getStatus().isTerminal()) {
            return sessions.expireFinishedSession(sessionId, finishedBefore) ? 1 : 0;
        }
        int changes = 0;
        for (PlayerMembership m : session.getPlayers()) {
            if (m.isConnected() && m.getLastSeenAt().isBefore(staleBefore)
                    && sessions.evictIfStale(sessionId, m.getId(), staleBefore)) {
                changes++;
            }
        }
        if (!session.hasConnectedPlayer() && sessions.abandonIfIdle(sessionId, idleBefore)) {
            changes++;
        }
        return changes;
    }

    /** 定时任务入口：异常不能逃出，否则后续周期会被取消 */
    private void sweepQuietly() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("在线清扫执行异常", e);
        }
    }
}
