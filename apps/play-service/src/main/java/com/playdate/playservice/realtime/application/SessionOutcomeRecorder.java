package com.playdate.playservice.realtime.application;

import com.playdate.playservice.realtime.config.OutcomeProperties;
import com.playdate.playservice.realtime.domain.model.SessionSnapshot;
import com.playdate.playservice.realtime.domain.repository.SessionOutcomeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 对局结果异步落库。
 *
 * 会话进入终态后调用 record，写入在 outcomeScheduler 上执行，失败按线性退避重试；
 * 用尽次数后只记错误日志，不回滚内存中的会话状态。
 * 未配置 SessionOutcomeRepository 时为空操作。
 */
@Slf4j
@Component
public class SessionOutcomeRecorder {

    private final ObjectProvider<SessionOutcomeRepository> repositoryProvider;
    private final ScheduledExecutorService outcomeScheduler;
    private final OutcomeProperties properties;

    public SessionOutcomeRecorder(ObjectProvider<SessionOutcomeRepository> repositoryProvider,
                                  @Qualifier("outcomeScheduler") ScheduledExecutorService outcomeScheduler,
                                  OutcomeProperties properties) {
        this.repositoryProvider = repositoryProvider;
        this.outcomeScheduler = outcomeScheduler;
        this.properties = properties;
    }

    public void record(SessionSnapshot snapshot) {
        SessionOutcomeRepository repository = repositoryProvider.getIfAvailable();
        if (repository == null) {
            log.debug("未配置对局结果存储，跳过: sessionId={}", snapshot.sessionId());
            return;
        }
        submit(repository, snapshot, 1, 0L);
    }

    private void submit(SessionOutcomeRepository repository, SessionSnapshot snapshot, int attempt, long delayMillis) {
        try {
            outcomeScheduler.schedule(() -> attempt(repository, snapshot, attempt), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.error("对局结果写入任务提交失败（线程池已关闭）: sessionId={}", snapshot.sessionId(), e);
        }
    }

    private void attempt(SessionOutcomeRepository repository, SessionSnapshot snapshot, int attempt) {
        try {
            repository.recordSessionOutcome(snapshot);
            log.info("对局结果已记录: sessionId={}, status={}, attempt={}",
                    snapshot.sessionId(), snapshot.status().wire(), attempt);
        } catch (Exception e) {
            if (attempt >= properties.getMaxAttempts()) {
                log.error("对局结果写入失败，放弃: sessionId={}, attempts={}", snapshot.sessionId(), attempt, e);
                return;
            }
            long backoff = properties.getRetryBackoff().toMillis() * attempt;
            log.warn("对局结果写入失败，{}ms 后重试: sessionId={}, attempt={}, ex={}",
                    backoff, snapshot.sessionId(), attempt, e.toString());
            submit(repository, snapshot, attempt + 1, backoff);
        }
    }
}
