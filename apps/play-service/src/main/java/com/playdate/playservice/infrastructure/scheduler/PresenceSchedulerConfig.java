package com.playdate.playservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 后台定时线程池。
 *
 * presenceScheduler：在线清扫（心跳超时、无人认领、已结束会话回收），单线程即可；
 * outcomeScheduler：对局结果落库及失败重试，与清扫分开，避免外部存储变慢拖住清扫节奏。
 */
@Configuration
public class PresenceSchedulerConfig {

    @Value("${scheduler.outcome.corePoolSize:2}")
    private int outcomePoolSize;

    @Bean(name = "presenceScheduler")
    public ScheduledExecutorService presenceScheduler() {
        return daemonPool(1, "presence-sweep-");
    }

    @Bean(name = "outcomeScheduler")
    public ScheduledExecutorService outcomeScheduler() {
        return daemonPool(outcomePoolSize, "outcome-writer-");
    }

    private static ScheduledExecutorService daemonPool(int size, String prefix) {
        ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(size, new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + idx.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        });
        // cancel 后从队列中移除
        exec.setRemoveOnCancelPolicy(true);
        return exec;
    }
}
