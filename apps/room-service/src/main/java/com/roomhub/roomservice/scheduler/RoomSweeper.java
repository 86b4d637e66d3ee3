package com.roomhub.roomservice.scheduler;

import com.roomhub.roomservice.platform.room.RoomProperties;
import com.roomhub.roomservice.platform.room.RoomRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 定期清理空闲房间（hub.room.idle-ttl / hub.room.sweep-interval）。
 */
@Slf4j
@Component
public class RoomSweeper {

    private final RoomRegistry registry;
    private final RoomProperties properties;
    private final ScheduledThreadPoolExecutor scheduler;

    private ScheduledFuture<?> task;

    public RoomSweeper(RoomRegistry registry,
                       RoomProperties properties,
                       @Qualifier("roomSweepScheduler") ScheduledThreadPoolExecutor scheduler) {
        this.registry = registry;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    @PostConstruct
    public void start() {
        long periodMs = Math.max(1000L, properties.getSweepInterval().toMillis());
        task = scheduler.scheduleAtFixedRate(this::sweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("房间清理已启动: interval={}ms, idleTtl={}", periodMs, properties.getIdleTtl());
    }

    @PreDestroy
    public void stop() {
        if (task != null) {
            task.cancel(false);
        }
    }

    /** 扫一轮；异常只记录，周期任务抛出异常会被取消 */
    public int sweep() {
        try {
            int removed = registry.sweepIdle(Instant.now());
            if (removed > 0) {
                log.info("本轮清理空闲房间 {} 个，剩余 {} 个", removed, registry.size());
            }
            return removed;
        } catch (RuntimeException e) {
            log.warn("空闲房间清理失败", e);
            return 0;
        }
    }
}
