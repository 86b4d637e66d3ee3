package com.roomhub.roomservice.scheduler;

import com.roomhub.roomservice.platform.room.RoomProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 房间清理用的定时线程池。
 * 线程命名 room-sweeper-N，守护线程；任务满时直接丢弃（下一轮还会再扫）。
 */
@Configuration
public class RoomSweeperConfig {

    @Bean(name = "roomSweepScheduler")
    public ScheduledThreadPoolExecutor roomSweepScheduler(RoomProperties properties) {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "room-sweeper-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                Math.max(1, properties.getSweeperPoolSize()), tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }
}
