package com.roomhub.roomservice.platform.room;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 房间配置（hub.room.*）。
 */
@Component
@Validated
@ConfigurationProperties(prefix = "hub.room")
public class RoomProperties {

    /** 房间码长度 */
    @Min(3)
    @Max(12)
    private int codeLength = 4;

    /** 房间空闲多久后被清理 */
    @NotNull
    private Duration idleTtl = Duration.ofMinutes(30);

    /** 清理任务执行间隔 */
    @NotNull
    private Duration sweepInterval = Duration.ofMinutes(1);

    /** 清理线程数 */
    @Min(1)
    private int sweeperPoolSize = 1;

    public int getCodeLength() {
        return codeLength;
    }

    public void setCodeLength(int codeLength) {
        this.codeLength = codeLength;
    }

    public Duration getIdleTtl() {
        return idleTtl;
    }

    public void setIdleTtl(Duration idleTtl) {
        this.idleTtl = idleTtl;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }

    public int getSweeperPoolSize() {
        return sweeperPoolSize;
    }

    public void setSweeperPoolSize(int sweeperPoolSize) {
        this.sweeperPoolSize = sweeperPoolSize;
    }
}
