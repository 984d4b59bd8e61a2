package com.xjx.txdb.server;

import com.google.common.base.Preconditions;
import com.xjx.txdb.server.lm.VictimPolicy;

/**
 * @Author: Xjx
 * @Create: 2023/3/13 - 9:40
 * 数据库启动参数，一次部署只能选择一种并发控制方式
 */
public class DBConfig {

    public enum ConcurrencyMode {
        TWO_PHASE_LOCKING,
        TIMESTAMP_ORDERING
    }

    private ConcurrencyMode mode = ConcurrencyMode.TWO_PHASE_LOCKING;
    private VictimPolicy victimPolicy = VictimPolicy.MOST_RECENT_WAITER;
    //检查点完成后是否丢弃不再需要的日志前缀
    private boolean truncateOnCheckpoint = true;
    //定时检查点的间隔，0表示不启用
    private long checkpointIntervalMillis = 0;
    //检查点等待活跃事务结束的最长时间，0表示一直等待
    private long checkpointWaitMillis = 0;

    public static DBConfig defaults() {
        return new DBConfig();
    }

    public ConcurrencyMode getMode() {
        return mode;
    }

    public DBConfig setMode(ConcurrencyMode mode) {
        this.mode = Preconditions.checkNotNull(mode);
        return this;
    }

    public VictimPolicy getVictimPolicy() {
        return victimPolicy;
    }

    public DBConfig setVictimPolicy(VictimPolicy victimPolicy) {
        this.victimPolicy = Preconditions.checkNotNull(victimPolicy);
        return this;
    }

    public boolean isTruncateOnCheckpoint() {
        return truncateOnCheckpoint;
    }

    public DBConfig setTruncateOnCheckpoint(boolean truncateOnCheckpoint) {
        this.truncateOnCheckpoint = truncateOnCheckpoint;
        return this;
    }

    public long getCheckpointIntervalMillis() {
        return checkpointIntervalMillis;
    }

    public DBConfig setCheckpointIntervalMillis(long checkpointIntervalMillis) {
        Preconditions.checkArgument(checkpointIntervalMillis >= 0, "negative checkpoint interval");
        this.checkpointIntervalMillis = checkpointIntervalMillis;
        return this;
    }

    public long getCheckpointWaitMillis() {
        return checkpointWaitMillis;
    }

    public DBConfig setCheckpointWaitMillis(long checkpointWaitMillis) {
        Preconditions.checkArgument(checkpointWaitMillis >= 0, "negative checkpoint wait");
        this.checkpointWaitMillis = checkpointWaitMillis;
        return this;
    }
}
