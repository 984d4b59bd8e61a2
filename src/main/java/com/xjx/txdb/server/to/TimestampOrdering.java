package com.xjx.txdb.server.to;

import com.xjx.txdb.common.Error;
import com.xjx.txdb.server.dm.store.DataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * @Author: Xjx
 * @Create: 2023/3/9 - 16:40
 * 基于时间戳排序的并发控制，从不阻塞调用方，冲突时直接拒绝。
 * 不采用 Thomas 写规则：过时的写同样会导致回滚
 */
public class TimestampOrdering {
    private static final Logger LOG = LoggerFactory.getLogger(TimestampOrdering.class);

    private DataStore store;
    // 事务XID -> 开始时间戳
    private Map<Long, Long> x2ts;
    // 数据项UID -> 读写时间戳
    private Map<Long, ItemStamp> u2stamp;
    private long lastTs;
    private Lock lock;

    static class ItemStamp {
        //读过该数据项的事务中最大的开始时间戳
        long readTs;
        //写过该数据项的事务中最大的开始时间戳
        long writeTs;
    }

    //写入数据前的钩子，抛出异常则不会写入
    public interface InstallHook {
        void beforeInstall(long uid, byte[] oldValue, byte[] newValue);
    }

    public TimestampOrdering(DataStore store) {
        this(store, 0);
    }

    // lastTs 之后的时间戳才会被分配出去
    public TimestampOrdering(DataStore store, long lastTs) {
        this.store = store;
        this.lastTs = lastTs;
        this.x2ts = new HashMap<>();
        this.u2stamp = new HashMap<>();
        this.lock = new ReentrantLock();
    }

    public long begin(long xid) {
        lock.lock();
        try {
            long ts = ++lastTs;
            x2ts.put(xid, ts);
            return ts;
        } finally {
            lock.unlock();
        }
    }

    public byte[] read(long xid, long uid) {
        lock.lock();
        try {
            long ts = startTs(xid);
            ItemStamp stamp = u2stamp.computeIfAbsent(uid, k -> new ItemStamp());
            //更晚的事务已经写过这个数据项，当前事务看到的视图已经失效
            if(ts < stamp.writeTs) {
                LOG.debug("Transaction {} (ts {}) cannot read {}: write ts {}", xid, ts, uid, stamp.writeTs);
                throw Error.TimestampConflictException;
            }
            stamp.readTs = Math.max(stamp.readTs, ts);
            return store.get(uid);
        } finally {
            lock.unlock();
        }
    }

    public void write(long xid, long uid, byte[] value, InstallHook hook) {
        lock.lock();
        try {
            long ts = startTs(xid);
            ItemStamp stamp = u2stamp.computeIfAbsent(uid, k -> new ItemStamp());
            //更晚的事务已经读过或写过这个数据项
            if(ts < stamp.readTs || ts < stamp.writeTs) {
                LOG.debug("Transaction {} (ts {}) cannot write {}: read ts {}, write ts {}",
                        xid, ts, uid, stamp.readTs, stamp.writeTs);
                throw Error.TimestampConflictException;
            }
            hook.beforeInstall(uid, store.get(uid), value);
            store.set(uid, value);
            stamp.writeTs = Math.max(stamp.writeTs, ts);
        } finally {
            lock.unlock();
        }
    }

    public void end(long xid) {
        lock.lock();
        try {
            x2ts.remove(xid);
        } finally {
            lock.unlock();
        }
    }

    public long getStartTs(long xid) {
        lock.lock();
        try {
            return startTs(xid);
        } finally {
            lock.unlock();
        }
    }

    public long getReadTs(long uid) {
        lock.lock();
        try {
            ItemStamp s = u2stamp.get(uid);
            return s == null ? 0 : s.readTs;
        } finally {
            lock.unlock();
        }
    }

    public long getWriteTs(long uid) {
        lock.lock();
        try {
            ItemStamp s = u2stamp.get(uid);
            return s == null ? 0 : s.writeTs;
        } finally {
            lock.unlock();
        }
    }

    private long startTs(long xid) {
        Long ts = x2ts.get(xid);
        if(ts == null) {
            throw Error.UnknownTimestampException;
        }
        return ts;
    }
}
