package com.xjx.txdb.server.tm;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * @Author: Xjx
 * @Create: 2023/3/10 - 9:30
 */
public class Transaction {
    public long xid;
    public IsolationLevel level;
    public volatile TransactionState state;
    //该事务 BEGIN 日志的seq，检查点需要它来确定日志可以截断到哪里
    public long firstSeq;
    //时间戳排序下的开始时间戳
    public long startTs;
    //两阶段锁下未提交的写，按写入顺序保存
    public Map<Long, byte[]> writeBuffer;
    //可重复读与串行化下第一次读到的值，null值表示读时不存在
    public Map<Long, byte[]> readCache;
    //被并发控制层自动回滚的原因
    public Exception err;
    public volatile boolean autoAborted;
    //提交与回滚互斥
    public final Lock lock = new ReentrantLock();

    public static Transaction newTransaction(long xid, IsolationLevel level, long firstSeq) {
        Transaction t = new Transaction();
        t.xid = xid;
        t.level = level;
        t.state = TransactionState.ACTIVE;
        t.firstSeq = firstSeq;
        t.writeBuffer = Collections.synchronizedMap(new LinkedHashMap<>());
        t.readCache = level.usesReadCache() ? Collections.synchronizedMap(new HashMap<>()) : null;
        return t;
    }

    public boolean isActive() {
        return state == TransactionState.ACTIVE;
    }

    //结束后不再需要缓存的数据
    void clearBuffers() {
        writeBuffer.clear();
        if(readCache != null) {
            readCache.clear();
        }
    }
}
