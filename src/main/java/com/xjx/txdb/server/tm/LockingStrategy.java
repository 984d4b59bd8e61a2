package com.xjx.txdb.server.tm;

import com.xjx.txdb.server.dm.logger.LogRecord;
import com.xjx.txdb.server.dm.logger.Logger;
import com.xjx.txdb.server.dm.store.DataStore;
import com.xjx.txdb.server.lm.LockMode;
import com.xjx.txdb.server.lm.LockTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @Author: Xjx
 * @Create: 2023/3/10 - 10:30
 * 严格两阶段锁：执行期间只加锁，提交或回滚时一次性释放全部锁。
 * 写缓存在事务内，提交时先写日志再应用到共享存储
 */
public class LockingStrategy implements ConcurrencyStrategy {
    private LockTable lt;
    private DataStore store;
    private Logger lg;

    public LockingStrategy(LockTable lt, DataStore store, Logger lg) {
        this.lt = lt;
        this.store = store;
        this.lg = lg;
    }

    @Override
    public void begin(Transaction t) {
    }

    @Override
    public byte[] read(Transaction t, long uid) {
        lt.acquire(t.xid, uid, LockMode.SHARED);
        return store.get(uid);
    }

    @Override
    public void write(Transaction t, long uid, byte[] value) {
        lt.acquire(t.xid, uid, LockMode.EXCLUSIVE);
        t.writeBuffer.put(uid, value);
    }

    @Override
    public void commit(Transaction t) {
        Map<Long, byte[]> writes;
        synchronized (t.writeBuffer) {
            writes = new LinkedHashMap<>(t.writeBuffer);
        }
        //每个缓存的写对应一条UPDATE日志，旧值从共享存储中读出；持有排他锁，旧值不会变
        List<Long> uids = new ArrayList<>(writes.keySet());
        for(long uid : uids) {
            lg.append(LogRecord.update(t.xid, uid, store.get(uid), writes.get(uid)));
        }
        lg.append(LogRecord.commit(t.xid));
        lg.flush();
        //COMMIT日志落盘之后才能让写对外可见
        for(long uid : uids) {
            store.set(uid, writes.get(uid));
        }
        t.writeBuffer.clear();
        lt.releaseAll(t.xid);
    }

    @Override
    public void abort(Transaction t) {
        t.writeBuffer.clear();
        lt.releaseAll(t.xid);
    }

    @Override
    public boolean buffersWrites() {
        return true;
    }

    public LockTable getLockTable() {
        return lt;
    }
}
