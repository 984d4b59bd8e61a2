package com.xjx.txdb.server.rm;

import com.xjx.txdb.common.Error;
import com.xjx.txdb.server.dm.CheckpointMarker;
import com.xjx.txdb.server.dm.logger.LogRecord;
import com.xjx.txdb.server.dm.logger.Logger;
import com.xjx.txdb.server.dm.store.DataStore;
import com.xjx.txdb.server.tm.TransactionManagerImpl;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.Lock;

/**
 * @Author: Xjx
 * @Create: 2023/3/15 - 10:42
 * 启动时通过重放日志恢复共享存储，运行期间负责做检查点。
 * 先按日志顺序redo已提交事务，再倒序undo未提交事务留下的值（时间戳排序下它们可能被检查点存进了快照）
 */
public class RecoveryManager {
    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(RecoveryManager.class);

    private Logger lg;
    private DataStore store;
    private CheckpointMarker marker;
    private volatile boolean recovered;

    public RecoveryManager(Logger lg, DataStore store, CheckpointMarker marker) {
        this.lg = lg;
        this.store = store;
        this.marker = marker;
    }

    public RecoverResult recover() {
        if(recovered) {
            throw Error.RecoveryAlreadyDoneException;
        }
        LOG.info("Recovering...");

        //确定扫描起点：最近一次完成的检查点，以及它开始时仍活跃的事务中最早的BEGIN
        long start = lg.firstSeq();
        long nextXid = 1;
        long ckptSeq = marker.load();
        if(ckptSeq != CheckpointMarker.NONE) {
            LogRecord ckpt = readAt(ckptSeq);
            if(ckpt != null && ckpt.getKind() == LogRecord.Kind.CHECKPOINT_BEGIN) {
                start = ckptSeq;
                for(long firstSeq : ckpt.getActiveTransactions().values()) {
                    start = Math.min(start, firstSeq);
                }
                nextXid = Math.max(nextXid, ckpt.getXid());
            } else {
                LOG.warn("Checkpoint marker points to seq {} which is not a checkpoint, scanning whole log", ckptSeq);
            }
        }
        start = Math.max(start, lg.firstSeq());

        //第一遍：找出每个事务最后的终止记录
        Map<Long, LogRecord.Kind> terminal = new HashMap<>();
        Set<Long> seen = new LinkedHashSet<>();
        Iterator<LogRecord> it = lg.scan(start);
        while(it.hasNext()) {
            LogRecord r = it.next();
            switch (r.getKind()) {
                case BEGIN:
                case UPDATE:
                    seen.add(r.getXid());
                    break;
                case COMMIT:
                case ABORT:
                    seen.add(r.getXid());
                    terminal.put(r.getXid(), r.getKind());
                    break;
                case CHECKPOINT_BEGIN:
                    nextXid = Math.max(nextXid, r.getXid());
                    continue;
                default:
                    continue;
            }
            nextXid = Math.max(nextXid, r.getXid() + 1);
        }
        Set<Long> committed = new HashSet<>();
        for(Map.Entry<Long, LogRecord.Kind> e : terminal.entrySet()) {
            if(e.getValue() == LogRecord.Kind.COMMIT) {
                committed.add(e.getKey());
            }
        }

        //第二遍：按日志顺序重做已提交事务的UPDATE，重复执行结果不变。
        //同时收集未提交事务的UPDATE，以及每个键最后一次被提交写入的seq
        int redone = 0;
        List<LogRecord> undoLogs = new ArrayList<>();
        Map<Long, Long> lastCommitted = new HashMap<>();
        it = lg.scan(start);
        while(it.hasNext()) {
            LogRecord r = it.next();
            if(r.getKind() != LogRecord.Kind.UPDATE) {
                continue;
            }
            if(committed.contains(r.getXid())) {
                store.set(r.getKey(), r.getNewValue());
                lastCommitted.put(r.getKey(), r.getSeq());
                redone++;
            } else {
                undoLogs.add(r);
            }
        }
        LOG.info("Redo Transactions Over. {} updates of {} transactions", redone, committed.size());

        //第三步：倒序撤销未提交事务留在共享存储里的值。
        //时间戳排序下写会立刻进入共享存储，检查点可能把它们存进了快照；之后被提交写覆盖过的键保持不动
        int undone = 0;
        for(int i = undoLogs.size() - 1; i >= 0; i--) {
            LogRecord r = undoLogs.get(i);
            Long committedSeq = lastCommitted.get(r.getKey());
            if(committedSeq != null && committedSeq > r.getSeq()) {
                continue;
            }
            store.set(r.getKey(), r.getOldValue());
            undone++;
        }
        LOG.info("Undo Transactions Over. {} updates undone", undone);

        //没有终止记录的事务补写ABORT
        Set<Long> losers = new LinkedHashSet<>();
        for(long xid : seen) {
            if(!terminal.containsKey(xid)) {
                losers.add(xid);
                lg.append(LogRecord.abort(xid));
            }
        }
        if(!losers.isEmpty()) {
            lg.flush();
            LOG.info("Aborted unfinished transactions {}", losers);
        }
        store.flush();
        recovered = true;
        RecoverResult res = new RecoverResult(start, redone, undone, committed.size(), losers, nextXid);
        LOG.info("Recovery Over: {}", res);
        return res;
    }

    private LogRecord readAt(long seq) {
        if(seq < lg.firstSeq()) {
            return null;
        }
        Iterator<LogRecord> it = lg.scan(seq);
        if(!it.hasNext()) {
            return null;
        }
        LogRecord r = it.next();
        return r.getSeq() == seq ? r : null;
    }

    // 做一次检查点。等待活跃事务结束超时或被中断时放弃本次检查点并返回false
    public boolean checkpoint(TransactionManagerImpl tm, long waitMillis, boolean truncate) {
        if(!recovered) {
            throw Error.RecoveryNotDoneException;
        }
        Lock barrier = tm.getCheckpointLock().writeLock();
        Map<Long, Long> active;
        long beginSeq;
        barrier.lock();
        try {
            active = tm.activeSnapshot();
            beginSeq = lg.append(LogRecord.checkpointBegin(tm.nextXid(), active));
            lg.flush();
        } finally {
            barrier.unlock();
        }
        LOG.info("Checkpoint begin at seq {}, active transactions {}", beginSeq, active.keySet());

        try {
            if(!tm.awaitTermination(active.keySet(), waitMillis)) {
                LOG.info("Checkpoint at seq {} abandoned, transactions still active", beginSeq);
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Checkpoint at seq {} interrupted", beginSeq);
            return false;
        }

        barrier.lock();
        try {
            store.flush();
            lg.append(LogRecord.checkpointEnd(beginSeq));
            lg.flush();
            marker.update(beginSeq);
        } finally {
            barrier.unlock();
        }
        LOG.info("Checkpoint at seq {} completed", beginSeq);

        if(truncate) {
            long keep = beginSeq;
            for(long firstSeq : active.values()) {
                keep = Math.min(keep, firstSeq);
            }
            lg.truncateBefore(keep);
        }
        return true;
    }

    public boolean isRecovered() {
        return recovered;
    }
}
