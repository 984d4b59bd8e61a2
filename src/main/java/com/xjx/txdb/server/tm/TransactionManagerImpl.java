package com.xjx.txdb.server.tm;

import com.google.common.collect.ImmutableMap;
import com.xjx.txdb.common.Error;
import com.xjx.txdb.common.LogIOException;
import com.xjx.txdb.common.TransactionAbortedException;
import com.xjx.txdb.server.dm.logger.LogRecord;
import com.xjx.txdb.server.dm.logger.Logger;
import com.xjx.txdb.server.dm.store.DataStore;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * @Author: Xjx
 * @Create: 2023/3/10 - 15:02
 */
public class TransactionManagerImpl implements TransactionManager {
    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(TransactionManagerImpl.class);

    private Logger lg;
    private DataStore store;
    private ConcurrencyStrategy strategy;
    //所有开启过的事务，结束之后仍保留状态用于查询
    private Map<Long, Transaction> transactions;
    //当前活跃的事务
    private Map<Long, Transaction> activeTransaction;
    private long xidCounter;
    private Lock counterLock;
    //有事务结束时唤醒等待中的检查点
    private Condition terminated;
    //提交、开启事务持读锁，检查点持写锁
    private ReadWriteLock checkpointLock;

    public TransactionManagerImpl(Logger lg, DataStore store, ConcurrencyStrategy strategy, long nextXid) {
        this.lg = lg;
        this.store = store;
        this.strategy = strategy;
        this.transactions = new ConcurrentHashMap<>();
        this.activeTransaction = new ConcurrentHashMap<>();
        this.xidCounter = nextXid - 1;
        this.counterLock = new ReentrantLock();
        this.terminated = counterLock.newCondition();
        this.checkpointLock = new ReentrantReadWriteLock();
    }

    @Override
    public long begin(IsolationLevel level) {
        checkpointLock.readLock().lock();
        try {
            long xid;
            counterLock.lock();
            try {
                xid = ++xidCounter;
            } finally {
                counterLock.unlock();
            }
            //BEGIN写失败则事务不存在，异常直接抛给调用方
            long seq = lg.append(LogRecord.begin(xid));
            Transaction t = Transaction.newTransaction(xid, level, seq);
            strategy.begin(t);
            transactions.put(xid, t);
            activeTransaction.put(xid, t);
            LOG.debug("Transaction {} began at seq {} ({})", xid, seq, level);
            return xid;
        } finally {
            checkpointLock.readLock().unlock();
        }
    }

    @Override
    public byte[] read(long xid, long uid) {
        Transaction t = getOpen(xid);
        //两阶段锁下先看自己未提交的写
        byte[] own = t.writeBuffer.get(uid);
        if(own != null) {
            return copy(own);
        }
        if(t.level == IsolationLevel.READ_UNCOMMITTED) {
            return store.get(uid);
        }
        if(t.level.usesReadCache()) {
            synchronized (t.readCache) {
                if(t.readCache.containsKey(uid)) {
                    return copy(t.readCache.get(uid));
                }
            }
        }
        byte[] value;
        try {
            value = strategy.read(t, uid);
        } catch (RuntimeException e) {
            throw abortOnConflict(t, e);
        }
        checkStillActive(t);
        if(t.level.usesReadCache()) {
            t.readCache.put(uid, copy(value));
        }
        return value;
    }

    @Override
    public void write(long xid, long uid, byte[] value) {
        if(value == null) {
            throw new IllegalArgumentException("null value");
        }
        Transaction t = getOpen(xid);
        byte[] v = copy(value);
        try {
            if(strategy.buffersWrites()) {
                //等锁时不能持有检查点读锁，否则排队的检查点会挡住锁持有者的提交
                strategy.write(t, uid, v);
            } else {
                checkpointLock.readLock().lock();
                try {
                    strategy.write(t, uid, v);
                } finally {
                    checkpointLock.readLock().unlock();
                }
            }
        } catch (RuntimeException e) {
            throw abortOnConflict(t, e);
        }
        checkStillActive(t);
        if(t.level.usesReadCache()) {
            t.readCache.put(uid, copy(v));
        }
    }

    //读写进行期间事务被其他线程回滚，刚拿到的锁要还回去
    private void checkStillActive(Transaction t) {
        t.lock.lock();
        try {
            if(t.isActive()) {
                return;
            }
            strategy.abort(t);
        } finally {
            t.lock.unlock();
        }
        throw Error.TransactionClosedException;
    }

    @Override
    public CommitResult commit(long xid) {
        Transaction t = get(xid);
        t.lock.lock();
        try {
            //被自动回滚过的事务，提交的结果就是已回滚
            if(t.state == TransactionState.ABORTED && t.autoAborted) {
                return CommitResult.ABORTED;
            }
            if(t.state != TransactionState.ACTIVE) {
                throw Error.TransactionClosedException;
            }
            checkpointLock.readLock().lock();
            try {
                strategy.commit(t);
            } catch (RuntimeException e) {
                if(!isAbortSignal(e)) {
                    throw e;
                }
                LOG.debug("Commit of transaction {} failed, aborting", xid, e);
                t.err = e;
                t.autoAborted = true;
                internAbort(t);
                return CommitResult.ABORTED;
            } finally {
                checkpointLock.readLock().unlock();
            }
            t.state = TransactionState.COMMITTED;
            finish(t);
            LOG.debug("Transaction {} committed", xid);
            return CommitResult.OK;
        } finally {
            t.lock.unlock();
        }
    }

    @Override
    public void abort(long xid) {
        Transaction t = get(xid);
        t.lock.lock();
        try {
            if(t.state == TransactionState.ABORTED) {
                return;
            }
            if(t.state == TransactionState.COMMITTED) {
                throw Error.TransactionClosedException;
            }
            internAbort(t);
        } finally {
            t.lock.unlock();
        }
    }

    //并发冲突或日志失败时自动回滚，返回要抛给调用方的异常
    private RuntimeException abortOnConflict(Transaction t, RuntimeException e) {
        if(!isAbortSignal(e)) {
            return e;
        }
        t.lock.lock();
        try {
            if(t.state != TransactionState.ACTIVE) {
                //其他线程已经结束了这个事务
                return Error.TransactionClosedException;
            }
            LOG.debug("Transaction {} aborted automatically: {}", t.xid, e.getMessage());
            t.err = e;
            t.autoAborted = true;
            //带着中断标志写日志会让 FileChannel 关闭，写完ABORT再恢复中断标志
            boolean interrupted = e == Error.LockWaitInterruptedException && Thread.interrupted();
            try {
                internAbort(t);
            } finally {
                if(interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        } finally {
            t.lock.unlock();
        }
        return new TransactionAbortedException(t.xid, e);
    }

    //调用方需持有 t.lock
    private void internAbort(Transaction t) {
        try {
            lg.append(LogRecord.abort(t.xid));
        } catch (LogIOException e) {
            //恢复时没有终止记录的事务同样不会被重做
            LOG.warn("Failed to log abort of transaction {}", t.xid, e);
        }
        strategy.abort(t);
        t.state = TransactionState.ABORTED;
        finish(t);
        LOG.debug("Transaction {} aborted", t.xid);
    }

    private void finish(Transaction t) {
        t.clearBuffers();
        counterLock.lock();
        try {
            activeTransaction.remove(t.xid);
            terminated.signalAll();
        } finally {
            counterLock.unlock();
        }
    }

    private static boolean isAbortSignal(RuntimeException e) {
        return e == Error.DeadlockException
                || e == Error.TimestampConflictException
                || e == Error.LockWaitInterruptedException
                || e instanceof LogIOException;
    }

    private Transaction get(long xid) {
        Transaction t = transactions.get(xid);
        if(t == null) {
            throw Error.NoTransactionException;
        }
        return t;
    }

    private Transaction getOpen(long xid) {
        Transaction t = get(xid);
        if(t.state != TransactionState.ACTIVE) {
            throw Error.TransactionClosedException;
        }
        return t;
    }

    private static byte[] copy(byte[] b) {
        return b == null ? null : Arrays.copyOf(b, b.length);
    }

    @Override
    public boolean isActive(long xid) {
        return state(xid) == TransactionState.ACTIVE;
    }

    @Override
    public boolean isCommitted(long xid) {
        return state(xid) == TransactionState.COMMITTED;
    }

    @Override
    public boolean isAborted(long xid) {
        return state(xid) == TransactionState.ABORTED;
    }

    @Override
    public TransactionState state(long xid) {
        return get(xid).state;
    }

    // 以下供检查点使用

    public ReadWriteLock getCheckpointLock() {
        return checkpointLock;
    }

    // 活跃事务 -> BEGIN日志的seq，需要在检查点写锁下调用
    public Map<Long, Long> activeSnapshot() {
        ImmutableMap.Builder<Long, Long> b = ImmutableMap.builder();
        for(Transaction t : activeTransaction.values()) {
            b.put(t.xid, t.firstSeq);
        }
        return b.build();
    }

    public long nextXid() {
        counterLock.lock();
        try {
            return xidCounter + 1;
        } finally {
            counterLock.unlock();
        }
    }

    // 等待xids全部结束，millis为0时一直等待；超时返回false
    public boolean awaitTermination(Collection<Long> xids, long millis) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        counterLock.lock();
        try {
            while(anyActive(xids)) {
                if(millis == 0) {
                    terminated.await();
                    continue;
                }
                long left = deadline - System.nanoTime();
                if(left <= 0) {
                    return false;
                }
                terminated.awaitNanos(left);
            }
            return true;
        } finally {
            counterLock.unlock();
        }
    }

    private boolean anyActive(Collection<Long> xids) {
        for(long xid : xids) {
            if(activeTransaction.containsKey(xid)) {
                return true;
            }
        }
        return false;
    }

    public ConcurrencyStrategy getStrategy() {
        return strategy;
    }

    public int activeCount() {
        return activeTransaction.size();
    }
}
