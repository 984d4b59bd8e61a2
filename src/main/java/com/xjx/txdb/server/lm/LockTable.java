package com.xjx.txdb.server.lm;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.xjx.txdb.common.Error;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * @Author: Xjx
 * @Create: 2023/3/7 - 10:20
 * 两阶段锁的锁表，维护了一个依赖等待图，以进行死锁检测。
 * 每个资源要么被任意多个事务以SHARED持有，要么只被一个事务以EXCLUSIVE持有。
 * 请求只和当前持有者比较，相容就直接授予，不排在等待者后面；
 * 因此源源不断的SHARED请求可能让排队的EXCLUSIVE一直等下去
 */
public class LockTable {
    private static final Logger LOG = LoggerFactory.getLogger(LockTable.class);

    // 资源UID -> 持有者和等待队列
    private Map<Long, LockEntry> u2e;
    // 某个XID已经获得的资源的UID集合
    private Map<Long, Set<Long>> x2u;
    // XID正在等待的请求，一个事务同一时刻只会有一个
    private Map<Long, Waiter> waitU;
    private VictimPolicy victimPolicy;
    // 进入等待的顺序号，用于找出最晚等待的事务
    private long waitSeq;
    private Lock lock;

    private static class LockEntry {
        LinkedHashMap<Long, LockMode> holders = new LinkedHashMap<>();
        LinkedList<Waiter> waiters = new LinkedList<>();
    }

    private enum WaitState {
        WAITING, GRANTED, VICTIM, CANCELLED
    }

    private static class Waiter {
        long xid;
        long uid;
        LockMode mode;
        long seq;
        Condition cond;
        WaitState state = WaitState.WAITING;
    }

    public LockTable() {
        this(VictimPolicy.MOST_RECENT_WAITER);
    }

    public LockTable(VictimPolicy victimPolicy) {
        this.u2e = new HashMap<>();
        this.x2u = new HashMap<>();
        this.waitU = new HashMap<>();
        this.victimPolicy = victimPolicy;
        this.lock = new ReentrantLock();
    }

    // 阻塞直到可以授予锁。被选为死锁牺牲者时抛出 DeadlockException
    public void acquire(long xid, long uid, LockMode mode) {
        lock.lock();
        try {
            LockEntry e = u2e.computeIfAbsent(uid, k -> new LockEntry());
            LockMode held = e.holders.get(xid);
            //已经持有足够的锁则无需任何操作
            if(held != null && held.covers(mode)) {
                return;
            }
            if(isGrantable(e, xid, mode)) {
                grant(e, xid, uid, mode);
                return;
            }
            //执行到这里表示资源被其他事务以不相容的模式占用，需要进入等待
            Waiter w = new Waiter();
            w.xid = xid;
            w.uid = uid;
            w.mode = mode;
            w.seq = ++waitSeq;
            w.cond = lock.newCondition();
            e.waiters.add(w);
            waitU.put(xid, w);

            List<Long> cycle;
            while((cycle = findCycle(xid)) != null) {
                long victim = selectVictim(cycle);
                LOG.debug("Deadlock detected in cycle {}, victim {}", cycle, victim);
                Waiter vw = waitU.get(victim);
                withdraw(vw);
                if(victim == xid) {
                    throw Error.DeadlockException;
                }
                vw.state = WaitState.VICTIM;
                vw.cond.signal();
            }

            while(w.state == WaitState.WAITING) {
                try {
                    w.cond.await();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    if(w.state != WaitState.WAITING) {
                        //中断前已经有了结果，按结果处理
                        break;
                    }
                    withdraw(w);
                    throw Error.LockWaitInterruptedException;
                }
            }
            if(w.state == WaitState.VICTIM) {
                throw Error.DeadlockException;
            }
            if(w.state == WaitState.CANCELLED) {
                throw Error.TransactionClosedException;
            }
        } finally {
            lock.unlock();
        }
    }

    // 释放xid在uid上的锁
    public void release(long xid, long uid) {
        lock.lock();
        try {
            LockEntry e = u2e.get(uid);
            if(e == null || e.holders.remove(xid) == null) {
                return;
            }
            Set<Long> held = x2u.get(xid);
            if(held != null) {
                held.remove(uid);
                if(held.isEmpty()) {
                    x2u.remove(xid);
                }
            }
            selectNewHolders(uid, e);
        } finally {
            lock.unlock();
        }
    }

    // 在一个事务 commit 或者 abort 时，释放所有它持有的锁，并将自身从等待图中删除
    public void releaseAll(long xid) {
        lock.lock();
        try {
            //其他线程回滚了这个事务，而它自己还阻塞在等待中
            Waiter w = waitU.get(xid);
            if(w != null) {
                withdraw(w);
                w.state = WaitState.CANCELLED;
                w.cond.signal();
            }
            Set<Long> held = x2u.remove(xid);
            if(held == null) {
                return;
            }
            for(long uid : held) {
                LockEntry e = u2e.get(uid);
                if(e == null) continue;
                e.holders.remove(xid);
                selectNewHolders(uid, e);
            }
        } finally {
            lock.unlock();
        }
    }

    //按等待顺序唤醒第一个可以授予的请求；如果它是SHARED，则一并唤醒其他可以授予的SHARED请求
    private void selectNewHolders(long uid, LockEntry e) {
        boolean sharedBatch = false;
        Iterator<Waiter> it = e.waiters.iterator();
        while(it.hasNext()) {
            Waiter w = it.next();
            if(sharedBatch && w.mode != LockMode.SHARED) {
                continue;
            }
            if(!isGrantable(e, w.xid, w.mode)) {
                continue;
            }
            it.remove();
            waitU.remove(w.xid);
            grant(e, w.xid, uid, w.mode);
            w.state = WaitState.GRANTED;
            w.cond.signal();
            if(w.mode == LockMode.EXCLUSIVE) {
                break;
            }
            sharedBatch = true;
        }
        removeIfIdle(uid, e);
    }

    private boolean isGrantable(LockEntry e, long xid, LockMode mode) {
        for(Map.Entry<Long, LockMode> h : e.holders.entrySet()) {
            if(h.getKey() != xid && !mode.compatibleWith(h.getValue())) {
                return false;
            }
        }
        return true;
    }

    private void grant(LockEntry e, long xid, long uid, LockMode mode) {
        //SHARED升级为EXCLUSIVE时直接覆盖
        e.holders.put(xid, mode);
        x2u.computeIfAbsent(xid, k -> new HashSet<>()).add(uid);
    }

    private void withdraw(Waiter w) {
        waitU.remove(w.xid);
        LockEntry e = u2e.get(w.uid);
        if(e == null) return;
        e.waiters.remove(w);
        removeIfIdle(w.uid, e);
    }

    private void removeIfIdle(long uid, LockEntry e) {
        if(e.holders.isEmpty() && e.waiters.isEmpty()) {
            u2e.remove(uid);
        }
    }

    //等待者xid指向所有以不相容模式持有它所等资源的事务
    private List<Long> waitingFor(long xid) {
        Waiter w = waitU.get(xid);
        if(w == null) {
            return Collections.emptyList();
        }
        LockEntry e = u2e.get(w.uid);
        List<Long> res = new ArrayList<>();
        for(Map.Entry<Long, LockMode> h : e.holders.entrySet()) {
            if(h.getKey() != xid && !w.mode.compatibleWith(h.getValue())) {
                res.add(h.getKey());
            }
        }
        return res;
    }

    //新的等待边只可能产生经过start的环，从start深搜回到start即为死锁
    private List<Long> findCycle(long start) {
        Deque<Long> path = new ArrayDeque<>();
        path.addLast(start);
        if(dfs(start, start, path, new HashSet<>())) {
            return Lists.newArrayList(path);
        }
        return null;
    }

    private boolean dfs(long xid, long start, Deque<Long> path, Set<Long> visited) {
        for(long next : waitingFor(xid)) {
            if(next == start) {
                return true;
            }
            if(!visited.add(next)) {
                continue;
            }
            path.addLast(next);
            if(dfs(next, start, path, visited)) {
                return true;
            }
            path.removeLast();
        }
        return false;
    }

    private long selectVictim(List<Long> cycle) {
        long victim = cycle.get(0);
        for(long x : cycle) {
            switch (victimPolicy) {
                case YOUNGEST_TRANSACTION:
                    if(x > victim) victim = x;
                    break;
                case MOST_RECENT_WAITER:
                default:
                    if(waitU.get(x).seq > waitU.get(victim).seq) victim = x;
                    break;
            }
        }
        return victim;
    }

    // 当前持有uid的事务及其模式
    public Map<Long, LockMode> holders(long uid) {
        lock.lock();
        try {
            LockEntry e = u2e.get(uid);
            return e == null ? ImmutableMap.of() : ImmutableMap.copyOf(e.holders);
        } finally {
            lock.unlock();
        }
    }

    // 依赖等待图的快照：等待者 -> 它在等待的持有者
    public Map<Long, Set<Long>> waitForGraph() {
        lock.lock();
        try {
            Map<Long, Set<Long>> graph = new HashMap<>();
            for(long xid : waitU.keySet()) {
                graph.put(xid, ImmutableSet.copyOf(waitingFor(xid)));
            }
            return graph;
        } finally {
            lock.unlock();
        }
    }

    public boolean isWaiting(long xid) {
        lock.lock();
        try {
            return waitU.containsKey(xid);
        } finally {
            lock.unlock();
        }
    }

    // 事务当前持有的资源
    public Set<Long> heldBy(long xid) {
        lock.lock();
        try {
            Set<Long> held = x2u.get(xid);
            return held == null ? ImmutableSet.of() : ImmutableSet.copyOf(held);
        } finally {
            lock.unlock();
        }
    }
}
