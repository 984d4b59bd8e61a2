package com.xjx.txdb.server.rm;

import com.google.common.collect.ImmutableMap;
import com.xjx.txdb.common.Error;
import com.xjx.txdb.server.DBConfig;
import com.xjx.txdb.server.dm.CheckpointMarker;
import com.xjx.txdb.server.dm.logger.LogRecord;
import com.xjx.txdb.server.dm.logger.MockLogger;
import com.xjx.txdb.server.dm.store.DataStore;
import com.xjx.txdb.server.tm.CommitResult;
import com.xjx.txdb.server.tm.IsolationLevel;
import com.xjx.txdb.server.tm.TransactionManager;
import com.xjx.txdb.server.tm.TransactionManagerImpl;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

/**
 * @Author: Xjx
 * @Create: 2023/3/15 - 16:10
 */
public class RecoveryManagerTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private MockLogger lg;
    private DataStore store;
    private CheckpointMarker marker;

    @Before
    public void setUp() {
        lg = new MockLogger();
        store = DataStore.newMemoryStore();
        marker = CheckpointMarker.create(new File(tmp.getRoot(), "rm_test").getPath());
    }

    private RecoveryManager newRecoveryManager() {
        return new RecoveryManager(lg, store, marker);
    }

    @Test
    public void testRedoCommitted() {
        lg.append(LogRecord.begin(1));
        lg.append(LogRecord.update(1, 10, null, "a".getBytes()));
        lg.append(LogRecord.begin(2));
        lg.append(LogRecord.update(2, 20, null, "b".getBytes()));
        lg.append(LogRecord.update(1, 10, "a".getBytes(), "a2".getBytes()));
        lg.append(LogRecord.commit(1));
        lg.append(LogRecord.begin(3));
        lg.append(LogRecord.update(3, 30, null, "c".getBytes()));
        lg.append(LogRecord.abort(3));

        RecoverResult res = newRecoveryManager().recover();
        //同一个事务的更新按日志顺序重做
        assertArrayEquals("a2".getBytes(), store.get(10));
        assertNull(store.get(20));
        assertNull(store.get(30));
        assertEquals(2, res.redone);
        assertEquals(1, res.committed);
        assertEquals(4, res.nextXid);
        //没有终止记录的事务被补写ABORT
        assertEquals(1, res.losers.size());
        assertTrue(res.losers.contains(2L));
        List<LogRecord> logs = lg.recordsOf(2);
        assertEquals(LogRecord.Kind.ABORT, logs.get(logs.size() - 1).getKind());
    }

    //重复重做与只做一次的结果相同
    @Test
    public void testIdempotentRedo() {
        lg.append(LogRecord.begin(1));
        lg.append(LogRecord.update(1, 10, null, "a".getBytes()));
        lg.append(LogRecord.update(1, 11, null, "b".getBytes()));
        lg.append(LogRecord.commit(1));

        newRecoveryManager().recover();
        assertArrayEquals("a".getBytes(), store.get(10));
        assertArrayEquals("b".getBytes(), store.get(11));
        int size = store.keys().size();

        RecoverResult res = newRecoveryManager().recover();
        assertEquals(2, res.redone);
        assertArrayEquals("a".getBytes(), store.get(10));
        assertArrayEquals("b".getBytes(), store.get(11));
        assertEquals(size, store.keys().size());
        assertTrue(res.losers.isEmpty());
    }

    //COMMIT之后又有ABORT的事务以最后的ABORT为准
    @Test
    public void testAbortAfterCommitWins() {
        lg.append(LogRecord.begin(1));
        lg.append(LogRecord.update(1, 10, null, "a".getBytes()));
        lg.append(LogRecord.commit(1));
        lg.append(LogRecord.abort(1));
        RecoverResult res = newRecoveryManager().recover();
        assertNull(store.get(10));
        assertEquals(0, res.committed);
        assertTrue(res.losers.isEmpty());
    }

    //快照里可能带着未提交事务的写，恢复时倒序还原成旧值
    @Test
    public void testUndoUncommitted() {
        lg.append(LogRecord.begin(1));
        lg.append(LogRecord.update(1, 10, null, "a".getBytes()));
        lg.append(LogRecord.commit(1));
        lg.append(LogRecord.begin(2));
        lg.append(LogRecord.update(2, 10, "a".getBytes(), "dirty1".getBytes()));
        lg.append(LogRecord.update(2, 10, "dirty1".getBytes(), "dirty2".getBytes()));
        lg.append(LogRecord.update(2, 11, null, "dirty3".getBytes()));
        store.set(10, "dirty2".getBytes());
        store.set(11, "dirty3".getBytes());

        RecoverResult res = newRecoveryManager().recover();
        assertArrayEquals("a".getBytes(), store.get(10));
        assertNull(store.get(11));
        assertEquals(1, res.redone);
        assertEquals(3, res.undone);
        assertTrue(res.losers.contains(2L));
    }

    //被回滚的写之后又有已提交的写，保留已提交的值
    @Test
    public void testLaterCommitNotUndone() {
        lg.append(LogRecord.begin(1));
        lg.append(LogRecord.update(1, 10, null, "x".getBytes()));
        lg.append(LogRecord.abort(1));
        lg.append(LogRecord.begin(2));
        lg.append(LogRecord.update(2, 10, "x".getBytes(), "y".getBytes()));
        lg.append(LogRecord.commit(2));

        RecoverResult res = newRecoveryManager().recover();
        assertArrayEquals("y".getBytes(), store.get(10));
        assertEquals(1, res.redone);
        assertEquals(0, res.undone);
        assertTrue(res.losers.isEmpty());
    }

    @Test
    public void testScanStartsAtCheckpoint() {
        lg.append(LogRecord.begin(1));
        lg.append(LogRecord.update(1, 10, null, "old".getBytes()));
        lg.append(LogRecord.commit(1));
        long active = lg.append(LogRecord.begin(2));
        long ckpt = lg.append(LogRecord.checkpointBegin(3, ImmutableMap.of(2L, active)));
        lg.append(LogRecord.update(2, 20, null, "b".getBytes()));
        lg.append(LogRecord.commit(2));
        lg.append(LogRecord.checkpointEnd(ckpt));
        marker.update(ckpt);

        RecoverResult res = newRecoveryManager().recover();
        //检查点开始时仍活跃的事务的BEGIN决定扫描起点
        assertEquals(active, res.scanStart);
        assertNull(store.get(10));
        assertArrayEquals("b".getBytes(), store.get(20));
        assertEquals(3, res.nextXid);
    }

    @Test
    public void testOnlyOnce() {
        RecoveryManager rm = newRecoveryManager();
        TransactionManagerImpl tm = TransactionManager.newTransactionManager(DBConfig.defaults(), lg, store, 1);
        try {
            rm.checkpoint(tm, 0, true);
            fail();
        } catch (RuntimeException e) {
            assertSame(Error.RecoveryNotDoneException, e);
        }
        rm.recover();
        assertTrue(rm.isRecovered());
        try {
            rm.recover();
            fail();
        } catch (RuntimeException e) {
            assertSame(Error.RecoveryAlreadyDoneException, e);
        }
    }

    @Test
    public void testCheckpointWaitsForActive() throws Exception {
        RecoveryManager rm = newRecoveryManager();
        RecoverResult res = rm.recover();
        TransactionManagerImpl tm = TransactionManager.newTransactionManager(DBConfig.defaults(), lg, store, res.nextXid);
        long x1 = tm.begin(IsolationLevel.READ_COMMITTED);
        tm.write(x1, 1, "a".getBytes());
        tm.commit(x1);
        long x2 = tm.begin(IsolationLevel.READ_COMMITTED);
        long x2Begin = tm.activeSnapshot().get(x2);

        //等待超时则放弃本次检查点
        assertFalse(rm.checkpoint(tm, 50, true));
        assertEquals(CheckpointMarker.NONE, marker.load());

        AtomicReference<Boolean> done = new AtomicReference<>();
        Thread t = new Thread(() -> done.set(rm.checkpoint(tm, 0, true)));
        t.start();
        //第二个检查点已经开始等待x2
        long deadline = System.currentTimeMillis() + 5000;
        while(countCheckpointBegins() < 2) {
            assertTrue(System.currentTimeMillis() < deadline);
            Thread.sleep(1);
        }
        tm.write(x2, 2, "b".getBytes());
        assertEquals(CommitResult.OK, tm.commit(x2));
        t.join(5000);
        assertTrue(done.get());

        long ckpt = marker.load();
        assertNotEquals(CheckpointMarker.NONE, ckpt);
        //日志只保留到检查点开始时仍活跃事务的BEGIN
        assertEquals(x2Begin, lg.firstSeq());
        boolean sawEnd = false;
        for(LogRecord r : lg.records()) {
            if(r.getKind() == LogRecord.Kind.CHECKPOINT_END) {
                assertEquals(ckpt, r.getCheckpointSeq());
                sawEnd = true;
            }
        }
        assertTrue(sawEnd);
    }

    private int countCheckpointBegins() {
        int n = 0;
        for(LogRecord r : lg.records()) {
            if(r.getKind() == LogRecord.Kind.CHECKPOINT_BEGIN) {
                n++;
            }
        }
        return n;
    }
}
