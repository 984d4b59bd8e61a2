package com.xjx.txdb.server.tm;

import com.xjx.txdb.common.Error;
import com.xjx.txdb.common.LogIOException;
import com.xjx.txdb.common.TransactionAbortedException;
import com.xjx.txdb.server.DBConfig;
import com.xjx.txdb.server.dm.logger.LogRecord;
import com.xjx.txdb.server.dm.logger.MockLogger;
import com.xjx.txdb.server.dm.store.DataStore;
import com.xjx.txdb.server.to.TimestampOrdering;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

/**
 * @Author: Xjx
 * @Create: 2023/3/11 - 14:45
 * 时间戳排序下的事务管理
 */
public class TimestampTransactionManagerTest {
    private MockLogger lg;
    private DataStore store;
    private TransactionManagerImpl tm;

    @Before
    public void setUp() {
        lg = new MockLogger();
        store = DataStore.newMemoryStore();
        DBConfig config = DBConfig.defaults().setMode(DBConfig.ConcurrencyMode.TIMESTAMP_ORDERING);
        tm = TransactionManager.newTransactionManager(config, lg, store, 1);
    }

    //提交返回OK时COMMIT记录已经刷盘
    @Test
    public void testCommitFlushes() {
        long xid = tm.begin(IsolationLevel.READ_COMMITTED);
        tm.write(xid, 1, "a".getBytes());
        int before = lg.flushCount;
        assertEquals(CommitResult.OK, tm.commit(xid));
        assertEquals(before + 1, lg.flushCount);

        //刷盘失败则提交失败
        long x2 = tm.begin(IsolationLevel.READ_COMMITTED);
        tm.write(x2, 2, "b".getBytes());
        lg.failFlush = true;
        assertEquals(CommitResult.ABORTED, tm.commit(x2));
        assertTrue(tm.isAborted(x2));
    }

    @Test
    public void testWriteInstalledImmediately() {
        long xid = tm.begin(IsolationLevel.READ_COMMITTED);
        tm.write(xid, 1, "a".getBytes());
        assertArrayEquals("a".getBytes(), store.get(1));
        assertEquals(CommitResult.OK, tm.commit(xid));
        List<LogRecord> logs = lg.recordsOf(xid);
        assertEquals(3, logs.size());
        assertEquals(LogRecord.Kind.UPDATE, logs.get(1).getKind());
        assertNull(logs.get(1).getOldValue());
        assertEquals(LogRecord.Kind.COMMIT, logs.get(2).getKind());
    }

    //较早开始的事务读取被较晚事务写过的数据项时被回滚
    @Test
    public void testAbortRule() {
        long x1 = tm.begin(IsolationLevel.READ_COMMITTED);
        long x2 = tm.begin(IsolationLevel.READ_COMMITTED);
        TimestampOrdering to = ((TimestampStrategy) tm.getStrategy()).getTimestampOrdering();
        assertTrue(to.getStartTs(x1) < to.getStartTs(x2));
        tm.write(x2, 1, "b".getBytes());
        try {
            tm.read(x1, 1);
            fail();
        } catch (TransactionAbortedException e) {
            assertSame(Error.TimestampConflictException, e.getReason());
        }
        assertTrue(tm.isAborted(x1));
        assertEquals(CommitResult.ABORTED, tm.commit(x1));
        //已回滚的事务再次回滚不做任何事
        tm.abort(x1);
        assertEquals(CommitResult.OK, tm.commit(x2));
    }

    //回滚只是拒绝继续执行，已写入的值保持不变
    @Test
    public void testAbortLeavesInstalledValue() {
        long x1 = tm.begin(IsolationLevel.READ_COMMITTED);
        tm.write(x1, 1, "a".getBytes());
        tm.abort(x1);
        assertArrayEquals("a".getBytes(), store.get(1));
        List<LogRecord> logs = lg.recordsOf(x1);
        assertEquals(LogRecord.Kind.ABORT, logs.get(logs.size() - 1).getKind());
    }

    @Test
    public void testIsolationSeparation() {
        store.set(1, "1".getBytes());
        long x1 = tm.begin(IsolationLevel.REPEATABLE_READ);
        assertArrayEquals("1".getBytes(), tm.read(x1, 1));

        long x2 = tm.begin(IsolationLevel.READ_COMMITTED);
        tm.write(x2, 1, "2".getBytes());
        assertEquals(CommitResult.OK, tm.commit(x2));

        assertArrayEquals("1".getBytes(), tm.read(x1, 1));
        long x3 = tm.begin(IsolationLevel.READ_UNCOMMITTED);
        assertArrayEquals("2".getBytes(), tm.read(x3, 1));
        tm.commit(x1);
        tm.commit(x3);
    }

    @Test
    public void testReadUncommittedSeesInstalledWrite() {
        long x1 = tm.begin(IsolationLevel.READ_COMMITTED);
        tm.write(x1, 1, "dirty".getBytes());
        long x2 = tm.begin(IsolationLevel.READ_UNCOMMITTED);
        assertArrayEquals("dirty".getBytes(), tm.read(x2, 1));
        tm.abort(x1);
        tm.commit(x2);
    }

    @Test
    public void testAppendFailureOnWrite() {
        store.set(1, "a".getBytes());
        long xid = tm.begin(IsolationLevel.READ_COMMITTED);
        lg.failAppend = true;
        try {
            tm.write(xid, 1, "b".getBytes());
            fail();
        } catch (TransactionAbortedException e) {
            assertTrue(e.getReason() instanceof LogIOException);
        }
        lg.failAppend = false;
        assertTrue(tm.isAborted(xid));
        //UPDATE没有写入日志，值也不会写入
        assertArrayEquals("a".getBytes(), store.get(1));
        assertEquals(CommitResult.ABORTED, tm.commit(xid));
    }
}
