package com.xjx.txdb.server.dm.logger;

import com.xjx.txdb.common.LogIOException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * @Author: Xjx
 * @Create: 2023/3/11 - 9:12
 * 内存中的日志，可以模拟写盘失败
 */
public class MockLogger implements Logger {
    private List<LogRecord> records = new ArrayList<>();
    private long first = LoggerImpl.FIRST_SEQ;
    private long next = LoggerImpl.FIRST_SEQ;
    public volatile boolean failAppend;
    public volatile boolean failFlush;
    public volatile int flushCount;
    //每次刷盘成功后调用
    public volatile Runnable onFlush;

    @Override
    public synchronized long append(LogRecord record) {
        if(failAppend) {
            throw new LogIOException(new IOException("mock append failure"));
        }
        long seq = next++;
        records.add(LogRecord.decode(seq, record.encode()));
        return seq;
    }

    @Override
    public synchronized void flush() {
        if(failFlush) {
            throw new LogIOException(new IOException("mock flush failure"));
        }
        flushCount++;
        if(onFlush != null) {
            onFlush.run();
        }
    }

    @Override
    public synchronized Iterator<LogRecord> scan(long fromSeq) {
        List<LogRecord> res = new ArrayList<>();
        for(LogRecord r : records) {
            if(r.getSeq() >= fromSeq) {
                res.add(r);
            }
        }
        return res.iterator();
    }

    @Override
    public synchronized void truncateBefore(long seq) {
        if(seq <= first) {
            return;
        }
        records.removeIf(r -> r.getSeq() < seq);
        first = seq;
    }

    @Override
    public synchronized long firstSeq() {
        return first;
    }

    @Override
    public synchronized long endSeq() {
        return next;
    }

    @Override
    public void close() {
    }

    public synchronized List<LogRecord> records() {
        return new ArrayList<>(records);
    }

    // 某个事务的全部记录
    public synchronized List<LogRecord> recordsOf(long xid) {
        List<LogRecord> res = new ArrayList<>();
        for(LogRecord r : records) {
            if(r.getXid() == xid && r.getKind() != LogRecord.Kind.CHECKPOINT_BEGIN) {
                res.add(r);
            }
        }
        return res;
    }
}
