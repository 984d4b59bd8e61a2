package com.xjx.txdb.server.tm;

import com.xjx.txdb.server.dm.logger.LogRecord;
import com.xjx.txdb.server.dm.logger.Logger;
import com.xjx.txdb.server.to.TimestampOrdering;

/**
 * @Author: Xjx
 * @Create: 2023/3/10 - 11:02
 * 时间戳排序：写被接受时立刻写入共享存储，回滚只是拒绝继续执行，已写入的值保持不变
 */
public class TimestampStrategy implements ConcurrencyStrategy {
    private TimestampOrdering to;
    private Logger lg;

    public TimestampStrategy(TimestampOrdering to, Logger lg) {
        this.to = to;
        this.lg = lg;
    }

    @Override
    public void begin(Transaction t) {
        t.startTs = to.begin(t.xid);
    }

    @Override
    public byte[] read(Transaction t, long uid) {
        return to.read(t.xid, uid);
    }

    @Override
    public void write(Transaction t, long uid, byte[] value) {
        //先写UPDATE日志，再写入共享存储
        to.write(t.xid, uid, value, (key, oldValue, newValue) ->
                lg.append(LogRecord.update(t.xid, key, oldValue, newValue)));
    }

    @Override
    public void commit(Transaction t) {
        lg.append(LogRecord.commit(t.xid));
        lg.flush();
        to.end(t.xid);
    }

    @Override
    public void abort(Transaction t) {
        to.end(t.xid);
    }

    @Override
    public boolean buffersWrites() {
        return false;
    }

    public TimestampOrdering getTimestampOrdering() {
        return to;
    }
}
