package com.xjx.txdb.server.tm;

import com.xjx.txdb.server.DBConfig;
import com.xjx.txdb.server.dm.logger.Logger;
import com.xjx.txdb.server.dm.store.DataStore;
import com.xjx.txdb.server.lm.LockTable;
import com.xjx.txdb.server.to.TimestampOrdering;

/**
 * @Author: Xjx
 * @Create: 2023/3/10 - 14:20
 * 提供给查询执行层的事务接口
 */
public interface TransactionManager {
    // 开启一个新事务
    long begin(IsolationLevel level);
    // 读取一个数据项，不存在时返回null
    byte[] read(long xid, long uid);
    void write(long xid, long uid, byte[] value);
    // 提交一个事务
    CommitResult commit(long xid);
    // 取消一个事务
    void abort(long xid);
    // 查询一个事务的状态是否是正在进行的状态
    boolean isActive(long xid);
    // 查询一个事务的状态是否是已提交
    boolean isCommitted(long xid);
    // 查询一个事务的状态是否是已取消
    boolean isAborted(long xid);
    TransactionState state(long xid);

    //按配置选择并发控制方式，nextXid 由恢复过程给出
    public static TransactionManagerImpl newTransactionManager(DBConfig config, Logger lg, DataStore store, long nextXid) {
        ConcurrencyStrategy strategy;
        switch (config.getMode()) {
            case TIMESTAMP_ORDERING:
                strategy = new TimestampStrategy(new TimestampOrdering(store), lg);
                break;
            case TWO_PHASE_LOCKING:
            default:
                strategy = new LockingStrategy(new LockTable(config.getVictimPolicy()), store, lg);
                break;
        }
        return new TransactionManagerImpl(lg, store, strategy, nextXid);
    }
}
