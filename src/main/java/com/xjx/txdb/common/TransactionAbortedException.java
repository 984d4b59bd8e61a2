package com.xjx.txdb.common;

/**
 * @Author: Xjx
 * @Create: 2023/3/2 - 10:46
 * 并发控制层或日志层导致事务被自动回滚时抛给调用方的信号
 */
public class TransactionAbortedException extends RuntimeException {
    private final long xid;
    private final Exception reason;

    public TransactionAbortedException(long xid, Exception reason) {
        super("Transaction " + xid + " aborted: " + reason.getMessage(), reason);
        this.xid = xid;
        this.reason = reason;
    }

    public long getXid() {
        return xid;
    }

    //Error 中的异常常量或 LogIOException，调用方可以按身份比较
    public Exception getReason() {
        return reason;
    }
}
