package com.xjx.txdb.server.rm;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * @Author: Xjx
 * @Create: 2023/3/15 - 10:20
 */
public class RecoverResult {
    //本次从哪个seq开始扫描
    public final long scanStart;
    //重做的UPDATE条数
    public final int redone;
    //撤销的未提交UPDATE条数
    public final int undone;
    public final int committed;
    //没有终止记录、被补写了ABORT的事务
    public final Set<Long> losers;
    public final long nextXid;

    public RecoverResult(long scanStart, int redone, int undone, int committed, Set<Long> losers, long nextXid) {
        this.scanStart = scanStart;
        this.redone = redone;
        this.undone = undone;
        this.committed = committed;
        this.losers = ImmutableSet.copyOf(losers);
        this.nextXid = nextXid;
    }

    @Override
    public String toString() {
        return "RecoverResult{scanStart=" + scanStart + ", redone=" + redone + ", undone=" + undone + ", committed=" + committed
                + ", losers=" + losers + ", nextXid=" + nextXid + "}";
    }
}
