package com.xjx.txdb.server.lm;

/**
 * @Author: Xjx
 * @Create: 2023/3/7 - 10:05
 * 检测到死锁环时选择回滚哪个事务
 */
public enum VictimPolicy {
    //最晚进入等待状态的事务
    MOST_RECENT_WAITER,
    //环中id最大（最年轻）的事务
    YOUNGEST_TRANSACTION
}
