package com.xjx.txdb.server.tm;

/**
 * @Author: Xjx
 * @Create: 2023/3/10 - 9:12
 */
public enum IsolationLevel {
    //直接读共享数据，不经过并发控制
    READ_UNCOMMITTED,
    //每次读都经过并发控制读取当前值
    READ_COMMITTED,
    //第一次读到的值缓存在事务内，之后重复读返回同一个值
    REPEATABLE_READ,
    SERIALIZABLE;

    public boolean usesReadCache() {
        return this == REPEATABLE_READ || this == SERIALIZABLE;
    }
}
