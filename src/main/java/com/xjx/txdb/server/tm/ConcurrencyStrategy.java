package com.xjx.txdb.server.tm;

/**
 * @Author: Xjx
 * @Create: 2023/3/10 - 10:05
 * 事务管理器通过它完成读写与提交，两阶段锁与时间戳排序各有一个实现，部署时二选一
 */
public interface ConcurrencyStrategy {
    void begin(Transaction t);
    //可能阻塞（两阶段锁）或直接抛出冲突异常（时间戳排序）
    byte[] read(Transaction t, long uid);
    void write(Transaction t, long uid, byte[] value);
    //返回时提交已经持久化并且对其他事务可见，抛出异常表示没有提交
    void commit(Transaction t);
    //释放事务占用的并发控制资源，不会失败
    void abort(Transaction t);
    //写是否缓存在事务内直到提交
    boolean buffersWrites();
}
