package com.xjx.txdb.server.dm.store;

import java.util.Set;

/**
 * @Author: Xjx
 * @Create: 2023/3/4 - 14:20
 * 存储层提供给事务核心的共享键值存储，自身的持久化不由事务核心负责
 */
public interface DataStore {
    //键不存在时返回null
    byte[] get(long key);
    void set(long key, byte[] value);
    //把当前内容固化下来，检查点时调用
    void flush();
    Set<Long> keys();
    void close();

    public static DataStore newMemoryStore() {
        return new MemoryDataStore();
    }

    public static DataStore create(String path) {
        return FileDataStore.create(path);
    }

    public static DataStore open(String path) {
        return FileDataStore.open(path);
    }
}
