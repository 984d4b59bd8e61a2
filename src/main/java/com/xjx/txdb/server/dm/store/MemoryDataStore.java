package com.xjx.txdb.server.dm.store;

import com.google.common.collect.ImmutableSet;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * @Author: Xjx
 * @Create: 2023/3/4 - 14:31
 */
public class MemoryDataStore implements DataStore {
    protected final Map<Long, byte[]> items;

    public MemoryDataStore() {
        this.items = new ConcurrentHashMap<>();
    }

    @Override
    public byte[] get(long key) {
        byte[] value = items.get(key);
        return value == null ? null : Arrays.copyOf(value, value.length);
    }

    @Override
    public void set(long key, byte[] value) {
        if(value == null) {
            items.remove(key);
        } else {
            items.put(key, Arrays.copyOf(value, value.length));
        }
    }

    @Override
    public void flush() {
    }

    @Override
    public Set<Long> keys() {
        return ImmutableSet.copyOf(items.keySet());
    }

    @Override
    public void close() {
    }
}
