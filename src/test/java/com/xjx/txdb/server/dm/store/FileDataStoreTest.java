package com.xjx.txdb.server.dm.store;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;

import static org.junit.Assert.*;

/**
 * @Author: Xjx
 * @Create: 2023/3/4 - 16:40
 */
public class FileDataStoreTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testFlushAndOpen() {
        String path = new File(tmp.getRoot(), "store_test").getPath();
        DataStore store = DataStore.create(path);
        store.set(1, "a".getBytes());
        store.set(2, "bb".getBytes());
        store.set(3, new byte[0]);
        store.flush();
        //flush 之后的修改没有固化
        store.set(4, "lost".getBytes());
        store.close();

        store = DataStore.open(path);
        assertArrayEquals("a".getBytes(), store.get(1));
        assertArrayEquals("bb".getBytes(), store.get(2));
        assertEquals(0, store.get(3).length);
        assertNull(store.get(4));
        assertEquals(3, store.keys().size());

        store.set(1, null);
        store.flush();
        store = DataStore.open(path);
        assertNull(store.get(1));
        assertFalse(store.keys().contains(1L));
        assertFalse(new File(path + FileDataStore.STORE_TMP_SUFFIX).exists());
    }

    @Test
    public void testValuesAreCopied() {
        DataStore store = DataStore.newMemoryStore();
        byte[] v = "abc".getBytes();
        store.set(7, v);
        v[0] = 'x';
        store.get(7)[1] = 'y';
        assertArrayEquals("abc".getBytes(), store.get(7));
        assertNull(store.get(8));
    }
}
