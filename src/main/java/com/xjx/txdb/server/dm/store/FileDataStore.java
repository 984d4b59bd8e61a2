package com.xjx.txdb.server.dm.store;

import com.google.common.primitives.Bytes;
import com.xjx.txdb.common.Error;
import com.xjx.txdb.server.utils.Panic;
import com.xjx.txdb.server.utils.ParseBytesRes;
import com.xjx.txdb.server.utils.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * @Author: Xjx
 * @Create: 2023/3/4 - 15:02
 * 内存中的键值表，flush 时整体写成快照文件。
 * 快照格式：[Count 4字节]([Key 8字节][ValueRaw])*
 */
public class FileDataStore extends MemoryDataStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileDataStore.class);

    public static final String STORE_SUFFIX = ".db";
    //修改快照文件时使用的临时文件后缀
    public static final String STORE_TMP_SUFFIX = ".db_tmp";

    private final String path;
    private final Lock flushLock;

    private FileDataStore(String path) {
        this.path = path;
        this.flushLock = new ReentrantLock();
    }

    public static FileDataStore create(String path) {
        removeBadTmp(path);
        File f = new File(path + STORE_SUFFIX);
        if(f.exists()) {
            Panic.panic(Error.FileExistsException);
        }
        FileDataStore store = new FileDataStore(path);
        store.flush();
        return store;
    }

    public static FileDataStore open(String path) {
        removeBadTmp(path);
        File f = new File(path + STORE_SUFFIX);
        if(!f.exists()) {
            Panic.panic(Error.FileNotExistsException);
        }
        if(!f.canRead() || !f.canWrite()) {
            Panic.panic(Error.FileCannotRWException);
        }
        FileDataStore store = new FileDataStore(path);
        byte[] raw = null;
        try {
            raw = Files.readAllBytes(f.toPath());
        } catch (IOException ioException) {
            Panic.panic(ioException);
        }
        store.load(raw);
        return store;
    }

    private static void removeBadTmp(String path) {
        new File(path + STORE_TMP_SUFFIX).delete();
    }

    private void load(byte[] raw) {
        try {
            int count = Parser.parseInt(raw, 0);
            int pos = 4;
            for(int i = 0; i < count; i++) {
                long key = Parser.parseLong(raw, pos);
                ParseBytesRes res = Parser.parseBytes(raw, pos + 8);
                items.put(key, res.data);
                pos += 8 + res.next;
            }
            if(pos != raw.length) {
                Panic.panic(Error.BadStoreFileException);
            }
        } catch (IndexOutOfBoundsException | IllegalArgumentException e) {
            Panic.panic(Error.BadStoreFileException);
        }
        LOG.info("Loaded {} items from {}{}", items.size(), path, STORE_SUFFIX);
    }

    //先写临时文件，再原子替换正式文件
    @Override
    public void flush() {
        flushLock.lock();
        try {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            int count = 0;
            for(Map.Entry<Long, byte[]> e : items.entrySet()) {
                bytes.write(Bytes.concat(Parser.long2Byte(e.getKey()), Parser.bytes2Raw(e.getValue())));
                count++;
            }
            File tmp = new File(path + STORE_TMP_SUFFIX);
            try(FileOutputStream out = new FileOutputStream(tmp)) {
                out.write(Parser.int2Byte(count));
                out.write(bytes.toByteArray());
                out.flush();
                out.getFD().sync();
            }
            Files.move(tmp.toPath(), new File(path + STORE_SUFFIX).toPath(),
                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Panic.panic(e);
        } finally {
            flushLock.unlock();
        }
    }
}
