package com.xjx.txdb.server.dm.logger;

import com.google.common.primitives.Bytes;
import com.xjx.txdb.common.Error;
import com.xjx.txdb.server.utils.Panic;
import com.xjx.txdb.server.utils.Parser;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.Iterator;

/**
 * @Author: Xjx
 * @Create: 2023/3/3 - 10:05
 * 只追加的持久化日志，是事务持久性的唯一来源
 */
public interface Logger {
    //追加一条记录并返回它的seq，失败抛出 LogIOException
    long append(LogRecord record);
    //持久化屏障，之前追加的记录全部刷入磁盘
    void flush();
    //从fromSeq开始的惰性迭代器，每次调用都是一个独立的游标
    Iterator<LogRecord> scan(long fromSeq);
    //丢弃seq之前的所有记录，保留记录的seq不变
    void truncateBefore(long seq);
    long firstSeq();
    //下一条记录将得到的seq
    long endSeq();
    void close();

    //根据路径创建日志文件，并返回对这个日志文件的日志操作对象
    public static Logger create(String path) {
        File file = new File(path + LoggerImpl.LOG_SUFFIX);
        try {
            if(!file.createNewFile()) {
                Panic.panic(Error.FileExistsException);
            }
        } catch (IOException ioException) {
            Panic.panic(ioException);
        }
        if(!file.canRead() || !file.canWrite()) {
            Panic.panic(Error.FileCannotRWException);
        }
        FileChannel fc = null;
        RandomAccessFile raf = null;
        try {
            raf = new RandomAccessFile(file, "rw");
            fc = raf.getChannel();
        } catch (FileNotFoundException e) {
            Panic.panic(e);
        }
        //新建日志的总校验和为0，第一条记录的seq为 FIRST_SEQ
        ByteBuffer buffer = ByteBuffer.wrap(Bytes.concat(Parser.int2Byte(0), Parser.long2Byte(LoggerImpl.FIRST_SEQ)));
        try {
            fc.position(0);
            fc.write(buffer);
            fc.force(false);
        } catch (IOException ioException) {
            Panic.panic(ioException);
        }
        return new LoggerImpl(file, raf, fc, 0, LoggerImpl.FIRST_SEQ);
    }

    //打开指定目录下的日志文件，校验并截掉坏尾
    public static Logger open(String path) {
        new File(path + LoggerImpl.LOG_TMP_SUFFIX).delete();
        File file = new File(path + LoggerImpl.LOG_SUFFIX);
        if(!file.exists()) {
            Panic.panic(Error.FileNotExistsException);
        }
        if(!file.canRead() || !file.canWrite()) {
            Panic.panic(Error.FileCannotRWException);
        }
        FileChannel fc = null;
        RandomAccessFile raf = null;
        try {
            raf = new RandomAccessFile(file, "rw");
            fc = raf.getChannel();
        } catch (FileNotFoundException e) {
            Panic.panic(e);
        }
        LoggerImpl log = new LoggerImpl(file, raf, fc);
        log.init();
        return log;
    }
}
