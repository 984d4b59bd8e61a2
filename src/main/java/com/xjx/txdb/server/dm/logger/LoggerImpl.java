package com.xjx.txdb.server.dm.logger;

import com.google.common.primitives.Bytes;
import com.xjx.txdb.common.Error;
import com.xjx.txdb.common.LogIOException;
import com.xjx.txdb.server.utils.Panic;
import com.xjx.txdb.server.utils.Parser;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * @Author: Xjx
 * @Create: 2023/3/3 - 10:32
 * 日志文件格式：[XChecksum 4字节][BaseSeq 8字节][Log1][Log2]...[LogN][BadTail]
 * 每条日志格式：[Size 4字节][Checksum 4字节][Data]
 * 一条日志的seq = BaseSeq + 它在文件中的偏移 - 文件头长度，截断前缀之后seq保持不变
 */
public class LoggerImpl implements Logger {
    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggerImpl.class);

    public static final String LOG_SUFFIX = ".log";
    public static final String LOG_TMP_SUFFIX = ".log_tmp";
    public static final long FIRST_SEQ = 1;

    //计算校验和用的种子
    private static final int SEED = 13331;

    private static final int OF_XCHECKSUM = 0;
    private static final int OF_BASE_SEQ = OF_XCHECKSUM + 4;
    static final int HEADER_LENGTH = OF_BASE_SEQ + 8;

    private static final int OF_SIZE = 0;
    private static final int OF_CHECKSUM = OF_SIZE + 4;
    private static final int OF_DATA = OF_CHECKSUM + 4;

    private File file;
    private RandomAccessFile raf;
    private FileChannel fc;
    private Lock lock;

    //当前文件的有效长度，下一条日志从这里写入
    private long fileSize;
    //所有有效日志的总校验和
    private int xChecksum;
    private long baseSeq;
    private boolean closed;

    LoggerImpl(File file, RandomAccessFile raf, FileChannel fc) {
        this.file = file;
        this.raf = raf;
        this.fc = fc;
        lock = new ReentrantLock();
    }

    LoggerImpl(File file, RandomAccessFile raf, FileChannel fc, int xChecksum, long baseSeq) {
        this(file, raf, fc);
        this.xChecksum = xChecksum;
        this.baseSeq = baseSeq;
        this.fileSize = HEADER_LENGTH;
    }

    void init() {
        long size = 0;
        try {
            size = raf.length();
        } catch (IOException ioException) {
            Panic.panic(ioException);
        }
        if(size < HEADER_LENGTH) {
            Panic.panic(Error.BadLogFileException);
        }
        byte[] header = null;
        try {
            header = readFully(0, HEADER_LENGTH);
        } catch (IOException ioException) {
            Panic.panic(ioException);
        }
        this.xChecksum = Parser.parseInt(header, OF_XCHECKSUM);
        this.baseSeq = Parser.parseLong(header, OF_BASE_SEQ);
        this.fileSize = size;
        checkAndRemoveTail();
    }

    //找出总校验和与文件头一致的最长日志前缀，其后的部分视为坏尾截掉
    private void checkAndRemoveTail() {
        long position = HEADER_LENGTH;
        long goodEnd = xChecksum == 0 ? HEADER_LENGTH : -1;
        int xCheck = 0;
        while(true) {
            byte[] log = internRead(position);
            if(log == null) break;
            xCheck = calChecksum(xCheck, log);
            position += log.length;
            if(xCheck == xChecksum) {
                goodEnd = position;
            }
        }
        if(goodEnd < 0) {
            Panic.panic(Error.BadLogFileException);
        }
        if(goodEnd < fileSize) {
            LOG.info("Cut bad log tail of {} bytes", fileSize - goodEnd);
            try {
                fc.truncate(goodEnd);
            } catch (IOException ioException) {
                Panic.panic(ioException);
            }
        }
        fileSize = goodEnd;
    }

    private int calChecksum(int xCheck, byte[] log) {
        for(byte b : log) {
            xCheck = xCheck * SEED + b;
        }
        return xCheck;
    }

    //读取position处的一整条日志（含头），读不出或校验失败返回null
    private byte[] internRead(long position) {
        if(position + OF_DATA > fileSize) {
            return null;
        }
        try {
            int size = Parser.parseInt(readFully(position, 4));
            if(size < 0 || position + OF_DATA + size > fileSize) {
                return null;
            }
            byte[] log = readFully(position, OF_DATA + size);
            int checkSum1 = calChecksum(0, Arrays.copyOfRange(log, OF_DATA, log.length));
            int checkSum2 = Parser.parseInt(log, OF_CHECKSUM);
            if(checkSum1 != checkSum2) {
                return null;
            }
            return log;
        } catch (IOException ioException) {
            throw new LogIOException(ioException);
        }
    }

    private byte[] readFully(long position, int length) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(length);
        while(buf.hasRemaining()) {
            int n = fc.read(buf, position + buf.position());
            if(n < 0) {
                throw new IOException("Unexpected end of log file at " + (position + buf.position()));
            }
        }
        return buf.array();
    }

    private void writeFully(long position, byte[] data) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(data);
        while(buf.hasRemaining()) {
            fc.write(buf, position + buf.position());
        }
    }

    private byte[] wrapLog(byte[] data) {
        byte[] checksum = Parser.int2Byte(calChecksum(0, data));
        byte[] size = Parser.int2Byte(data.length);
        return Bytes.concat(size, checksum, data);
    }

    @Override
    public long append(LogRecord record) {
        byte[] log = wrapLog(record.encode());
        lock.lock();
        try {
            checkOpen();
            long position = fileSize;
            int oldChecksum = xChecksum;
            try {
                writeFully(position, log);
                xChecksum = calChecksum(xChecksum, log);
                writeFully(OF_XCHECKSUM, Parser.int2Byte(xChecksum));
            } catch (IOException e) {
                //写失败时把文件和总校验和都退回到追加之前
                xChecksum = oldChecksum;
                try {
                    fc.truncate(position);
                    writeFully(OF_XCHECKSUM, Parser.int2Byte(oldChecksum));
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
                throw new LogIOException(e);
            }
            fileSize = position + log.length;
            return toSeq(position);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void flush() {
        lock.lock();
        try {
            checkOpen();
            fc.force(true);
        } catch (IOException e) {
            throw new LogIOException(e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Iterator<LogRecord> scan(long fromSeq) {
        lock.lock();
        try {
            long start = fromSeq <= baseSeq ? HEADER_LENGTH : toPosition(fromSeq);
            return new LogScanner(start);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void truncateBefore(long seq) {
        lock.lock();
        try {
            checkOpen();
            if(seq <= baseSeq) {
                return;
            }
            if(seq > toSeq(fileSize)) {
                throw new IllegalArgumentException("Cannot truncate beyond log end: " + seq);
            }
            long from = toPosition(seq);
            byte[] kept = readFully(from, (int) (fileSize - from));
            int newChecksum = 0;
            int pos = 0;
            while(pos < kept.length) {
                int size = Parser.parseInt(kept, pos + OF_SIZE);
                byte[] log = Arrays.copyOfRange(kept, pos, pos + OF_DATA + size);
                newChecksum = calChecksum(newChecksum, log);
                pos += log.length;
            }
            //先写临时文件再整体替换，中途崩溃时旧日志保持完整
            File tmp = new File(file.getPath().substring(0, file.getPath().length() - LOG_SUFFIX.length()) + LOG_TMP_SUFFIX);
            try(RandomAccessFile out = new RandomAccessFile(tmp, "rw")) {
                out.setLength(0);
                out.write(Bytes.concat(Parser.int2Byte(newChecksum), Parser.long2Byte(seq), kept));
                out.getChannel().force(true);
            }
            fc.close();
            raf.close();
            Files.move(tmp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            raf = new RandomAccessFile(file, "rw");
            fc = raf.getChannel();
            LOG.info("Log truncated before seq {} ({} bytes discarded)", seq, from - HEADER_LENGTH);
            baseSeq = seq;
            xChecksum = newChecksum;
            fileSize = HEADER_LENGTH + kept.length;
        } catch (IOException e) {
            throw new LogIOException(e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long firstSeq() {
        lock.lock();
        try {
            return baseSeq;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long endSeq() {
        lock.lock();
        try {
            return toSeq(fileSize);
        } finally {
            lock.unlock();
        }
    }

    private long toSeq(long position) {
        return baseSeq + position - HEADER_LENGTH;
    }

    private long toPosition(long seq) {
        return seq - baseSeq + HEADER_LENGTH;
    }

    private void checkOpen() {
        if(closed) {
            throw new LogIOException(new IOException("Log is closed"));
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if(closed) return;
            closed = true;
            fc.close();
            raf.close();
        } catch (IOException ioException) {
            Panic.panic(ioException);
        } finally {
            lock.unlock();
        }
    }

    //Logger 被实现成迭代器模式，每个游标独立维护自己的位置
    private class LogScanner implements Iterator<LogRecord> {
        private long position;
        private LogRecord next;

        LogScanner(long position) {
            this.position = position;
        }

        @Override
        public boolean hasNext() {
            if(next != null) {
                return true;
            }
            lock.lock();
            try {
                checkOpen();
                byte[] log = internRead(position);
                if(log == null) {
                    return false;
                }
                next = LogRecord.decode(toSeq(position), Arrays.copyOfRange(log, OF_DATA, log.length));
                position += log.length;
                return true;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public LogRecord next() {
            if(!hasNext()) {
                throw new NoSuchElementException();
            }
            LogRecord r = next;
            next = null;
            return r;
        }
    }
}
