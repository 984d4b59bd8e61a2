package com.xjx.txdb.server.dm.logger;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Bytes;
import com.xjx.txdb.common.Error;
import com.xjx.txdb.server.utils.ParseBytesRes;
import com.xjx.txdb.server.utils.Parser;

import java.util.Arrays;
import java.util.Map;

/**
 * @Author: Xjx
 * @Create: 2023/3/3 - 9:21
 * 一条日志记录，写入后不可变。
 * 日志数据格式：[Kind 1字节][XID 8字节][Payload]
 * UPDATE:           [Key 8字节][OldRaw][NewRaw]
 * CHECKPOINT_BEGIN: [Count 4字节]([XID 8字节][FirstSeq 8字节])*，XID 字段保存下一个可分配的事务id
 * CHECKPOINT_END:   [BeginSeq 8字节]
 */
public final class LogRecord {

    public enum Kind {
        BEGIN((byte) 0),
        UPDATE((byte) 1),
        COMMIT((byte) 2),
        ABORT((byte) 3),
        CHECKPOINT_BEGIN((byte) 4),
        CHECKPOINT_END((byte) 5);

        private final byte code;

        Kind(byte code) {
            this.code = code;
        }

        public byte code() {
            return code;
        }

        static Kind of(byte code) {
            for(Kind k : values()) {
                if(k.code == code) {
                    return k;
                }
            }
            throw Error.BadLogRecordException;
        }
    }

    //还没写入日志的记录，seq 为-1
    public static final long NO_SEQ = -1;

    private static final int OF_KIND = 0;
    private static final int OF_XID = OF_KIND + 1;
    private static final int OF_PAYLOAD = OF_XID + 8;

    private final long seq;
    private final Kind kind;
    private final long xid;
    private final long key;
    private final byte[] oldValue;
    private final byte[] newValue;
    // xid -> 该事务 BEGIN 记录的 seq，仅 CHECKPOINT_BEGIN 使用
    private final Map<Long, Long> activeTransactions;
    private final long checkpointSeq;

    private LogRecord(long seq, Kind kind, long xid, long key, byte[] oldValue, byte[] newValue,
                      Map<Long, Long> activeTransactions, long checkpointSeq) {
        this.seq = seq;
        this.kind = kind;
        this.xid = xid;
        this.key = key;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.activeTransactions = activeTransactions;
        this.checkpointSeq = checkpointSeq;
    }

    public static LogRecord begin(long xid) {
        return new LogRecord(NO_SEQ, Kind.BEGIN, xid, 0, null, null, ImmutableMap.of(), NO_SEQ);
    }

    public static LogRecord update(long xid, long key, byte[] oldValue, byte[] newValue) {
        return new LogRecord(NO_SEQ, Kind.UPDATE, xid, key, copy(oldValue), copy(newValue), ImmutableMap.of(), NO_SEQ);
    }

    public static LogRecord commit(long xid) {
        return new LogRecord(NO_SEQ, Kind.COMMIT, xid, 0, null, null, ImmutableMap.of(), NO_SEQ);
    }

    public static LogRecord abort(long xid) {
        return new LogRecord(NO_SEQ, Kind.ABORT, xid, 0, null, null, ImmutableMap.of(), NO_SEQ);
    }

    public static LogRecord checkpointBegin(long nextXid, Map<Long, Long> active) {
        return new LogRecord(NO_SEQ, Kind.CHECKPOINT_BEGIN, nextXid, 0, null, null, ImmutableMap.copyOf(active), NO_SEQ);
    }

    public static LogRecord checkpointEnd(long beginSeq) {
        return new LogRecord(NO_SEQ, Kind.CHECKPOINT_END, 0, 0, null, null, ImmutableMap.of(), beginSeq);
    }

    public byte[] encode() {
        byte[] head = Bytes.concat(new byte[]{kind.code()}, Parser.long2Byte(xid));
        switch (kind) {
            case UPDATE:
                return Bytes.concat(head, Parser.long2Byte(key), Parser.bytes2Raw(oldValue), Parser.bytes2Raw(newValue));
            case CHECKPOINT_BEGIN:
                byte[] raw = Bytes.concat(head, Parser.int2Byte(activeTransactions.size()));
                for(Map.Entry<Long, Long> e : activeTransactions.entrySet()) {
                    raw = Bytes.concat(raw, Parser.long2Byte(e.getKey()), Parser.long2Byte(e.getValue()));
                }
                return raw;
            case CHECKPOINT_END:
                return Bytes.concat(head, Parser.long2Byte(checkpointSeq));
            default:
                return head;
        }
    }

    //解析日志数据，seq 由日志文件中的位置决定
    public static LogRecord decode(long seq, byte[] raw) {
        if(raw.length < OF_PAYLOAD) {
            throw Error.BadLogRecordException;
        }
        Kind kind = Kind.of(raw[OF_KIND]);
        long xid = Parser.parseLong(raw, OF_XID);
        switch (kind) {
            case UPDATE: {
                long key = Parser.parseLong(raw, OF_PAYLOAD);
                ParseBytesRes oldRes = Parser.parseBytes(raw, OF_PAYLOAD + 8);
                ParseBytesRes newRes = Parser.parseBytes(raw, OF_PAYLOAD + 8 + oldRes.next);
                return new LogRecord(seq, kind, xid, key, oldRes.data, newRes.data, ImmutableMap.of(), NO_SEQ);
            }
            case CHECKPOINT_BEGIN: {
                int count = Parser.parseInt(raw, OF_PAYLOAD);
                ImmutableMap.Builder<Long, Long> active = ImmutableMap.builder();
                int pos = OF_PAYLOAD + 4;
                for(int i = 0; i < count; i++) {
                    active.put(Parser.parseLong(raw, pos), Parser.parseLong(raw, pos + 8));
                    pos += 16;
                }
                return new LogRecord(seq, kind, xid, 0, null, null, active.build(), NO_SEQ);
            }
            case CHECKPOINT_END:
                return new LogRecord(seq, kind, xid, 0, null, null, ImmutableMap.of(), Parser.parseLong(raw, OF_PAYLOAD));
            default:
                return new LogRecord(seq, kind, xid, 0, null, null, ImmutableMap.of(), NO_SEQ);
        }
    }

    private static byte[] copy(byte[] b) {
        return b == null ? null : Arrays.copyOf(b, b.length);
    }

    public long getSeq() {
        return seq;
    }

    public Kind getKind() {
        return kind;
    }

    public long getXid() {
        return xid;
    }

    public long getKey() {
        return key;
    }

    public byte[] getOldValue() {
        return copy(oldValue);
    }

    public byte[] getNewValue() {
        return copy(newValue);
    }

    public Map<Long, Long> getActiveTransactions() {
        return activeTransactions;
    }

    public long getCheckpointSeq() {
        return checkpointSeq;
    }

    @Override
    public String toString() {
        return "LogRecord{seq=" + seq + ", kind=" + kind + ", xid=" + xid + "}";
    }
}
