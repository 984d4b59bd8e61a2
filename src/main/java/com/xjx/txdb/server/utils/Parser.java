package com.xjx.txdb.server.utils;

import com.google.common.primitives.Bytes;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * @Author: Xjx
 * @Create: 2023/3/2 - 11:10
 */
public class Parser {
    //长度为-1表示值不存在（null）
    private static final int NULL_LENGTH = -1;

    public static byte[] long2Byte(long value) {
        return ByteBuffer.allocate(Long.SIZE / Byte.SIZE).putLong(value).array();
    }

    public static long parseLong(byte[] buf) {
        ByteBuffer buffer = ByteBuffer.wrap(buf, 0, 8);
        return buffer.getLong();
    }

    public static long parseLong(byte[] buf, int offset) {
        return ByteBuffer.wrap(buf, offset, 8).getLong();
    }

    public static byte[] int2Byte(int value) {
        return ByteBuffer.allocate(Integer.SIZE / Byte.SIZE).putInt(value).array();
    }

    public static int parseInt(byte[] buf) {
        ByteBuffer buffer = ByteBuffer.wrap(buf, 0, 4);
        return buffer.getInt();
    }

    public static int parseInt(byte[] buf, int offset) {
        return ByteBuffer.wrap(buf, offset, 4).getInt();
    }

    //变长字节数组的格式：[Length 4字节][Data]，null 的 Length 记为-1
    public static byte[] bytes2Raw(byte[] data) {
        if(data == null) {
            return int2Byte(NULL_LENGTH);
        }
        return Bytes.concat(int2Byte(data.length), data);
    }

    public static ParseBytesRes parseBytes(byte[] raw, int offset) {
        int length = parseInt(raw, offset);
        if(length == NULL_LENGTH) {
            return new ParseBytesRes(null, 4);
        }
        if(length < 0 || offset + 4 + length > raw.length) {
            throw new IllegalArgumentException("Bad length " + length + " at offset " + offset);
        }
        byte[] data = Arrays.copyOfRange(raw, offset + 4, offset + 4 + length);
        return new ParseBytesRes(data, length + 4);
    }

    //将字符串映射为一个键，供测试和上层按名字访问数据项
    public static long str2Key(String key) {
        long seed = 13331;
        long res = 0;
        for(byte b : key.getBytes()) {
            res = res * seed + (long)b;
        }
        return res;
    }
}
