package com.xjx.txdb.server.utils;

/**
 * @Author: Xjx
 * @Create: 2023/3/2 - 11:16
 */
public class ParseBytesRes {
    public byte[] data;
    //本次解析一共消耗的字节数（含长度前缀）
    public int next;

    public ParseBytesRes(byte[] data, int next) {
        this.data = data;
        this.next = next;
    }
}
