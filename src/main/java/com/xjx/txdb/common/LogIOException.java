package com.xjx.txdb.common;

/**
 * @Author: Xjx
 * @Create: 2023/3/2 - 10:40
 * 日志写入或刷盘失败。所在事务必须回滚，且不能重试
 */
public class LogIOException extends RuntimeException {
    public LogIOException(Throwable cause) {
        super("Log I/O failure: " + cause.getMessage(), cause);
    }
}
