package com.xjx.txdb.server.tm;

/**
 * @Author: Xjx
 * @Create: 2023/3/10 - 9:18
 */
public enum CommitResult {
    OK,
    ABORTED
}
