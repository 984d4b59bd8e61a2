package com.xjx.txdb.server.tm;

/**
 * @Author: Xjx
 * @Create: 2023/3/10 - 9:15
 * 只允许 ACTIVE -> COMMITTED 或 ACTIVE -> ABORTED
 */
public enum TransactionState {
    ACTIVE,
    COMMITTED,
    ABORTED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
