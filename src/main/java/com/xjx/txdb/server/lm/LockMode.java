package com.xjx.txdb.server.lm;

/**
 * @Author: Xjx
 * @Create: 2023/3/7 - 10:02
 */
public enum LockMode {
    SHARED,
    EXCLUSIVE;

    //已经持有this模式时，再请求other是否无需任何操作
    public boolean covers(LockMode other) {
        return this == EXCLUSIVE || other == SHARED;
    }

    public boolean compatibleWith(LockMode other) {
        return this == SHARED && other == SHARED;
    }
}
