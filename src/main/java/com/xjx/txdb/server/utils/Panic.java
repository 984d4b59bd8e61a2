package com.xjx.txdb.server.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * @Author: Xjx
 * @Create: 2023/3/2 - 11:02
 * 遇到无法恢复的错误（文件损坏等）时直接停机
 */
public class Panic {
    private static final Logger LOG = LoggerFactory.getLogger(Panic.class);

    public static void panic(Exception err) {
        LOG.error("Fatal error, shutting down", err);
        System.exit(1);
    }
}
