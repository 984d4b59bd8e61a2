package com.xjx.txdb.server;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.xjx.txdb.server.dm.CheckpointMarker;
import com.xjx.txdb.server.dm.logger.Logger;
import com.xjx.txdb.server.dm.store.DataStore;
import com.xjx.txdb.server.rm.RecoverResult;
import com.xjx.txdb.server.rm.RecoveryManager;
import com.xjx.txdb.server.tm.TransactionManager;
import com.xjx.txdb.server.tm.TransactionManagerImpl;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * @Author: Xjx
 * @Create: 2023/3/16 - 14:05
 * 把日志、共享存储、检查点文件组装起来：先恢复，再开放事务
 */
public class Engine {
    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(Engine.class);

    private DBConfig config;
    private Logger lg;
    private DataStore store;
    private RecoveryManager rm;
    private TransactionManagerImpl tm;
    private RecoverResult recoverResult;
    private ScheduledExecutorService scheduler;

    private Engine(DBConfig config, Logger lg, DataStore store, RecoveryManager rm) {
        this.config = config;
        this.lg = lg;
        this.store = store;
        this.rm = rm;
    }

    //新建 <path>.log、<path>.db、<path>.ckpt 三个文件
    public static Engine create(String path, DBConfig config) {
        Logger lg = Logger.create(path);
        DataStore store = DataStore.create(path);
        CheckpointMarker marker = CheckpointMarker.create(path);
        return start(config, lg, store, marker);
    }

    public static Engine open(String path, DBConfig config) {
        Logger lg = Logger.open(path);
        DataStore store = DataStore.open(path);
        CheckpointMarker marker = CheckpointMarker.open(path);
        return start(config, lg, store, marker);
    }

    private static Engine start(DBConfig config, Logger lg, DataStore store, CheckpointMarker marker) {
        Engine engine = new Engine(config, lg, store, new RecoveryManager(lg, store, marker));
        //恢复完成之前不能开启任何事务
        engine.recoverResult = engine.rm.recover();
        engine.tm = TransactionManager.newTransactionManager(config, lg, store, engine.recoverResult.nextXid);
        if(config.getCheckpointIntervalMillis() > 0) {
            engine.startCheckpointScheduler();
        }
        LOG.info("Engine started in {} mode", config.getMode());
        return engine;
    }

    private void startCheckpointScheduler() {
        scheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("txdb-checkpoint-%d").setDaemon(true).build());
        long interval = config.getCheckpointIntervalMillis();
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                checkpoint();
            } catch (RuntimeException e) {
                LOG.error("Scheduled checkpoint failed", e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    public TransactionManager tm() {
        return tm;
    }

    public boolean checkpoint() {
        return rm.checkpoint(tm, config.getCheckpointWaitMillis(), config.isTruncateOnCheckpoint());
    }

    public RecoverResult recoverResult() {
        return recoverResult;
    }

    public Logger logger() {
        return lg;
    }

    public DataStore store() {
        return store;
    }

    public DBConfig config() {
        return config;
    }

    public void close() {
        if(scheduler != null) {
            //不能中断正在写日志的检查点，FileChannel 被中断会直接关闭
            scheduler.shutdown();
            try {
                if(!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    LOG.warn("Checkpoint scheduler did not stop in time");
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        lg.flush();
        lg.close();
        store.close();
        LOG.info("Engine closed");
    }
}
