package com.xjx.txdb.server;

import com.google.common.io.BaseEncoding;
import com.google.gson.Gson;
import com.xjx.txdb.common.Error;
import com.xjx.txdb.server.dm.logger.LogRecord;
import com.xjx.txdb.server.utils.Panic;
import org.apache.commons.cli.*;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @Author: Xjx
 * @Create: 2023/3/17 - 10:15
 */
public class Launcher {

    public static void main(String[] args) throws Exception {
        Options options = new Options();
        options.addOption("open", true, "-open DBPath");
        options.addOption("create", true, "-create DBPath");
        options.addOption("mode", true, "-mode 2pl|to");
        options.addOption("checkpoint", false, "-checkpoint");
        options.addOption("dump", false, "-dump");
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options, args);
        DBConfig config = DBConfig.defaults().setMode(parseMode(cmd.getOptionValue("mode")));
        if(cmd.hasOption("open")) {
            openDB(cmd.getOptionValue("open"), config, cmd.hasOption("checkpoint"), cmd.hasOption("dump"));
            return;
        }
        if(cmd.hasOption("create")) {
            createDB(cmd.getOptionValue("create"), config);
            return;
        }
        System.out.println("Usage: launcher (open|create) DBPath [-mode 2pl|to] [-checkpoint] [-dump]");
    }

    private static void createDB(String path, DBConfig config) {
        Engine engine = Engine.create(path, config);
        engine.close();
    }

    //打开数据库会先执行恢复，然后按需做一次检查点或打印日志
    private static void openDB(String path, DBConfig config, boolean checkpoint, boolean dump) {
        Engine engine = Engine.open(path, config);
        System.out.println(engine.recoverResult());
        if(checkpoint) {
            System.out.println("Checkpoint " + (engine.checkpoint() ? "completed" : "abandoned"));
        }
        if(dump) {
            Gson gson = new Gson();
            Iterator<LogRecord> it = engine.logger().scan(engine.logger().firstSeq());
            while(it.hasNext()) {
                System.out.println(gson.toJson(toJsonMap(it.next())));
            }
        }
        engine.close();
    }

    static Map<String, Object> toJsonMap(LogRecord r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("seq", r.getSeq());
        m.put("kind", r.getKind().name());
        m.put("xid", r.getXid());
        switch (r.getKind()) {
            case UPDATE:
                m.put("key", r.getKey());
                m.put("old", r.getOldValue() == null ? null : BaseEncoding.base64().encode(r.getOldValue()));
                m.put("new", BaseEncoding.base64().encode(r.getNewValue()));
                break;
            case CHECKPOINT_BEGIN:
                m.put("active", r.getActiveTransactions());
                break;
            case CHECKPOINT_END:
                m.put("checkpointSeq", r.getCheckpointSeq());
                break;
            default:
                break;
        }
        return m;
    }

    static DBConfig.ConcurrencyMode parseMode(String mode) {
        if(mode == null || "".equals(mode) || "2pl".equalsIgnoreCase(mode)) {
            return DBConfig.ConcurrencyMode.TWO_PHASE_LOCKING;
        }
        if("to".equalsIgnoreCase(mode)) {
            return DBConfig.ConcurrencyMode.TIMESTAMP_ORDERING;
        }
        Panic.panic(Error.InvalidCommandException);
        return DBConfig.ConcurrencyMode.TWO_PHASE_LOCKING;
    }
}
