package com.xjx.txdb.server;

import com.xjx.txdb.server.dm.logger.LogRecord;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

/**
 * @Author: Xjx
 * @Create: 2023/3/17 - 11:02
 */
public class LauncherTest {

    @Test
    public void testParseMode() {
        assertEquals(DBConfig.ConcurrencyMode.TWO_PHASE_LOCKING, Launcher.parseMode(null));
        assertEquals(DBConfig.ConcurrencyMode.TWO_PHASE_LOCKING, Launcher.parseMode("2PL"));
        assertEquals(DBConfig.ConcurrencyMode.TIMESTAMP_ORDERING, Launcher.parseMode("to"));
    }

    @Test
    public void testDumpRecord() {
        LogRecord r = LogRecord.decode(5, LogRecord.update(2, 9, null, "ab".getBytes()).encode());
        Map<String, Object> m = Launcher.toJsonMap(r);
        assertEquals(5L, m.get("seq"));
        assertEquals("UPDATE", m.get("kind"));
        assertEquals(9L, m.get("key"));
        assertEquals(null, m.get("old"));
        assertEquals("YWI=", m.get("new"));

        m = Launcher.toJsonMap(LogRecord.decode(1, LogRecord.commit(2).encode()));
        assertFalse(m.containsKey("key"));
    }
}
