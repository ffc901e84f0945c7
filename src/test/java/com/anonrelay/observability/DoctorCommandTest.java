package com.anonrelay.observability;

import com.anonrelay.shared.config.AnonRelayConfig;
import com.anonrelay.shared.config.RateLimitConfig;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DoctorCommandTest {

    @Test
    void reportsHealthyDatabaseAndConfig() throws Exception {
        var rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true);
        var ps = mock(PreparedStatement.class);
        when(ps.executeQuery()).thenReturn(rs);
        var meta = mock(DatabaseMetaData.class);
        when(meta.getTables(isNull(), isNull(), anyString(), isNull())).thenReturn(rs);
        var conn = mock(Connection.class);
        when(conn.prepareStatement("SELECT 1")).thenReturn(ps);
        when(conn.getMetaData()).thenReturn(meta);
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenReturn(conn);

        var result = new DoctorCommand(ds, config("123:abc", true, "42")).run();

        assertTrue(result.contains("[OK] PostgreSQL connection"));
        assertTrue(result.contains("[OK] Schema tables present"));
        assertTrue(result.contains("[OK] Telegram bot token configured"));
        assertTrue(result.contains("[OK] Moderation queue: 42"));
        assertTrue(result.contains("[OK] Java"));
    }

    @Test
    void reportsFailuresAndWarnings() throws Exception {
        var ds = mock(DataSource.class);
        when(ds.getConnection()).thenThrow(new RuntimeException("refused"));

        var result = new DoctorCommand(ds, config("", true, "")).run();

        assertTrue(result.contains("[FAIL] PostgreSQL: refused"));
        assertTrue(result.contains("[WARN] Telegram bot token not configured"));
        assertTrue(result.contains("[FAIL] Moderation enabled but no admin channel configured"));
    }

    private static AnonRelayConfig config(String token, boolean moderation, String adminChannel) {
        return new AnonRelayConfig(token, 42, adminChannel, "", moderation, true, "",
                RateLimitConfig.defaults(), 10, 8, null);
    }
}
