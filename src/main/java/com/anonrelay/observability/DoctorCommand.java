package com.anonrelay.observability;

import com.anonrelay.shared.config.AnonRelayConfig;

import javax.sql.DataSource;
import java.util.ArrayList;

/**
 * Startup self-check, logged once by the application and available to operators.
 */
public class DoctorCommand {

    private static final String[] TABLES = {"users", "messages", "reply_tokens", "rate_limits", "alerts", "mod_log"};

    private final DataSource dataSource;
    private final AnonRelayConfig config;

    public DoctorCommand(DataSource dataSource, AnonRelayConfig config) {
        this.dataSource = dataSource;
        this.config = config;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkDatabase());
        results.add(checkTables());
        results.add(checkBotToken());
        results.add(checkModeration());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkDatabase() {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT 1");
             var rs = ps.executeQuery()) {
            return "[OK] PostgreSQL connection";
        } catch (Exception e) {
            return "[FAIL] PostgreSQL: " + e.getMessage();
        }
    }

    private String checkTables() {
        var missing = new ArrayList<String>();
        try (var conn = dataSource.getConnection()) {
            var meta = conn.getMetaData();
            for (var table : TABLES) {
                try (var rs = meta.getTables(null, null, table, null)) {
                    if (!rs.next()) missing.add(table);
                }
            }
        } catch (Exception e) {
            return "[FAIL] Schema check: " + e.getMessage();
        }
        return missing.isEmpty() ? "[OK] Schema tables present" : "[FAIL] Missing tables: " + missing;
    }

    private String checkBotToken() {
        var token = config.telegramBotToken();
        return token != null && !token.isBlank()
                ? "[OK] Telegram bot token configured"
                : "[WARN] Telegram bot token not configured (set ANONRELAY_BOT_TOKEN)";
    }

    private String checkModeration() {
        if (!config.moderationEnabled()) return "[WARN] Moderation disabled, messages publish immediately";
        return config.adminChannel() != null && !config.adminChannel().isBlank()
                ? "[OK] Moderation queue: " + config.adminChannel()
                : "[FAIL] Moderation enabled but no admin channel configured";
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
