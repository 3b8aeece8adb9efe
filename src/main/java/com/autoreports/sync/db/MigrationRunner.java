package com.autoreports.sync.db;

import com.autoreports.sync.db.mybatis.MyBatisSupport;
import com.autoreports.sync.db.mybatis.SyncStateMapper;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates the registry schema. Every statement is idempotent, so the runner is safe on each start;
 * the applied version is kept in {@code sync_state}.
 */
public final class MigrationRunner {
    private static final Logger log = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        try (Connection conn = database.connect()) {
            conn.setAutoCommit(false);
            try (Statement st = conn.createStatement()) {
                st.execute("CREATE SCHEMA IF NOT EXISTS " + database.schema());
                st.execute("SET search_path TO " + database.schema() + ", public");
                st.execute("CREATE TABLE IF NOT EXISTS sync_state ("
                        + "state_key TEXT PRIMARY KEY,"
                        + "state_value TEXT NOT NULL,"
                        + "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()"
                        + ")");
            }
            conn.commit();

            try (SqlSession session = MyBatisSupport.openSession(conn)) {
                SyncStateMapper state = session.getMapper(SyncStateMapper.class);
                int applied = parseVersion(state.selectState(SyncStateMapper.SCHEMA_VERSION));
                if (applied >= TARGET_VERSION) {
                    log.debug("schema {} already at version {}", database.schema(), applied);
                    return;
                }
                String current = "";
                try (Statement st = conn.createStatement()) {
                    for (String sql : buildStatements()) {
                        current = sql;
                        st.execute(sql);
                    }
                    state.saveState(SyncStateMapper.SCHEMA_VERSION, Integer.toString(TARGET_VERSION), OffsetDateTime.now(ZoneOffset.UTC));
                    conn.commit();
                } catch (SQLException | PersistenceException e) {
                    conn.rollback();
                    String detail = "migration to version " + TARGET_VERSION + " failed (applied=" + applied
                            + ") at: " + summarizeSql(current) + ": " + e.getMessage();
                    log.error(detail);
                    throw new SQLException(detail, e);
                }
                log.info("schema {} migrated {} -> {}", database.schema(), applied, TARGET_VERSION);
            }
        }
    }

    List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS requests (" +
                "request_id TEXT PRIMARY KEY," +
                "customer_login TEXT NULL," +
                "customer_name TEXT NULL," +
                "customer_company TEXT NULL," +
                "customer_orgstructure TEXT NULL," +
                "receiver_login TEXT NULL," +
                "receiver_name TEXT NULL," +
                "receiver_company TEXT NULL," +
                "receiver_orgstructure TEXT NULL," +
                "report_create_date TIMESTAMP NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS auto_reports (" +
                "task_name TEXT PRIMARY KEY," +
                "request_id TEXT NULL," +
                "customer_login TEXT NULL," +
                "customer_name TEXT NULL," +
                "customer_company TEXT NULL," +
                "customer_orgstructure TEXT NULL," +
                "receiver_login TEXT NULL," +
                "receiver_name TEXT NULL," +
                "receiver_company TEXT NULL," +
                "receiver_orgstructure TEXT NULL," +
                "report_create_date TIMESTAMP NULL," +
                "report_name TEXT NULL," +
                "report_recipients_email TEXT NULL," +
                "report_sender_type TEXT NULL," +
                "task_last_run_date TIMESTAMP NULL," +
                "task_last_run_result TEXT NULL," +
                "task_author_login TEXT NULL," +
                "task_file_path TEXT NULL," +
                "task_file_name TEXT NULL," +
                "task_description TEXT NULL," +
                "task_status TEXT NULL," +
                "task_run_as_user TEXT NULL," +
                "task_trigger_status TEXT NULL," +
                "task_schedule_type TEXT NULL," +
                "task_schedule_start_date TEXT NULL," +
                "task_schedule_days_interval TEXT NULL," +
                "task_schedule_weeks_interval TEXT NULL," +
                "task_schedule_week_days TEXT NULL," +
                "task_schedule_months TEXT NULL," +
                "task_schedule_month_days TEXT NULL," +
                "task_schedule_repeat_every TEXT NULL," +
                "task_schedule_repeat_until_time TEXT NULL," +
                "task_schedule_repeat_until_duration TEXT NULL," +
                "database_type TEXT NULL," +
                "database_hostname TEXT NULL," +
                "delivery_last_date TIMESTAMP NULL," +
                "delivery_status TEXT NULL," +
                "delivery_recipients TEXT NULL," +
                "delivery_attachments TEXT NULL," +
                "delivery_missing_attachments TEXT NULL," +
                "delivery_error TEXT NULL," +
                "archived BOOLEAN NULL," +
                "archive_folder TEXT NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE INDEX IF NOT EXISTS idx_auto_reports_request ON auto_reports(request_id)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_auto_reports_status ON auto_reports(task_status)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_auto_reports_delivery ON auto_reports(delivery_last_date DESC)");
        return sqls;
    }

    static int parseVersion(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("unreadable schema version '{}', re-applying migrations", raw);
            return 0;
        }
    }

    static String summarizeSql(String sql) {
        if (sql == null || sql.isBlank()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        return oneLine.length() <= 120 ? oneLine : oneLine.substring(0, 117) + "...";
    }
}
