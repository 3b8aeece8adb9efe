package com.autoreports.sync.db;

import com.autoreports.app.properties.DbProperties;
import com.autoreports.sync.db.mybatis.MyBatisSupport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Connections to the auto-report registry. Every connection has the registry schema on its search path.
 */
public final class Database {
    private static final Logger log = LogManager.getLogger(Database.class);
    private static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    static final String APPLICATION_NAME = "autoreports-sync";

    private final PGSimpleDataSource dataSource;
    private final String jdbcUrl;
    private final String schema;

    public Database(String jdbcUrl, String user, String pass, String schema, int connectTimeoutSeconds) {
        String url = jdbcUrl == null ? "" : jdbcUrl.trim();
        if (!url.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must be a PostgreSQL JDBC URL, got '" + maskUrl(url) + "'");
        }
        String schemaName = schema == null || schema.isBlank() ? "autoreports" : schema.trim();
        if (!SCHEMA_NAME.matcher(schemaName).matches()) {
            throw new IllegalArgumentException("db.schema is not a plain identifier: " + schemaName);
        }
        this.jdbcUrl = url;
        this.schema = schemaName;

        dataSource = new PGSimpleDataSource();
        dataSource.setUrl(url);
        if (user != null && !user.isBlank()) {
            dataSource.setUser(user.trim());
        }
        dataSource.setPassword(pass);
        dataSource.setCurrentSchema(schemaName);
        dataSource.setApplicationName(APPLICATION_NAME);
        dataSource.setConnectTimeout(Math.max(0, connectTimeoutSeconds));
    }

    public static Database fromProperties(DbProperties props) {
        MyBatisSupport.setSqlLogging(props.getSqlLog().isEnabled());
        return new Database(props.getUrl(), props.getUser(), props.getPass(), props.getSchema(), props.getConnectTimeoutSeconds());
    }

    /**
     * @throws SQLException with the masked URL and a failure hint in its message
     */
    public Connection connect() throws SQLException {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            String message = "registry unavailable (" + hint(e) + "): url=" + maskedJdbcUrl()
                    + ", schema=" + schema + ": " + e.getMessage();
            log.error(message);
            throw new SQLException(message, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        return maskUrl(jdbcUrl);
    }

    static String maskUrl(String url) {
        return url
                .replaceAll("(?i)(password=)[^&]+", "$1***")
                .replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
    }

    /**
     * Short operator hint from the driver's SQL state, falling back to the message text.
     */
    static String hint(SQLException e) {
        String state = e.getSQLState() == null ? "" : e.getSQLState();
        if (state.startsWith("28")) {
            return "check AUTOREPORTS_DB_USER / AUTOREPORTS_DB_PASS";
        }
        if (state.equals("3D000")) {
            return "database does not exist";
        }
        if (state.startsWith("08")) {
            return "host unreachable";
        }
        String text = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return text.contains("timeout") ? "connect timeout" : "connection error";
    }
}
