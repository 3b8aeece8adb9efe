package com.autoreports.sync.db.mybatis;

import org.apache.ibatis.logging.log4j2.Log4j2Impl;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

import java.sql.Connection;

/**
 * One annotation-only MyBatis configuration shared by the registry store and the schema migration.
 * <p>
 * Registered mappers: {@link SyncStateMapper} (schema version and last-write bookkeeping),
 * {@link RequestMapper} (the primary source of request attributes) and {@link AutoReportMapper}
 * (the reconciled auto-report rows). Statements log under {@code SQL.} plus the statement id,
 * so {@code db.sql-log.enabled} switches all of them with one logger level.
 */
public final class MyBatisSupport {
    static final String SQL_LOG_PREFIX = "SQL.";

    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    /**
     * Opens a session over {@code connection}. Commits stay with the caller; closing the session closes the connection.
     */
    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    /**
     * Switches statement logging for every registry mapper at once.
     */
    public static void setSqlLogging(boolean enabled) {
        Configurator.setLevel("SQL", enabled ? Level.DEBUG : Level.OFF);
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);
        config.setLogImpl(Log4j2Impl.class);
        config.setLogPrefix(SQL_LOG_PREFIX);
        // keep NULL columns in the row maps
        config.setCallSettersOnNulls(true);

        config.addMapper(SyncStateMapper.class);
        config.addMapper(RequestMapper.class);
        config.addMapper(AutoReportMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}
