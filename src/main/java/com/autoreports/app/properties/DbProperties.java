package com.autoreports.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private String url = "jdbc:postgresql://localhost:5432/autoreports";
    private String user = "autoreports";
    private String pass = "autoreports";
    private String schema = "autoreports";
    private int connectTimeoutSeconds = 10;
    private SqlLog sqlLog = new SqlLog();

    @Getter
    @Setter
    public static class SqlLog {
        private boolean enabled = true;
    }
}
