package com.autoreports.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "mail")
public class MailProperties {
    private boolean enabled = false;
    private String smtpHost = "localhost";
    private int smtpPort = 25;
    private String smtpUser = "";
    private String smtpPass = "";
    private boolean starttls = false;
    private String from = "";
    private List<String> to = new ArrayList<>();
    private List<String> auditTo = new ArrayList<>();
    private String subjectPrefix = "[AutoReports]";
    private boolean dryRun = false;
    private boolean failFast = false;
    private String dryRunDir = "";
    private String logFile = "log/autoreports.log";
}
