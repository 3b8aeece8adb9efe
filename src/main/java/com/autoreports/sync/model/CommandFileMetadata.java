package com.autoreports.sync.model;

/**
 * Metadata found in a job's command artifact. Every attribute is optional.
 */
public final class CommandFileMetadata {
    public final String taskName;
    public final String senderType;
    public final String emailRecipients;
    public final String subjectTheme;
    public final String databaseHostname;
    public final String databaseType;

    public CommandFileMetadata(
            String taskName,
            String senderType,
            String emailRecipients,
            String subjectTheme,
            String databaseHostname,
            String databaseType
    ) {
        this.taskName = taskName;
        this.senderType = senderType;
        this.emailRecipients = emailRecipients;
        this.subjectTheme = subjectTheme;
        this.databaseHostname = databaseHostname;
        this.databaseType = databaseType;
    }

    public static CommandFileMetadata bare(String taskName) {
        return new CommandFileMetadata(taskName, null, null, null, null, null);
    }

    public boolean hasMailDirective() {
        return senderType != null;
    }

    public TaskRecord toRecord() {
        TaskRecord record = new TaskRecord(taskName);
        if (senderType != null) {
            record.put(RecordField.SENDER_TYPE, senderType);
            record.put(RecordField.EMAILS, emailRecipients);
        }
        if (subjectTheme != null) {
            record.put(RecordField.THEME, subjectTheme);
        }
        if (databaseHostname != null) {
            record.put(RecordField.DATABASE_HOSTNAME, databaseHostname);
            record.put(RecordField.DATABASE_TYPE, databaseType);
        }
        return record;
    }
}
