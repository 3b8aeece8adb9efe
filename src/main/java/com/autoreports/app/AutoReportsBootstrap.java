package com.autoreports.app;

import com.autoreports.app.properties.DbProperties;
import com.autoreports.app.properties.MailProperties;
import com.autoreports.sync.config.Config;
import com.autoreports.sync.db.Database;
import com.autoreports.sync.db.MigrationRunner;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;
import java.util.function.Function;

/**
 * Binds the typed property views from {@link Config} and opens the migrated database.
 */
public final class AutoReportsBootstrap {
    static final String ENV_DB_URL = "AUTOREPORTS_DB_URL";
    static final String ENV_DB_USER = "AUTOREPORTS_DB_USER";
    static final String ENV_DB_PASS = "AUTOREPORTS_DB_PASS";

    private final Binder binder;
    private final Function<String, String> env;

    public AutoReportsBootstrap(Config config) {
        this(config, System::getenv);
    }

    AutoReportsBootstrap(Config config, Function<String, String> env) {
        Map<String, String> flat = config.asMap();
        this.binder = new Binder(new MapConfigurationPropertySource(flat));
        this.env = env;
    }

    public DbProperties dbProperties() {
        DbProperties props = binder.bind("db", Bindable.of(DbProperties.class)).orElseGet(DbProperties::new);
        props.setUrl(firstNonBlank(env.apply(ENV_DB_URL), props.getUrl()));
        props.setUser(firstNonBlank(env.apply(ENV_DB_USER), props.getUser()));
        props.setPass(firstNonBlank(env.apply(ENV_DB_PASS), props.getPass()));
        return props;
    }

    public MailProperties mailProperties() {
        return binder.bind("mail", Bindable.of(MailProperties.class)).orElseGet(MailProperties::new);
    }

    public Database database() {
        Database database = Database.fromProperties(dbProperties());
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
