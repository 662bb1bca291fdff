package com.kickoff.tipping.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.Arrays;

/**
 * Refuses to start with {@code create}/{@code create-drop} schema generation unless a test profile is
 * active, so a misconfigured deployment cannot wipe fixtures and tips. In-memory databases only warn.
 */
@Configuration
public class DatabaseSafetyConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseSafetyConfig.class);

    private final Environment environment;
    private final String ddlAuto;
    private final String datasourceUrl;

    public DatabaseSafetyConfig(Environment environment,
                                @Value("${spring.jpa.hibernate.ddl-auto:validate}") String ddlAuto,
                                @Value("${spring.datasource.url:}") String datasourceUrl) {
        this.environment = environment;
        this.ddlAuto = ddlAuto;
        this.datasourceUrl = datasourceUrl;
    }

    @PostConstruct
    public void verifySchemaSafety() {
        String[] profiles = environment.getActiveProfiles();
        log.info("[DB_SAFETY] profiles={} ddl-auto='{}' datasource='{}'", Arrays.toString(profiles), ddlAuto, datasourceUrl);
        check(profiles, ddlAuto, datasourceUrl);
    }

    static void check(String[] profiles, String ddlAuto, String datasourceUrl) {
        String ddl = ddlAuto == null ? "" : ddlAuto.trim().toLowerCase().replace('_', '-');
        boolean destructive = "create".equals(ddl) || "create-drop".equals(ddl);
        boolean testProfile = Arrays.stream(profiles).anyMatch(p -> p.toLowerCase().contains("test"));
        if (destructive && !testProfile) {
            throw new IllegalStateException("ddl-auto=" + ddl + " outside a test profile, refusing to start");
        }
        if (datasourceUrl != null && datasourceUrl.toLowerCase().contains("mem:")) {
            log.warn("[DB_SAFETY] in-memory database, fixtures and tips will not survive a restart");
        }
    }
}
