package com.stockledger.config;

import com.stockledger.audit.AuditLogMirror;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class AuditConfig {

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(destroyMethod = "close")
    AuditLogMirror auditLogMirror(InventoryProperties properties, Clock clock) {
        InventoryProperties.Audit audit = properties.getAudit();
        AuditLogMirror mirror = new AuditLogMirror(audit.getAuthorName(), audit.getAuthorEmail(),
                audit.getJournalFile(), clock);
        // A missing repository degrades auditing only, never startup
        mirror.ensureRepository(Path.of(audit.getRepositoryPath()));
        return mirror;
    }
}
