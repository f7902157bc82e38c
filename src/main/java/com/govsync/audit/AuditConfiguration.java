package com.govsync.audit;

import com.govsync.config.GovSyncProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class AuditConfiguration {

    @Bean
    public ImportAuditLog importAuditLog(GovSyncProperties properties) {
        GovSyncProperties.Audit audit = properties.getAudit();
        return new JsonLinesImportAuditLog(Path.of(audit.getFile()), audit.getRecentLimit());
    }
}
