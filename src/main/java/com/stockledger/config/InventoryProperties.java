package com.stockledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code inventory.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "inventory")
public class InventoryProperties {
    private Audit audit = new Audit();
    private Shell shell = new Shell();
    private SampleData sampleData = new SampleData();
    private History history = new History();

    @Data
    public static class Audit {
        /** Working directory of the git repository that mirrors inventory events. */
        private String repositoryPath = "audit-ledger";
        private String authorName = "Stock Ledger";
        private String authorEmail = "stock-ledger@localhost";
        /** File inside the working directory that every recorded event is appended to. */
        private String journalFile = "audit-journal.log";
        private int historyLimit = 10;
    }

    @Data
    public static class Shell {
        private boolean enabled = true;
    }

    @Data
    public static class SampleData {
        /** Ask at startup whether to load the demonstration products and customers. */
        private boolean prompt = true;
    }

    @Data
    public static class History {
        private int limit = 50;
    }
}
