package com.sommerph.skillbackend.config;

import com.sommerph.skillbackend.repository.ledger.InMemoryLedgerStore;
import com.sommerph.skillbackend.repository.ledger.JsonFileLedgerStore;
import com.sommerph.skillbackend.repository.ledger.LedgerStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Clock;

@Configuration
public class LedgerStoreConfig {

    private final LedgerProperties properties;

    public LedgerStoreConfig(LedgerProperties properties) {
        this.properties = properties;
    }

    @Bean
    public LedgerStore ledgerStore() throws IOException {
        return switch (properties.getStore().getType().toLowerCase()) {
            case "json" -> new JsonFileLedgerStore(properties.getStore().getPath());
            case "memory" -> new InMemoryLedgerStore();
            default -> throw new IllegalArgumentException("Unsupported ledger store type: " + properties.getStore().getType());
        };
    }

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

}
