package com.sommerph.skillbackend.config;

import com.sommerph.skillbackend.model.escrow.PayoutPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Store store = new Store();
    private Verifier verifier = new Verifier();
    private Escrow escrow = new Escrow();

    @Data
    public static class Store {
        // memory | json
        private String type = "memory";
        private String path = "./data/ledger";
    }

    @Data
    public static class Verifier {
        // non-empty | hex-digest
        private String type = "non-empty";
    }

    @Data
    public static class Escrow {
        private PayoutPolicy payoutPolicy = PayoutPolicy.DECREMENT;
    }

}
