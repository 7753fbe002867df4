package com.flagship.trade_ledger.config;

import com.flagship.trade_ledger.account.AccountExistenceCheck;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code ledger.*} namespace.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private Store store = new Store();
    private Keys keys = new Keys();
    private Accounts accounts = new Accounts();
    private Invoices invoices = new Invoices();
    private Bootstrap bootstrap = new Bootstrap();

    /**
     * Participants registered at startup, same as name/role pairs passed to {@code init}.
     */
    private List<Participant> participants = new ArrayList<>();

    public enum StoreType {
        JDBC,
        MEMORY
    }

    @Getter
    @Setter
    public static class Store {
        private StoreType type = StoreType.JDBC;
    }

    /**
     * Reserved world state keys. Account numbers and invoice ids may not start
     * with {@code reservedPrefix}, so these never collide with primary records.
     */
    @Getter
    @Setter
    public static class Keys {
        private String reservedPrefix = "_";
        private String accountIndex = "_accountindex";
        private String invoiceIndex = "_invoiceindex";
        private String rolePrefix = "_role.";

        public boolean isReserved(String key) {
            return key.startsWith(reservedPrefix);
        }
    }

    @Getter
    @Setter
    public static class Accounts {
        private AccountExistenceCheck existenceCheck = AccountExistenceCheck.FIELD_MATCH;
    }

    @Getter
    @Setter
    public static class Invoices {
        private String defaultCurrency = "USD";
        private boolean validatePayerRole = true;
    }

    @Getter
    @Setter
    public static class Bootstrap {
        /** Create missing indexes and register {@code participants} at startup. */
        private boolean enabled = true;
    }

    @Getter
    @Setter
    public static class Participant {
        private String name;
        private String role;
    }
}
