package com.flagship.trade_ledger.identity;

import com.flagship.trade_ledger.config.LedgerProperties;
import com.flagship.trade_ledger.exception.ValidationException;
import com.flagship.trade_ledger.store.LedgerTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Principal → role records kept in the world state.
 *
 * Each principal has one record under {@code <rolePrefix><principal>} whose
 * value is the role label. Roles are read back on every call; nothing is cached.
 */
@Component
@Slf4j
public class RoleRegistry {

    private final String rolePrefix;

    public RoleRegistry(LedgerProperties properties) {
        this.rolePrefix = properties.getKeys().getRolePrefix();
    }

    /**
     * Records the principal's role unless it already has a role record.
     * An existing record is never replaced.
     *
     * @return true if a new record was written
     * @throws ValidationException if the name is empty or the label is not a known role
     */
    public boolean register(LedgerTransaction tx, String principal, String roleLabel) {
        if (principal == null || principal.isEmpty()) {
            throw new ValidationException("Participant name must be a non-empty string");
        }
        Role role = Role.fromLabel(roleLabel)
            .orElseThrow(() -> new ValidationException(
                "Unknown role '" + roleLabel + "' for participant " + principal));
        String key = keyFor(principal);
        if (tx.get(key).isPresent()) {
            log.warn("Participant {} already has a role record; keeping it instead of {}", principal, role.getLabel());
            return false;
        }
        tx.put(key, role.getLabel().getBytes(StandardCharsets.UTF_8));
        log.info("Registered participant: principal={}, role={}", principal, role.getLabel());
        return true;
    }

    /**
     * @return the registered role, or empty when the principal is unknown or
     *         its record holds an unrecognised label
     */
    public Optional<Role> roleOf(LedgerTransaction tx, String principal) {
        return tx.get(keyFor(principal))
            .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
            .flatMap(Role::fromLabel);
    }

    public String keyFor(String principal) {
        return rolePrefix + principal;
    }
}
