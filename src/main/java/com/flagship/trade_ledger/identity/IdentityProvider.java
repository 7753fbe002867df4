package com.flagship.trade_ledger.identity;

import com.flagship.trade_ledger.exception.PermissionDeniedException;

import java.util.Optional;

/**
 * Resolves who is calling the current operation.
 *
 * Certificate and token verification happen before the ledger is reached;
 * implementations only expose the already-authenticated result.
 */
public interface IdentityProvider {

    /**
     * @throws PermissionDeniedException if the invocation carries no principal
     */
    String currentPrincipal();

    Optional<String> findAttribute(String name);

    /**
     * @throws PermissionDeniedException if the caller has no such attribute
     */
    default String attribute(String name) {
        return findAttribute(name)
            .orElseThrow(() -> new PermissionDeniedException("Caller has no attribute '" + name + "'"));
    }
}
