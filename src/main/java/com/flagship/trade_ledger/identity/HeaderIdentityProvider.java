package com.flagship.trade_ledger.identity;

import com.flagship.trade_ledger.exception.PermissionDeniedException;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * Identity taken from headers set by the authenticating gateway in front of the service.
 *
 * {@code X-Principal} carries the principal name; each attribute travels as
 * {@code X-Principal-Attr-<name>}.
 */
public class HeaderIdentityProvider implements IdentityProvider {

    public static final String PRINCIPAL_HEADER = "X-Principal";
    public static final String ATTRIBUTE_HEADER_PREFIX = "X-Principal-Attr-";

    private final HttpServletRequest request;

    public HeaderIdentityProvider(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public String currentPrincipal() {
        String principal = request.getHeader(PRINCIPAL_HEADER);
        if (principal == null || principal.isBlank()) {
            throw new PermissionDeniedException("Request carries no authenticated principal");
        }
        return principal;
    }

    @Override
    public Optional<String> findAttribute(String name) {
        return Optional.ofNullable(request.getHeader(ATTRIBUTE_HEADER_PREFIX + name))
            .filter(value -> !value.isBlank());
    }
}
