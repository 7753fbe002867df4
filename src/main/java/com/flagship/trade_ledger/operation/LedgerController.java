package com.flagship.trade_ledger.operation;

import com.flagship.trade_ledger.identity.HeaderIdentityProvider;
import com.flagship.trade_ledger.identity.IdentityProvider;
import com.flagship.trade_ledger.operation.dto.OperationRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

/**
 * REST Controller for ledger operations.
 *
 * Key features:
 * - One endpoint per verb; the operation name travels in the path
 * - Positional string arguments in the body as {@code {"args": [...]}}
 * - Caller identity from the {@code X-Principal} headers set by the gateway
 * - Failures are mapped to HTTP status codes by the global exception handler
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private static final Set<String> TEXT_RESULTS = Set.of("ping", "get_username", "check_unique_invoice");
    private static final String RAW_RESULT = "read";

    private final OperationDispatcher dispatcher;

    @PostMapping("/invoke/{operation}")
    public ResponseEntity<byte[]> invoke(@PathVariable String operation,
                                         @Valid @RequestBody OperationRequest request,
                                         HttpServletRequest servletRequest) {
        log.info("Received invoke request: operation={}, args={}", operation, request.getArgs().size());
        IdentityProvider identity = new HeaderIdentityProvider(servletRequest);
        return respond(operation, dispatcher.invoke(operation, request.getArgs(), identity));
    }

    @PostMapping("/query/{operation}")
    public ResponseEntity<byte[]> query(@PathVariable String operation,
                                        @Valid @RequestBody OperationRequest request,
                                        HttpServletRequest servletRequest) {
        log.debug("Received query request: operation={}, args={}", operation, request.getArgs().size());
        IdentityProvider identity = new HeaderIdentityProvider(servletRequest);
        return respond(operation, dispatcher.query(operation, request.getArgs(), identity));
    }

    private static ResponseEntity<byte[]> respond(String operation, byte[] payload) {
        if (payload.length == 0) {
            return ResponseEntity.noContent().build();
        }
        MediaType contentType;
        if (TEXT_RESULTS.contains(operation)) {
            contentType = MediaType.TEXT_PLAIN;
        } else if (RAW_RESULT.equals(operation)) {
            contentType = MediaType.APPLICATION_OCTET_STREAM;
        } else {
            contentType = MediaType.APPLICATION_JSON;
        }
        return ResponseEntity.ok().contentType(contentType).body(payload);
    }
}
