package com.flagship.trade_ledger.operation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for invoking or querying a ledger operation: its positional arguments.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class OperationRequest {

    @NotNull(message = "Arguments are required")
    @JsonProperty("args")
    private List<@NotNull(message = "Arguments must not be null") String> args = new ArrayList<>();
}
