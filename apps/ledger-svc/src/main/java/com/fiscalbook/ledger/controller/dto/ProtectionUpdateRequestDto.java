package com.fiscalbook.ledger.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.AssertTrue;

/**
 * Bound as a raw node so that strings and numbers are rejected instead of being coerced.
 */
public record ProtectionUpdateRequestDto(@JsonProperty("isProtected") JsonNode isProtected) {

    @JsonIgnore
    @AssertTrue(message = "isProtected must be a boolean")
    public boolean isBooleanFlag() {
        return isProtected != null && isProtected.isBoolean();
    }

    public boolean protectedFlag() {
        return isProtected.booleanValue();
    }
}
