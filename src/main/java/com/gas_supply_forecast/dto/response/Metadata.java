package com.gas_supply_forecast.dto.response;

import java.time.Instant;
import java.util.UUID;

/**
 * Response stamp used to correlate a reply with the server log.
 */
public record Metadata(Instant timestamp, String transactionId) {

    public static Metadata now() {
        return new Metadata(Instant.now(), UUID.randomUUID().toString());
    }
}
