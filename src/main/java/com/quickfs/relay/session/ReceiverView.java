package com.quickfs.relay.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Display-safe projection of a {@link Receiver}, one entry of {@code receivers_update}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReceiverView(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("public_key") String publicKey,
        @JsonProperty("connected_at") Instant connectedAt) {
}
