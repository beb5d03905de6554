package br.com.pvss.webhookreceiver.model;

import java.time.Duration;
import java.time.Instant;

public record StoreHealth(
        String backend,
        String location,
        Duration ttl,
        boolean backendReachable,
        Instant now
) {
}
