package com.nosota.landmarket.dto;

import java.time.Duration;

/**
 * Result of the underpriced-sale cooldown check.
 *
 * @param restricted True if the seller may not sell right now
 * @param remaining  Time left until the restriction lifts, {@link Duration#ZERO} when not restricted
 */
public record CooldownStatus(boolean restricted, Duration remaining) {

    public static CooldownStatus unrestricted() {
        return new CooldownStatus(false, Duration.ZERO);
    }
}
