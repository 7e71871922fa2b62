package com.worksuite.security.tenant;

import java.util.Locale;
import java.util.Optional;

/**
 * Commercial plan of a workspace. {@link #FREE} is the trial tier; the others are paid.
 */
public enum PlanType {

    FREE("free"),
    BASIC("basic"),
    PREMIUM("premium"),
    ENTERPRISE("enterprise");

    private final String value;

    PlanType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isPaid() {
        return this != FREE;
    }

    /**
     * Unknown or missing values read as {@link #FREE}, the most restrictive tier.
     */
    public static PlanType fromValue(String value) {
        return parse(value).orElse(FREE);
    }

    public static Optional<PlanType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (PlanType plan : values()) {
            if (plan.value.equals(normalized)) {
                return Optional.of(plan);
            }
        }
        return Optional.empty();
    }
}
