package com.gillianbc.rothprojection.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * Identifier shared by every account and income stream, real or synthetic.
 * Synthetic ids live under a reserved prefix that real ids may not use, so the two can never collide.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountId implements Comparable<AccountId> {

    static final String SYNTHETIC_PREFIX = "synthetic:";

    String value;

    public static AccountId of(String value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("account id must not be blank");
        }
        if (value.startsWith(SYNTHETIC_PREFIX)) {
            throw new IllegalArgumentException("account id " + value + " uses the reserved prefix " + SYNTHETIC_PREFIX);
        }
        return new AccountId(value);
    }

    static AccountId synthetic(String kind, int sequence) {
        return new AccountId(SYNTHETIC_PREFIX + kind + ":" + sequence);
    }

    public boolean isSynthetic() {
        return value.startsWith(SYNTHETIC_PREFIX);
    }

    @Override
    public int compareTo(AccountId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
