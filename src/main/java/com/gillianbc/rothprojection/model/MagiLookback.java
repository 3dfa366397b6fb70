package com.gillianbc.rothprojection.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * The MAGI an IRMAA determination looks back to, or its absence for the first simulated years
 * when no earlier MAGI was supplied.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MagiLookback {

    int lookbackYear;
    BigDecimal magi;
    boolean available;

    public static MagiLookback of(int lookbackYear, BigDecimal magi) {
        return new MagiLookback(lookbackYear, Objects.requireNonNull(magi, "magi must not be null"), true);
    }

    public static MagiLookback unavailable(int lookbackYear) {
        return new MagiLookback(lookbackYear, null, false);
    }
}
