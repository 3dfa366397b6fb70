package com.gillianbc.rothprojection.ledger;

import com.gillianbc.rothprojection.exception.StateNotReadyException;
import com.gillianbc.rothprojection.model.MagiLookback;
import com.gillianbc.rothprojection.model.Money;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Append-only year to MAGI mapping for one plan run. May be seeded with MAGI already known for
 * years before the projection; projected years are then appended one at a time in order.
 * A recorded value is never replaced.
 */
public class MagiHistory {

    /** IRMAA for year Y is set from MAGI of year Y - 2. */
    public static final int LOOKBACK_YEARS = 2;

    private final int firstProjectedYear;
    private final NavigableMap<Integer, BigDecimal> magiByYear = new TreeMap<>();

    public MagiHistory(int firstProjectedYear) {
        this(firstProjectedYear, Collections.emptyMap());
    }

    public MagiHistory(int firstProjectedYear, Map<Integer, BigDecimal> priorMagi) {
        Objects.requireNonNull(priorMagi, "priorMagi must not be null");
        this.firstProjectedYear = firstProjectedYear;
        priorMagi.forEach((year, magi) -> {
            if (year >= firstProjectedYear) {
                throw new IllegalArgumentException("prior MAGI for " + year
                        + " must precede the first projected year " + firstProjectedYear);
            }
            magiByYear.put(year, Money.round(Objects.requireNonNull(magi, "prior MAGI must not be null")));
        });
    }

    public void record(int year, BigDecimal magi) {
        Objects.requireNonNull(magi, "magi must not be null");
        int expected = nextYear();
        if (year != expected) {
            throw new StateNotReadyException("MAGI recorded for " + year + " but the next year to compute is " + expected);
        }
        magiByYear.put(year, Money.round(magi));
    }

    public BigDecimal get(int year) {
        return find(year).orElseThrow(() ->
                new StateNotReadyException("MAGI for " + year + " has not been recorded"));
    }

    public Optional<BigDecimal> find(int year) {
        return Optional.ofNullable(magiByYear.get(year));
    }

    /**
     * MAGI that sets the IRMAA bracket for the given year. Years whose lookback falls before the
     * projection and was not supplied report the lookback as unavailable; a missing lookback inside
     * the projection means years were computed out of order.
     */
    public MagiLookback lookbackFor(int year) {
        int lookbackYear = year - LOOKBACK_YEARS;
        BigDecimal magi = magiByYear.get(lookbackYear);
        if (magi != null) {
            return MagiLookback.of(lookbackYear, magi);
        }
        if (lookbackYear < firstProjectedYear) {
            return MagiLookback.unavailable(lookbackYear);
        }
        throw new StateNotReadyException("MAGI lookback for " + year + " needs " + lookbackYear
                + ", which has not been computed");
    }

    public int getFirstProjectedYear() {
        return firstProjectedYear;
    }

    public Map<Integer, BigDecimal> asMap() {
        return Collections.unmodifiableMap(magiByYear);
    }

    private int nextYear() {
        Map.Entry<Integer, BigDecimal> last = magiByYear.lastEntry();
        if (last == null || last.getKey() < firstProjectedYear) {
            return firstProjectedYear;
        }
        return last.getKey() + 1;
    }
}
