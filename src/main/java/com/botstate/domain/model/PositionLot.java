package com.botstate.domain.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An open position in one instrument owned by one strategy or bucket.
 *
 * <p>A lot only exists while {@code qty > 0}; the store deletes it the moment it
 * reaches zero. {@code highWatermark} starts at the average price and is raised by the
 * strategy layer as prices move. {@code flags} holds boolean/decimal markers the exit
 * logic sets (e.g. partial take-profit done).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PositionLot {

    private String code;
    private String sid;

    /** Execution path that opened the lot (strategy engine, rebalance, manual...). */
    private String engine;

    private int qty;
    private BigDecimal avgPrice;
    private OffsetDateTime entryTs;
    private BigDecimal highWatermark;

    @Builder.Default
    private Map<String, Object> flags = new TreeMap<>();

    private OffsetDateTime lastUpdateTs;

    /** Parsed {@link #getSid()}; empty when the sid is blank or a placeholder. */
    public Optional<Attribution> attribution() {
        return Attribution.tryParse(sid);
    }

    /** Store key of this lot. */
    public String key() {
        return PositionState.lotKey(code, sid);
    }

    /** Copy with its own flag map, so mutations never leak between snapshots. */
    public PositionLot copy() {
        return toBuilder().flags(flags == null ? new TreeMap<>() : new TreeMap<>(flags)).build();
    }
}
