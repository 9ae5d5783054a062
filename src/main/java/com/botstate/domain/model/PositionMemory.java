package com.botstate.domain.model;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.TreeMap;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Best-effort per-code hints kept next to the lots: last broker price, when the code
 * last changed at the broker, and its last owner. May be stale or missing; it never
 * outranks the ledger or the rebalance bucket during attribution recovery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionMemory {

    @Builder.Default
    private Map<String, BigDecimal> lastPrice = new TreeMap<>();

    @Builder.Default
    private Map<String, OffsetDateTime> lastSeen = new TreeMap<>();

    @Builder.Default
    private Map<String, String> lastStrategyId = new TreeMap<>();

    public static PositionMemory empty() {
        return PositionMemory.builder().build();
    }

    public PositionMemory copy() {
        return PositionMemory.builder()
                .lastPrice(new TreeMap<>(nullSafe(lastPrice)))
                .lastSeen(new TreeMap<>(nullSafe(lastSeen)))
                .lastStrategyId(new TreeMap<>(nullSafe(lastStrategyId)))
                .build();
    }

    private static <V> Map<String, V> nullSafe(Map<String, V> map) {
        return map != null ? map : Map.of();
    }
}
