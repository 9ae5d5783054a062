package com.botstate.domain.model;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The Position Store snapshot: every open lot keyed by {@code <code>|<sid>}, plus the
 * recovery memory.
 *
 * <p>{@code schemaVersion} is mandatory in the file and only changes through an explicit
 * migration. Keying by (code, sid) lets several strategies hold the same instrument.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionState {

    public static final int SCHEMA_VERSION = 1;

    private Integer schemaVersion;
    private OffsetDateTime updatedAt;

    @Builder.Default
    private Map<String, PositionLot> positions = new TreeMap<>();

    @Builder.Default
    private PositionMemory memory = PositionMemory.empty();

    public static PositionState empty() {
        return PositionState.builder().schemaVersion(SCHEMA_VERSION).build();
    }

    public static String lotKey(String code, String sid) {
        return code + "|" + sid;
    }

    /** Deep copy; the reconciler works on one so a failed run never touches the original. */
    public PositionState copy() {
        Map<String, PositionLot> lots = new TreeMap<>();
        positions.forEach((key, lot) -> lots.put(key, lot.copy()));
        return PositionState.builder()
                .schemaVersion(schemaVersion)
                .updatedAt(updatedAt)
                .positions(lots)
                .memory(memory != null ? memory.copy() : PositionMemory.empty())
                .build();
    }

    /** Lots of one code, oldest entry first. */
    public List<PositionLot> lotsFor(String code) {
        List<PositionLot> lots = new ArrayList<>();
        for (PositionLot lot : positions.values()) {
            if (lot.getCode().equals(code)) {
                lots.add(lot);
            }
        }
        lots.sort(Comparator.comparing(PositionLot::getEntryTs, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(PositionLot::getSid));
        return lots;
    }

    public SortedSet<String> codes() {
        SortedSet<String> codes = new TreeSet<>();
        positions.values().forEach(lot -> codes.add(lot.getCode()));
        return codes;
    }

    public int totalQty(String code) {
        return lotsFor(code).stream().mapToInt(PositionLot::getQty).sum();
    }

    public void putLot(PositionLot lot) {
        positions.put(lot.key(), lot);
    }

    public void removeLot(PositionLot lot) {
        positions.remove(lot.key());
    }
}
