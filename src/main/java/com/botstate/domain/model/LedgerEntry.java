package com.botstate.domain.model;

import com.botstate.domain.enums.Side;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.TreeMap;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One confirmed fill in the append-only ledger.
 *
 * <p>Entries are immutable once appended. Timestamps come from the bot's clock and may
 * be out of order across runs (clock skew), so consumers that care about recency sort
 * explicitly instead of trusting append order.
 *
 * <p>{@code meta} is free-form; the reconciler reads {@code meta.engine} when it adopts
 * an entry's attribution.
 */
@Value
@Builder
@Jacksonized
public class LedgerEntry {

    public static final String META_ENGINE = "engine";

    @NotNull
    OffsetDateTime timestamp;

    @NotNull
    @Pattern(regexp = "\\d{6}", message = "must be a 6-digit instrument code")
    String code;

    @NotBlank
    String strategyId;

    @NotNull
    Side side;

    @Positive
    int qty;

    @NotNull
    @Positive
    BigDecimal price;

    @NotNull
    @Builder.Default
    Map<String, Object> meta = new TreeMap<>();

    /** meta.engine as text, or null when absent or blank. */
    public String engineOrNull() {
        Object engine = meta != null ? meta.get(META_ENGINE) : null;
        if (engine == null || engine.toString().isBlank()) {
            return null;
        }
        return engine.toString();
    }
}
