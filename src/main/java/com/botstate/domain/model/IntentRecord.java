package com.botstate.domain.model;

import com.botstate.domain.enums.Side;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.OffsetDateTime;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An order a strategy proposes, recorded before anything is sent to the broker.
 * Never mutated after append.
 */
@Value
@Builder
@Jacksonized
public class IntentRecord {

    @NotBlank
    String intentId;

    @NotNull
    OffsetDateTime ts;

    @NotBlank
    String strategyId;

    @NotNull
    @Pattern(regexp = "\\d{6}", message = "must be a 6-digit instrument code")
    String code;

    @NotNull
    Side side;

    /** Suggested quantity; the executor may size differently. */
    @PositiveOrZero
    Integer qtyHint;

    String rationale;
}
