package com.botstate.domain.model;

import com.botstate.domain.enums.AttributionKind;
import com.botstate.exception.ValidationException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Owner of a lot: a named strategy, a dated rebalance bucket, or MANUAL.
 *
 * <p>Instances only come from the factories below, so an attribution is never blank and
 * never one of the legacy placeholders ({@code UNKNOWN}, {@code ORPHAN}, ...). The
 * persisted {@code sid} is {@link #sid()}; {@link #tryParse} is its inverse.
 */
@Getter
@EqualsAndHashCode
public final class Attribution {

    public static final String MANUAL_SID = "MANUAL";
    public static final String REBALANCE_PREFIX = "REB_";

    private static final DateTimeFormatter BUCKET_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final Pattern REBALANCE_SID = Pattern.compile("REB_(\\d{8})");
    private static final Set<String> PLACEHOLDERS = Set.of("", "UNKNOWN", "ORPHAN", "NONE", "NULL", "NAN");

    private static final Attribution MANUAL = new Attribution(AttributionKind.MANUAL, null, null);

    private final AttributionKind kind;
    private final String strategyId;
    private final LocalDate bucketDate;

    private Attribution(AttributionKind kind, String strategyId, LocalDate bucketDate) {
        this.kind = kind;
        this.strategyId = strategyId;
        this.bucketDate = bucketDate;
    }

    public static Attribution strategy(String strategyId) {
        String id = strategyId == null ? "" : strategyId.trim();
        if (isPlaceholder(id)) {
            throw new ValidationException("Strategy id is blank or a placeholder: '" + strategyId + "'");
        }
        String upper = id.toUpperCase(Locale.ROOT);
        if (upper.equals(MANUAL_SID) || upper.startsWith(REBALANCE_PREFIX)) {
            throw new ValidationException("Strategy id collides with a reserved bucket: '" + strategyId + "'");
        }
        return new Attribution(AttributionKind.STRATEGY, id, null);
    }

    public static Attribution rebalance(LocalDate date) {
        if (date == null) {
            throw new ValidationException("Rebalance bucket needs a date");
        }
        return new Attribution(AttributionKind.REBALANCE, null, date);
    }

    public static Attribution manual() {
        return MANUAL;
    }

    /**
     * Parses a persisted sid. Returns empty for blank values, placeholders and
     * malformed rebalance buckets.
     */
    public static Optional<Attribution> tryParse(String sid) {
        if (sid == null) {
            return Optional.empty();
        }
        String text = sid.trim();
        String upper = text.toUpperCase(Locale.ROOT);
        if (isPlaceholder(text)) {
            return Optional.empty();
        }
        if (upper.equals(MANUAL_SID)) {
            return Optional.of(MANUAL);
        }
        if (upper.startsWith(REBALANCE_PREFIX)) {
            Matcher matcher = REBALANCE_SID.matcher(upper);
            if (!matcher.matches()) {
                return Optional.empty();
            }
            try {
                return Optional.of(rebalance(LocalDate.parse(matcher.group(1), BUCKET_DATE)));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.of(new Attribution(AttributionKind.STRATEGY, text, null));
    }

    public static boolean isPlaceholder(String sid) {
        return sid == null || PLACEHOLDERS.contains(sid.trim().toUpperCase(Locale.ROOT));
    }

    /** Canonical persisted form: the strategy id, {@code REB_yyyyMMdd} or {@code MANUAL}. */
    public String sid() {
        return switch (kind) {
            case STRATEGY -> strategyId;
            case REBALANCE -> REBALANCE_PREFIX + bucketDate.format(BUCKET_DATE);
            case MANUAL -> MANUAL_SID;
        };
    }

    /** Engine recorded on lots created for a bucket attribution; null for strategies. */
    public String bucketEngine() {
        return switch (kind) {
            case STRATEGY -> null;
            case REBALANCE -> "rebalance";
            case MANUAL -> "manual";
        };
    }

    @Override
    public String toString() {
        return sid();
    }
}
