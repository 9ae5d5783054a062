package com.botstate.position;

import com.botstate.config.StorageConfig;
import com.botstate.domain.model.Attribution;
import com.botstate.domain.model.PositionLot;
import com.botstate.domain.model.PositionMemory;
import com.botstate.domain.model.PositionState;
import com.botstate.exception.NotFoundException;
import com.botstate.exception.StateCorruptionException;
import com.botstate.exception.StateStorageException;
import com.botstate.exception.ValidationException;
import com.botstate.io.AtomicFiles;
import com.botstate.mapper.StateJson;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Working copy of the Position Store: the bot's current belief about open lots.
 *
 * <p>Holds the loaded snapshot in memory and writes it back atomically after every
 * mutation. The strategy layer calls the fill methods; the reconciler replaces the
 * whole snapshot through {@link #install}. Callers get copies, never the live state.
 *
 * <p>Not thread-safe. One run owns the store at a time.
 */
@Component
public class PositionStore {

    private static final Logger log = LoggerFactory.getLogger(PositionStore.class);

    private static final Pattern CODE = Pattern.compile("\\d{6}");
    private static final int PRICE_SCALE = 4;

    private final StorageConfig storageConfig;
    private final Clock clock;

    private PositionState state = PositionState.empty();

    public PositionStore(StorageConfig storageConfig, Clock clock) {
        this.storageConfig = storageConfig;
        this.clock = clock;
    }

    public Path path() {
        return storageConfig.positionsFile();
    }

    /**
     * Loads the working copy file. A missing file yields an empty store.
     *
     * @throws StateCorruptionException if the file exists but cannot be trusted
     */
    public PositionState load() {
        Path path = path();
        if (!Files.exists(path)) {
            log.info("[POSITIONS] No position file at {}, starting empty", path);
            state = PositionState.empty();
            return current();
        }
        try {
            state = parse(path.toString(), Files.readAllBytes(path));
        } catch (IOException e) {
            throw new StateStorageException("Failed to read position store " + path, e);
        }
        log.info("[POSITIONS] Loaded {} lots from {}", state.getPositions().size(), path);
        return current();
    }

    /** Writes the in-memory snapshot to the working copy. */
    public void save() {
        try {
            AtomicFiles.write(path(), serialize(state));
        } catch (IOException e) {
            throw new StateStorageException("Failed to write position store " + path(), e);
        }
    }

    /** Replaces the whole snapshot (restore or reconcile) and saves it. */
    public void install(PositionState newState) {
        state = newState.copy();
        save();
        log.info("[POSITIONS] Installed snapshot with {} lots", state.getPositions().size());
    }

    /** Copy of the current snapshot. */
    public PositionState current() {
        return state.copy();
    }

    public List<PositionLot> lotsFor(String code) {
        List<PositionLot> copies = new ArrayList<>();
        state.lotsFor(code).forEach(lot -> copies.add(lot.copy()));
        return copies;
    }

    public int totalQty(String code) {
        return state.totalQty(code);
    }

    /**
     * Adds a BUY fill to the (code, owner) lot, creating it when absent. The average
     * price becomes the quantity-weighted average; the high watermark never drops below it.
     */
    public PositionLot applyBuyFill(String code, Attribution owner, String engine, int qty, BigDecimal price) {
        requireCode(code);
        if (qty <= 0 || price == null || price.signum() <= 0) {
            throw new ValidationException("BUY fill needs qty > 0 and price > 0, got qty=" + qty + " price=" + price);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        PositionLot lot = state.getPositions().get(PositionState.lotKey(code, owner.sid()));
        if (lot == null) {
            lot = PositionLot.builder()
                    .code(code)
                    .sid(owner.sid())
                    .engine(engine != null ? engine : owner.bucketEngine())
                    .qty(qty)
                    .avgPrice(price)
                    .entryTs(now)
                    .highWatermark(price)
                    .flags(new TreeMap<>())
                    .lastUpdateTs(now)
                    .build();
        } else {
            int newQty = lot.getQty() + qty;
            BigDecimal cost = lot.getAvgPrice()
                    .multiply(BigDecimal.valueOf(lot.getQty()))
                    .add(price.multiply(BigDecimal.valueOf(qty)));
            lot.setAvgPrice(cost.divide(BigDecimal.valueOf(newQty), PRICE_SCALE, RoundingMode.HALF_UP));
            lot.setQty(newQty);
            if (lot.getHighWatermark() == null || lot.getHighWatermark().compareTo(lot.getAvgPrice()) < 0) {
                lot.setHighWatermark(lot.getAvgPrice());
            }
            lot.setLastUpdateTs(now);
        }
        state.putLot(lot);
        state.getMemory().getLastStrategyId().put(code, owner.sid());
        touch(now);
        log.info("[POSITIONS] BUY {} x{} @ {} -> lot {} qty={}", code, qty, price, lot.key(), lot.getQty());
        return lot.copy();
    }

    /**
     * Removes a SELL fill, taking from the requested owner's lot first and then from the
     * other lots of the code, oldest entry first. Lots reaching zero are deleted.
     *
     * @return quantity actually removed; less than {@code qty} only when the store held less
     */
    public int applySellFill(String code, Attribution owner, int qty) {
        requireCode(code);
        if (qty <= 0) {
            throw new ValidationException("SELL fill needs qty > 0, got " + qty);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<PositionLot> order = new ArrayList<>();
        PositionLot requested = owner != null ? state.getPositions().get(PositionState.lotKey(code, owner.sid())) : null;
        if (requested != null) {
            order.add(requested);
        }
        for (PositionLot lot : state.lotsFor(code)) {
            if (lot != requested) {
                order.add(lot);
            }
        }
        int remaining = qty;
        for (PositionLot lot : order) {
            if (remaining == 0) {
                break;
            }
            int take = Math.min(remaining, lot.getQty());
            remaining -= take;
            lot.setQty(lot.getQty() - take);
            lot.setLastUpdateTs(now);
            if (lot.getQty() == 0) {
                state.removeLot(lot);
                log.info("[POSITIONS] Lot {} closed", lot.key());
            }
        }
        int sold = qty - remaining;
        if (remaining > 0) {
            log.warn("[POSITIONS] SELL {} x{} exceeds holding, removed {}", code, qty, sold);
        }
        touch(now);
        return sold;
    }

    /** Raises the lot's high watermark to {@code price}; lower prices are ignored. */
    public PositionLot updateHighWatermark(String code, String sid, BigDecimal price) {
        PositionLot lot = requireLot(code, sid);
        if (price != null && (lot.getHighWatermark() == null || price.compareTo(lot.getHighWatermark()) > 0)) {
            lot.setHighWatermark(price);
            lot.setLastUpdateTs(OffsetDateTime.now(clock));
            touch(lot.getLastUpdateTs());
        }
        return lot.copy();
    }

    /** Sets an exit-logic marker on the lot. Values are booleans or decimals. */
    public PositionLot setFlag(String code, String sid, String name, Object value) {
        if (!(value instanceof Boolean) && !(value instanceof BigDecimal)) {
            throw new ValidationException("Flag '" + name + "' must be a boolean or decimal");
        }
        PositionLot lot = requireLot(code, sid);
        lot.getFlags().put(name, value);
        lot.setLastUpdateTs(OffsetDateTime.now(clock));
        touch(lot.getLastUpdateTs());
        return lot.copy();
    }

    /** Canonical file content of a snapshot. */
    public static byte[] serialize(PositionState positionState) {
        return StateJson.toDocument(positionState);
    }

    /**
     * Parses and checks Position Store content. Lots are re-keyed from their own code and
     * sid, so files keyed by plain code load too.
     *
     * @throws StateCorruptionException if the content is not a usable version-1 snapshot
     */
    public static PositionState parse(String source, byte[] content) {
        PositionState parsed;
        try {
            parsed = StateJson.fromDocument(content, PositionState.class);
        } catch (IOException e) {
            throw new StateCorruptionException(source, "Position store is not valid JSON", e);
        }
        if (parsed == null) {
            throw new StateCorruptionException(source, "Position store is empty");
        }
        if (parsed.getSchemaVersion() == null) {
            throw new StateCorruptionException(source, "schema_version is missing");
        }
        if (parsed.getSchemaVersion() != PositionState.SCHEMA_VERSION) {
            throw new StateCorruptionException(source, "Unsupported schema_version " + parsed.getSchemaVersion());
        }
        Map<String, PositionLot> rekeyed = new TreeMap<>();
        if (parsed.getPositions() != null) {
            for (Map.Entry<String, PositionLot> entry : parsed.getPositions().entrySet()) {
                PositionLot lot = entry.getValue();
                checkLot(source, entry.getKey(), lot);
                if (lot.getQty() == 0) {
                    log.warn("[POSITIONS] Dropping empty lot {} from {}", entry.getKey(), source);
                    continue;
                }
                if (lot.getFlags() == null) {
                    lot.setFlags(new TreeMap<>());
                }
                if (rekeyed.put(lot.key(), lot) != null) {
                    throw new StateCorruptionException(source, "Duplicate lot " + lot.key());
                }
            }
        }
        parsed.setPositions(rekeyed);
        if (parsed.getMemory() == null) {
            parsed.setMemory(PositionMemory.empty());
        } else {
            parsed.setMemory(parsed.getMemory().copy());
        }
        return parsed;
    }

    private static void checkLot(String source, String key, PositionLot lot) {
        if (lot == null) {
            throw new StateCorruptionException(source, "Lot " + key + " is null");
        }
        if (lot.getCode() == null || !CODE.matcher(lot.getCode()).matches()) {
            throw new StateCorruptionException(source, "Lot " + key + " has no valid code");
        }
        if (Attribution.tryParse(lot.getSid()).isEmpty()) {
            throw new StateCorruptionException(source, "Lot " + key + " has no valid sid: '" + lot.getSid() + "'");
        }
        if (lot.getQty() < 0) {
            throw new StateCorruptionException(source, "Lot " + key + " has negative qty " + lot.getQty());
        }
        if (lot.getAvgPrice() == null || lot.getAvgPrice().signum() <= 0) {
            throw new StateCorruptionException(source, "Lot " + key + " has no positive avg_price");
        }
    }

    private PositionLot requireLot(String code, String sid) {
        PositionLot lot = state.getPositions().get(PositionState.lotKey(code, sid));
        if (lot == null) {
            throw new NotFoundException("Lot", PositionState.lotKey(code, sid));
        }
        return lot;
    }

    private static void requireCode(String code) {
        if (code == null || !CODE.matcher(code).matches()) {
            throw new ValidationException("Instrument code must be 6 digits: '" + code + "'");
        }
    }

    private void touch(OffsetDateTime now) {
        state.setUpdatedAt(now);
        save();
    }
}
