package com.botstate.ledger;

import com.botstate.config.StorageConfig;
import com.botstate.domain.enums.Side;
import com.botstate.domain.model.LedgerEntry;
import com.botstate.domain.model.LedgerHolding;
import com.botstate.exception.StateStorageException;
import com.botstate.exception.ValidationException;
import com.botstate.io.AtomicFiles;
import com.botstate.io.JsonLinesReader;
import com.botstate.mapper.StateJson;
import com.botstate.validation.RecordValidator;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Append-only record of confirmed fills, one JSON line per entry in the working copy.
 *
 * <p>The ledger is the source of truth for trade history: the Position Store can be
 * rebuilt from it, and the reconciler asks it who bought an untracked holding. Entries
 * are never rewritten. Append order is the only order the file guarantees; entry
 * timestamps may be skewed across runs.
 */
@Component
public class Ledger {

    private static final Logger log = LoggerFactory.getLogger(Ledger.class);

    private static final int PRICE_SCALE = 4;

    private final StorageConfig storageConfig;
    private final RecordValidator recordValidator;

    public Ledger(StorageConfig storageConfig, RecordValidator recordValidator) {
        this.storageConfig = storageConfig;
        this.recordValidator = recordValidator;
    }

    public Path path() {
        return storageConfig.ledgerFile();
    }

    /**
     * Appends a fill. The line is on disk when this returns.
     *
     * @throws ValidationException if the entry is incomplete or out of range; nothing is written
     */
    public void append(LedgerEntry entry) {
        recordValidator.validate(entry, "ledger entry");
        try {
            AtomicFiles.appendLine(path(), StateJson.toLine(entry));
        } catch (IOException e) {
            throw new StateStorageException("Failed to append to ledger " + path(), e);
        }
        log.info(
                "[LEDGER] Appended {} {} x{} @ {} for strategy {}",
                entry.getSide(),
                entry.getCode(),
                entry.getQty(),
                entry.getPrice(),
                entry.getStrategyId());
    }

    /**
     * All readable entries in append order. Lazy and restartable: every call reads the
     * file from the start. Malformed lines are skipped with a warning. Close the stream.
     */
    public Stream<LedgerEntry> iterate() {
        Path ledgerPath = path();
        return JsonLinesReader.lines(ledgerPath, 0)
                .map(line -> parse(ledgerPath, line))
                .filter(Objects::nonNull);
    }

    /**
     * Latest BUY of the code by entry timestamp. Of several BUYs with the same timestamp
     * the one appended last wins.
     */
    public Optional<LedgerEntry> findLatestBuy(String code) {
        LedgerEntry latest = null;
        try (Stream<LedgerEntry> entries = iterate()) {
            for (LedgerEntry entry : (Iterable<LedgerEntry>) entries::iterator) {
                if (entry.getSide() != Side.BUY || !entry.getCode().equals(code)) {
                    continue;
                }
                if (latest == null || !entry.getTimestamp().isBefore(latest.getTimestamp())) {
                    latest = entry;
                }
            }
        }
        return Optional.ofNullable(latest);
    }

    /**
     * Replays every fill into average-cost holdings per (code, strategy). SELLs reduce
     * quantity at the running average and book realized P&L; a holding sold down to zero
     * keeps its realized P&L with a null average price. Sorted by code, then strategy.
     */
    public List<LedgerHolding> rebuildPositions() {
        Map<String, LedgerHolding> holdings = new LinkedHashMap<>();
        Map<String, BigDecimal> totalCost = new LinkedHashMap<>();
        try (Stream<LedgerEntry> entries = iterate()) {
            entries.forEach(entry -> {
                String key = entry.getCode() + "|" + entry.getStrategyId();
                LedgerHolding holding = holdings.computeIfAbsent(key, k -> LedgerHolding.builder()
                        .code(entry.getCode())
                        .strategyId(entry.getStrategyId())
                        .build());
                BigDecimal cost = totalCost.getOrDefault(key, BigDecimal.ZERO);
                BigDecimal qty = BigDecimal.valueOf(entry.getQty());
                if (entry.getSide() == Side.BUY) {
                    cost = cost.add(entry.getPrice().multiply(qty));
                    holding.setQty(holding.getQty() + entry.getQty());
                    holding.setAvgPrice(cost.divide(BigDecimal.valueOf(holding.getQty()), PRICE_SCALE, RoundingMode.HALF_UP));
                    if (holding.getFirstBuyTs() == null) {
                        holding.setFirstBuyTs(entry.getTimestamp());
                    }
                } else {
                    BigDecimal avg = holding.getAvgPrice() != null ? holding.getAvgPrice() : BigDecimal.ZERO;
                    BigDecimal costBasis = avg.multiply(qty);
                    holding.setRealizedPnl(holding.getRealizedPnl().add(entry.getPrice().multiply(qty)).subtract(costBasis));
                    cost = cost.subtract(costBasis);
                    holding.setQty(holding.getQty() - entry.getQty());
                    if (holding.getQty() <= 0) {
                        if (holding.getQty() < 0) {
                            log.warn("[LEDGER] SELL exceeds holding for {} ({}), clamping to zero", entry.getCode(), entry.getStrategyId());
                        }
                        holding.setQty(0);
                        holding.setAvgPrice(null);
                        cost = BigDecimal.ZERO;
                    }
                }
                totalCost.put(key, cost);
            });
        }
        List<LedgerHolding> result = new ArrayList<>(holdings.values());
        result.sort(Comparator.comparing(LedgerHolding::getCode).thenComparing(LedgerHolding::getStrategyId));
        return result;
    }

    private LedgerEntry parse(Path ledgerPath, JsonLinesReader.Line line) {
        LedgerEntry entry;
        try {
            entry = StateJson.fromLine(line.text(), LedgerEntry.class);
        } catch (IOException e) {
            log.warn("[LEDGER] Skipping malformed line at offset {} of {}: {}", line.startOffset(), ledgerPath, e.getMessage());
            return null;
        }
        try {
            recordValidator.validate(entry, "ledger entry");
        } catch (ValidationException e) {
            log.warn("[LEDGER] Skipping invalid entry at offset {} of {}: {}", line.startOffset(), ledgerPath, e.getMessage());
            return null;
        }
        return entry;
    }
}
