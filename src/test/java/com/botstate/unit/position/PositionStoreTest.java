package com.botstate.unit.position;

import static com.botstate.unit.StateFixtures.NOW;
import static com.botstate.unit.StateFixtures.lot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.botstate.domain.model.Attribution;
import com.botstate.domain.model.PositionLot;
import com.botstate.domain.model.PositionState;
import com.botstate.exception.NotFoundException;
import com.botstate.exception.StateCorruptionException;
import com.botstate.exception.ValidationException;
import com.botstate.position.PositionStore;
import com.botstate.unit.StateFixtures;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("PositionStore")
class PositionStoreTest {

    @TempDir
    Path tempDir;

    private PositionStore positionStore;

    @BeforeEach
    void setUp() {
        positionStore = new PositionStore(StateFixtures.storageConfig(tempDir), StateFixtures.CLOCK);
    }

    @Nested
    @DisplayName("Load and save")
    class LoadAndSave {

        @Test
        @DisplayName("starts empty when the file does not exist")
        void missingFile() {
            PositionState state = positionStore.load();

            assertThat(state.getPositions()).isEmpty();
            assertThat(state.getSchemaVersion()).isEqualTo(PositionState.SCHEMA_VERSION);
        }

        @Test
        @DisplayName("round-trips installed state through the file")
        void roundTrip() {
            PositionState state = PositionState.empty();
            state.putLot(lot("005930", "momentum", 10, "70000", NOW));
            state.getMemory().getLastPrice().put("005930", new BigDecimal("70000"));
            positionStore.install(state);

            PositionStore reopened = new PositionStore(StateFixtures.storageConfig(tempDir), StateFixtures.CLOCK);
            PositionState loaded = reopened.load();

            assertThat(loaded).isEqualTo(state);
            assertThat(PositionStore.serialize(loaded)).isEqualTo(PositionStore.serialize(state));
        }

        @Test
        @DisplayName("re-keys lots stored under a plain code")
        void rekeysLegacyKeys() throws IOException {
            write("""
                    {"schema_version": 1, "positions": {"005930": {"code": "005930", "sid": "momentum",
                      "qty": 10, "avg_price": 70000, "entry_ts": "2024-05-01T09:00:00+09:00"}}}
                    """);

            PositionState state = positionStore.load();

            assertThat(state.getPositions()).containsOnlyKeys("005930|momentum");
            assertThat(state.getMemory()).isNotNull();
        }

        @Test
        @DisplayName("reports a missing schema_version instead of resetting")
        void missingSchemaVersion() throws IOException {
            write("{\"positions\": {}}");

            assertThatThrownBy(() -> positionStore.load())
                    .isInstanceOf(StateCorruptionException.class)
                    .hasMessageContaining("schema_version");
        }

        @Test
        @DisplayName("reports lots with a placeholder sid")
        void placeholderSid() throws IOException {
            write("""
                    {"schema_version": 1, "positions": {"005930|UNKNOWN": {"code": "005930", "sid": "UNKNOWN",
                      "qty": 10, "avg_price": 70000}}}
                    """);

            assertThatThrownBy(() -> positionStore.load()).isInstanceOf(StateCorruptionException.class);
        }

        @Test
        @DisplayName("reports a file that is not JSON")
        void notJson() throws IOException {
            write("{\"schema_version\": 1, \"positions\": ");

            assertThatThrownBy(() -> positionStore.load()).isInstanceOf(StateCorruptionException.class);
        }

        private void write(String content) throws IOException {
            Files.createDirectories(positionStore.path().getParent());
            Files.writeString(positionStore.path(), content, StandardCharsets.UTF_8);
        }
    }

    @Nested
    @DisplayName("Fills")
    class Fills {

        @BeforeEach
        void load() {
            positionStore.load();
        }

        @Test
        @DisplayName("BUY creates a lot with entry time, watermark and owner memory")
        void buyCreatesLot() {
            PositionLot lot = positionStore.applyBuyFill(
                    "005930", Attribution.strategy("momentum"), "swing", 10, new BigDecimal("70000"));

            assertThat(lot.getSid()).isEqualTo("momentum");
            assertThat(lot.getEngine()).isEqualTo("swing");
            assertThat(lot.getEntryTs()).isEqualTo(NOW);
            assertThat(lot.getHighWatermark()).isEqualByComparingTo("70000");
            assertThat(positionStore.current().getMemory().getLastStrategyId()).containsEntry("005930", "momentum");
            assertThat(Files.exists(positionStore.path())).isTrue();
        }

        @Test
        @DisplayName("BUY on an existing lot averages the price by quantity")
        void buyAverages() {
            positionStore.applyBuyFill("005930", Attribution.strategy("momentum"), null, 10, new BigDecimal("70000"));
            PositionLot lot = positionStore.applyBuyFill(
                    "005930", Attribution.strategy("momentum"), null, 30, new BigDecimal("74000"));

            assertThat(lot.getQty()).isEqualTo(40);
            assertThat(lot.getAvgPrice()).isEqualByComparingTo("73000");
            assertThat(lot.getHighWatermark()).isEqualByComparingTo("73000");
        }

        @Test
        @DisplayName("bucket owners record their bucket engine")
        void bucketEngine() {
            PositionLot lot = positionStore.applyBuyFill("005930", Attribution.manual(), null, 1, new BigDecimal("70000"));

            assertThat(lot.getEngine()).isEqualTo("manual");
        }

        @Test
        @DisplayName("SELL takes from the requested lot first and spills to the oldest other lot")
        void sellSpills() {
            PositionState state = PositionState.empty();
            state.putLot(lot("005930", "old", 5, "69000", NOW.minusDays(2)));
            state.putLot(lot("005930", "newer", 5, "69500", NOW.minusDays(1)));
            state.putLot(lot("005930", "momentum", 3, "70000", NOW));
            positionStore.install(state);

            int sold = positionStore.applySellFill("005930", Attribution.strategy("momentum"), 6);

            assertThat(sold).isEqualTo(6);
            assertThat(positionStore.lotsFor("005930"))
                    .extracting(PositionLot::getSid, PositionLot::getQty)
                    .containsExactly(
                            tuple("old", 2),
                            tuple("newer", 5));
            assertThat(positionStore.totalQty("005930")).isEqualTo(7);
        }

        @Test
        @DisplayName("SELL beyond the holding removes every lot and reports what was sold")
        void oversell() {
            positionStore.applyBuyFill("005930", Attribution.strategy("momentum"), null, 4, new BigDecimal("70000"));

            int sold = positionStore.applySellFill("005930", Attribution.strategy("momentum"), 10);

            assertThat(sold).isEqualTo(4);
            assertThat(positionStore.current().getPositions()).isEmpty();
        }

        @Test
        @DisplayName("rejects fills with non-positive quantity or price")
        void rejectsInvalidFills() {
            assertThatThrownBy(() -> positionStore.applyBuyFill(
                            "005930", Attribution.manual(), null, 0, new BigDecimal("70000")))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> positionStore.applyBuyFill(
                            "005930", Attribution.manual(), null, 1, BigDecimal.ZERO))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> positionStore.applySellFill("005930", Attribution.manual(), 0))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Markers")
    class Markers {

        @BeforeEach
        void seed() {
            positionStore.load();
            positionStore.applyBuyFill("005930", Attribution.strategy("momentum"), null, 10, new BigDecimal("70000"));
        }

        @Test
        @DisplayName("high watermark only moves up")
        void highWatermark() {
            positionStore.updateHighWatermark("005930", "momentum", new BigDecimal("75000"));
            PositionLot lot = positionStore.updateHighWatermark("005930", "momentum", new BigDecimal("72000"));

            assertThat(lot.getHighWatermark()).isEqualByComparingTo("75000");
        }

        @Test
        @DisplayName("flags accept booleans and decimals only")
        void flags() {
            PositionLot lot = positionStore.setFlag("005930", "momentum", "tp1_done", true);
            positionStore.setFlag("005930", "momentum", "trail_pct", new BigDecimal("0.05"));

            assertThat(lot.getFlags()).containsEntry("tp1_done", true);
            assertThat(positionStore.lotsFor("005930").get(0).getFlags()).containsKeys("tp1_done", "trail_pct");
            assertThatThrownBy(() -> positionStore.setFlag("005930", "momentum", "note", "text"))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("unknown lots are reported as not found")
        void unknownLot() {
            assertThatThrownBy(() -> positionStore.setFlag("005930", "swing", "tp1_done", true))
                    .isInstanceOf(NotFoundException.class);
        }
    }
}
