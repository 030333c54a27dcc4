package org.nowstart.scalper.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nowstart.scalper.data.model.Position;
import org.nowstart.scalper.data.type.PositionStatus;
import org.nowstart.scalper.support.TradingPropertiesFixture;

class PositionRepositoryTest {

    @TempDir
    Path tempDir;

    private PositionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new PositionRepository(
                new JsonDocumentStore(),
                TradingPropertiesFixture.builder().dataDirectory(tempDir.toString()).build()
        );
    }

    @Test
    void loadAll_returnsEmptyWhenFileIsMissing() {
        assertThat(repository.loadAll()).isEmpty();
    }

    @Test
    void saveAll_reloadsEveryFieldExactly() {
        Position position = position("BTCZAR_1", "0.00012345", "1234567.89");

        repository.saveAll(List.of(position));
        Map<String, Position> loaded = repository.loadAll();

        assertThat(loaded).containsOnlyKeys("BTCZAR_1");
        assertThat(loaded.get("BTCZAR_1")).usingRecursiveComparison().isEqualTo(position);
        assertThat(loaded.get("BTCZAR_1").getQuantity().toPlainString()).isEqualTo("0.00012345");
    }

    @Test
    void save_writesAtomicallyWithoutLeavingTempFile() throws Exception {
        repository.save(position("BTCZAR_1", "0.5", "100"));

        assertThat(repository.file()).exists();
        assertThat(Files.exists(tempDir.resolve(PositionRepository.FILE_NAME + ".tmp"))).isFalse();
        assertThat(Files.readString(repository.file())).contains("\"BTCZAR_1\"").contains("\"0.5\"");
    }

    @Test
    void save_mergesWithExistingPositions() {
        repository.save(position("BTCZAR_1", "0.5", "100"));
        repository.save(position("ETHZAR_2", "1.2", "50000"));

        assertThat(repository.loadAll()).containsOnlyKeys("BTCZAR_1", "ETHZAR_2");
    }

    @Test
    void delete_removesOnlyTheGivenPosition() {
        repository.saveAll(List.of(position("BTCZAR_1", "0.5", "100"), position("ETHZAR_2", "1.2", "50000")));

        repository.delete("BTCZAR_1");
        repository.delete("unknown");

        assertThat(repository.loadAll()).containsOnlyKeys("ETHZAR_2");
    }

    private Position position(String id, String quantity, String entryPrice) {
        return Position.builder()
                .id(id)
                .pair(id.substring(0, id.indexOf('_')))
                .quantity(new BigDecimal(quantity))
                .entryPrice(new BigDecimal(entryPrice))
                .stopLossPrice(new BigDecimal("98.00"))
                .takeProfitPrice(new BigDecimal("101.50"))
                .createdAt(Instant.parse("2026-03-01T10:15:30.123Z"))
                .entryFilledAt(Instant.parse("2026-03-01T10:15:31Z"))
                .status(PositionStatus.OPEN)
                .entryOrderId("entry-1")
                .takeProfitOrderId("tp-1")
                .stopLossOrderId("sl-1")
                .build();
    }
}
