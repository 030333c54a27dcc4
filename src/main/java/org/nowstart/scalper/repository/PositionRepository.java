package org.nowstart.scalper.repository;

import com.fasterxml.jackson.databind.JavaType;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scalper.data.model.Position;
import org.nowstart.scalper.data.property.TradingProperties;
import org.springframework.stereotype.Repository;

/**
 * Open positions as a single JSON object keyed by position id.
 */
@Slf4j
@Repository
public class PositionRepository {

    static final String FILE_NAME = "positions.json";

    private final JsonDocumentStore jsonDocumentStore;
    private final Path file;
    private final JavaType documentType;

    public PositionRepository(JsonDocumentStore jsonDocumentStore, TradingProperties tradingProperties) {
        this.jsonDocumentStore = jsonDocumentStore;
        this.file = Path.of(tradingProperties.dataDirectory(), FILE_NAME);
        this.documentType = jsonDocumentStore.mapType(String.class, Position.class);
    }

    public synchronized Map<String, Position> loadAll() {
        Map<String, Position> positions = jsonDocumentStore.<Map<String, Position>>read(file, documentType)
                .orElseGet(LinkedHashMap::new);
        return new LinkedHashMap<>(positions);
    }

    public synchronized void saveAll(Collection<Position> positions) {
        Map<String, Position> document = new LinkedHashMap<>();
        positions.forEach(position -> document.put(position.getId(), position));
        jsonDocumentStore.write(file, document);
        log.debug("event=positions_saved count={} file={}", document.size(), file);
    }

    public synchronized void save(Position position) {
        Map<String, Position> document = loadAll();
        document.put(position.getId(), position);
        jsonDocumentStore.write(file, document);
    }

    public synchronized void delete(String positionId) {
        Map<String, Position> document = loadAll();
        if (document.remove(positionId) != null) {
            jsonDocumentStore.write(file, document);
        }
    }

    Path file() {
        return file;
    }
}
