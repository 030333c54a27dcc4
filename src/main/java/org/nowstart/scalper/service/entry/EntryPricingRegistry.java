package org.nowstart.scalper.service.entry;

import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.scalper.data.type.EntryPricing;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EntryPricingRegistry {

    private final List<EntryPricingStrategy> strategies;
    private Map<EntryPricing, EntryPricingStrategy> strategiesByType = Map.of();

    @PostConstruct
    void init() {
        Map<EntryPricing, EntryPricingStrategy> byType = new EnumMap<>(EntryPricing.class);
        for (EntryPricingStrategy strategy : strategies) {
            EntryPricingStrategy previous = byType.put(strategy.type(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate entry pricing strategy registered for type=" + strategy.type());
            }
        }
        strategiesByType = Map.copyOf(byType);
    }

    public EntryPricingStrategy getRequired(EntryPricing type) {
        EntryPricingStrategy strategy = strategiesByType.get(type);
        if (strategy == null) {
            throw new IllegalStateException("No entry pricing strategy registered for type=" + type);
        }
        return strategy;
    }
}
