package com.changelab.mentor.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class StrategyRegistry {
    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    private final Map<String, StrategyDescriptor> descriptors;

    public StrategyRegistry(List<StrategyCatalog> catalogs) {
        Map<String, StrategyDescriptor> byKey = new LinkedHashMap<>();
        for (StrategyCatalog catalog : catalogs) {
            for (StrategyDescriptor descriptor : catalog.descriptors()) {
                if (byKey.putIfAbsent(descriptor.focusKey(), descriptor) != null) {
                    throw new IllegalStateException("Duplicate strategy for focus '" + descriptor.focusKey() + "'");
                }
            }
        }
        this.descriptors = Collections.unmodifiableMap(byKey);
        log.info("Registered {} strategies from {} catalogs", descriptors.size(), catalogs.size());
    }

    public static String focusKey(String stageId, String zoneId) {
        return zoneId == null || zoneId.isBlank() ? stageId : stageId + ":" + zoneId;
    }

    public StrategyDescriptor lookup(String stageId, String zoneId) {
        return lookup(focusKey(stageId, zoneId));
    }

    public StrategyDescriptor lookup(String focusKey) {
        StrategyDescriptor descriptor = focusKey == null ? null : descriptors.get(focusKey);
        if (descriptor == null) {
            throw new StrategyNotFoundException(focusKey);
        }
        return descriptor;
    }

    public Set<String> focusKeys() {
        return descriptors.keySet();
    }
}
