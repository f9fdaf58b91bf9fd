package com.autolens.insight.market;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class MarketTablesService {
    private static final Logger log = LoggerFactory.getLogger(MarketTablesService.class);

    private final MarketTablesLoader loader;
    private final MarketTablesProperties properties;
    private volatile SegmentClassifier classifier = new SegmentClassifier(MarketTables.empty("mt_unloaded"));

    public MarketTablesService(MarketTablesLoader loader, MarketTablesProperties properties) {
        this.loader = loader;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        reload();
    }

    /**
     * Loads and validates the tables, then swaps the whole snapshot. In strict mode a table that fails
     * validation is rejected and the previous snapshot stays in place.
     */
    public synchronized MarketTables reload() {
        MarketTables loaded = loader.load(properties.getPath());
        try {
            MarketTablesValidator.validate(loaded, properties.getWeightTolerance());
            log.info("market tables loaded version={} brands={} segments={}",
                loaded.getVersion(), loaded.getBrands().size(), loaded.getSegmentWeights().size());
        } catch (IllegalStateException ex) {
            if (properties.isStrict()) {
                throw ex;
            }
            log.warn("market tables validation failed: {}", ex.getMessage());
        }
        classifier = new SegmentClassifier(loaded);
        return loaded;
    }

    public MarketTables getTables() {
        return classifier.getTables();
    }

    public SegmentClassifier getClassifier() {
        return classifier;
    }
}
