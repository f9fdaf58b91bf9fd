package com.autolens.insight.market;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MarketTablesServiceTest {

    @Mock
    private MarketTablesLoader loader;

    private MarketTablesProperties properties;
    private MarketTables bundled;

    @BeforeEach
    void setUp() {
        properties = new MarketTablesProperties();
        properties.setPath("classpath:config/market-tables.yaml");
        properties.setWeightTolerance(0.01);
        bundled = new MarketTablesLoader().load("classpath:config/market-tables.yaml");
    }

    @Test
    void reloadSwapsSnapshot() {
        when(loader.load(anyString())).thenReturn(bundled);
        MarketTablesService service = new MarketTablesService(loader, properties);

        service.init();

        assertThat(service.getTables().getVersion()).isEqualTo("mt_2026_1");
        assertThat(service.getClassifier().classify("Dacia").segment()).isEqualTo(MarketSegment.BUDGET);
    }

    @Test
    void strictModeRejectsInvalidTablesAndKeepsPreviousSnapshot() {
        properties.setStrict(true);
        when(loader.load(anyString())).thenReturn(bundled, MarketTables.empty("mt_missing"));
        MarketTablesService service = new MarketTablesService(loader, properties);
        service.init();

        assertThatThrownBy(service::reload).isInstanceOf(IllegalStateException.class);
        assertThat(service.getTables().getVersion()).isEqualTo("mt_2026_1");
    }

    @Test
    void lenientModeKeepsRunningOnInvalidTables() {
        properties.setStrict(false);
        when(loader.load(anyString())).thenReturn(MarketTables.empty("mt_missing"));
        MarketTablesService service = new MarketTablesService(loader, properties);

        service.init();

        assertThat(service.getTables().getVersion()).isEqualTo("mt_missing");
        assertThat(service.getClassifier().classify("Dacia").segment()).isEqualTo(MarketSegment.VOLUME);
    }
}
