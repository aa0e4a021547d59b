package com.volforecast.engine.domain.service.marketdata;

import com.volforecast.engine.domain.model.PriceTick;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PriceHistoryBufferTest {

    private PriceHistoryBuffer buffer;

    @BeforeEach
    void setUp() {
        MarketDataProperties properties = new MarketDataProperties();
        properties.setHistoryCapacity(8);
        buffer = new PriceHistoryBuffer(properties);
    }

    @Test
    void keepsTicksInTimeOrder() {
        buffer.record("btc", 100.0, 1_000L);
        buffer.record("BTC", 101.0, 2_000L);
        buffer.record("BTC", 102.0, 3_000L);

        assertThat(buffer.latest("btc")).contains(new PriceTick(3_000L, 102.0));
        assertThat(buffer.atOrBefore("BTC", 2_500L)).contains(new PriceTick(2_000L, 101.0));
        assertThat(buffer.atOrBefore("BTC", 999L)).isEmpty();
    }

    @Test
    void dropsInvalidAndOutOfOrderTicks() {
        assertThat(buffer.record("BTC", 100.0, 5_000L)).isTrue();
        assertThat(buffer.record("BTC", 99.0, 4_000L)).isFalse();
        assertThat(buffer.record("BTC", Double.NaN, 6_000L)).isFalse();
        assertThat(buffer.record("BTC", -1.0, 6_000L)).isFalse();
        assertThat(buffer.record(null, 1.0, 6_000L)).isFalse();

        assertThat(buffer.latest("BTC")).contains(new PriceTick(5_000L, 100.0));
        assertThat(buffer.atOrBefore("BTC", 4_999L)).isEmpty();
    }

    @Test
    void overwritesOldestWhenFull() {
        for (int i = 0; i < 12; i++) {
            buffer.record("ETH", 100.0 + i, i * 1_000L);
        }

        assertThat(buffer.latest("ETH")).contains(new PriceTick(11_000L, 111.0));
        assertThat(buffer.atOrBefore("ETH", 4_000L)).contains(new PriceTick(4_000L, 104.0));
        assertThat(buffer.atOrBefore("ETH", 3_500L)).isEmpty();
    }

    @Test
    void unknownAssetHasNoHistory() {
        assertThat(buffer.latest("XAU")).isEmpty();
        assertThat(buffer.atOrBefore("XAU", Long.MAX_VALUE)).isEmpty();
    }
}
