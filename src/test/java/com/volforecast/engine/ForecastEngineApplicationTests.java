package com.volforecast.engine;

import com.volforecast.engine.domain.model.TunableParameter;
import com.volforecast.engine.domain.service.AssetParameterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ForecastEngineApplicationTests {

    private static final Path DATA_DIR;

    static {
        try {
            DATA_DIR = Files.createTempDirectory("forecast-engine-test");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @DynamicPropertySource
    static void storage(DynamicPropertyRegistry registry) {
        registry.add("forecast.storage.base-dir", DATA_DIR::toString);
    }

    @Autowired
    private AssetParameterRegistry registry;

    @Test
    void contextLoads() {
        assertThat(registry.assets()).contains("BTC", "XAU", "SPYX");
        assertThat(registry.currentValue("BTC", TunableParameter.DECAY_LAMBDA)).isEqualTo(0.94);
        assertThat(registry.currentValue("XAU", TunableParameter.DAILY_CAP)).isEqualTo(0.03);
    }
}
