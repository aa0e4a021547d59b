package com.volforecast.engine.domain.service.montecarlo;

import com.volforecast.engine.domain.exception.PathGenerationException;
import com.volforecast.engine.domain.model.DistributionFamily;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PricePathGeneratorTest {

    private SimpleMeterRegistry meterRegistry;
    private PricePathGenerator generator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        generator = new PricePathGenerator(new ShockSampler(), meterRegistry);
    }

    private static PathGenerationRequest.PathGenerationRequestBuilder request() {
        return PathGenerationRequest.builder()
                .spotPrice(65000.123456789)
                .stepSigma(0.001)
                .stepCount(10)
                .distributionFamily(DistributionFamily.studentT(5))
                .seed(42L);
    }

    @Test
    void roundsToSignificantDigits() {
        MathContext mc = new MathContext(8, RoundingMode.HALF_EVEN);

        assertThat(PricePathGenerator.round(65000.123456789, mc)).isEqualTo(65000.123);
        assertThat(PricePathGenerator.round(0.000123456789, mc)).isEqualTo(0.00012345679);
    }

    @Test
    void generatesFullEnsembleAnchoredAtSpot() {
        double[][] paths = generator.generate(request().build());

        assertThat(paths).hasNumberOfRows(1000);
        for (double[] path : paths) {
            assertThat(path).hasSize(10);
            assertThat(path[0]).isEqualTo(65000.123);
            for (double price : path) {
                assertThat(price).isPositive().isFinite();
            }
        }
        assertThat(paths[0]).containsOnly(65000.123);
    }

    @Test
    void sameSeedIsReproducible() {
        double[][] first = generator.generate(request().build());
        double[][] second = generator.generate(request().build());
        double[][] other = generator.generate(request().seed(43L).build());

        assertThat(Arrays.deepEquals(first, second)).isTrue();
        assertThat(Arrays.deepEquals(first, other)).isFalse();
    }

    @Test
    void flattenedRequestRepeatsSpot() {
        double[][] paths = generator.generate(request().stepSigma(0.0).flatten(true).build());

        for (double[] path : paths) {
            assertThat(path).containsOnly(65000.123);
        }
    }

    @Test
    void singleStepContainsOnlySpot() {
        double[][] paths = generator.generate(request().stepCount(1).build());

        assertThat(paths).hasNumberOfRows(1000);
        assertThat(paths[999]).containsExactly(65000.123);
    }

    @Test
    void explodingPricesAreRejectedAndCounted() {
        PathGenerationRequest exploding = request().stepSigma(1000.0).stepCount(50).build();

        assertThatThrownBy(() -> generator.generate(exploding))
                .isInstanceOf(PathGenerationException.class);
        assertThat(meterRegistry.counter("forecast.paths.invalid_prices").count()).isPositive();
    }

    @Test
    void rejectsInvalidRequests() {
        assertThatThrownBy(() -> generator.generate(request().spotPrice(0.0).build()))
                .isInstanceOf(PathGenerationException.class);
        assertThatThrownBy(() -> generator.generate(request().stepSigma(-0.01).build()))
                .isInstanceOf(PathGenerationException.class);
        assertThatThrownBy(() -> generator.generate(request().stepCount(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
