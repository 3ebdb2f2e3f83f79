package org.carball.docsim.cost;

import org.carball.docsim.model.cost.CostBreakdown;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CostModelTest {

    private final CostModel costModel = new CostModel(CostModelConfig.defaults());

    @Test
    void shouldPriceLocalIoLinearly() {
        // When
        CostBreakdown cost = costModel.io("scan", 2.0, false);

        // Then
        assertThat(cost.label()).isEqualTo("scan");
        assertThat(cost.dataScannedGb()).isEqualTo(2.0);
        assertThat(cost.timeCost()).isEqualTo(2.0);
        assertThat(cost.carbonCost()).isEqualTo(1.0);
        assertThat(cost.priceCost()).isCloseTo(0.2, within(1e-12));
        assertThat(cost.notes()).isEmpty();
    }

    @Test
    void shouldApplyNetworkMultiplierToRemoteTransfers() {
        // When
        CostBreakdown cost = costModel.io("shuffle", 2.0, true);

        // Then
        assertThat(cost.dataScannedGb()).isEqualTo(2.0);
        assertThat(cost.timeCost()).isEqualTo(10.0);
        assertThat(cost.carbonCost()).isEqualTo(5.0);
        assertThat(cost.priceCost()).isCloseTo(1.0, within(1e-12));
        assertThat(cost.notes()).containsExactly("Network multiplier x5.0");
    }

    @Test
    void shouldConvertBytesWithBinaryGigabytes() {
        // When
        CostBreakdown local = costModel.localIo("scan", CostModelConfig.BYTES_PER_GB);
        CostBreakdown remote = costModel.io("shuffle", CostModelConfig.defaults().toGb(CostModelConfig.BYTES_PER_GB / 2), true);

        // Then
        assertThat(local.dataScannedGb()).isEqualTo(1.0);
        assertThat(remote.dataScannedGb()).isEqualTo(0.5);
        assertThat(remote.timeCost()).isEqualTo(2.5);
    }

    @Test
    void shouldAggregateElementwiseKeepingNoteOrder() {
        // Given
        CostBreakdown first = new CostBreakdown("a", 1.0, 2.0, 3.0, 4.0, List.of("first"));
        CostBreakdown second = new CostBreakdown("b", 0.5, 0.25, 0.125, 1.0, List.of("second", "third"));

        // When
        CostBreakdown total = costModel.aggregate("total", List.of(first, second));

        // Then
        assertThat(total.label()).isEqualTo("total");
        assertThat(total.dataScannedGb()).isEqualTo(1.5);
        assertThat(total.timeCost()).isEqualTo(2.25);
        assertThat(total.carbonCost()).isEqualTo(3.125);
        assertThat(total.priceCost()).isEqualTo(5.0);
        assertThat(total.notes()).containsExactly("first", "second", "third");
    }

    @Test
    void shouldAggregateNothingToZero() {
        // When
        CostBreakdown total = costModel.aggregate("total", List.of());

        // Then
        assertThat(total).isEqualTo(CostBreakdown.zero("total"));
    }

    @Test
    void shouldWeightScoreWithConfiguredWeights() {
        // Given
        CostModel weighted = new CostModel(CostModelConfig.builder()
                .timeWeight(2.0)
                .carbonWeight(0.0)
                .priceWeight(10.0)
                .build());

        // Then
        assertThat(costModel.weightedScore(1.0, 2.0, 3.0)).isEqualTo(6.0);
        assertThat(weighted.weightedScore(1.0, 2.0, 3.0)).isEqualTo(32.0);
    }

    @Test
    void shouldUseConfiguredUnits() {
        // Given
        CostModel custom = new CostModel(CostModelConfig.builder()
                .timeUnit(3.0)
                .networkMultiplier(2.0)
                .build());

        // When
        CostBreakdown cost = custom.io("shuffle", 1.0, true);

        // Then
        assertThat(cost.timeCost()).isEqualTo(6.0);
        assertThat(cost.notes()).containsExactly("Network multiplier x2.0");
    }
}
