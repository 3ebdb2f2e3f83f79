package org.carball.docsim.cost;

import lombok.Getter;
import org.carball.docsim.model.cost.CostBreakdown;

import java.util.ArrayList;
import java.util.List;

/**
 * Linear I/O cost model: every metric is the data volume times a per-GB unit,
 * multiplied again when the transfer crosses the network.
 */
public class CostModel {

    @Getter
    private final CostModelConfig config;

    public CostModel(CostModelConfig config) {
        this.config = config;
    }

    public CostBreakdown io(String label, double dataGb, boolean network) {
        double multiplier = network ? config.getNetworkMultiplier() : 1.0;
        List<String> notes = network
                ? List.of("Network multiplier x" + config.getNetworkMultiplier())
                : List.of();
        return new CostBreakdown(
                label,
                dataGb,
                dataGb * config.getTimeUnit() * multiplier,
                dataGb * config.getCarbonUnit() * multiplier,
                dataGb * config.getPriceUnit() * multiplier,
                notes
        );
    }

    public CostBreakdown localIo(String label, long bytes) {
        return io(label, config.toGb(bytes), false);
    }

    /**
     * Elementwise sum of the parts; notes are concatenated in input order.
     */
    public CostBreakdown aggregate(String label, List<CostBreakdown> parts) {
        double dataGb = 0.0;
        double time = 0.0;
        double carbon = 0.0;
        double price = 0.0;
        List<String> notes = new ArrayList<>();
        for (CostBreakdown part : parts) {
            dataGb += part.dataScannedGb();
            time += part.timeCost();
            carbon += part.carbonCost();
            price += part.priceCost();
            notes.addAll(part.notes());
        }
        return new CostBreakdown(label, dataGb, time, carbon, price, notes);
    }

    /**
     * Single-number score used to rank designs.
     */
    public double weightedScore(double time, double carbon, double price) {
        return time * config.getTimeWeight()
                + carbon * config.getCarbonWeight()
                + price * config.getPriceWeight();
    }
}
