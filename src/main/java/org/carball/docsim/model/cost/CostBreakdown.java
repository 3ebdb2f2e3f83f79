package org.carball.docsim.model.cost;

import java.util.ArrayList;
import java.util.List;

public record CostBreakdown(
        String label,
        double dataScannedGb,
        double timeCost,
        double carbonCost,
        double priceCost,
        List<String> notes
) {

    public CostBreakdown {
        notes = List.copyOf(notes);
    }

    public CostBreakdown withNotes(List<String> extraNotes) {
        if (extraNotes.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(notes);
        merged.addAll(extraNotes);
        return new CostBreakdown(label, dataScannedGb, timeCost, carbonCost, priceCost, merged);
    }

    public static CostBreakdown zero(String label) {
        return new CostBreakdown(label, 0.0, 0.0, 0.0, 0.0, List.of());
    }
}
