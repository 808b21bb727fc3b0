package com.driftmonitor.support;

import com.driftmonitor.model.Observation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builders for synthetic prediction populations.
 */
public final class Samples {

    private Samples() {
    }

    /** {@code total} observations whose {@code region} is "north" for the first {@code northShare}. */
    public static List<Observation> regionSplit(int total, double northShare) {
        List<Observation> out = new ArrayList<>();
        int north = (int) Math.round(total * northShare);
        for (int i = 0; i < total; i++) {
            String region = i < north ? "north" : "south";
            out.add(new Observation(Map.of("region", region, "age", 30 + (i % 20)),
                i % 2 == 0 ? "1" : "0", 0.8, Map.of(), null, null));
        }
        return out;
    }

    /**
     * Observations with a protected {@code gender} attribute and the given selection rates.
     */
    public static List<Observation> genderSelection(int perGroup, double maleRate, double femaleRate) {
        List<Observation> out = new ArrayList<>();
        addGroup(out, "male", perGroup, maleRate);
        addGroup(out, "female", perGroup, femaleRate);
        return out;
    }

    private static void addGroup(List<Observation> out, String group, int n, double rate) {
        int positives = (int) Math.round(n * rate);
        for (int i = 0; i < n; i++) {
            out.add(new Observation(Map.of("income", 40_000 + i * 100), i < positives ? "1" : "0",
                0.7, Map.of("gender", group), null, null));
        }
    }
}
