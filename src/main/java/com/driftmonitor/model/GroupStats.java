package com.driftmonitor.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class GroupStats {
    long count;
    long positives;
    double selectionRate;
    long labeledPositives;
    long truePositives;
    Double truePositiveRate;
}
