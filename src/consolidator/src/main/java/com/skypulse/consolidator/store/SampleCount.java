package com.skypulse.consolidator.store;

import java.time.Instant;

/**
 * Row counts of one stored sample, used for per-sample chart series.
 *
 * @param sampleId partition-local sample id
 * @param timestamp sample capture time
 * @param flights flight rows in the sample
 * @param sessions controller session rows in the sample
 */
public record SampleCount(long sampleId, Instant timestamp, int flights, int sessions) {}
