package com.skypulse.consolidator.store;

import java.time.Instant;

/**
 * One appearance of a controller callsign in a stored sample.
 *
 * @param callsign upper-case position callsign
 * @param sampleId partition-local sample id
 * @param timestamp sample capture time
 */
public record ControllerPresence(String callsign, long sampleId, Instant timestamp) {}
