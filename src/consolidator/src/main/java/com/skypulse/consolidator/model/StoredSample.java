package com.skypulse.consolidator.model;

/**
 * A sample as read back from one partition, with its partition-local id.
 *
 * @param id partition-local, strictly increasing sample id
 * @param partition partition the sample was read from
 * @param sample stored content
 */
public record StoredSample(long id, Partition partition, Sample sample) {}
