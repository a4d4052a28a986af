package com.skypulse.consolidator.region;

/**
 * Source of the region prefixes in force at query time.
 *
 * <p>Implementations may change their value at runtime; consumers must read it per query and
 * never keep it inside a result.
 */
public interface RegionConfigProvider {
  /**
   * Returns the current prefix snapshot.
   *
   * @return current prefixes, never null
   */
  RegionPrefixes current();

  /**
   * Replaces the prefix set used by subsequent queries.
   *
   * @param prefixes new prefixes
   */
  void update(RegionPrefixes prefixes);
}
