package com.skypulse.consolidator.stats;

/**
 * Distinct-flight figures of a window.
 *
 * @param total distinct flights involving the region
 * @param domestic both endpoints in the region
 * @param outgoing departure only in the region
 * @param incoming arrival only in the region
 * @param uniquePilots distinct subject keys among those flights
 * @param peopleOnBoard sum over flights of the highest seat count seen for each
 */
public record FlightTotals(
    int total, int domestic, int outgoing, int incoming, int uniquePilots, long peopleOnBoard) {

  public static final FlightTotals EMPTY = new FlightTotals(0, 0, 0, 0, 0, 0);
}
