package com.skypulse.consolidator.api;

import java.util.List;

/**
 * Request and response body of {@code /api/regions}.
 *
 * @param prefixes region prefixes, e.g. {@code ["LF"]}
 */
public record RegionPrefixesPayload(List<String> prefixes) {}
