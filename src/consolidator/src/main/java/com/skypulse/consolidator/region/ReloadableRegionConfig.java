package com.skypulse.consolidator.region;

import com.skypulse.consolidator.config.ConsolidatorProperties;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * In-memory {@link RegionConfigProvider} seeded from {@code consolidator.region.prefixes}.
 */
@Component
public class ReloadableRegionConfig implements RegionConfigProvider {
  private static final Logger log = LoggerFactory.getLogger(ReloadableRegionConfig.class);

  private final AtomicReference<RegionPrefixes> current;

  @Autowired
  public ReloadableRegionConfig(ConsolidatorProperties properties) {
    this(RegionPrefixes.of(properties.getRegion().getPrefixes()));
  }

  public ReloadableRegionConfig(RegionPrefixes initial) {
    this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    if (initial.isEmpty()) {
      log.warn("No region prefixes configured; every flight and controller will be out of scope");
    }
  }

  @Override
  public RegionPrefixes current() {
    return current.get();
  }

  @Override
  public void update(RegionPrefixes prefixes) {
    RegionPrefixes previous = current.getAndSet(Objects.requireNonNull(prefixes, "prefixes"));
    log.info("Region prefixes reloaded: {} -> {}", previous.values(), prefixes.values());
  }
}
