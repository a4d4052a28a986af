package com.skypulse.consolidator;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.skypulse.consolidator.collector.SnapshotCollectionJob;
import com.skypulse.consolidator.service.ConsolidationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(
    properties = {
      "consolidator.scheduling.enabled=false",
      "consolidator.collector.enabled=false",
      "consolidator.store.path=target/test-store/consolidator.db",
      "consolidator.chart.output-dir=target/test-store/charts"
    })
class ConsolidatorApplicationTests {
  @Autowired
  private ApplicationContext applicationContext;

  @Autowired
  private ConsolidationService consolidationService;

  @Test
  void contextLoads() {
    assertNotNull(applicationContext);
    assertNotNull(consolidationService);
    assertTrue(applicationContext.getBeansOfType(SnapshotCollectionJob.class).isEmpty());
  }
}
