package com.skypulse.consolidator.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the consolidator service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code consolidator.*} prefix.
 */
@ConfigurationProperties(prefix = "consolidator")
public class ConsolidatorProperties {
  private final Store store = new Store();
  private final Region region = new Region();
  private final Collector collector = new Collector();
  private final Retention retention = new Retention();
  private final Chart chart = new Chart();
  private final Sessions sessions = new Sessions();
  private final Weather weather = new Weather();

  public Store getStore() {
    return store;
  }

  public Region getRegion() {
    return region;
  }

  public Collector getCollector() {
    return collector;
  }

  public Retention getRetention() {
    return retention;
  }

  public Chart getChart() {
    return chart;
  }

  public Sessions getSessions() {
    return sessions;
  }

  public Weather getWeather() {
    return weather;
  }

  /** SQLite snapshot store location and connection tuning. */
  public static class Store {
    private String path = "data/consolidator.db";
    private int busyTimeoutMs = 5000;

    public String getPath() {
      return path;
    }

    public void setPath(String path) {
      this.path = path;
    }

    public int getBusyTimeoutMs() {
      return busyTimeoutMs;
    }

    public void setBusyTimeoutMs(int busyTimeoutMs) {
      this.busyTimeoutMs = busyTimeoutMs;
    }
  }

  /** Initial region prefixes; can be replaced at runtime through the API. */
  public static class Region {
    private List<String> prefixes = new ArrayList<>();

    public List<String> getPrefixes() {
      return prefixes;
    }

    public void setPrefixes(List<String> prefixes) {
      this.prefixes = prefixes;
    }
  }

  /** Upstream network snapshot polling. */
  public static class Collector {
    private boolean enabled = true;
    private String url = "https://api.ivao.aero/v2/tracker/whazzup";
    private long refreshMs = 60000;
    private long timeoutSeconds = 20;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public long getRefreshMs() {
      return refreshMs;
    }

    public void setRefreshMs(long refreshMs) {
      this.refreshMs = refreshMs;
    }

    public long getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }
  }

  /** Partition retention: rolling prune for the short window, boundary resets for the others. */
  public static class Retention {
    private boolean enabled = true;
    private long shortHorizonHours = 36;
    private String pruneCron = "0 5 * * * *";
    private String mediumResetCron = "0 0 0 * * MON";
    private String longResetCron = "0 0 0 1 * *";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getShortHorizonHours() {
      return shortHorizonHours;
    }

    public void setShortHorizonHours(long shortHorizonHours) {
      this.shortHorizonHours = shortHorizonHours;
    }

    public String getPruneCron() {
      return pruneCron;
    }

    public void setPruneCron(String pruneCron) {
      this.pruneCron = pruneCron;
    }

    public String getMediumResetCron() {
      return mediumResetCron;
    }

    public void setMediumResetCron(String mediumResetCron) {
      this.mediumResetCron = mediumResetCron;
    }

    public String getLongResetCron() {
      return longResetCron;
    }

    public void setLongResetCron(String longResetCron) {
      this.longResetCron = longResetCron;
    }
  }

  /** Chart series and artifact cache. */
  public static class Chart {
    private long cacheTtlSeconds = 60;
    private long sweepIntervalSeconds = 300;
    private String outputDir = "data/charts";
    private int width = 1000;
    private int height = 500;

    public long getCacheTtlSeconds() {
      return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(long cacheTtlSeconds) {
      this.cacheTtlSeconds = cacheTtlSeconds;
    }

    public long getSweepIntervalSeconds() {
      return sweepIntervalSeconds;
    }

    public void setSweepIntervalSeconds(long sweepIntervalSeconds) {
      this.sweepIntervalSeconds = sweepIntervalSeconds;
    }

    public String getOutputDir() {
      return outputDir;
    }

    public void setOutputDir(String outputDir) {
      this.outputDir = outputDir;
    }

    public int getWidth() {
      return width;
    }

    public void setWidth(int width) {
      this.width = width;
    }

    public int getHeight() {
      return height;
    }

    public void setHeight(int height) {
      this.height = height;
    }
  }

  /** Controller session continuity lookups. */
  public static class Sessions {
    private long lookbackHours = 24;

    public long getLookbackHours() {
      return lookbackHours;
    }

    public void setLookbackHours(long lookbackHours) {
      this.lookbackHours = lookbackHours;
    }
  }

  /** METAR lookup attached to the live report. */
  public static class Weather {
    private boolean enabled = false;
    private String url = "https://avwx.rest/api/metar";
    private String airport = "LFPG";
    private String token = "";
    private long refreshSeconds = 300;
    private long timeoutSeconds = 10;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public String getAirport() {
      return airport;
    }

    public void setAirport(String airport) {
      this.airport = airport;
    }

    public String getToken() {
      return token;
    }

    public void setToken(String token) {
      this.token = token;
    }

    public long getRefreshSeconds() {
      return refreshSeconds;
    }

    public void setRefreshSeconds(long refreshSeconds) {
      this.refreshSeconds = refreshSeconds;
    }

    public long getTimeoutSeconds() {
      return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
      this.timeoutSeconds = timeoutSeconds;
    }
  }
}
