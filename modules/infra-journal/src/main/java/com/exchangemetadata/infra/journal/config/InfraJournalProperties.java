package com.exchangemetadata.infra.journal.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.journal")
public class InfraJournalProperties {
  private boolean enabled = true;
  private String baseDir = "data/journal";
  private boolean fsync = true;
  private long maxSegmentBytes = 64L * 1024L * 1024L;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getBaseDir() {
    return baseDir;
  }

  public void setBaseDir(String baseDir) {
    this.baseDir = baseDir;
  }

  public boolean isFsync() {
    return fsync;
  }

  public void setFsync(boolean fsync) {
    this.fsync = fsync;
  }

  public long getMaxSegmentBytes() {
    return maxSegmentBytes;
  }

  public void setMaxSegmentBytes(long maxSegmentBytes) {
    this.maxSegmentBytes = maxSegmentBytes;
  }

  public String effectiveBaseDir() {
    if (baseDir == null || baseDir.isBlank()) {
      return "data/journal";
    }
    return baseDir.trim();
  }

  public long effectiveMaxSegmentBytes() {
    return Math.max(4096L, maxSegmentBytes);
  }
}
