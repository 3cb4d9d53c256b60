package io.firebolt.client.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Execution statistics reported with a query response. Every field is optional. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Statistics {
  private final Double elapsed;
  private final Long rowsRead;
  private final Long bytesRead;
  private final Double timeBeforeExecution;
  private final Double timeToExecute;
  private final Long scannedBytesCache;
  private final Long scannedBytesStorage;

  @JsonCreator
  public Statistics(
      @JsonProperty("elapsed") Double elapsed,
      @JsonProperty("rows_read") Long rowsRead,
      @JsonProperty("bytes_read") Long bytesRead,
      @JsonProperty("time_before_execution") Double timeBeforeExecution,
      @JsonProperty("time_to_execute") Double timeToExecute,
      @JsonProperty("scanned_bytes_cache") Long scannedBytesCache,
      @JsonProperty("scanned_bytes_storage") Long scannedBytesStorage) {
    this.elapsed = elapsed;
    this.rowsRead = rowsRead;
    this.bytesRead = bytesRead;
    this.timeBeforeExecution = timeBeforeExecution;
    this.timeToExecute = timeToExecute;
    this.scannedBytesCache = scannedBytesCache;
    this.scannedBytesStorage = scannedBytesStorage;
  }

  /** @return elapsed server time in seconds */
  public Double getElapsed() {
    return elapsed;
  }

  public Long getRowsRead() {
    return rowsRead;
  }

  public Long getBytesRead() {
    return bytesRead;
  }

  public Double getTimeBeforeExecution() {
    return timeBeforeExecution;
  }

  public Double getTimeToExecute() {
    return timeToExecute;
  }

  public Long getScannedBytesCache() {
    return scannedBytesCache;
  }

  public Long getScannedBytesStorage() {
    return scannedBytesStorage;
  }

  @Override
  public String toString() {
    return "Statistics{elapsed="
        + elapsed
        + ", rowsRead="
        + rowsRead
        + ", bytesRead="
        + bytesRead
        + ", timeBeforeExecution="
        + timeBeforeExecution
        + ", timeToExecute="
        + timeToExecute
        + '}';
  }
}
