package com.heavyai.client.exception;

/**
 * Thrown when a multi-batch columnar load fails after some batches were already accepted by the
 * server. Nothing is rolled back: the target table holds the rows of the first {@link
 * #getBatchesSent()} batches and callers have to reconcile it themselves, e.g. by counting rows.
 */
public class PartialLoadException extends TransportFailureException {

  private final int batchesSent;
  private final int totalBatches;

  public PartialLoadException(int batchesSent, int totalBatches, Throwable cause) {
    super(
        Phase.LOAD,
        String.format(
            "Load failed on batch %d of %d, %d batch(es) already loaded: %s",
            batchesSent + 1, totalBatches, batchesSent, cause.getMessage()),
        cause,
        HeavyClientErrorCode.PARTIAL_LOAD);
    this.batchesSent = batchesSent;
    this.totalBatches = totalBatches;
  }

  public int getBatchesSent() {
    return batchesSent;
  }

  public int getTotalBatches() {
    return totalBatches;
  }
}
