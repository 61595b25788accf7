package com.notisync.device.sync;

/** Mutable counters for one sync or retry pass. Confined to the thread running the pass. */
public final class PassTally {

  private int succeeded;
  private int failed;
  private int abandoned;
  private int conflicts;
  private int batches;
  private int networkErrors;
  private int serverErrors;
  private int syncErrors;

  void recordSuccess() {
    succeeded++;
  }

  void recordFailure(SyncTransportException.Reason reason) {
    failed++;
    countError(reason);
  }

  void recordAbandoned(SyncTransportException.Reason reason) {
    abandoned++;
    countError(reason);
  }

  void recordConflict() {
    conflicts++;
  }

  void recordBatch() {
    batches++;
  }

  private void countError(SyncTransportException.Reason reason) {
    if (reason == SyncTransportException.Reason.TIMEOUT
        || reason == SyncTransportException.Reason.UNREACHABLE) {
      networkErrors++;
    } else if (reason == SyncTransportException.Reason.SERVER_ERROR) {
      serverErrors++;
    } else {
      syncErrors++;
    }
  }

  public int succeeded() {
    return succeeded;
  }

  public int failed() {
    return failed;
  }

  public int abandoned() {
    return abandoned;
  }

  public int conflicts() {
    return conflicts;
  }

  public int batches() {
    return batches;
  }

  public int networkErrors() {
    return networkErrors;
  }

  public int serverErrors() {
    return serverErrors;
  }

  public int syncErrors() {
    return syncErrors;
  }
}
