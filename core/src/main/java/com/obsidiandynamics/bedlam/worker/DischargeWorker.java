package com.obsidiandynamics.bedlam.worker;

import com.obsidiandynamics.bedlam.event.*;
import com.obsidiandynamics.bedlam.pool.*;

public final class DischargeWorker extends Worker {
  private final BedPool bedPool;

  private final EventLog eventLog;

  private final long dischargeIntervalMs;

  public DischargeWorker(BedPool bedPool, EventLog eventLog, long dischargeIntervalMs) {
    super("discharge-worker");
    this.bedPool = bedPool;
    this.eventLog = eventLog;
    this.dischargeIntervalMs = dischargeIntervalMs;
  }

  @Override
  protected void cycle() throws InterruptedException {
    if (awaitShutdown(dischargeIntervalMs)) {
      return;
    }

    final var snapshot = bedPool.dischargeAndSnapshot();
    if (snapshot != null) {
      eventLog.record(EventType.DISCHARGED);
      eventLog.recordCapacity(snapshot.getTotalCapacity(), snapshot.getOccupied());
    }
  }
}
