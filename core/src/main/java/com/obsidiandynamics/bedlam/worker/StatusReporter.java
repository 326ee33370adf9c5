package com.obsidiandynamics.bedlam.worker;

import com.obsidiandynamics.bedlam.pool.*;
import com.obsidiandynamics.bedlam.queue.*;
import org.slf4j.*;

import java.util.function.*;

public final class StatusReporter extends Worker {
  private static final Logger LOG = LoggerFactory.getLogger(StatusReporter.class);

  private final BedPool bedPool;

  private final PriorityAdmissionQueue queue;

  private final CapacityPool criticalCare;

  private final CapacityPool generalWard;

  private final Consumer<StatusReport> sink;

  private final long statusIntervalMs;

  public StatusReporter(BedPool bedPool, PriorityAdmissionQueue queue,
                        CapacityPool criticalCare, CapacityPool generalWard,
                        Consumer<StatusReport> sink, long statusIntervalMs) {
    super("status-reporter");
    this.bedPool = bedPool;
    this.queue = queue;
    this.criticalCare = criticalCare;
    this.generalWard = generalWard;
    this.sink = sink;
    this.statusIntervalMs = statusIntervalMs;
  }

  public StatusReport read() {
    return new StatusReport(bedPool.snapshot(), queue.size(),
                            criticalCare.available(), criticalCare.capacity(),
                            generalWard.available(), generalWard.capacity());
  }

  @Override
  protected void cycle() throws InterruptedException {
    final var report = read();
    try {
      sink.accept(report);
    } catch (RuntimeException e) {
      LOG.warn("Status sink failed", e);
    }
    awaitShutdown(statusIntervalMs);
  }
}
