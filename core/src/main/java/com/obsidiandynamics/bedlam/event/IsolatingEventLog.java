package com.obsidiandynamics.bedlam.event;

import com.obsidiandynamics.bedlam.*;
import org.slf4j.*;

public final class IsolatingEventLog implements EventLog {
  private static final Logger LOG = LoggerFactory.getLogger(IsolatingEventLog.class);

  private final EventLog delegate;

  public IsolatingEventLog(EventLog delegate) {
    this.delegate = delegate;
  }

  @Override
  public void record(EventType type, Patient patient) {
    try {
      delegate.record(type, patient);
    } catch (RuntimeException e) {
      LOG.warn("Failed to record {} event", type, e);
    }
  }

  @Override
  public void recordCapacity(int total, int occupied) {
    try {
      delegate.recordCapacity(total, occupied);
    } catch (RuntimeException e) {
      LOG.warn("Failed to record bed status {}/{}", occupied, total, e);
    }
  }
}
