package com.obsidiandynamics.bedlam.event;

import com.obsidiandynamics.bedlam.*;
import org.slf4j.*;

public final class LoggingEventLog implements EventLog {
  private final Logger logger;

  public LoggingEventLog() {
    this(LoggerFactory.getLogger(LoggingEventLog.class));
  }

  public LoggingEventLog(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void record(EventType type, Patient patient) {
    if (logger.isInfoEnabled()) {
      logger.info(EventFormat.formatEvent(type, patient));
    }
  }

  @Override
  public void recordCapacity(int total, int occupied) {
    if (logger.isInfoEnabled()) {
      logger.info(EventFormat.formatCapacity(total, occupied));
    }
  }
}
