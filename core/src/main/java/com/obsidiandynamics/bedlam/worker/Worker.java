package com.obsidiandynamics.bedlam.worker;

import org.slf4j.*;

import java.util.concurrent.*;

public abstract class Worker {
  private static final Logger LOG = LoggerFactory.getLogger(Worker.class);

  private final CountDownLatch shutdown = new CountDownLatch(1);

  private final Thread thread;

  protected Worker(String name) {
    thread = new Thread(this::run, name);
    thread.setDaemon(true);
  }

  public final String getName() {
    return thread.getName();
  }

  public final void start() {
    thread.start();
  }

  public final void signalShutdown() {
    shutdown.countDown();
  }

  public final boolean isShutdownSignalled() {
    return shutdown.getCount() == 0;
  }

  public final boolean join(long timeoutMs) throws InterruptedException {
    thread.join(timeoutMs);
    return !thread.isAlive();
  }

  protected final boolean awaitShutdown(long timeoutMs) throws InterruptedException {
    return shutdown.await(timeoutMs, TimeUnit.MILLISECONDS);
  }

  protected abstract void cycle() throws InterruptedException;

  private void run() {
    LOG.debug("{} started", getName());
    try {
      while (!isShutdownSignalled()) {
        cycle();
      }
    } catch (InterruptedException e) {
      LOG.debug("{} interrupted", getName());
      Thread.currentThread().interrupt();
    } catch (RuntimeException | Error e) {
      LOG.error("{} terminated abnormally", getName(), e);
      throw e;
    }
    LOG.debug("{} stopped", getName());
  }
}
