package com.obsidiandynamics.bedlam;

import com.obsidiandynamics.bedlam.IllegalLifecycleStateException.*;
import com.obsidiandynamics.bedlam.event.*;
import com.obsidiandynamics.bedlam.pool.*;
import com.obsidiandynamics.bedlam.queue.*;
import com.obsidiandynamics.bedlam.util.*;
import com.obsidiandynamics.bedlam.worker.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;
import java.util.function.*;

public final class Hospital implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Hospital.class);

  public static class Options {
    public int totalBeds = 5;

    public int criticalCareBeds = 5;

    public int generalWardBeds = 10;

    public int queueCapacity = 100;

    // bounds every idle wait of the admission worker, and so shutdown latency
    public long idleWaitMs = 100;

    public long admissionIntervalMs = 1_000;

    public long dischargeIntervalMs = 5_000;

    // 0 disables periodic reporting
    public long statusIntervalMs = 4_000;

    public long allocationHoldMs = 1_000;

    public long shutdownTimeoutMs = 10_000;

    public CapacityPool.Factory capacityPoolFactory = FifoCapacityPool::new;

    public Clock clock = Clock.systemUTC();

    public Consumer<StatusReport> statusSink = report -> LOG.info("Status:\n{}", report.describe());

    void validate() {
      Assert.argument(totalBeds > 0, Assert.withMessage("totalBeds must be positive"));
      Assert.argument(criticalCareBeds > 0, Assert.withMessage("criticalCareBeds must be positive"));
      Assert.argument(generalWardBeds > 0, Assert.withMessage("generalWardBeds must be positive"));
      Assert.argument(queueCapacity > 0, Assert.withMessage("queueCapacity must be positive"));
      Assert.argument(idleWaitMs > 0, Assert.withMessage("idleWaitMs must be positive"));
      Assert.argument(admissionIntervalMs >= 0, Assert.withMessage("admissionIntervalMs cannot be negative"));
      Assert.argument(dischargeIntervalMs > 0, Assert.withMessage("dischargeIntervalMs must be positive"));
      Assert.argument(statusIntervalMs >= 0, Assert.withMessage("statusIntervalMs cannot be negative"));
      Assert.argument(allocationHoldMs >= 0, Assert.withMessage("allocationHoldMs cannot be negative"));
      Assert.argument(shutdownTimeoutMs >= 0, Assert.withMessage("shutdownTimeoutMs cannot be negative"));
      Assert.argument(capacityPoolFactory != null, Assert.withMessage("capacityPoolFactory cannot be null"));
      Assert.argument(clock != null, Assert.withMessage("clock cannot be null"));
      Assert.argument(statusSink != null, Assert.withMessage("statusSink cannot be null"));
    }
  }

  private enum State {
    NEW,
    RUNNING,
    SHUT_DOWN
  }

  private final Options options;

  private final EventLog eventLog;

  private final PriorityAdmissionQueue queue;

  private final BedPool bedPool;

  private final Map<CareUnit, CapacityPool> capacityPools = new EnumMap<>(CareUnit.class);

  private final List<Worker> workers = new ArrayList<>();

  private final StatusReporter statusReporter;

  private final ExecutorService allocationExecutor;

  private final AtomicLong idGenerator = new AtomicLong();

  private final Object lifecycleMonitor = new Object();

  private final Object allocationMonitor = new Object();

  private int allocationsInFlight;

  private volatile State state = State.NEW;

  public Hospital(Options options, EventLog eventLog) {
    options.validate();
    this.options = options;
    this.eventLog = new IsolatingEventLog(eventLog);
    queue = new PriorityAdmissionQueue(options.queueCapacity);
    bedPool = new BedPool(options.totalBeds);
    capacityPools.put(CareUnit.CRITICAL_CARE, options.capacityPoolFactory.create(options.criticalCareBeds));
    capacityPools.put(CareUnit.GENERAL_WARD, options.capacityPoolFactory.create(options.generalWardBeds));

    workers.add(new AdmissionWorker(queue, bedPool, this.eventLog, options.idleWaitMs, options.admissionIntervalMs));
    workers.add(new DischargeWorker(bedPool, this.eventLog, options.dischargeIntervalMs));
    statusReporter = new StatusReporter(bedPool, queue,
                                        capacityPools.get(CareUnit.CRITICAL_CARE), capacityPools.get(CareUnit.GENERAL_WARD),
                                        options.statusSink, options.statusIntervalMs);
    if (options.statusIntervalMs > 0) {
      workers.add(statusReporter);
    }

    final var threadIds = new AtomicInteger();
    allocationExecutor = Executors.newCachedThreadPool(runnable -> {
      final var thread = new Thread(runnable, "allocation-task-" + threadIds.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  public void start() {
    synchronized (lifecycleMonitor) {
      if (state != State.NEW) {
        throw new IllegalLifecycleStateException(Reason.ALREADY_STARTED, "Hospital already started");
      }
      state = State.RUNNING;
      workers.forEach(Worker::start);
    }
    LOG.info("Hospital started with {} beds, {} critical-care and {} general-ward slots",
             options.totalBeds, options.criticalCareBeds, options.generalWardBeds);
  }

  /**
   * Creates a patient and routes it into one of the two allocation workflows. Capacity-pool
   * patients are assigned a care unit by {@link CareUnit#forSeverity(int)}.
   *
   * @param name Display name.
   * @param priorityClass Queue precedence.
   * @param severity Severity score, 1 to 10.
   * @param wantsCapacityPool {@code true} to spawn an allocation task instead of queueing.
   * @return {@code false} if the patient was dropped because the admission queue is full.
   */
  public boolean submitPatient(String name, PriorityClass priorityClass, int severity, boolean wantsCapacityPool) {
    if (wantsCapacityPool) {
      return submitPatient(name, priorityClass, severity, CareUnit.forSeverity(severity));
    } else {
      // shutdown cannot begin between the state check and the push
      synchronized (lifecycleMonitor) {
        final var patient = createPatient(name, priorityClass, severity, CareUnit.forSeverity(severity));
        if (queue.push(patient, accepted -> eventLog.record(EventType.CHECK_IN, accepted))) {
          return true;
        } else {
          LOG.debug("Admission queue full, shedding {}", patient);
          return false;
        }
      }
    }
  }

  public boolean submitPatient(String name, PriorityClass priorityClass, int severity, CareUnit careUnit) {
    Objects.requireNonNull(careUnit, "careUnit");
    final var patient = createPatient(name, priorityClass, severity, careUnit);
    final var task = new AllocationTask(patient, capacityPools.get(careUnit), eventLog, options.allocationHoldMs);
    synchronized (allocationMonitor) {
      allocationsInFlight++;
    }
    try {
      allocationExecutor.execute(() -> {
        try {
          task.run();
        } finally {
          allocationDone();
        }
      });
    } catch (RejectedExecutionException e) {
      allocationDone();
      throw new IllegalLifecycleStateException(Reason.SHUT_DOWN, "Hospital has been shut down");
    }
    return true;
  }

  private Patient createPatient(String name, PriorityClass priorityClass, int severity, CareUnit careUnit) {
    if (state == State.SHUT_DOWN) {
      throw new IllegalLifecycleStateException(Reason.SHUT_DOWN, "Hospital has been shut down");
    }
    Assert.argument(name != null && !name.isBlank(), Assert.withMessage("Patient name cannot be blank"));
    Objects.requireNonNull(priorityClass, "priorityClass");
    Assert.argument(severity >= Patient.MIN_SEVERITY && severity <= Patient.MAX_SEVERITY,
                    () -> String.format("Severity must be between %d and %d: %d", Patient.MIN_SEVERITY, Patient.MAX_SEVERITY, severity));
    return new Patient(idGenerator.incrementAndGet(), name, priorityClass, careUnit, severity, Instant.now(options.clock));
  }

  private void allocationDone() {
    synchronized (allocationMonitor) {
      allocationsInFlight--;
      if (allocationsInFlight == 0) {
        allocationMonitor.notifyAll();
      }
    }
  }

  public boolean awaitAllocations(long timeoutMs) throws InterruptedException {
    var deadline = 0L;
    synchronized (allocationMonitor) {
      while (allocationsInFlight != 0) {
        final var currentTime = System.currentTimeMillis();
        if (deadline == 0) {
          deadline = addNoWrap(currentTime, timeoutMs);
        }
        final var remaining = deadline - currentTime;
        if (remaining > 0) {
          allocationMonitor.wait(remaining);
        } else {
          return false;
        }
      }
      return true;
    }
  }

  public StatusReport status() {
    return statusReporter.read();
  }

  public PriorityAdmissionQueue getQueue() {
    return queue;
  }

  public BedPool getBedPool() {
    return bedPool;
  }

  public CapacityPool getCapacityPool(CareUnit careUnit) {
    return capacityPools.get(careUnit);
  }

  public boolean shutdown(long timeoutMs) throws InterruptedException {
    synchronized (lifecycleMonitor) {
      if (state == State.SHUT_DOWN) {
        return allocationExecutor.isTerminated();
      }
      final var wasRunning = state == State.RUNNING;
      state = State.SHUT_DOWN;
      LOG.info("Shutting down");

      final var deadline = addNoWrap(System.currentTimeMillis(), timeoutMs);
      workers.forEach(Worker::signalShutdown);
      allocationExecutor.shutdown();

      var terminated = true;
      if (wasRunning) {
        for (var worker : workers) {
          terminated &= worker.join(Math.max(1, deadline - System.currentTimeMillis()));
        }
      }
      terminated &= allocationExecutor.awaitTermination(Math.max(0, deadline - System.currentTimeMillis()), TimeUnit.MILLISECONDS);
      if (terminated) {
        LOG.info("Shutdown complete");
      } else {
        LOG.warn("Shutdown timed out after {} ms", timeoutMs);
      }
      return terminated;
    }
  }

  @Override
  public void close() throws InterruptedException {
    shutdown(options.shutdownTimeoutMs);
  }

  private static long addNoWrap(long l1, long l2) {
    final var sum = l1 + l2;
    return sum < 0 ? Long.MAX_VALUE : sum;
  }

  @Override
  public String toString() {
    return Hospital.class.getSimpleName() + "[state=" + state + ", queue=" + queue + ", bedPool=" + bedPool + ']';
  }
}
