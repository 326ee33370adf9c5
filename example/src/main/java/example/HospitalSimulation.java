package example;

import com.obsidiandynamics.bedlam.*;
import com.obsidiandynamics.bedlam.event.*;
import org.slf4j.*;

import java.io.*;
import java.nio.charset.*;
import java.nio.file.*;
import java.util.*;

public class HospitalSimulation {
  private static final Logger LOG = LoggerFactory.getLogger(HospitalSimulation.class);

  private static final int WARD_PATIENTS = 10;

  private static final int FIRST_WARD_PATIENT_ID = 100;

  public static void main(String[] args) throws IOException, InterruptedException {
    final var logPath = Paths.get(args.length > 0 ? args[0] : "hospital.log");
    try (var fileLog = new FileEventLog(logPath);
         var hospital = new Hospital(new Hospital.Options(), fileLog.andThen(new LoggingEventLog()))) {
      Runtime.getRuntime().addShutdownHook(shutdownHook(hospital, fileLog));
      hospital.start();

      // Scripted arrivals, one second apart.
      final Object[][] arrivals = {
          {"Alice", PriorityClass.REGULAR, 5},
          {"Bob", PriorityClass.EMERGENCY, 9},
          {"Charlie", PriorityClass.REGULAR, 3},
          {"Diana", PriorityClass.EMERGENCY, 10},
          {"Eve", PriorityClass.REGULAR, 2},
          {"Frank", PriorityClass.REGULAR, 4}
      };
      for (var i = 0; i < arrivals.length; i++) {
        if (i > 0) Thread.sleep(1_000);
        hospital.submitPatient((String) arrivals[i][0], (PriorityClass) arrivals[i][1], (int) arrivals[i][2], false);
      }

      // A burst of ward patients competing for the critical-care and general-ward pools.
      final var rng = new SplittableRandom();
      for (var i = 0; i < WARD_PATIENTS; i++) {
        final var severity = rng.nextInt(Patient.MIN_SEVERITY, Patient.MAX_SEVERITY + 1);
        hospital.submitPatient("WardPatient_" + (FIRST_WARD_PATIENT_ID + i), PriorityClass.REGULAR, severity, true);
        Thread.sleep(100);
      }
      hospital.awaitAllocations(Long.MAX_VALUE);

      final var console = new ConsoleFrontEnd(hospital,
                                              new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                                              System.out);
      console.run();
    }
    System.out.println("System shutdown complete.");
  }

  static Thread shutdownHook(Hospital hospital, Closeable eventFile) {
    return new Thread(() -> {
      try {
        hospital.close();
      } catch (InterruptedException e) {
        LOG.warn("Interrupted while shutting down");
        Thread.currentThread().interrupt();
      } finally {
        try {
          eventFile.close();
        } catch (IOException e) {
          LOG.warn("Error closing event log", e);
        }
      }
    }, "shutdown-hook");
  }
}
