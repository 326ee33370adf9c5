package com.obsidiandynamics.bedlam.event;

import com.obsidiandynamics.bedlam.*;
import com.obsidiandynamics.bedlam.util.*;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.*;

import java.io.*;
import java.nio.file.*;

import static org.assertj.core.api.Assertions.*;

final class FileEventLogTest {
  @TempDir
  Path tempDir;

  @Test
  void testWritesLines() throws IOException {
    final var path = tempDir.resolve("hospital.log");
    try (var log = new FileEventLog(path)) {
      assertThat(log.getPath()).isEqualTo(path);
      log.record(EventType.ADMITTED, Patients.emergency(2, "Bob", 60));
      log.recordCapacity(5, 1);
      log.record(EventType.DISCHARGED);
    }

    assertThat(Files.readAllLines(path)).containsExactly(
        "Admitted: PatientID=2, Name=Bob, Type=EMERGENCY, Time=60",
        "Bed Status: 1/5 beds occupied",
        "Discharged: (no patient)");
  }

  @Test
  void testAppendsToExistingFile() throws IOException {
    final var path = tempDir.resolve("hospital.log");
    Files.writeString(path, "previous run" + System.lineSeparator());
    try (var log = new FileEventLog(path)) {
      log.recordCapacity(5, 0);
    }
    assertThat(Files.readAllLines(path)).containsExactly("previous run", "Bed Status: 0/5 beds occupied");
  }

  @Test
  void testRecordsAfterCloseAreDiscarded() throws IOException {
    final var path = tempDir.resolve("hospital.log");
    final var log = new FileEventLog(path);
    log.close();
    log.close();
    log.recordCapacity(5, 0);
    assertThat(Files.readAllLines(path)).isEmpty();
  }

  @Test
  void testConcurrentWritersProduceWholeLines() throws IOException, InterruptedException {
    final var path = tempDir.resolve("hospital.log");
    final var threads = 8;
    final var perThread = 100;
    try (var log = new FileEventLog(path)) {
      Contention.run(threads, thread -> {
        for (var i = 0; i < perThread; i++) {
          log.recordCapacity(threads, thread);
        }
      });
    }

    final var lines = Files.readAllLines(path);
    assertThat(lines).hasSize(threads * perThread);
    assertThat(lines).allMatch(line -> line.matches("Bed Status: \\d/8 beds occupied"));
  }

  @Test
  void testUnwritablePathFailsOnOpen() {
    final var path = tempDir.resolve("missing").resolve("hospital.log");
    assertThat(catchThrowable(() -> new FileEventLog(path))).isInstanceOf(IOException.class);
  }
}
