package example;

import com.obsidiandynamics.bedlam.*;

import java.io.*;

public final class ConsoleFrontEnd {
  private static final String PROMPT = "Type 'add' to admit patient, 'emergency' for emergency, 'status' for status, or 'exit' to quit:";

  private final Hospital hospital;

  private final BufferedReader in;

  private final PrintStream out;

  public ConsoleFrontEnd(Hospital hospital, BufferedReader in, PrintStream out) {
    this.hospital = hospital;
    this.in = in;
    this.out = out;
  }

  public void run() throws IOException {
    while (true) {
      out.println();
      out.println(PROMPT);
      out.print("> ");
      out.flush();
      final var line = in.readLine();
      if (line == null) {
        return;
      }

      final var command = line.strip();
      if (command.startsWith("add")) {
        add();
      } else if (command.startsWith("emergency")) {
        emergency();
      } else if (command.startsWith("status")) {
        out.println(hospital.status().describe());
      } else if (command.startsWith("exit")) {
        return;
      } else if (!command.isEmpty()) {
        out.format("Unknown command '%s'%n", command);
      }
    }
  }

  private void add() throws IOException {
    final var name = prompt("Enter patient name: ");
    if (name == null) return;
    final var severity = promptInt("Enter severity (1-10): ", Patient.MIN_SEVERITY, Patient.MAX_SEVERITY);
    if (severity == null) return;
    final var ward = promptInt("Ward allocation? (1 for yes, 0 for no): ", 0, 1);
    if (ward == null) return;

    if (ward == 1) {
      final var unit = CareUnit.forSeverity(severity);
      hospital.submitPatient(name, PriorityClass.REGULAR, severity, true);
      out.format("[WARD REQUEST] %s requires %s%n", name, unit);
    } else if (hospital.submitPatient(name, PriorityClass.REGULAR, severity, false)) {
      out.format("[CHECK-IN] %s queued for admission%n", name);
    } else {
      out.format("[REJECTED] Admission queue full, %s not queued%n", name);
    }
  }

  private void emergency() throws IOException {
    final var name = prompt("Enter emergency patient name: ");
    if (name == null) return;
    if (hospital.submitPatient(name, PriorityClass.EMERGENCY, Patient.MAX_SEVERITY, false)) {
      out.println("[EMERGENCY] Emergency patient added!");
    } else {
      out.format("[REJECTED] Admission queue full, %s not queued%n", name);
    }
  }

  private String prompt(String message) throws IOException {
    while (true) {
      out.print(message);
      out.flush();
      final var line = in.readLine();
      if (line == null) {
        return null;
      }
      final var value = line.strip();
      if (!value.isEmpty()) {
        return value;
      }
    }
  }

  private Integer promptInt(String message, int min, int max) throws IOException {
    while (true) {
      final var value = prompt(message);
      if (value == null) {
        return null;
      }
      final var number = parseInt(value);
      if (number != null && number >= min && number <= max) {
        return number;
      }
      out.format("Expected a number between %d and %d%n", min, max);
    }
  }

  private static Integer parseInt(String value) {
    return value.matches("-?\\d{1,9}") ? Integer.valueOf(value) : null;
  }
}
