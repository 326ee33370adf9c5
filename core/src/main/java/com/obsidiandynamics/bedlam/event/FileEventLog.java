package com.obsidiandynamics.bedlam.event;

import com.obsidiandynamics.bedlam.*;

import java.io.*;
import java.nio.charset.*;
import java.nio.file.*;

public final class FileEventLog implements EventLog, Closeable {
  private final Object monitor = new Object();

  private final Path path;

  private Writer writer;

  public FileEventLog(Path path) throws IOException {
    this.path = path;
    writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  public Path getPath() {
    return path;
  }

  @Override
  public void record(EventType type, Patient patient) {
    writeLine(EventFormat.formatEvent(type, patient));
  }

  @Override
  public void recordCapacity(int total, int occupied) {
    writeLine(EventFormat.formatCapacity(total, occupied));
  }

  private void writeLine(String line) {
    synchronized (monitor) {
      if (writer == null) {
        return;
      }

      try {
        writer.write(line);
        writer.write(System.lineSeparator());
        writer.flush();
      } catch (IOException e) {
        throw new UncheckedIOException("Error writing to " + path, e);
      }
    }
  }

  @Override
  public void close() throws IOException {
    synchronized (monitor) {
      if (writer != null) {
        try {
          writer.close();
        } finally {
          writer = null;
        }
      }
    }
  }
}
