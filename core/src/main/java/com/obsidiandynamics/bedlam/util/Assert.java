package com.obsidiandynamics.bedlam.util;

import java.util.function.*;

public final class Assert {
  private Assert() {}

  public static void that(boolean condition) {
    that(condition, () -> null);
  }

  public static Supplier<String> withMessage(String message) {
    return () -> message;
  }

  public static void that(boolean condition, Supplier<String> messageBuilder) {
    that(condition, AssertionError::new, messageBuilder);
  }

  public static <X extends Throwable> void that(boolean condition, Function<String, X> errorMaker, Supplier<String> messageBuilder) throws X {
    if (! condition) {
      throw errorMaker.apply(messageBuilder.get());
    }
  }

  public static void inRange(int value, int lower, int upper, String name) {
    that(value >= lower && value <= upper,
         () -> String.format("%s out of range [%d, %d]: %d", name, lower, upper, value));
  }

  public static void argument(boolean condition, Supplier<String> messageBuilder) {
    that(condition, IllegalArgumentException::new, messageBuilder);
  }
}
