package com.quantori.bqp.executor.ncbi;

import java.time.Duration;

/** Waits between status polls. Replaced in tests so that polling takes no wall-clock time. */
@FunctionalInterface
public interface Sleeper {
  Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
