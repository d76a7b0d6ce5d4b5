package com.gentoro.llmc.compiler;

import java.util.concurrent.atomic.AtomicBoolean;

/** Checked between chunks of an incremental compilation. */
@FunctionalInterface
public interface CancellationSignal {
  CancellationSignal NEVER = () -> false;

  boolean isCancelled();

  /** A signal that is cancelled by calling {@link Flag#cancel()}, from any thread. */
  static Flag flag() {
    return new Flag();
  }

  final class Flag implements CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
      cancelled.set(true);
    }

    @Override
    public boolean isCancelled() {
      return cancelled.get();
    }
  }
}
