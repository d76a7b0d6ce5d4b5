package com.gentoro.llmc.compiler;

@FunctionalInterface
public interface IncrementalUpdateListener {
  IncrementalUpdateListener NONE = update -> {};

  void onUpdate(IncrementalUpdate update);
}
