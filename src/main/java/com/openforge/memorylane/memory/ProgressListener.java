package com.openforge.memorylane.memory;

/** Receives {@code (processed, total)} chunk counts after every chunk. */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (processed, total) -> { };

    void onProgress(int processed, int total);
}
