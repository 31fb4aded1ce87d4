package com.scholary.meeting.service;

/** Receives progress of a meeting run, as a phase name and a percentage. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (phase, percentComplete) -> {};

  void onProgress(String phase, int percentComplete);
}
