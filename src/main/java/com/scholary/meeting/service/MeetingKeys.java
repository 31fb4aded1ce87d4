package com.scholary.meeting.service;

/**
 * Object keys of a meeting's artifacts.
 *
 * <pre>
 * meetings/{id}/chunks/chunk_{i}.txt
 * meetings/{id}/chunks/chunk_{i}_overlap.txt
 * meetings/{id}/chunks/metadata.json
 * meetings/{id}/01_turns.json
 * meetings/{id}/01_turns.txt
 * </pre>
 */
public final class MeetingKeys {

  private MeetingKeys() {}

  public static String meetingPrefix(String meetingId) {
    return "meetings/" + meetingId + "/";
  }

  public static String chunkText(String meetingId, int chunkIndex) {
    return meetingPrefix(meetingId) + "chunks/chunk_" + chunkIndex + ".txt";
  }

  public static String chunkOverlap(String meetingId, int chunkIndex) {
    return meetingPrefix(meetingId) + "chunks/chunk_" + chunkIndex + "_overlap.txt";
  }

  public static String chunkMetadata(String meetingId) {
    return meetingPrefix(meetingId) + "chunks/metadata.json";
  }

  public static String turnsJson(String meetingId) {
    return meetingPrefix(meetingId) + "01_turns.json";
  }

  public static String turnsText(String meetingId) {
    return meetingPrefix(meetingId) + "01_turns.txt";
  }
}
