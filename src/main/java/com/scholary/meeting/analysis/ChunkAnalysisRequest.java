package com.scholary.meeting.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Input for analyzing one chunk.
 *
 * @param meetingId meeting the chunk belongs to
 * @param chunkIndex index of the chunk
 * @param text the chunk's text
 * @param overlapText tail of the chunk shared with the next chunk, null for the last chunk
 * @param timeZone IANA zone the meeting's wall-clock timestamps are in
 */
public record ChunkAnalysisRequest(
    @JsonProperty("meeting_id") String meetingId,
    @JsonProperty("chunk_index") int chunkIndex,
    @JsonProperty("text") String text,
    @JsonProperty("overlap_text") String overlapText,
    @JsonProperty("time_zone") String timeZone) {}
