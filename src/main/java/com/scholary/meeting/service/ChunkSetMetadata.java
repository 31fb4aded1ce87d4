package com.scholary.meeting.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.meeting.chunking.ChunkingParams;
import com.scholary.meeting.chunking.TranscriptChunk;
import java.util.List;

/** Contents of {@code chunks/metadata.json}, written next to the chunk slices. */
public record ChunkSetMetadata(
    @JsonProperty("meeting_id") String meetingId,
    @JsonProperty("original_input_key") String originalInputKey,
    @JsonProperty("chunk_count") int chunkCount,
    @JsonProperty("total_chars") int totalChars,
    @JsonProperty("estimated_total_tokens") int estimatedTotalTokens,
    @JsonProperty("chunking_params") ChunkingParams chunkingParams,
    @JsonProperty("chunks") List<TranscriptChunk> chunks,
    @JsonProperty("created_at") String createdAt) {}
