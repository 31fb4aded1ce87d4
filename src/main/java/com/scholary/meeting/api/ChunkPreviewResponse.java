package com.scholary.meeting.api;

import com.scholary.meeting.chunking.ChunkingParams;
import com.scholary.meeting.chunking.TranscriptChunk;
import java.util.List;

/** Planned chunks of a transcript, without any analysis. */
public record ChunkPreviewResponse(
    int totalChars,
    int estimatedTokens,
    boolean chunked,
    int chunkCount,
    ChunkingParams params,
    List<TranscriptChunk> chunks) {}
