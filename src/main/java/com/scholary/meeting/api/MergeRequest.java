package com.scholary.meeting.api;

import com.scholary.meeting.chunking.TranscriptChunk;
import com.scholary.meeting.turn.Turn;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

/**
 * Request for merging chunk results that were analyzed elsewhere.
 *
 * <p>{@code results} maps chunk index to turns; a chunk with no entry or a null entry counts as
 * failed.
 */
public record MergeRequest(
    @NotNull List<TranscriptChunk> chunks,
    @NotNull Map<Integer, List<Turn>> results,
    Double similarityThreshold) {}
