package com.scholary.meeting.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.meeting.turn.Turn;
import java.util.List;

/** Body returned by the analyzer service. */
@JsonIgnoreProperties(ignoreUnknown = true)
record AnalyzeResponse(@JsonProperty("turns") List<Turn> turns) {}
