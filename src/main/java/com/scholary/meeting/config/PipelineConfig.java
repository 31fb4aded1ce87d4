package com.scholary.meeting.config;

import com.scholary.meeting.analysis.AnalyzerProperties;
import com.scholary.meeting.chunking.ChunkingParams;
import com.scholary.meeting.turn.MergeParams;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the chunking and merge beans.
 *
 * <p>Turns the bound properties into the parameter records the chunker and merger take, so an
 * invalid combination (overlap not smaller than the chunk size) fails at startup.
 */
@Configuration
@EnableConfigurationProperties({PipelineProperties.class, AnalyzerProperties.class})
public class PipelineConfig {

  @Bean
  public ChunkingParams chunkingParams(PipelineProperties properties) {
    return properties.chunking().toParams();
  }

  @Bean
  public MergeParams mergeParams(PipelineProperties properties) {
    PipelineProperties.Merge merge = properties.merge();
    return new MergeParams(
        merge.similarityThreshold(),
        merge.averageTokensPerTurn(),
        merge.maxWindowTurns(),
        properties.chunking().charsPerToken());
  }
}
