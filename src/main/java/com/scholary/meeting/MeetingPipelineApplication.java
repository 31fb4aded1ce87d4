package com.scholary.meeting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class MeetingPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(MeetingPipelineApplication.class, args);
  }
}
