package com.scholary.video.transcriber;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoTranscriberApplication {

  public static void main(String[] args) {
    SpringApplication.run(VideoTranscriberApplication.class, args);
  }
}
