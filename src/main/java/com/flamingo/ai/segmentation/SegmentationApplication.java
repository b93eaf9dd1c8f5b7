package com.flamingo.ai.segmentation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the document segmentation service. */
@SpringBootApplication
public class SegmentationApplication {

  public static void main(String[] args) {
    SpringApplication.run(SegmentationApplication.class, args);
  }
}
