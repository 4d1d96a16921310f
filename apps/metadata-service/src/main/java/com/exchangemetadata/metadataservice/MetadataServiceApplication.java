package com.exchangemetadata.metadataservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MetadataServiceApplication {
  public static void main(String[] args) {
    SpringApplication.run(MetadataServiceApplication.class, args);
  }
}
