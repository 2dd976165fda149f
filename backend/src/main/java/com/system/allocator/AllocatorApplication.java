package com.system.allocator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AllocatorApplication {

  public static void main(String[] args) {
    SpringApplication.run(AllocatorApplication.class, args);
  }
}
