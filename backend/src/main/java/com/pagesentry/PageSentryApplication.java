package com.pagesentry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PageSentryApplication {

  public static void main(String[] args) {
    SpringApplication.run(PageSentryApplication.class, args);
  }
}
