package com.delta.linktools;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LinkToolsApplication {

  public static void main(String[] args) {
    SpringApplication.run(LinkToolsApplication.class, args);
  }
}
