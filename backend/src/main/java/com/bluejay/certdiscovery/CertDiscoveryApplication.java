package com.bluejay.certdiscovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CertDiscoveryApplication {

  public static void main(String[] args) {
    SpringApplication.run(CertDiscoveryApplication.class, args);
  }
}
