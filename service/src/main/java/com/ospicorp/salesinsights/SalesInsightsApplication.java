package com.ospicorp.salesinsights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SalesInsightsApplication {

  public static void main(String[] args) {
    SpringApplication.run(SalesInsightsApplication.class, args);
  }
}
