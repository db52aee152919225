package io.b2mash.schemaswitch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SchemaSwitchApplication {

  public static void main(String[] args) {
    SpringApplication.run(SchemaSwitchApplication.class, args);
  }
}
