package io.b2mash.chores;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChoresApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChoresApplication.class, args);
  }
}
