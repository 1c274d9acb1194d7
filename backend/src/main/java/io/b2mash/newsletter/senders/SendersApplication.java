package io.b2mash.newsletter.senders;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SendersApplication {

  public static void main(String[] args) {
    SpringApplication.run(SendersApplication.class, args);
  }
}
