package com.friendfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FriendFeedApplication {

  public static void main(String[] args) {
    SpringApplication.run(FriendFeedApplication.class, args);
  }
}
