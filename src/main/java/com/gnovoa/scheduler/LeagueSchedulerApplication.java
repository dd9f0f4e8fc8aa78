// Namespace
package com.gnovoa.scheduler;

// Imports
import com.gnovoa.scheduler.config.SlotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties(SlotProperties.class)
public class LeagueSchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(LeagueSchedulerApplication.class, args);
  }
}
