/*
 * Where: eCard application entry point
 * What: Boots Spring and enables the scheduled workers
 */
package com.ecards.ecard;

import com.ecards.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class EcardApplication {

  public static void main(String[] args) {
    SpringApplication.run(EcardApplication.class, args);
  }
}
