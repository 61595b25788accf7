package com.notisync.device;

import com.notisync.common.config.RuleEngineConfig;
import com.notisync.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import({TimeConfig.class, RuleEngineConfig.class})
public class DeviceApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeviceApplication.class, args);
  }
}
