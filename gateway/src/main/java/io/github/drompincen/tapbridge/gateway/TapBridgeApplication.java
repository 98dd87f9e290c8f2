package io.github.drompincen.tapbridge.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.tapbridge")
@ConfigurationPropertiesScan
public class TapBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TapBridgeApplication.class, args);
    }
}
