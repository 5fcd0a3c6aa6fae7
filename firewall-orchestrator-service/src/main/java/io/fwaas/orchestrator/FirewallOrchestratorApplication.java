package io.fwaas.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "io.fwaas.orchestrator.config")
public class FirewallOrchestratorApplication {
    public static void main(String[] args) {
        SpringApplication.run(FirewallOrchestratorApplication.class, args);
    }
}
