package com.openforge.memorylane;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

// Every *Properties record under the base package is registered here so the
// conditional store beans can rely on them regardless of which store is active.
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoryLaneApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryLaneApplication.class, args);
    }
}
