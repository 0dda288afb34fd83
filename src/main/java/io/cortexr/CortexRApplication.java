package io.cortexr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Cortex-R: a tool-using agent that plans in code and calls MCP tool servers.
 */
@SpringBootApplication
public class CortexRApplication {

    public static void main(String[] args) {
        SpringApplication.run(CortexRApplication.class, args);
    }
}
