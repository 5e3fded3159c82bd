package com.neoforge.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrchestratorApplication {

    /**
     * Runs one pipeline for the requirement given on the command line, then exits
     * with the runner's exit code. The progress endpoints are served while the
     * pipeline runs.
     *
     * To run:
     *   GROQ_API_KEY=gsk_... mvn -pl orchestrator spring-boot:run -Dspring-boot.run.arguments="Build a counter CLI"
     */
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(OrchestratorApplication.class, args)));
    }
}
