package com.dcruver.docgrade;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Doc Grader.
 *
 * A Spring Shell tool that grades agent, command, skill, plugin and
 * output-style documents on a 0-100 quality scale with letter tiers.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class DocGraderApplication {

    public static void main(String[] args) {
        log.info("Starting Doc Grader...");
        SpringApplication.run(DocGraderApplication.class, args);
    }
}
