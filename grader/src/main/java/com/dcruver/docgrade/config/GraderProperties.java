package com.dcruver.docgrade.config;

import com.dcruver.docgrade.reporting.OutputFormat;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runtime settings for the grader shell.
 * Scoring rules and thresholds are fixed and not configured here.
 */
@Component
@ConfigurationProperties(prefix = "grader")
@Data
public class GraderProperties {

    /**
     * Directory scanned when no path is given
     */
    private String projectPath = ".";

    private OutputFormat outputFormat = OutputFormat.CONSOLE;

    private boolean verbose = false;

    private boolean showImprovements = false;

    /**
     * Mean score a scan should reach to be reported as on target
     */
    private int targetScore = 70;

    /**
     * Directory names never descended into
     */
    private List<String> excludedDirectories = new ArrayList<>(List.of(".git", "node_modules", "target", "build"));
}
