package com.dcruver.docgrade.app;

import com.dcruver.docgrade.config.GraderProperties;
import com.dcruver.docgrade.domain.ComponentScanner;
import com.dcruver.docgrade.domain.ComponentType;
import com.dcruver.docgrade.domain.ScanSummary;
import com.dcruver.docgrade.domain.ScoredComponent;
import com.dcruver.docgrade.reporting.OutputFormat;
import com.dcruver.docgrade.reporting.ScoreReportFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;

/**
 * Spring Shell commands for grading component documents.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class GraderShellCommands {

    private final ComponentScanner componentScanner;
    private final ScoreReportFormatter reportFormatter;
    private final GraderProperties properties;

    @ShellMethod(key = "score", value = "Grade a single agent, command, skill, plugin or output-style file")
    public String score(
        @ShellOption(help = "File to grade") String path,
        @ShellOption(defaultValue = ShellOption.NULL, help = "agent, command, skill, plugin or output-style") String type,
        @ShellOption(defaultValue = ShellOption.NULL, help = "console, json or markdown") String format,
        @ShellOption(defaultValue = "false", help = "Show every metric") boolean verbose,
        @ShellOption(defaultValue = "false", help = "List improvements") boolean improvements) {

        log.info("Grading {}", path);

        try {
            ComponentType componentType = null;
            if (type != null) {
                componentType = ComponentType.fromName(type)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown component type: " + type));
            }

            ScoredComponent scored = componentScanner.scoreFile(Path.of(path), componentType);

            return reportFormatter.format(scored,
                resolveFormat(format),
                verbose || properties.isVerbose(),
                improvements || properties.isShowImprovements());

        } catch (Exception e) {
            log.error("Grading failed for {}", path, e);
            return "Grading failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "scan", value = "Grade every component under a project directory")
    public String scan(
        @ShellOption(defaultValue = ShellOption.NULL, help = "Project directory (defaults to grader.project-path)") String path,
        @ShellOption(defaultValue = ShellOption.NULL, help = "console, json or markdown") String format,
        @ShellOption(defaultValue = "false", help = "Show every metric") boolean verbose,
        @ShellOption(defaultValue = "false", help = "List improvements") boolean improvements) {

        String projectPath = path != null ? path : properties.getProjectPath();
        log.info("Scanning project {}", projectPath);

        try {
            ScanSummary summary = componentScanner.scan(Path.of(projectPath));
            OutputFormat outputFormat = resolveFormat(format);

            String report = reportFormatter.format(summary,
                outputFormat,
                verbose || properties.isVerbose(),
                improvements || properties.isShowImprovements());

            if (outputFormat == OutputFormat.CONSOLE && summary.getTotalComponents() > 0) {
                report += summary.meetsTarget(properties.getTargetScore())
                    ? String.format("Target %d reached.%n", properties.getTargetScore())
                    : String.format("Below target %d.%n", properties.getTargetScore());
            }
            return report;

        } catch (Exception e) {
            log.error("Scan failed for {}", projectPath, e);
            return "Scan failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "tiers", value = "Show the score bands for each tier")
    public String tiers() {
        return reportFormatter.formatTiers();
    }

    private OutputFormat resolveFormat(String format) {
        return format != null ? OutputFormat.fromName(format) : properties.getOutputFormat();
    }
}
