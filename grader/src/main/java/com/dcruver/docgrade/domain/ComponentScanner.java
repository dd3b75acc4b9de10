package com.dcruver.docgrade.domain;

import com.dcruver.docgrade.config.GraderProperties;
import com.dcruver.docgrade.domain.scoring.QualityScore;
import com.dcruver.docgrade.domain.scoring.Tier;
import com.dcruver.docgrade.io.ComponentTypeDetector;
import com.dcruver.docgrade.io.DocumentParseException;
import com.dcruver.docgrade.io.DocumentReader;
import com.dcruver.docgrade.io.ParsedDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;

/**
 * Scans a project directory, detects component files and grades them.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ComponentScanner {

    private final DocumentReader documentReader;
    private final ComponentTypeDetector typeDetector;
    private final GraderProperties properties;

    /**
     * Grade every recognised component under the given directory
     */
    public ScanSummary scan(Path projectDir) throws IOException {
        Path root = projectDir.toAbsolutePath().normalize();

        if (!Files.exists(root)) {
            throw new NoSuchFileException(root.toString());
        }
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }

        log.info("Scanning components at: {}", root);

        ComponentFileCollector collector =
            new ComponentFileCollector(root, new HashSet<>(properties.getExcludedDirectories()));
        Files.walkFileTree(root, collector);

        List<ScoredComponent> components = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (Path file : collector.getFiles()) {
            Path relative = root.relativize(file);
            Optional<ComponentType> type = typeDetector.detect(relative);
            if (type.isEmpty()) {
                continue;
            }

            try {
                components.add(grade(file, relative, type.get()));
            } catch (IOException | DocumentParseException e) {
                log.warn("Skipping {}: {}", relative, e.getMessage());
                skipped.add(toDisplayPath(relative));
            }
        }

        for (Path unreadable : collector.getUnreadable()) {
            skipped.add(toDisplayPath(root.relativize(unreadable)));
        }

        log.info("Graded {} components ({} skipped)", components.size(), skipped.size());

        return buildSummary(root, components, skipped);
    }

    /**
     * Grade a single file. The type is detected from the path unless given.
     */
    public ScoredComponent scoreFile(Path file, ComponentType type) throws IOException, DocumentParseException {
        Path path = file.toAbsolutePath().normalize();

        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }

        ComponentType resolved = type;
        if (resolved == null) {
            resolved = typeDetector.detect(path)
                .orElseThrow(() -> new IllegalArgumentException(
                    "Cannot determine component type of " + file + "; pass --type"));
        }

        return grade(path, file, resolved);
    }

    private ScoredComponent grade(Path file, Path displayPath, ComponentType type)
        throws IOException, DocumentParseException {
        ParsedDocument document = documentReader.read(file, type);

        QualityScore score = type.getScorer().score(
            document.getRawContent(), document.getFrontmatter(), document.getBody());

        log.debug("{} {} -> {} ({})", type.getLabel(), displayPath, score.getOverall(), score.getTier());

        return ScoredComponent.builder()
            .path(toDisplayPath(displayPath))
            .type(type)
            .score(score)
            .build();
    }

    private String toDisplayPath(Path path) {
        return path.toString().replace('\\', '/');
    }

    private ScanSummary buildSummary(Path root, List<ScoredComponent> components, List<String> skipped) {
        Map<Tier, Integer> tierCounts = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            tierCounts.put(tier, 0);
        }
        Map<ComponentType, Integer> typeCounts = new EnumMap<>(ComponentType.class);
        for (ComponentType type : ComponentType.values()) {
            typeCounts.put(type, 0);
        }
        for (ScoredComponent component : components) {
            tierCounts.merge(component.getScore().getTier(), 1, Integer::sum);
            typeCounts.merge(component.getType(), 1, Integer::sum);
        }

        double meanScore = components.stream()
            .mapToInt(c -> c.getScore().getOverall())
            .average()
            .orElse(0.0);

        // Worst first; path keeps the order stable between runs
        List<ScoredComponent> lowestScoring = components.stream()
            .sorted(Comparator.comparingInt((ScoredComponent c) -> c.getScore().getOverall())
                .thenComparing(ScoredComponent::getPath))
            .toList();

        return ScanSummary.builder()
            .root(root.toString())
            .scannedAt(Instant.now())
            .components(List.copyOf(components))
            .skipped(List.copyOf(skipped))
            .totalComponents(components.size())
            .meanScore(meanScore)
            .tierCounts(tierCounts)
            .typeCounts(typeCounts)
            .lowestScoring(lowestScoring)
            .build();
    }
}
