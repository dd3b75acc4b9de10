package com.dcruver.docgrade.domain.scoring;

/**
 * Alternate check consulted when a section's primary pattern does not match,
 * so an equivalent phrasing can still earn the section's points.
 */
@FunctionalInterface
public interface SectionFallback {

    boolean matches(String body, String sectionName);
}
