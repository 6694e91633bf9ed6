package org.sitemodel.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.sitemodel.output.SiteModelColumn;
import org.sitemodel.output.SiteRecord;
import org.sitemodel.policy.AssociationWarning;

import java.util.List;
import java.util.Set;

/**
 * Site records ready for writing, plus the warnings and counters of the run.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class PreparationResult {
    private final Set<SiteModelColumn> columns;
    private final List<SiteRecord> records;
    private final List<AssociationWarning> warnings;
    private final PreparationTelemetry telemetry;
}
