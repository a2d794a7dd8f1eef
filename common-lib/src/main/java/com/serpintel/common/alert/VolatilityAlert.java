package com.serpintel.common.alert;

import java.time.Instant;
import java.util.UUID;

/**
 * Closed union of the alert kinds produced by {@link AlertEvaluator}.
 *
 * <p>The {@code sort*} accessors feed the deterministic alert order and are
 * not part of the serialized record.
 */
public sealed interface VolatilityAlert
    permits RegimeTransitionAlert, SpikeAlert, ConcentrationAlert {

    AlertTrigger triggerType();

    int severityRank();

    Instant sortCapturedAt();

    /** Null for project-level alerts. */
    UUID sortKeywordTargetId();

    /** Null for project-level alerts. */
    UUID sortSnapshotId();
}
