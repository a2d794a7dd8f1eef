package com.serpintel.common.alert;

import com.serpintel.common.window.AnalysisWindow;

import java.util.UUID;

/**
 * One keyword target and its windowed snapshots.
 */
public record KeywordSeries(
    UUID keywordTargetId,
    String query,
    String locale,
    String device,
    AnalysisWindow window
) {}
