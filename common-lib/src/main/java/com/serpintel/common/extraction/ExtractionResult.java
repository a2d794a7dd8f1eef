package com.serpintel.common.extraction;

import com.serpintel.common.model.RankedResult;

import java.util.List;

/**
 * Organic results pulled from one payload, plus whether the payload shape was
 * unrecognised (or recognised but yielded nothing from non-empty input).
 */
public record ExtractionResult(List<RankedResult> results, boolean parseWarning) {}
