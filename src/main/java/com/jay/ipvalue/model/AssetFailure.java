package com.jay.ipvalue.model;

import com.jay.ipvalue.exception.ValuationErrorKind;

/** An asset skipped by a best-effort portfolio run. */
public record AssetFailure(String assetId, ValuationErrorKind kind, String message) {}
