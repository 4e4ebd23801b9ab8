package com.phillippitts.makeready.service.reconcile.impl;

import com.phillippitts.makeready.domain.ConflictStrategy;
import com.phillippitts.makeready.service.reconcile.AbstractAttributeReconciler;

/**
 * Keeps both values so a reviewer can see the disagreement:
 * {@code "40-4 Southern Pine (ENGINEERING: 45-3 Southern Pine)"}.
 */
public final class HighlightDifferencesReconciler extends AbstractAttributeReconciler {

    static final String LABEL = "ENGINEERING";

    @Override
    protected String doReconcile(String survey, String engineering) {
        return survey + " (" + LABEL + ": " + engineering + ")";
    }

    @Override
    public ConflictStrategy strategy() {
        return ConflictStrategy.HIGHLIGHT_DIFFERENCES;
    }
}
