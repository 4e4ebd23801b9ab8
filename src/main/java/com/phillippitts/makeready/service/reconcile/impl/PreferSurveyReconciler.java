package com.phillippitts.makeready.service.reconcile.impl;

import com.phillippitts.makeready.domain.ConflictStrategy;
import com.phillippitts.makeready.service.reconcile.AbstractAttributeReconciler;

/**
 * Resolves conflicts in favour of the field survey.
 */
public final class PreferSurveyReconciler extends AbstractAttributeReconciler {

    @Override
    protected String doReconcile(String survey, String engineering) {
        return survey;
    }

    @Override
    public ConflictStrategy strategy() {
        return ConflictStrategy.PREFER_SURVEY;
    }
}
