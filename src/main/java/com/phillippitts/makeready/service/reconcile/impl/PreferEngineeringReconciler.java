package com.phillippitts.makeready.service.reconcile.impl;

import com.phillippitts.makeready.domain.ConflictStrategy;
import com.phillippitts.makeready.service.reconcile.AbstractAttributeReconciler;

/**
 * Resolves conflicts in favour of the engineering analysis. This is the default strategy.
 */
public final class PreferEngineeringReconciler extends AbstractAttributeReconciler {

    @Override
    protected String doReconcile(String survey, String engineering) {
        return engineering;
    }

    @Override
    public ConflictStrategy strategy() {
        return ConflictStrategy.PREFER_ENGINEERING;
    }
}
