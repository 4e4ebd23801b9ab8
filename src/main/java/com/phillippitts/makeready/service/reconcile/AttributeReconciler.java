package com.phillippitts.makeready.service.reconcile;

import com.phillippitts.makeready.domain.ConflictStrategy;

/**
 * Strategy for resolving one pole attribute reported by both the survey and the engineering
 * document.
 *
 * <p><b>Available strategies:</b>
 * <ul>
 *   <li>{@link com.phillippitts.makeready.service.reconcile.impl.PreferSurveyReconciler} -
 *       the survey value wins</li>
 *   <li>{@link com.phillippitts.makeready.service.reconcile.impl.PreferEngineeringReconciler} -
 *       the engineering value wins</li>
 *   <li>{@link com.phillippitts.makeready.service.reconcile.impl.HighlightDifferencesReconciler} -
 *       both values are kept in an annotated string</li>
 * </ul>
 *
 * <p>A value reported by only one source is used unconditionally. Implementations are stateless
 * and thread-safe.
 */
public interface AttributeReconciler {

    /**
     * Resolves an attribute.
     *
     * @param survey      value from the survey document (nullable)
     * @param engineering value from the engineering document (nullable)
     * @return resolved value, or null when neither source has one
     */
    String reconcile(String survey, String engineering);

    ConflictStrategy strategy();
}
