package com.phillippitts.makeready.service.reconcile;

import java.util.Locale;

/**
 * Template for attribute reconcilers. {@link #reconcile(String, String)} settles the cases
 * that are not conflicts and delegates real conflicts to {@link #doReconcile(String, String)}.
 *
 * <ul>
 *   <li>both values absent or blank: null</li>
 *   <li>one value absent or blank: the other one</li>
 *   <li>values equal ignoring case and surrounding whitespace: the survey value</li>
 *   <li>otherwise: {@link #doReconcile(String, String)}</li>
 * </ul>
 */
public abstract class AbstractAttributeReconciler implements AttributeReconciler {

    @Override
    public final String reconcile(String survey, String engineering) {
        boolean hasSurvey = survey != null && !survey.isBlank();
        boolean hasEngineering = engineering != null && !engineering.isBlank();
        if (!hasSurvey && !hasEngineering) {
            return null;
        }
        if (!hasEngineering) {
            return survey.trim();
        }
        if (!hasSurvey) {
            return engineering.trim();
        }
        String s = survey.trim();
        String e = engineering.trim();
        if (s.toLowerCase(Locale.ROOT).equals(e.toLowerCase(Locale.ROOT))) {
            return s;
        }
        return doReconcile(s, e);
    }

    /**
     * Resolves a genuine conflict.
     *
     * @param survey      trimmed survey value (never null or blank)
     * @param engineering trimmed engineering value (never null or blank)
     */
    protected abstract String doReconcile(String survey, String engineering);
}
