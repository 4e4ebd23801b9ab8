package com.phillippitts.makeready.service.attribute;

import com.phillippitts.makeready.domain.ConflictStrategy;
import com.phillippitts.makeready.domain.PoleAttributes;
import com.phillippitts.makeready.service.reconcile.AttributeReconciler;
import com.phillippitts.makeready.service.reconcile.AttributeReconcilers;
import com.phillippitts.makeready.service.survey.PoleLabelResolver;
import com.phillippitts.makeready.util.JsonTrees;
import com.phillippitts.makeready.util.PoleIds;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.Objects;

/**
 * Resolves the attributes of one pole from both documents under a conflict strategy.
 */
public final class PoleAttributeResolver {

    private static final Logger LOG = LogManager.getLogger(PoleAttributeResolver.class);

    private final AttributeReconcilers reconcilers;

    public PoleAttributeResolver(AttributeReconcilers reconcilers) {
        this.reconcilers = Objects.requireNonNull(reconcilers, "reconcilers must not be null");
    }

    /**
     * @param node        survey node of the pole
     * @param location    engineering location, or null
     * @param engineering engineering document, or null
     * @param strategy    conflict strategy, or null for the configured default
     */
    public PoleAttributes resolve(JSONObject node, JSONObject location, JSONObject engineering,
                                  ConflictStrategy strategy) {
        JSONObject attributes = JsonTrees.object(node, "attributes");
        String poleNumber = PoleLabelResolver.poleNumber(node);
        SourceAttributes survey = SurveyAttributeExtractor.extract(node);
        SourceAttributes design = EngineeringAttributeExtractor.extract(location, engineering);

        AttributeReconciler reconciler = reconcilers.forStrategy(strategy);
        PoleAttributes resolved = new PoleAttributes(
                poleNumber,
                PoleIds.normalize(poleNumber),
                reconciler.reconcile(survey.owner(), design.owner()),
                reconciler.reconcile(survey.structure(), design.structure()),
                reconciler.reconcile(survey.constructionGrade(), design.constructionGrade()),
                reconciler.reconcile(survey.plaPercentage(), design.plaPercentage()),
                reconciler.reconcile(survey.notes(), design.notes()),
                SurveyAttributeExtractor.passingCapacity(attributes),
                JsonTrees.number(node, "latitude"),
                JsonTrees.number(node, "longitude"));
        LOG.debug("Pole {} attributes resolved with {}", poleNumber, reconciler.strategy());
        return resolved;
    }
}
