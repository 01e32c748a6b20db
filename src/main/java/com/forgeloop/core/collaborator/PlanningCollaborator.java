package com.forgeloop.core.collaborator;

import com.forgeloop.core.model.AppPlan;
import com.forgeloop.core.model.IdeationResult;

import java.util.List;

/**
 * Turns a raw idea into an ideation analysis and then a plan.
 */
public interface PlanningCollaborator extends CapabilityAware {

    IdeationResult ideate(String prompt);

    String refinePrompt(String originalPrompt, List<String> selectedFeatures);

    AppPlan generatePlan(String prompt);
}
