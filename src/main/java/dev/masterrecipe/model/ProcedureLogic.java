package dev.masterrecipe.model;

import java.util.List;

/**
 * The step/transition graph of a master recipe, connected by control links.
 */
public record ProcedureLogic(
    List<Link> links,
    List<Step> steps,
    List<Transition> transitions
) {}
