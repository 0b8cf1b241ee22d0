package dev.masterrecipe.model;

import java.util.List;

/**
 * An equipment-bound recipe: formula, procedure logic and recipe elements cross-referencing each other.
 */
public record MasterRecipe(
    String id,
    String version,
    String versionDate,
    String description,
    ProductHeader header,
    EquipmentRequirement equipmentRequirement,
    List<FormulaParameter> formula,
    ProcedureLogic procedureLogic,
    List<RecipeElement> recipeElements
) {

    public record ProductHeader(String productId, String productName) {}

    public record EquipmentRequirement(
        String id,
        String constraintId,
        String constraintCondition,
        String description
    ) {}
}
