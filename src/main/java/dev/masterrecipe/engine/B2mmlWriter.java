package dev.masterrecipe.engine;

import dev.masterrecipe.model.*;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link CompiledDocument} as B2MML batch information.
 */
public final class B2mmlWriter {

    public static final String B2MML_NAMESPACE = "http://www.mesa.org/xml/B2MML";
    public static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String SCHEMA_LOCATION = "http://www.mesa.org/xml/B2MML Schema/AllSchemas.xsd";

    private static final String PREFIX = "b2mml:";

    private B2mmlWriter() {}

    public static void write(CompiledDocument document, Path path) throws IOException {
        Files.writeString(path, toXml(document), StandardCharsets.UTF_8);
    }

    public static String toXml(CompiledDocument document) {
        try {
            Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            doc.setXmlStandalone(true);
            doc.appendChild(batchInformation(doc, document));

            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");

            var out = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
            return out.toString();
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IllegalStateException("Failed to serialize master recipe " + document.masterRecipe().id(), e);
        }
    }

    private static Element batchInformation(Document doc, CompiledDocument document) {
        Element root = doc.createElement(PREFIX + "BatchInformation");
        root.setAttribute("xmlns:xsi", XSI_NAMESPACE);
        root.setAttribute("xsi:schemaLocation", SCHEMA_LOCATION);
        root.setAttribute("xmlns:b2mml", B2MML_NAMESPACE);

        Element listHeader = child(root, "ListHeader");
        text(listHeader, "ID", document.listHeaderId());
        text(listHeader, "CreateDate", document.createDate());
        text(root, "Description", document.description());

        root.appendChild(masterRecipe(root, document.masterRecipe()));
        return root;
    }

    private static Element masterRecipe(Element root, MasterRecipe recipe) {
        Element element = root.getOwnerDocument().createElement(PREFIX + "MasterRecipe");
        text(element, "ID", recipe.id());
        text(element, "Version", recipe.version());
        text(element, "VersionDate", recipe.versionDate());
        text(element, "Description", recipe.description());

        Element header = child(element, "Header");
        text(header, "ProductID", recipe.header().productId());
        text(header, "ProductName", recipe.header().productName());

        MasterRecipe.EquipmentRequirement requirement = recipe.equipmentRequirement();
        Element equipment = child(element, "EquipmentRequirement");
        text(equipment, "ID", requirement.id());
        Element constraint = child(equipment, "Constraint");
        text(constraint, "ID", requirement.constraintId());
        text(constraint, "Condition", requirement.constraintCondition());
        text(equipment, "Description", requirement.description());

        Element formula = child(element, "Formula");
        for (FormulaParameter parameter : recipe.formula()) {
            writeParameter(formula, parameter);
        }

        Element procedureLogic = child(element, "ProcedureLogic");
        ProcedureLogic logic = recipe.procedureLogic();
        logic.links().forEach(link -> writeLink(procedureLogic, link));
        logic.steps().forEach(step -> writeStep(procedureLogic, step));
        logic.transitions().forEach(transition -> writeTransition(procedureLogic, transition));

        recipe.recipeElements().forEach(recipeElement -> writeRecipeElement(element, recipeElement));
        return element;
    }

    private static void writeParameter(Element formula, FormulaParameter parameter) {
        Element element = child(formula, "Parameter");
        text(element, "ID", parameter.id());
        text(element, "Description", parameter.description());
        text(element, "ParameterType", FormulaParameter.PARAMETER_TYPE);
        text(element, "ParameterSubType", FormulaParameter.PARAMETER_SUB_TYPE);

        Element value = child(element, "Value");
        text(value, "ValueString", parameter.value().valueString());
        text(value, "DataInterpretation", FormulaParameter.DATA_INTERPRETATION);
        text(value, "DataType", parameter.value().dataType());
        text(value, "UnitOfMeasure", parameter.value().unitOfMeasure());
    }

    private static void writeLink(Element procedureLogic, Link link) {
        Element element = child(procedureLogic, "Link");
        text(element, "ID", link.id());

        Element from = child(element, "FromID");
        text(from, "FromIDValue", link.fromId());
        text(from, "FromType", link.fromType().label());
        text(from, "IDScope", Link.ID_SCOPE);

        Element to = child(element, "ToID");
        text(to, "ToIDValue", link.toId());
        text(to, "ToType", link.toType().label());
        text(to, "IDScope", Link.ID_SCOPE);

        text(element, "LinkType", Link.LINK_TYPE);
        text(element, "Depiction", Link.DEPICTION);
        text(element, "EvaluationOrder", Link.EVALUATION_ORDER);
        text(element, "Description", Link.DESCRIPTION);
    }

    private static void writeStep(Element procedureLogic, Step step) {
        Element element = child(procedureLogic, "Step");
        text(element, "ID", step.id());
        text(element, "RecipeElementID", step.recipeElementId());
        child(element, "RecipeElementVersion");
        text(element, "Description", step.description());
    }

    private static void writeTransition(Element procedureLogic, Transition transition) {
        Element element = child(procedureLogic, "Transition");
        text(element, "ID", transition.id());
        text(element, "Condition", transition.condition());
    }

    private static void writeRecipeElement(Element masterRecipe, RecipeElement recipeElement) {
        Element element = child(masterRecipe, "RecipeElement");
        text(element, "ID", recipeElement.id());

        if (recipeElement instanceof RecipeElement.Operation operation) {
            text(element, "Description", operation.description());
            text(element, "RecipeElementType", operation.type());
            text(element, "ActualEquipmentID", operation.actualEquipmentId());
            Element requirement = child(element, "EquipmentRequirement");
            text(requirement, "ID", operation.equipmentRequirementId());
            for (String parameterId : operation.parameterIds()) {
                Element reference = child(element, "Parameter");
                text(reference, "ID", parameterId);
                text(reference, "ParameterType", FormulaParameter.PARAMETER_TYPE);
            }
        } else {
            text(element, "RecipeElementType", recipeElement.type());
        }
    }

    private static Element child(Element parent, String name) {
        Element element = parent.getOwnerDocument().createElement(PREFIX + name);
        parent.appendChild(element);
        return element;
    }

    private static void text(Element parent, String name, String value) {
        child(parent, name).setTextContent(value);
    }
}
