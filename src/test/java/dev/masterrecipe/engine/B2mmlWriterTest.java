package dev.masterrecipe.engine;

import dev.masterrecipe.model.CompiledDocument;
import dev.masterrecipe.model.CompilerSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class B2mmlWriterTest {

    private static CompiledDocument compile() throws Exception {
        return new DocumentAssembler(TestFixtures.catalog(), CompilerSettings.defaults(),
            TestFixtures.FIXED_CLOCK, TestFixtures.sequentialTokens())
            .compile(TestFixtures.recipe(), TestFixtures.solution("4"));
    }

    private static Document parse(String xml) throws Exception {
        return DocumentBuilderFactory.newInstance().newDocumentBuilder()
            .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    private static List<String> texts(Document doc, String tag) {
        NodeList nodes = doc.getElementsByTagName(tag);
        var texts = new ArrayList<String>();
        for (int i = 0; i < nodes.getLength(); i++) {
            texts.add(nodes.item(i).getTextContent());
        }
        return texts;
    }

    @Test
    void writesBatchInformationRoot() throws Exception {
        Document doc = parse(B2mmlWriter.toXml(compile()));

        Element root = doc.getDocumentElement();
        assertThat(root.getTagName()).isEqualTo("b2mml:BatchInformation");
        assertThat(root.getAttribute("xmlns:b2mml")).isEqualTo(B2mmlWriter.B2MML_NAMESPACE);
        assertThat(root.getAttribute("xsi:schemaLocation")).isEqualTo(B2mmlWriter.SCHEMA_LOCATION);
        assertThat(texts(doc, "b2mml:CreateDate")).containsExactly("2025-05-01T09:00:00+01:00");
        assertThat(texts(doc, "b2mml:ProductID")).containsExactly("StirredHeatedWater");
    }

    @Test
    void writesSectionsInDocumentOrder() throws Exception {
        Document doc = parse(B2mmlWriter.toXml(compile()));

        Element masterRecipe = (Element) doc.getElementsByTagName("b2mml:MasterRecipe").item(0);
        var childTags = new ArrayList<String>();
        for (int i = 0; i < masterRecipe.getChildNodes().getLength(); i++) {
            if (masterRecipe.getChildNodes().item(i) instanceof Element child) {
                childTags.add(child.getTagName());
            }
        }

        assertThat(childTags).containsExactly(
            "b2mml:ID", "b2mml:Version", "b2mml:VersionDate", "b2mml:Description", "b2mml:Header",
            "b2mml:EquipmentRequirement", "b2mml:Formula", "b2mml:ProcedureLogic",
            "b2mml:RecipeElement", "b2mml:RecipeElement", "b2mml:RecipeElement",
            "b2mml:RecipeElement", "b2mml:RecipeElement");
    }

    @Test
    void writesProcedureLogicAndReferences() throws Exception {
        Document doc = parse(B2mmlWriter.toXml(compile()));

        assertThat(doc.getElementsByTagName("b2mml:Link").getLength()).isEqualTo(8);
        assertThat(doc.getElementsByTagName("b2mml:Step").getLength()).isEqualTo(5);
        assertThat(doc.getElementsByTagName("b2mml:Transition").getLength()).isEqualTo(4);
        assertThat(texts(doc, "b2mml:Condition")).contains("true", "Step 002:HC20_Dosing:Dosing is Completed");
        assertThat(texts(doc, "b2mml:LinkType")).containsOnly("ControlLink");
        assertThat(texts(doc, "b2mml:RecipeElementType"))
            .containsExactly("Begin", "End", "Operation", "Operation", "Operation");
        assertThat(texts(doc, "b2mml:ValueString")).containsExactly("60", "120", "5.5", "60");
        assertThat(texts(doc, "b2mml:UnitOfMeasure")).contains("Liter", "Sekunde");
    }

    @Test
    void identicalInputsProduceIdenticalXml() throws Exception {
        assertThat(B2mmlWriter.toXml(compile())).isEqualTo(B2mmlWriter.toXml(compile()));
    }

    @Test
    void writesFile(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("MasterRecipe_B2MML.xml");

        B2mmlWriter.write(compile(), out);

        assertThat(Files.readString(out)).contains("<b2mml:ID>MasterRecipe_4</b2mml:ID>");
    }
}
