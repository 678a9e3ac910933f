package org.srm.alerting.config.factory;

import org.junit.jupiter.api.Test;
import org.srm.alerting.config.document.AlertingDocument;
import org.srm.alerting.config.document.AlertingDocumentHelper;
import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.document.NodeHelper;
import org.srm.alerting.config.factory.models.NodeComponent;
import org.srm.alerting.config.index.CategoryIndex;
import org.srm.alerting.config.prune.ReachabilityPruner;
import org.srm.alerting.config.walk.DefinitionWalker;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class NodeFactoryTest {
    private static final String SCENARIO_XML = "src/test/resources/alerting/scenario.xml";

    private static CategoryIndex loadScenario() {
        return CategoryIndex.build(AlertingDocumentHelper.parse(Path.of(SCENARIO_XML)));
    }

    @Test
    void shouldLinkNewActionIntoExistingGraph() {
        CategoryIndex index = loadScenario();
        NodeFactory factory = new NodeFactory(index);

        Element ac3 = factory.createNode(Category.ACTION, "Ac3", List.of(NodeComponent.of("name", "x")));
        factory.addLink(index.lookup(Category.OPERATION, "O1"), ac3, "true", "entry");

        Element definition = index.lookup(Category.DEFINITION, "D");
        List<String> visited = new DefinitionWalker(index).collect(definition).stream()
                .map(CategoryIndex::identifierOf)
                .toList();
        assertEquals(List.of("E1", "O1", "Ac1", "Ac2", "Ac3"), visited);

        assertEquals(0, new ReachabilityPruner(index).prune(List.of(definition)).removedCount());
    }

    @Test
    void shouldInsertAfterLastNodeOfSameCategory() {
        CategoryIndex index = loadScenario();

        Element ac3 = new NodeFactory(index).createNode(Category.ACTION, "Ac3", List.of());

        List<Element> children = NodeHelper.childElements(index.document().root());
        int position = children.indexOf(ac3);
        assertEquals("Ac2", CategoryIndex.identifierOf(children.get(position - 1)));
        assertEquals("grouped-box-list", NodeHelper.localName(children.get(position + 1)));
        assertSame(ac3, index.lookup(Category.ACTION, "Ac3"));
    }

    @Test
    void shouldBuildNodeFromComponents() {
        CategoryIndex index = loadScenario();

        Element node = new NodeFactory(index).createNode(Category.ACTION, "Mail1", List.of(
                NodeComponent.of("name", "Mail admins"),
                NodeComponent.of("class", "com.watch4net.alerting.action.MailAction"),
                NodeComponent.param("to", "ops@example.com")));

        assertEquals("Mail1", node.getAttribute("id"));
        assertEquals(List.of("name", "class", "param-list"),
                NodeHelper.childElements(node).stream().map(NodeHelper::localName).toList());
        Element param = NodeHelper.firstChildNamed(node, "param-list");
        assertEquals("to", param.getAttribute("name"));
        assertEquals("ops@example.com", NodeHelper.textOf(param));
        assertFalse(NodeHelper.firstChildNamed(node, "name").hasAttribute("name"));
        assertEquals(index.document().namespace(), node.getNamespaceURI());
    }

    @Test
    void shouldSerializeCreatedNodesInDocumentNamespace() {
        CategoryIndex index = loadScenario();
        new NodeFactory(index).createNode(Category.OPERATION, "O2", List.of(NodeComponent.of("name", "New")));

        AlertingDocument reparsed = AlertingDocumentHelper.parseString(AlertingDocumentHelper.toXml(index.document()));
        CategoryIndex reindexed = CategoryIndex.build(reparsed);

        Element operation = reindexed.lookup(Category.OPERATION, "O2");
        assertNotNull(operation);
        assertEquals(reparsed.namespace(), operation.getNamespaceURI());
        assertEquals("New", NodeHelper.firstChildText(operation, "name"));
        assertTrue(reindexed.isCategoryOrderValid());
    }

    @Test
    void shouldKeepCategoryOrderForAnyInsertionSequence() {
        Category[] categories = Category.values();
        for (int seed = 0; seed < 50; seed++) {
            Random random = new Random(seed);
            CategoryIndex index = CategoryIndex.build(AlertingDocumentHelper.parseString(
                    "<AlertingConfig xmlns=\"http://www.watch4net.com/Alerting\">\n</AlertingConfig>"));
            NodeFactory factory = new NodeFactory(index);

            for (int i = 0; i < 20; i++) {
                Category category = categories[random.nextInt(categories.length)];
                factory.createNode(category, "n" + i, List.of());
                assertFirstOccurrencesOrdered(index, "seed " + seed + ", insertion " + i);
            }
            assertEquals(20, NodeHelper.childElements(index.document().root()).size());
        }
    }

    private static void assertFirstOccurrencesOrdered(CategoryIndex index, String context) {
        List<Category> firstOccurrences = new ArrayList<>();
        for (Element child : NodeHelper.childElements(index.document().root())) {
            Category category = NodeHelper.categoryOf(child);
            if (!firstOccurrences.contains(category)) {
                firstOccurrences.add(category);
            }
        }
        List<Category> sorted = new ArrayList<>(firstOccurrences);
        sorted.sort(null);
        assertEquals(sorted, firstOccurrences, context);
        assertTrue(index.isCategoryOrderValid(), context);
    }

    @Test
    void shouldRejectDuplicateWithoutMutating() {
        CategoryIndex index = loadScenario();
        String before = AlertingDocumentHelper.toXml(index.document());

        DuplicateIdentifierException e = assertThrows(DuplicateIdentifierException.class,
                () -> new NodeFactory(index).createNode(Category.ACTION, "Ac1", List.of(NodeComponent.of("name", "again"))));

        assertEquals(Category.ACTION, e.getCategory());
        assertEquals("Ac1", e.getIdentifier());
        assertEquals(before, AlertingDocumentHelper.toXml(index.document()));
    }

    @Test
    void shouldRejectDuplicateNameIdentifier() {
        CategoryIndex index = loadScenario();

        assertThrows(DuplicateIdentifierException.class,
                () -> new NodeFactory(index).createNode(Category.DEFINITION, "D", List.of()));
    }

    @Test
    void shouldAllowSameIdInOtherCategory() {
        CategoryIndex index = loadScenario();

        Element operation = new NodeFactory(index).createNode(Category.OPERATION, "Ac1", List.of());

        assertSame(operation, index.lookup(Category.OPERATION, "Ac1"));
        assertNotSame(operation, index.lookup(Category.ACTION, "Ac1"));
    }

    @Test
    void shouldRequireIdentifier() {
        CategoryIndex index = loadScenario();

        assertThrows(IllegalArgumentException.class,
                () -> new NodeFactory(index).createNode(Category.ACTION, "", List.of()));
    }

    @Test
    void shouldAddLinkWithPorts() {
        CategoryIndex index = loadScenario();
        Element operation = index.lookup(Category.OPERATION, "O1");

        Element link = new NodeFactory(index).addLink(operation, index.lookup(Category.ACTION, "Ac2"), "true", "entry");

        assertEquals("action-list", NodeHelper.localName(link));
        assertEquals("true", link.getAttribute("from"));
        assertEquals("entry", link.getAttribute("to"));
        assertEquals("Ac2", NodeHelper.textOf(link));
        assertSame(operation, link.getParentNode());
    }

    @Test
    void shouldAllowDuplicateLinks() {
        CategoryIndex index = loadScenario();
        NodeFactory factory = new NodeFactory(index);
        Element operation = index.lookup(Category.OPERATION, "O1");
        Element ac3 = factory.createNode(Category.ACTION, "Ac3", List.of());

        factory.addLink(operation, ac3, "true", "entry");
        factory.addLink(operation, ac3, "true", "entry");
        factory.addLink(operation, ac3, "false", "entry");

        long links = NodeHelper.childElementsNamed(operation, "action-list").stream()
                .filter(reference -> "Ac3".equals(NodeHelper.referenceTarget(reference)))
                .count();
        assertEquals(3, links);

        List<Element> visited = new DefinitionWalker(index).collect(index.lookup(Category.DEFINITION, "D"));
        assertEquals(1, visited.stream().filter(node -> node == ac3).count());
    }

    @Test
    void shouldRejectLinkToNonReferenceCategory() {
        CategoryIndex index = loadScenario();

        assertThrows(IllegalArgumentException.class, () -> new NodeFactory(index).addLink(
                index.lookup(Category.OPERATION, "O1"), index.lookup(Category.DEFINITION, "D"), "output", "entry"));
    }
}
