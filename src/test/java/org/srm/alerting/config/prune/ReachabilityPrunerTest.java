package org.srm.alerting.config.prune;

import org.junit.jupiter.api.Test;
import org.srm.alerting.config.document.AlertingDocumentHelper;
import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.document.NodeHelper;
import org.srm.alerting.config.index.CategoryIndex;
import org.srm.alerting.config.prune.models.LiveSets;
import org.srm.alerting.config.prune.models.PruneReport;
import org.srm.alerting.config.prune.models.PrunedNode;
import org.w3c.dom.Element;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReachabilityPrunerTest {
    private static final String SCENARIO_XML = "src/test/resources/alerting/scenario.xml";
    private static final String ORPHANS_XML = "src/test/resources/alerting/orphans.xml";
    private static final String CYCLIC_XML = "src/test/resources/alerting/cyclic.xml";
    private static final String DANGLING_XML = "src/test/resources/alerting/dangling.xml";

    private static CategoryIndex load(String path) {
        return CategoryIndex.build(AlertingDocumentHelper.parse(Path.of(path)));
    }

    private static List<Element> definitions(CategoryIndex index, String... names) {
        return Arrays.stream(names).map(name -> index.lookup(Category.DEFINITION, name)).toList();
    }

    @Test
    void shouldComputeLiveSetsWithoutMutating() {
        CategoryIndex index = load(ORPHANS_XML);
        String before = AlertingDocumentHelper.toXml(index.document());

        LiveSets live = new ReachabilityPruner(index).liveSets(definitions(index, "Kept"));

        assertEquals(Set.of("E1"), live.entryPoints());
        assertEquals(Set.of("O1"), live.operations());
        assertEquals(Set.of("Ac1"), live.actions());
        assertEquals(before, AlertingDocumentHelper.toXml(index.document()));
    }

    @Test
    void shouldFollowNestedOperations() {
        CategoryIndex index = load(ORPHANS_XML);

        LiveSets live = new ReachabilityPruner(index).liveSets(definitions(index, "Kept", "Disabled"));

        assertEquals(Set.of("E1", "E2"), live.entryPoints());
        assertEquals(Set.of("O1", "O2", "O3"), live.operations());
        assertEquals(Set.of("Ac1", "Ac2"), live.actions());
    }

    @Test
    void shouldRemoveUnreachableNodes() {
        CategoryIndex index = load(ORPHANS_XML);

        PruneReport report = new ReachabilityPruner(index).prune(definitions(index, "Kept"));

        assertEquals(7, report.removedCount());
        assertEquals(2, report.removedCount(Category.ENTRY_POINT));
        assertEquals(3, report.removedCount(Category.OPERATION));
        assertEquals(2, report.removedCount(Category.ACTION));
        assertEquals(List.of("E1"), List.copyOf(index.identifiers(Category.ENTRY_POINT)));
        assertEquals(List.of("O1"), List.copyOf(index.identifiers(Category.OPERATION)));
        assertEquals(List.of("Ac1"), List.copyOf(index.identifiers(Category.ACTION)));
        // definitions are never pruned, even when they end up with dangling references
        assertEquals(2, index.nodes(Category.DEFINITION).size());
    }

    @Test
    void shouldRemoveNodesFromDocument() {
        CategoryIndex index = load(ORPHANS_XML);

        new ReachabilityPruner(index).prune(definitions(index, "Kept"));

        List<String> remaining = NodeHelper.childElements(index.document().root()).stream()
                .map(CategoryIndex::identifierOf)
                .toList();
        assertEquals(List.of("Kept", "Disabled", "E1", "O1", "Ac1"), remaining);

        String xml = AlertingDocumentHelper.toXml(index.document());
        assertFalse(xml.contains("\n    \n"));
        assertFalse(xml.contains("O-orphan"));
    }

    @Test
    void shouldDescribeRemovedNodes() {
        CategoryIndex index = load(ORPHANS_XML);

        PruneReport report = new ReachabilityPruner(index).prune(definitions(index, "Kept"));

        PrunedNode orphan = report.removed().stream()
                .filter(node -> "O-orphan".equals(node.id()))
                .findFirst()
                .orElseThrow();
        assertEquals(Category.OPERATION, orphan.category());
        assertEquals("Unused operation", orphan.name());
        assertEquals("com.watch4net.alerting.operation.ThresholdOperation", orphan.className());
        assertEquals("Never referenced", orphan.description());
        assertEquals(Category.ENTRY_POINT, report.removed().get(0).category());
    }

    @Test
    void shouldBeIdempotent() {
        CategoryIndex index = load(ORPHANS_XML);
        ReachabilityPruner pruner = new ReachabilityPruner(index);
        List<Element> live = definitions(index, "Kept");

        assertEquals(7, pruner.prune(live).removedCount());
        String afterFirst = AlertingDocumentHelper.toXml(index.document());

        assertEquals(0, pruner.prune(live).removedCount());
        assertEquals(afterFirst, AlertingDocumentHelper.toXml(index.document()));
    }

    @Test
    void shouldKeepEverythingReachableInScenario() {
        CategoryIndex index = load(SCENARIO_XML);

        assertEquals(0, new ReachabilityPruner(index).prune(definitions(index, "D")).removedCount());
    }

    @Test
    void shouldRemoveAllGraphNodesWithoutLiveDefinitions() {
        CategoryIndex index = load(SCENARIO_XML);

        PruneReport report = new ReachabilityPruner(index).prune(List.of());

        assertEquals(4, report.removedCount());
        assertEquals(1, index.nodes(Category.ADAPTER).size());
        assertEquals(1, index.nodes(Category.GROUPED_BOX).size());
        assertEquals(1, index.nodes(Category.DEFINITION).size());
    }

    @Test
    void shouldTerminateOnCyclicOperations() {
        CategoryIndex index = load(CYCLIC_XML);

        PruneReport report = new ReachabilityPruner(index).prune(definitions(index, "Loop"));

        assertEquals(0, report.removedCount());
        assertEquals(Set.of("OA", "OB"), report.live().operations());
    }

    @Test
    void shouldTolerateDanglingReferences() {
        CategoryIndex index = load(DANGLING_XML);

        PruneReport report = assertDoesNotThrow(() -> new ReachabilityPruner(index).prune(definitions(index, "Stale")));

        assertEquals(0, report.removedCount());
        assertTrue(report.live().entryPoints().contains("E-missing"));
    }

    @Test
    void shouldRemoveEveryDuplicateOfAnUnreachableId() {
        CategoryIndex index = CategoryIndex.build(AlertingDocumentHelper.parseString("<AlertingConfig>"
                + "<definition-list name=\"D\" enabled=\"true\"><entry-point-list>E1</entry-point-list></definition-list>"
                + "<entry-point-list id=\"E1\"><name>Events</name></entry-point-list>"
                + "<action-list id=\"X\"><name>first</name></action-list>"
                + "<action-list id=\"X\"><name>second</name></action-list>"
                + "</AlertingConfig>"));
        ReachabilityPruner pruner = new ReachabilityPruner(index);

        PruneReport first = pruner.prune(definitions(index, "D"));
        PruneReport second = pruner.prune(definitions(index, "D"));

        assertEquals(2, first.removedCount(Category.ACTION));
        assertEquals(0, second.removedCount());
        assertTrue(index.nodes(Category.ACTION).isEmpty());
        assertNotNull(index.lookup(Category.ENTRY_POINT, "E1"));
    }

    @Test
    void shouldRefreshInsertionPointsAfterPruning() {
        CategoryIndex index = load(ORPHANS_XML);

        new ReachabilityPruner(index).prune(definitions(index, "Kept"));

        assertEquals("O1", CategoryIndex.identifierOf(index.refPoint(Category.ENTRY_POINT)));
        assertEquals("Ac1", CategoryIndex.identifierOf(index.refPoint(Category.OPERATION)));
        assertNull(index.refPoint(Category.ACTION));
    }
}
