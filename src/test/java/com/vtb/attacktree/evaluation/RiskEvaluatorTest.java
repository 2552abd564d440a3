package com.vtb.attacktree.evaluation;

import com.vtb.attacktree.errors.CycleException;
import com.vtb.attacktree.errors.InvalidNodeException;
import com.vtb.attacktree.errors.MissingValueException;
import com.vtb.attacktree.errors.SpecException;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.Contributor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для RiskEvaluator
 */
class RiskEvaluatorTest {

    private static final double EPS = 1e-9;

    @Test
    void testAndIsProductOfChildren() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("n1", "AND", "a", "b")
            .leaf("a", 0.5, 10.0)
            .leaf("b", 0.2, 5.0)
            .map();

        assertEquals(0.1, RiskEvaluator.topEventProbability("n1", nodes), EPS);
    }

    @Test
    void testOrIsIndependentUnion() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("top", "OR", "a", "b")
            .leaf("a", 0.3, 7.0)
            .leaf("b", 0.6, 2.0)
            .map();

        // 1 - 0.7 * 0.4
        assertEquals(0.72, RiskEvaluator.topEventProbability("top", nodes), EPS);
    }

    @Test
    void testNestedGates() {
        AttackTree tree = TestTrees.nodes()
            .gate("root", "OR", "takeover", "insider")
            .gate("takeover", "AND", "phishing", "otp")
            .leaf("phishing", 0.4, 1000.0)
            .leaf("otp", 0.25, 3000.0)
            .leaf("insider", 0.05, 20000.0)
            .tree("root");

        assertEquals(1 - 0.9 * 0.95, RiskEvaluator.topEventProbability(tree), EPS);
    }

    @Test
    void testEmptyGates() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("and", "AND")
            .gate("or", "OR")
            .map();

        assertEquals(1.0, RiskEvaluator.topEventProbability("and", nodes));
        assertEquals(0.0, RiskEvaluator.topEventProbability("or", nodes));
    }

    @Test
    void testMissingProbabilityNamesLeaf() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("r", "AND", "a", "b")
            .leaf("a", 0.5, 1.0)
            .leaf("b", null, 1.0)
            .map();

        MissingValueException e = assertThrows(MissingValueException.class,
            () -> RiskEvaluator.topEventProbability("r", nodes));
        assertEquals("b", e.getNodeId());
        assertTrue(e.getMessage().contains("'b'"));
    }

    @Test
    void testUnknownKind() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("r", "XOR", "a")
            .leaf("a", 0.5, 1.0)
            .map();

        InvalidNodeException e = assertThrows(InvalidNodeException.class,
            () -> RiskEvaluator.topEventProbability("r", nodes));
        assertEquals("r", e.getNodeId());
    }

    @Test
    void testCycleIsDetected() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("r", "OR", "x")
            .gate("x", "AND", "y")
            .gate("y", "OR", "x")
            .map();

        CycleException e = assertThrows(CycleException.class,
            () -> RiskEvaluator.topEventProbability("r", nodes));
        assertEquals("x", e.getNodeId());
    }

    @Test
    void testSelfReferenceIsDetected() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("r", "AND", "r")
            .map();

        assertThrows(CycleException.class, () -> RiskEvaluator.topEventProbability("r", nodes));
    }

    @Test
    void testDepthLimit() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("l0", "AND", "l1")
            .gate("l1", "AND", "l2")
            .gate("l2", "AND", "l3")
            .leaf("l3", 0.5, 1.0)
            .map();

        assertEquals(0.5, RiskEvaluator.topEventProbability("l0", nodes, 3), EPS);
        assertThrows(CycleException.class, () -> RiskEvaluator.topEventProbability("l0", nodes, 2));
    }

    @Test
    void testSharedSubtreeIsNotACycle() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("r", "AND", "left", "right")
            .gate("left", "OR", "shared")
            .gate("right", "OR", "shared")
            .leaf("shared", 0.5, 1.0)
            .map();

        assertEquals(0.25, RiskEvaluator.topEventProbability("r", nodes), EPS);
    }

    @Test
    void testDanglingChildReference() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("r", "OR", "ghost")
            .map();

        assertThrows(SpecException.class, () -> RiskEvaluator.topEventProbability("r", nodes));
    }

    @Test
    void testExpectedLossSumsAllLeaves() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("n1", "AND", "a")
            .leaf("a", 0.5, 10.0)
            .leaf("b", 0.2, 5.0) // недостижим из корня, но учитывается
            .map();

        assertEquals(6.0, RiskEvaluator.expectedLoss(nodes), EPS);
    }

    @Test
    void testExpectedLossReportsFirstIncompleteLeaf() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("r", "OR", "a", "b", "c")
            .leaf("a", 0.5, 10.0)
            .leaf("b", 0.1, null)
            .leaf("c", null, 1.0)
            .map();

        MissingValueException e = assertThrows(MissingValueException.class,
            () -> RiskEvaluator.expectedLoss(nodes));
        assertEquals("b", e.getNodeId());
        assertEquals("impact", e.getField());
    }

    @Test
    void testTopContributorsOrderAndTies() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .leaf("a", 0.1, 5.0)
            .leaf("b", 0.4, 2.0)
            .leaf("c", 0.4, 2.0)
            .leaf("d", 0.2, null)
            .map();

        List<Contributor> top = RiskEvaluator.topContributors(nodes, 2);

        assertEquals(2, top.size());
        assertEquals("b", top.get(0).getId());
        assertEquals("c", top.get(1).getId(), "При равенстве сохраняется исходный порядок");
        assertTrue(top.get(0).getValue() >= top.get(1).getValue());
        assertEquals("B", top.get(0).getLabel());
    }

    @Test
    void testTopContributorsSkipsIncompleteLeaves() {
        Map<String, AttackNode> nodes = TestTrees.nodes()
            .gate("r", "OR", "a", "b")
            .leaf("a", null, 5.0)
            .leaf("b", 0.5, 3.0)
            .map();

        List<Contributor> top = RiskEvaluator.topContributors(nodes, 5);
        assertEquals(1, top.size());
        assertEquals(1.5, top.get(0).getValue(), EPS);
        assertTrue(RiskEvaluator.topContributors(nodes, 0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> RiskEvaluator.topContributors(nodes, -1));
    }

    @Test
    void testEvaluationIsRepeatable() {
        AttackTree tree = TestTrees.nodes()
            .gate("r", "OR", "a", "b")
            .leaf("a", 0.37, 11.0)
            .leaf("b", 0.19, 13.0)
            .tree("r");

        assertEquals(Double.doubleToLongBits(RiskEvaluator.topEventProbability(tree)),
            Double.doubleToLongBits(RiskEvaluator.topEventProbability(tree)));
        assertEquals(Double.doubleToLongBits(RiskEvaluator.expectedLoss(tree)),
            Double.doubleToLongBits(RiskEvaluator.expectedLoss(tree)));
        assertEquals(0.37, tree.getNode("a").getProbability());
    }
}
