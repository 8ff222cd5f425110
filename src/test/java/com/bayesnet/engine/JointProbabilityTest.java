package com.bayesnet.engine;

import com.bayesnet.api.Evidence;
import com.bayesnet.api.MissingTableException;
import com.bayesnet.api.NodeNotFoundException;
import com.bayesnet.tensor.Tensor;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class JointProbabilityTest {

    private static final double EPS = 1e-9;

    @Test
    public void testChainJoint() {
        Tensor joint = Networks.chain().jointProbability();
        assertArrayEquals(new int[] { 3, 3 }, joint.shape());
        assertEquals(1.0, joint.sum(), EPS);
        // P(Smoking=Light, Cancer=Malignant) = 0.15 * 0.04
        assertEquals(0.006, joint.get(1, 2), EPS);
        assertEquals(0.8 * 0.96, joint.get(0, 0), EPS);
    }

    @Test
    public void testSprinklerJointSumsToOne() {
        Tensor joint = Networks.sprinkler().jointProbability();
        assertArrayEquals(new int[] { 2, 2, 2, 2 }, joint.shape());
        assertEquals(1.0, joint.sum(), EPS);
        // P(c=T, s=F, r=T, w=T) = 0.5 * 0.9 * 0.8 * 0.9
        assertEquals(0.324, joint.get(0, 1, 0, 0), EPS);
    }

    @Test
    public void testJointIsIdempotent() {
        BayesianNetwork net = Networks.sprinkler();
        assertEquals(net.jointProbability(), net.jointProbability());
    }

    @Test
    public void testSubsetFollowsRequestedOrder() {
        BayesianNetwork net = Networks.chain();
        Tensor full = net.jointProbability();
        Tensor swapped = net.jointProbability(List.of("Cancer", "Smoking"));
        assertArrayEquals(new int[] { 3, 3 }, swapped.shape());
        for (int s = 0; s < 3; s++)
            for (int c = 0; c < 3; c++)
                assertEquals(full.get(s, c), swapped.get(c, s), EPS);
    }

    @Test
    public void testSubsetOfRootOnly() {
        Tensor joint = Networks.chain().jointProbability(List.of("Smoking"));
        assertTrue(joint.approxEquals(Tensor.of(0.8, 0.15, 0.05), EPS));
    }

    @Test
    public void testNullSubsetMeansAllNodes() {
        BayesianNetwork net = Networks.chain();
        assertEquals(net.jointProbability(), net.jointProbability(null));
    }

    @Test
    public void testEvidenceSlicesFullJoint() {
        BayesianNetwork net = Networks.sprinkler();
        Tensor unconditioned = net.jointProbability();
        assertTrue(net.setEvidence(List.of(Evidence.of("rain", "T"))));

        Tensor joint = net.jointProbability();
        assertArrayEquals(new int[] { 2, 2, 2 }, joint.shape());
        assertEquals(1.0, joint.sum(), EPS);

        // Conditioned entry equals unconditioned entry divided by P(rain=T) = 0.5.
        assertEquals(unconditioned.get(0, 1, 0, 0) / 0.5, joint.get(0, 1, 0), EPS);
    }

    @Test
    public void testEvidenceIgnoresSubset() {
        BayesianNetwork net = Networks.sprinkler();
        net.setEvidence(List.of(Evidence.of("rain", "T")));
        assertEquals(net.jointProbability(), net.jointProbability(List.of("cloudy")));
    }

    @Test
    public void testEvidenceOnEveryNodeGivesScalar() {
        BayesianNetwork net = Networks.chain();
        net.setEvidence(List.of(Evidence.of("Smoking", "Heavy"), Evidence.of("Cancer", "Benign")));
        Tensor joint = net.jointProbability();
        assertEquals(0, joint.rank());
        assertEquals(1.0, joint.get(), EPS);
    }

    @Test
    public void testRepeatedEvidenceLastEntryWins() {
        BayesianNetwork net = Networks.chain();
        net.setEvidence(List.of(Evidence.of("Smoking", "None"), Evidence.of("Smoking", "Heavy")));
        Tensor joint = net.jointProbability();
        assertTrue(joint.approxEquals(Tensor.of(0.60, 0.25, 0.15), EPS));
    }

    @Test(expected = IllegalStateException.class)
    public void testImpossibleEvidenceFails() {
        // A is always on and B is always yes when A is on, so B=no has zero mass.
        BayesianNetwork net = new BayesianNetwork();
        net.addChild("A", "B");
        net.addProbabilityTable("A", Tensor.of(1.0, 0.0), List.of("on", "off"));
        net.addProbabilityTable("B", Tensor.of(new double[][] { { 1.0, 0.5 }, { 0.0, 0.5 } }),
                List.of("yes", "no"), List.of("A"));
        net.setEvidence(List.of(Evidence.of("B", "no")));
        net.jointProbability();
    }

    @Test
    public void testMissingTableFails() {
        BayesianNetwork net = new BayesianNetwork();
        net.addChild("A", "B");
        net.addProbabilityTable("A", Tensor.of(0.5, 0.5), List.of("x", "y"));
        try {
            net.jointProbability();
            fail("Expected MissingTableException");
        } catch (MissingTableException e) {
            assertEquals("B", e.nodeName());
        }
        // A subset that avoids B still works.
        assertEquals(1.0, net.jointProbability(List.of("A")).sum(), EPS);
    }

    @Test(expected = NodeNotFoundException.class)
    public void testUnknownSubsetNode() {
        Networks.chain().jointProbability(List.of("Smoking", "Asbestos"));
    }

    @Test
    public void testNetworkWiderThanAnAlphabet() {
        // 40 single-state nodes ahead of the chain push its labels well past 26.
        BayesianNetwork net = new BayesianNetwork();
        for (int i = 0; i < 40; i++) {
            net.addNode("pad" + i);
            net.addProbabilityTable("pad" + i, Tensor.of(1.0), List.of("only"));
        }
        net.addChild("Smoking", "Cancer");
        BayesianNetwork chain = Networks.chain();
        net.addProbabilityTable("Smoking", chain.table("Smoking").orElseThrow().table(), Networks.SMOKING);
        net.addProbabilityTable("Cancer", chain.table("Cancer").orElseThrow().table(), Networks.CANCER,
                List.of("Smoking"));

        Tensor joint = net.jointProbability();
        assertEquals(42, joint.rank());
        assertEquals(1.0, joint.sum(), EPS);
        assertTrue(net.marginalProbability("Cancer").approxEquals(chain.marginalProbability("Cancer"), EPS));
    }
}
