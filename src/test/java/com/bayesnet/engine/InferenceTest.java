package com.bayesnet.engine;

import com.bayesnet.api.Evidence;
import com.bayesnet.api.Inference;
import com.bayesnet.api.InvalidStateException;
import com.bayesnet.api.MissingTableException;
import com.bayesnet.api.NodeNotFoundException;
import com.bayesnet.tensor.Tensor;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class InferenceTest {

    private static final double EPS = 1e-9;

    @Test
    public void testObservedNodeReturnsItsState() {
        BayesianNetwork net = Networks.chain();
        net.setEvidence(List.of(Evidence.of("Smoking", "Light")));

        Inference inf = net.getInference("Smoking");
        assertTrue(inf.isObserved());
        assertEquals("Light", inf.observedState());
        assertNull(inf.distribution());
        assertEquals("Light", inf.mostLikelyState());
        assertEquals(1.0, inf.probabilityOf("Light"), 0.0);
        assertEquals(0.0, inf.probabilityOf("Heavy"), 0.0);
    }

    @Test
    public void testRepeatedEvidenceReportsFirstEntry() {
        BayesianNetwork net = Networks.chain();
        net.setEvidence(List.of(Evidence.of("Smoking", "None"), Evidence.of("Smoking", "Heavy")));
        assertEquals("None", net.getInference("Smoking").observedState());
    }

    @Test
    public void testChainInferenceGivenEvidence() {
        BayesianNetwork net = Networks.chain();
        net.setEvidence(List.of(Evidence.of("Smoking", "Light")));

        Inference inf = net.getInference("Cancer");
        assertFalse(inf.isObserved());
        assertArrayEquals(new double[] { 0.88, 0.08, 0.04 }, inf.distribution().toArray(), EPS);
        assertEquals("None", inf.mostLikelyState());
        assertEquals(0.04, inf.probabilityOf("Malignant"), EPS);
    }

    @Test
    public void testSprinklerGrassWetGivenRain() {
        BayesianNetwork net = Networks.sprinkler();
        Tensor unconditioned = net.getInference("grass wet").distribution();

        net.setEvidence(List.of(Evidence.of("rain", "T")));
        Tensor conditioned = net.getInference("grass wet").distribution();

        // P(s=T | r=T) = 0.09 / 0.5 = 0.18
        double pSprinkler = 0.18;
        double expectedWet = pSprinkler * 0.99 + (1 - pSprinkler) * 0.9;
        assertArrayEquals(new double[] { expectedWet, 1 - expectedWet }, conditioned.toArray(), EPS);
        assertEquals(0.9162, conditioned.get(0), EPS);
        assertFalse(conditioned.approxEquals(unconditioned, 1e-3));
    }

    @Test
    public void testExplainingAway() {
        // Observing wet grass raises belief in rain; also seeing the sprinkler on lowers it again.
        BayesianNetwork net = Networks.sprinkler();
        double prior = net.getInference("rain").probabilityOf("T");

        net.setEvidence(List.of(Evidence.of("grass wet", "T")));
        double givenWet = net.getInference("rain").probabilityOf("T");

        net.setEvidence(List.of(Evidence.of("grass wet", "T"), Evidence.of("sprinkler", "T")));
        double givenWetAndSprinkler = net.getInference("rain").probabilityOf("T");

        assertTrue(givenWet > prior);
        assertTrue(givenWetAndSprinkler < givenWet);
    }

    @Test
    public void testInferenceWithoutEvidenceMatchesMarginal() {
        BayesianNetwork net = Networks.sprinkler();
        for (String name : net.nodeNames())
            assertTrue(name, net.getInference(name).distribution()
                    .approxEquals(net.marginalProbability(name, true), EPS));
    }

    @Test(expected = InvalidStateException.class)
    public void testProbabilityOfUnknownState() {
        Networks.chain().getInference("Cancer").probabilityOf("Terminal");
    }

    @Test(expected = NodeNotFoundException.class)
    public void testUnknownNode() {
        Networks.chain().getInference("Asbestos");
    }

    @Test(expected = MissingTableException.class)
    public void testMissingTable() {
        BayesianNetwork net = Networks.chain();
        net.addChild("Cancer", "Cough");
        net.getInference("Cancer");
    }
}
