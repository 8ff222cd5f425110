package com.bayesnet.engine;

import com.bayesnet.api.BeliefNetwork;
import com.bayesnet.api.Evidence;
import com.bayesnet.api.Inference;
import com.bayesnet.api.InferenceListener;
import com.bayesnet.api.InvalidStateException;
import com.bayesnet.api.MissingTableException;
import com.bayesnet.api.NodeNotFoundException;
import com.bayesnet.api.QueryKind;
import com.bayesnet.api.ShapeMismatchException;
import com.bayesnet.graph.DirectedGraph;
import com.bayesnet.graph.TopologicalOrder;
import com.bayesnet.graph.Vertex;
import com.bayesnet.tensor.Contraction;
import com.bayesnet.tensor.Contraction.Operand;
import com.bayesnet.tensor.Tensor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;

import lombok.extern.log4j.Log4j2;

/**
 * Exact inference over a discrete Bayesian network.
 *
 * The network owns a {@link DirectedGraph} for its structure and attaches a
 * {@link ProbabilityTable} to each node. Structural operations are delegated
 * to the graph; only addNode and addChild are exposed.
 *
 * Algorithm:
 * 1. Labeling: every node of the network gets an integer axis label equal to
 * its position in node insertion order. The labeling is recomputed per query
 * and covers the whole network, so a parent's label is the same in every
 * table that refers to it.
 * 2. Joint: each participating node contributes its table as a contraction
 * operand labeled [own, parent_1, ..., parent_k]. Contracting all operands
 * onto the participants' own labels yields the unnormalized joint, which is
 * then divided by its total.
 * 3. Evidence: with evidence set, the joint always covers the whole network.
 * Each observed axis is fixed to the observed state's index and dropped, and
 * the remaining slice is renormalized.
 * 4. Marginal: one more contraction sums the joint over every remaining axis
 * except the queried node's.
 *
 * Nothing is cached. Every query recomputes from the current tables and
 * evidence.
 *
 * Trust boundary:
 * The dependency list passed to addProbabilityTable must list the parents in
 * the order of the table's trailing axes. Only the count is checked unless
 * {@link NetworkOptions#isValidateParentNames()} is set, and even then the
 * order is never re-derived.
 *
 * Not thread-safe.
 */
@Log4j2
public final class BayesianNetwork implements BeliefNetwork {
    private final NetworkOptions options;
    private final DirectedGraph graph = new DirectedGraph();
    private final Map<String, ProbabilityTable> tables = new HashMap<>();

    private List<Evidence> evidence = List.of();
    private InferenceListener listener;
    private long queryCount;

    public BayesianNetwork() {
        this(NetworkOptions.defaults());
    }

    public BayesianNetwork(NetworkOptions options) {
        this.options = options;
    }

    public NetworkOptions options() {
        return options;
    }

    public void setListener(InferenceListener listener) {
        this.listener = listener;
    }

    @Override
    public void addNode(String name) {
        graph.addNode(name);
    }

    @Override
    public void addChild(String parentName, String childName) {
        graph.addEdge(parentName, childName);
    }

    /** Node names in insertion order. */
    public List<String> nodeNames() {
        List<String> names = new ArrayList<>(graph.nodeCount());
        for (Vertex v : graph.nodes())
            names.add(v.name());
        return names;
    }

    public boolean containsNode(String name) {
        return graph.containsNode(name);
    }

    /**
     * Structural parents of a node.
     *
     * @throws NodeNotFoundException if the node does not exist.
     */
    public Set<String> parentsOf(String name) {
        Set<String> parents = new LinkedHashSet<>();
        for (Vertex v : graph.parentsOf(name))
            parents.add(v.name());
        return parents;
    }

    /**
     * @throws IllegalStateException if the structure contains a cycle.
     */
    public TopologicalOrder topologicalOrder() {
        return graph.topologicalOrder();
    }

    /** Attaches a marginal table to a node without parents. */
    public void addProbabilityTable(String name, Tensor table, List<String> states) {
        addProbabilityTable(name, table, states, List.of());
    }

    @Override
    public void addProbabilityTable(String name, Tensor table, List<String> states, List<String> parentNames) {
        Set<String> structuralParents = parentsOf(name);
        if (parentNames == null)
            parentNames = List.of();

        if (table.rank() == 0 || table.dim(0) != states.size())
            throw new ShapeMismatchException(name, "Incorrect states");
        if (table.rank() - 1 != structuralParents.size())
            throw new ShapeMismatchException(name, "Incorrect dimensions for conditional/marginal probability");
        if (table.rank() - 1 != parentNames.size())
            throw new ShapeMismatchException(name, "Incorrect dependency list");
        if (options.isValidateParentNames() && !structuralParents.equals(new HashSet<>(parentNames)))
            throw new ShapeMismatchException(name, "Dependency list " + parentNames
                    + " does not match graph parents " + structuralParents);

        tables.put(name, new ProbabilityTable(table, states, parentNames));
        log.debug("Attached table {} to '{}' with states {} given {}", Arrays.toString(table.shape()), name, states,
                parentNames);
    }

    public Optional<ProbabilityTable> table(String name) {
        return Optional.ofNullable(tables.get(name));
    }

    /** True once every node has a probability table. */
    public boolean isComplete() {
        for (Vertex v : graph.nodes())
            if (!tables.containsKey(v.name()))
                return false;
        return true;
    }

    /**
     * Checks that the network can answer queries over all of its nodes.
     *
     * @throws MissingTableException if some node has no table.
     * @throws IllegalStateException if the structure contains a cycle.
     */
    public void validate() {
        for (Vertex v : graph.nodes())
            requireTable(v.name());
        graph.topologicalOrder();
    }

    @Override
    public boolean setEvidence(List<Evidence> newEvidence) {
        for (Evidence ev : newEvidence) {
            if (!graph.containsNode(ev.node())) {
                log.warn("Invalid node specified in evidence: '{}'. Evidence left unchanged.", ev.node());
                return false;
            }
            ProbabilityTable pt = tables.get(ev.node());
            if (pt == null || pt.stateIndex(ev.state()) < 0)
                throw new InvalidStateException(ev.node(), ev.state());
        }
        this.evidence = List.copyOf(newEvidence);
        log.info("Evidence set: {}", evidence);
        return true;
    }

    @Override
    public void unsetEvidence() {
        if (!evidence.isEmpty())
            log.info("Evidence cleared ({} entries)", evidence.size());
        this.evidence = List.of();
    }

    /** Current evidence, in the order it was given. */
    public List<Evidence> evidence() {
        return evidence;
    }

    @Override
    public Tensor jointProbability() {
        return query(QueryKind.JOINT, null, () -> joint(nodeNames()));
    }

    @Override
    public Tensor jointProbability(List<String> subset) {
        return query(QueryKind.JOINT, null, () -> joint(subset == null ? nodeNames() : subset));
    }

    /** Marginal computed from the joint of the whole network. */
    public Tensor marginalProbability(String name) {
        return marginalProbability(name, true);
    }

    @Override
    public Tensor marginalProbability(String name, boolean total) {
        return query(QueryKind.MARGINAL, name, () -> marginal(name, total));
    }

    @Override
    public Inference getInference(String name) {
        return query(QueryKind.INFERENCE, name, () -> {
            for (Evidence ev : evidence)
                if (ev.node().equals(name))
                    return Inference.observed(name, ev.state(), tables.get(name).states());
            ProbabilityTable pt = requireTable(name);
            return Inference.believed(name, marginal(name, true), pt.states());
        });
    }

    private Tensor joint(List<String> subset) {
        List<String> all = nodeNames();
        List<String> members = evidence.isEmpty() ? subset : all;
        Map<String, Integer> labels = labels(all);

        List<Operand> operands = new ArrayList<>(members.size());
        int[] out = new int[members.size()];
        for (int i = 0; i < members.size(); i++) {
            String name = members.get(i);
            ProbabilityTable pt = requireTable(name);
            int[] operandLabels = new int[pt.parentNames().size() + 1];
            operandLabels[0] = labels.get(name);
            for (int p = 0; p < pt.parentNames().size(); p++)
                operandLabels[p + 1] = label(labels, pt.parentNames().get(p));
            operands.add(Operand.of(pt.table(), operandLabels));
            out[i] = operandLabels[0];
        }
        log.debug("Joint over {} with evidence {}", members, evidence);

        Tensor joint = Contraction.contract(operands, out).normalize();
        if (evidence.isEmpty())
            return joint;

        // Slice from the highest axis down so lower axis positions stay valid.
        // A node listed twice keeps its last state.
        Map<Integer, Integer> fixed = new TreeMap<>((a, b) -> Integer.compare(b, a));
        for (Evidence ev : evidence) {
            ProbabilityTable pt = requireTable(ev.node());
            int stateIdx = pt.stateIndex(ev.state());
            if (stateIdx < 0)
                throw new InvalidStateException(ev.node(), ev.state());
            fixed.put(members.indexOf(ev.node()), stateIdx);
        }
        for (Map.Entry<Integer, Integer> e : fixed.entrySet())
            joint = joint.slice(e.getKey(), e.getValue());
        return joint.normalize();
    }

    private Tensor marginal(String name, boolean total) {
        ProbabilityTable pt = requireTable(name);
        if (pt.isRoot() && evidence.isEmpty())
            return pt.table();

        Set<String> clamped = new HashSet<>();
        String observed = null;
        for (Evidence ev : evidence) {
            clamped.add(ev.node());
            if (ev.node().equals(name))
                observed = ev.state();
        }
        if (observed != null)
            return pointMass(pt, observed);

        List<String> members;
        if (total || !evidence.isEmpty()) {
            members = nodeNames();
        } else {
            members = new ArrayList<>();
            members.add(name);
            members.addAll(pt.parentNames());
        }

        Tensor joint = joint(members);
        Map<String, Integer> labels = labels(nodeNames());
        int[] jointLabels = members.stream()
                .filter(n -> !clamped.contains(n))
                .mapToInt(n -> label(labels, n))
                .toArray();
        Tensor result = Contraction.contract(List.of(Operand.of(joint, jointLabels)), labels.get(name));

        double mass = result.sum();
        if (Math.abs(mass - 1.0) > options.getTolerance())
            log.warn("Marginal of '{}' sums to {} before renormalization", name, mass);
        return result.normalize();
    }

    private static Tensor pointMass(ProbabilityTable pt, String state) {
        double[] p = new double[pt.states().size()];
        p[pt.stateIndex(state)] = 1.0;
        return Tensor.of(p);
    }

    private <T> T query(QueryKind kind, String node, Supplier<T> body) {
        long id = ++queryCount;
        InferenceListener l = this.listener;
        if (l == null)
            return body.get();

        l.onQueryStart(id, kind, node);
        long start = System.nanoTime();
        try {
            T result = body.get();
            l.onQueryEnd(id, kind, node, System.nanoTime() - start);
            return result;
        } catch (RuntimeException e) {
            l.onQueryError(id, kind, node, e);
            throw e;
        }
    }

    private ProbabilityTable requireTable(String name) {
        graph.nodeByName(name);
        ProbabilityTable pt = tables.get(name);
        if (pt == null)
            throw new MissingTableException(name);
        return pt;
    }

    private static Map<String, Integer> labels(List<String> names) {
        Map<String, Integer> labels = new HashMap<>(names.size() * 2);
        for (int i = 0; i < names.size(); i++)
            labels.put(names.get(i), i);
        return labels;
    }

    private static int label(Map<String, Integer> labels, String name) {
        Integer l = labels.get(name);
        if (l == null)
            throw new NodeNotFoundException(name);
        return l;
    }

    @Override
    public String toString() {
        return "BayesianNetwork" + graph.edges().stream().sorted().toList();
    }
}
