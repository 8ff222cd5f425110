package com.bayesnet.api;

import com.bayesnet.tensor.Tensor;

import java.util.List;

/**
 * The public surface of a discrete Bayesian network.
 *
 * Lifecycle:
 * 1. Build the structure with addNode() and addChild().
 * 2. Attach a probability table to every node with addProbabilityTable().
 * 3. Optionally clamp observed variables with setEvidence().
 * 4. Query beliefs with getInference(), or the lower level
 * marginalProbability() and jointProbability().
 *
 * Every query recomputes from the current tables and evidence. Nothing is
 * cached between calls.
 *
 * Thread Safety:
 * Implementations are not thread-safe. Mutating calls must be serialized by
 * the caller, and reads may only run concurrently while no mutation is in
 * flight.
 */
public interface BeliefNetwork {

    /** Adds a node if it does not exist yet. */
    void addNode(String name);

    /**
     * Adds a directed edge from parent to child, creating either node if
     * needed. Adding the same edge twice has no effect.
     */
    void addChild(String parentName, String childName);

    /**
     * Attaches a probability table to a node, replacing any previous one.
     *
     * Axis 0 of the table ranges over the node's own states; the remaining
     * axes range over the parents' states in the order given by
     * parentNames.
     *
     * Precondition: parentNames lists the node's structural parents in the
     * exact order of the table's trailing axes. Only the count is checked by
     * default; the order is the caller's responsibility and is never
     * re-derived.
     *
     * @throws NodeNotFoundException  if the node does not exist.
     * @throws ShapeMismatchException if the table is inconsistent with the
     *                                states, the structural parents or the
     *                                parent list.
     */
    void addProbabilityTable(String name, Tensor table, List<String> states, List<String> parentNames);

    /**
     * Joint distribution over all nodes, in node insertion order, with
     * evidence axes removed.
     */
    Tensor jointProbability();

    /**
     * Joint distribution over the given nodes, in the given order. When
     * evidence is set the subset is ignored and the result covers every
     * non-evidence node of the network.
     */
    Tensor jointProbability(List<String> subset);

    /**
     * Marginal distribution of a node.
     *
     * @param total If false, only the node and its parents take part in the
     *              joint. Forced to true when evidence is set.
     */
    Tensor marginalProbability(String name, boolean total);

    /**
     * Clamps nodes to observed states, replacing any previous evidence.
     *
     * @return false if any entry names an unknown node; no evidence is
     *         applied in that case.
     * @throws InvalidStateException if a known node is given a state it does
     *                               not declare.
     */
    boolean setEvidence(List<Evidence> evidence);

    /** Removes all evidence. */
    void unsetEvidence();

    /**
     * Current belief about a node: its observed state if it is clamped by
     * evidence, otherwise its posterior marginal.
     */
    Inference getInference(String name);
}
