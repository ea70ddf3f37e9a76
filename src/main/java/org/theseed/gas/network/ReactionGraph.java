/**
 *
 */
package org.theseed.gas.network;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object is a directed graph over the species of a reaction network.  There is one edge for
 * each distinct (source, target) pair, carrying the result of applying the source to the target.
 * When a pair is listed more than once, the last listing wins.
 *
 * Two flavors are built.  The closed graph admits only reactions whose product is a tracked species.
 * The full graph admits every reaction, and its edges may carry the OPEN result.  In both flavors,
 * every species in the network is a node, even if it has no edges.
 *
 * @author Bruce Parrello
 *
 */
public class ReactionGraph {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReactionGraph.class);
    /** map of source IDs to maps of target IDs to edges, in node order */
    private final Map<Integer, Map<Integer, Edge>> adjacency;
    /** list of all edges, in order of first appearance of each pair */
    private final List<Edge> edges;
    /** TRUE if this graph admits open reactions */
    private final boolean full;
    /** empty edge map for unknown nodes */
    private static final Map<Integer, Edge> NO_EDGES = Collections.emptyMap();

    /**
     * This class represents a single edge in the graph.  Its natural identity is the
     * (source, target) pair.
     */
    public static class Edge {

        /** ID of the function species */
        private final int source;
        /** ID of the argument species */
        private final int target;
        /** ID of the product species, or OPEN */
        private int result;

        /**
         * Construct an edge.
         *
         * @param source	ID of the function species
         * @param target	ID of the argument species
         * @param result	ID of the product species, or OPEN
         */
        protected Edge(int source, int target, int result) {
            this.source = source;
            this.target = target;
            this.result = result;
        }

        /**
         * @return the ID of the function species
         */
        public int getSource() {
            return this.source;
        }

        /**
         * @return the ID of the argument species
         */
        public int getTarget() {
            return this.target;
        }

        /**
         * @return the ID of the product species, or OPEN
         */
        public int getResult() {
            return this.result;
        }

        /**
         * @return TRUE if the product is a tracked species
         */
        public boolean isClosed() {
            return (this.result != ReactionLink.OPEN);
        }

        @Override
        public String toString() {
            return this.source + "(" + this.target + ") -> "
                    + (this.isClosed() ? String.valueOf(this.result) : "?");
        }

    }

    /**
     * Construct a reaction graph.
     *
     * @param network	reaction network whose species form the nodes
     * @param links		reactions from which to build the edges
     * @param full		TRUE to admit open reactions, FALSE to admit only closed ones
     *
     * @throws MalformedNetworkException	if a reaction refers to a species not in the network
     */
    protected ReactionGraph(ReactionNetwork network, List<ReactionLink> links, boolean full)
            throws MalformedNetworkException {
        this.full = full;
        Set<Integer> ids = network.getIds();
        Map<Integer, Map<Integer, Edge>> adjParts = new LinkedHashMap<Integer, Map<Integer, Edge>>(ids.size() * 4 / 3 + 1);
        for (int id : ids)
            adjParts.put(id, new LinkedHashMap<Integer, Edge>());
        List<Edge> edgeParts = new ArrayList<Edge>(links.size());
        for (ReactionLink link : links) {
            ReactionNetwork.checkLink(ids, link);
            if (full || link.isClosed()) {
                Map<Integer, Edge> targets = adjParts.get(link.getSource());
                Edge edge = targets.get(link.getTarget());
                if (edge == null) {
                    edge = new Edge(link.getSource(), link.getTarget(), link.getResult());
                    targets.put(link.getTarget(), edge);
                    edgeParts.add(edge);
                } else {
                    // A repeated pair keeps its position but takes the new result.
                    edge.result = link.getResult();
                }
            }
        }
        // Lock down the structures.
        for (Map.Entry<Integer, Map<Integer, Edge>> adjEntry : adjParts.entrySet())
            adjEntry.setValue(Collections.unmodifiableMap(adjEntry.getValue()));
        this.adjacency = Collections.unmodifiableMap(adjParts);
        this.edges = Collections.unmodifiableList(edgeParts);
        log.debug("{} graph built with {} nodes and {} edges.", (full ? "Full" : "Closed"),
                this.adjacency.size(), this.edges.size());
    }

    /**
     * @return the graph of closed reactions for a network
     *
     * @param network	reaction network to convert
     *
     * @throws MalformedNetworkException
     */
    public static ReactionGraph closed(ReactionNetwork network) throws MalformedNetworkException {
        return new ReactionGraph(network, network.getLinks(), false);
    }

    /**
     * @return the graph of all reactions for a network
     *
     * @param network	reaction network to convert
     *
     * @throws MalformedNetworkException
     */
    public static ReactionGraph full(ReactionNetwork network) throws MalformedNetworkException {
        return new ReactionGraph(network, network.getLinks(), true);
    }

    /**
     * @return a graph built from the species of a network and an arbitrary reaction list
     *
     * @param network	reaction network whose species form the nodes
     * @param links		reactions from which to build the edges
     * @param full		TRUE to admit open reactions, FALSE to admit only closed ones
     *
     * @throws MalformedNetworkException	if a reaction refers to a species not in the network
     */
    public static ReactionGraph build(ReactionNetwork network, List<ReactionLink> links, boolean full)
            throws MalformedNetworkException {
        return new ReactionGraph(network, links, full);
    }

    /**
     * @return TRUE if this graph admits open reactions
     */
    public boolean isFull() {
        return this.full;
    }

    /**
     * @return the node IDs, in network order
     */
    public Set<Integer> getNodes() {
        return this.adjacency.keySet();
    }

    /**
     * @return TRUE if the specified species is a node in this graph
     *
     * @param id	ID of the species to check
     */
    public boolean hasNode(int id) {
        return this.adjacency.containsKey(id);
    }

    /**
     * @return all the edges, in order of first appearance
     */
    public List<Edge> getEdges() {
        return this.edges;
    }

    /**
     * @return the number of edges
     */
    public int edgeCount() {
        return this.edges.size();
    }

    /**
     * @return the edge for the specified pair, or NULL if there is none
     *
     * @param source	ID of the function species
     * @param target	ID of the argument species
     */
    public Edge getEdge(int source, int target) {
        return this.adjacency.getOrDefault(source, NO_EDGES).get(target);
    }

    /**
     * @return the edges leaving the specified species
     *
     * @param source	ID of the function species
     */
    public Collection<Edge> getOutEdges(int source) {
        return this.adjacency.getOrDefault(source, NO_EDGES).values();
    }

    /**
     * @return the result of applying one species to another, or OPEN if there is no such edge
     *
     * @param source	ID of the function species
     * @param target	ID of the argument species
     */
    public int getResult(int source, int target) {
        Edge edge = this.getEdge(source, target);
        return (edge == null ? ReactionLink.OPEN : edge.getResult());
    }

}
