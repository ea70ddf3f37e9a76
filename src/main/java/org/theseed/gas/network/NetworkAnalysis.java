/**
 *
 */
package org.theseed.gas.network;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object contains the results of analyzing a reaction network.  It is produced by
 * {@link NetworkAnalyzer} and is immutable.
 *
 * @author Bruce Parrello
 *
 */
public class NetworkAnalysis {

    // FIELDS
    /** number of reactions listed */
    private final int totalReactions;
    /** number of reactions whose product is a tracked species */
    private final int closedReactions;
    /** reactions whose product is outside the population, in input order */
    private final List<ReactionLink> leaks;
    /** map of species IDs to the distinct products they yield as functions */
    private final Map<Integer, Set<Integer>> producers;
    /** map of constant-function species IDs to their single product */
    private final Map<Integer, Integer> universalNodes;
    /** IDs of species that always return their argument */
    private final List<Integer> identityLike;

    /**
     * Construct an analysis result.  The collections are stored as-is, so the caller must
     * not retain modifiable references to them.
     *
     * @param totalReactions	number of reactions listed
     * @param closedReactions	number of closed reactions
     * @param leaks				open reactions, in input order
     * @param producers			map of species IDs to product sets
     * @param universalNodes	map of constant-function species IDs to products
     * @param identityLike		IDs of identity-like species
     */
    protected NetworkAnalysis(int totalReactions, int closedReactions, List<ReactionLink> leaks,
            Map<Integer, Set<Integer>> producers, Map<Integer, Integer> universalNodes,
            List<Integer> identityLike) {
        this.totalReactions = totalReactions;
        this.closedReactions = closedReactions;
        this.leaks = Collections.unmodifiableList(leaks);
        this.producers = Collections.unmodifiableMap(producers);
        this.universalNodes = Collections.unmodifiableMap(universalNodes);
        this.identityLike = Collections.unmodifiableList(identityLike);
    }

    /**
     * @return the number of reactions listed, including repeated pairs
     */
    public int getTotalReactions() {
        return this.totalReactions;
    }

    /**
     * @return the number of reactions whose product is a tracked species
     */
    public int getClosedReactions() {
        return this.closedReactions;
    }

    /**
     * @return the number of reactions whose product is outside the population
     */
    public int getOpenReactions() {
        return this.totalReactions - this.closedReactions;
    }

    /**
     * @return the fraction of reactions that are closed, or 0 if there are no reactions
     */
    public double getClosureRatio() {
        double retVal = 0.0;
        if (this.totalReactions > 0)
            retVal = ((double) this.closedReactions) / this.totalReactions;
        return retVal;
    }

    /**
     * @return the open reactions, in input order
     */
    public List<ReactionLink> getLeaks() {
        return this.leaks;
    }

    /**
     * @return the map of species IDs to the distinct products each yields as a function
     */
    public Map<Integer, Set<Integer>> getProducers() {
        return this.producers;
    }

    /**
     * @return the distinct products of the specified species, or an empty set if it is unknown
     *
     * @param id	ID of the function species
     */
    public Set<Integer> getProducts(int id) {
        return this.producers.getOrDefault(id, Collections.emptySet());
    }

    /**
     * @return the map of constant-function species IDs to their single product
     */
    public Map<Integer, Integer> getUniversalNodes() {
        return this.universalNodes;
    }

    /**
     * @return TRUE if the specified species is a constant function
     *
     * @param id	ID of the species to check
     */
    public boolean isUniversal(int id) {
        return this.universalNodes.containsKey(id);
    }

    /**
     * @return the IDs of the identity-like species, in network order
     */
    public List<Integer> getIdentityLike() {
        return this.identityLike;
    }

    /**
     * @return TRUE if the specified species is identity-like
     *
     * @param id	ID of the species to check
     */
    public boolean isIdentityLike(int id) {
        return this.identityLike.contains(id);
    }

    /**
     * @return a JSON object describing this analysis
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put("total_reactions", this.totalReactions);
        retVal.put("closed_reactions", this.closedReactions);
        retVal.put("open_reactions", this.getOpenReactions());
        retVal.put("closure_ratio", this.getClosureRatio());
        JsonArray leakList = new JsonArray();
        for (ReactionLink leak : this.leaks)
            leakList.add(new JsonArray().addChain(leak.getSource()).addChain(leak.getTarget()));
        retVal.put("leaks", leakList);
        JsonObject producerMap = new JsonObject();
        for (Map.Entry<Integer, Set<Integer>> producerEntry : this.producers.entrySet())
            producerMap.put(String.valueOf(producerEntry.getKey()), new JsonArray(producerEntry.getValue()));
        retVal.put("producers", producerMap);
        JsonObject universalMap = new JsonObject();
        for (Map.Entry<Integer, Integer> universalEntry : this.universalNodes.entrySet())
            universalMap.put(String.valueOf(universalEntry.getKey()), universalEntry.getValue());
        retVal.put("universal_nodes", universalMap);
        retVal.put("identity_like", new JsonArray(this.identityLike));
        return retVal;
    }

    @Override
    public String toString() {
        return String.format("Network analysis: %d reactions, %d closed, %d open, %d constant functions, %d identity-like",
                this.totalReactions, this.closedReactions, this.getOpenReactions(), this.universalNodes.size(),
                this.identityLike.size());
    }

}
