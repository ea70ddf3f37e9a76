/**
 *
 */
package org.theseed.gas.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object represents a validated reaction network built from a {@link NetworkRecord}.  It maps
 * each species ID to its label and population count, and it guarantees that every reaction refers
 * only to species present in the network.  The object is immutable once built.
 *
 * @author Bruce Parrello
 *
 */
public class ReactionNetwork {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReactionNetwork.class);
    /** map of species IDs to species, in input order */
    private final Map<Integer, Species> speciesMap;
    /** map of species IDs to labels */
    private final Map<Integer, String> labels;
    /** map of species IDs to population counts */
    private final Map<Integer, Integer> counts;
    /** reactions, in input order */
    private final List<ReactionLink> links;
    /** total population */
    private final long totalPopulation;

    /**
     * Construct a reaction network from a raw network record.
     *
     * @param record	record containing the species and reactions
     *
     * @throws MalformedNetworkException	if a species ID is duplicated or a reaction refers to an unknown species
     */
    public ReactionNetwork(NetworkRecord record) throws MalformedNetworkException {
        this(record.getNodes(), record.getLinks());
    }

    /**
     * Construct a reaction network from lists of species and reactions.
     *
     * @param nodes		species entries
     * @param links		reaction entries
     *
     * @throws MalformedNetworkException	if a species ID is duplicated or a reaction refers to an unknown species
     */
    public ReactionNetwork(List<Species> nodes, List<ReactionLink> links) throws MalformedNetworkException {
        final int hashSize = nodes.size() * 4 / 3 + 1;
        Map<Integer, Species> speciesParts = new LinkedHashMap<Integer, Species>(hashSize);
        Map<Integer, String> labelParts = new LinkedHashMap<Integer, String>(hashSize);
        Map<Integer, Integer> countParts = new LinkedHashMap<Integer, Integer>(hashSize);
        long total = 0;
        for (Species node : nodes) {
            int id = node.getId();
            if (speciesParts.containsKey(id))
                throw new MalformedNetworkException("Duplicate species ID " + id + ".");
            speciesParts.put(id, node);
            labelParts.put(id, node.getLabel());
            countParts.put(id, node.getCount());
            total += node.getCount();
        }
        // Verify the reactions.
        for (ReactionLink link : links)
            checkLink(speciesParts.keySet(), link);
        this.speciesMap = Collections.unmodifiableMap(speciesParts);
        this.labels = Collections.unmodifiableMap(labelParts);
        this.counts = Collections.unmodifiableMap(countParts);
        this.links = List.copyOf(links);
        this.totalPopulation = total;
        log.debug("Network built with {} species, {} reactions, and total population {}.",
                this.speciesMap.size(), this.links.size(), this.totalPopulation);
    }

    /**
     * Verify that a reaction refers only to known species.
     *
     * @param ids		set of known species IDs
     * @param link		reaction to check
     *
     * @throws MalformedNetworkException	if the reaction refers to an unknown species
     */
    protected static void checkLink(Set<Integer> ids, ReactionLink link) throws MalformedNetworkException {
        if (! ids.contains(link.getSource()))
            throw new MalformedNetworkException("Reaction " + link + " has unknown source species " + link.getSource() + ".");
        if (! ids.contains(link.getTarget()))
            throw new MalformedNetworkException("Reaction " + link + " has unknown target species " + link.getTarget() + ".");
        if (link.isClosed() && ! ids.contains(link.getResult()))
            throw new MalformedNetworkException("Reaction " + link + " has unknown result species " + link.getResult() + ".");
    }

    /**
     * @return the species, in input order
     */
    public List<Species> getSpecies() {
        return new ArrayList<Species>(this.speciesMap.values());
    }

    /**
     * @return the species with the specified ID, or NULL if there is none
     *
     * @param id	ID of the desired species
     */
    public Species getSpecies(int id) {
        return this.speciesMap.get(id);
    }

    /**
     * @return the species IDs, in input order
     */
    public Set<Integer> getIds() {
        return this.speciesMap.keySet();
    }

    /**
     * @return TRUE if the specified species is in this network
     *
     * @param id	ID of the species to check
     */
    public boolean contains(int id) {
        return this.speciesMap.containsKey(id);
    }

    /**
     * @return the reactions, in input order
     */
    public List<ReactionLink> getLinks() {
        return this.links;
    }

    /**
     * @return the map of species IDs to labels
     */
    public Map<Integer, String> getLabels() {
        return this.labels;
    }

    /**
     * @return the map of species IDs to population counts
     */
    public Map<Integer, Integer> getCounts() {
        return this.counts;
    }

    /**
     * @return the label for the specified species, or the ID itself if the species is not found
     *
     * @param id	ID of the desired species
     */
    public String getLabel(int id) {
        String retVal = this.labels.get(id);
        if (retVal == null)
            retVal = String.valueOf(id);
        return retVal;
    }

    /**
     * @return the population count of the specified species, or 0 if the species is not found
     *
     * @param id	ID of the desired species
     */
    public int getCount(int id) {
        return this.counts.getOrDefault(id, 0);
    }

    /**
     * @return the number of species
     */
    public int size() {
        return this.speciesMap.size();
    }

    /**
     * @return the total population of all species
     */
    public long getTotalPopulation() {
        return this.totalPopulation;
    }

    /**
     * @return TRUE if the species IDs are exactly 0 through N-1
     */
    public boolean isDense() {
        final int n = this.speciesMap.size();
        boolean retVal = true;
        for (int id : this.speciesMap.keySet()) {
            if (id >= n) {
                retVal = false;
                break;
            }
        }
        return retVal;
    }

    @Override
    public String toString() {
        return "Reaction network (" + this.speciesMap.size() + " species, " + this.links.size() + " reactions)";
    }

}
