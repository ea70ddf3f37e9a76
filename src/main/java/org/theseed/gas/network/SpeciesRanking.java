/**
 *
 */
package org.theseed.gas.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * This object ranks the species of a network by abundance.  Species with higher counts come first;
 * species with equal counts stay in input order.
 *
 * @author Bruce Parrello
 *
 */
public class SpeciesRanking {

    // FIELDS
    /** species in rank order */
    private final List<Species> ranked;
    /** total population */
    private final long total;

    /**
     * This class sorts species from most abundant to least.  Used with a stable sort, it leaves
     * ties in their original order.
     */
    public static class AbundanceSorter implements Comparator<Species> {

        @Override
        public int compare(Species o1, Species o2) {
            return Integer.compare(o2.getCount(), o1.getCount());
        }

    }

    /**
     * Rank the species of a network.
     *
     * @param network	network whose species are to be ranked
     */
    public SpeciesRanking(ReactionNetwork network) {
        this(network.getSpecies());
    }

    /**
     * Rank a list of species.
     *
     * @param species	species to rank, in input order
     */
    public SpeciesRanking(List<Species> species) {
        List<Species> sorted = new ArrayList<Species>(species);
        // List.sort is a stable merge sort.
        sorted.sort(new AbundanceSorter());
        this.ranked = Collections.unmodifiableList(sorted);
        this.total = species.stream().mapToLong(x -> x.getCount()).sum();
    }

    /**
     * @return the species, most abundant first
     */
    public List<Species> getRanked() {
        return this.ranked;
    }

    /**
     * @return the most abundant species, at most the specified number
     *
     * @param n		maximum number of species to return
     */
    public List<Species> getTop(int n) {
        return this.ranked.subList(0, Math.min(Math.max(n, 0), this.ranked.size()));
    }

    /**
     * @return the total population
     */
    public long getTotal() {
        return this.total;
    }

    /**
     * @return the number of species ranked
     */
    public int size() {
        return this.ranked.size();
    }

    /**
     * @return the percentage of the population belonging to a species, or 0 if the population is empty
     *
     * @param species	species of interest
     */
    public double getPercent(Species species) {
        double retVal = 0.0;
        if (this.total > 0)
            retVal = 100.0 * species.getCount() / this.total;
        return retVal;
    }

}
