/**
 *
 */
package org.theseed.gas.report;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.theseed.gas.network.LabelFormatter;
import org.theseed.gas.network.NetworkAnalysis;
import org.theseed.gas.network.ReactionLink;
import org.theseed.gas.network.ReactionNetwork;
import org.theseed.gas.network.Species;
import org.theseed.gas.network.SpeciesRanking;

/**
 * This object produces the text summary of a network analysis.  The summary lists the headline
 * reaction counts, the most abundant species, the constant functions, and the leak reactions.
 * If the network has more species than the display ceiling, the summary is headed with a notice
 * that only the analysis is being shown.
 *
 * @author Bruce Parrello
 *
 */
public class NetworkSummary {

    // FIELDS
    /** network being summarized */
    private final ReactionNetwork network;
    /** analysis of the network */
    private final NetworkAnalysis analysis;
    /** abundance ranking of the species */
    private final SpeciesRanking ranking;
    /** maximum number of species for a full display */
    private final int maxSpecies;
    /** number of top species to list */
    private int topSpecies;
    /** maximum number of constant functions or leaks to list */
    private int listLimit;
    /** default display ceiling */
    public static final int DEFAULT_MAX_SPECIES = 150;
    /** default number of top species to list */
    public static final int DEFAULT_TOP_SPECIES = 8;
    /** default number of constant functions or leaks to list */
    public static final int DEFAULT_LIST_LIMIT = 5;

    /**
     * Construct a summary for an analyzed network.
     *
     * @param network		network being summarized
     * @param analysis		analysis of the network
     * @param maxSpecies	maximum number of species for a full display
     */
    public NetworkSummary(ReactionNetwork network, NetworkAnalysis analysis, int maxSpecies) {
        this.network = network;
        this.analysis = analysis;
        this.ranking = new SpeciesRanking(network);
        this.maxSpecies = maxSpecies;
        this.topSpecies = DEFAULT_TOP_SPECIES;
        this.listLimit = DEFAULT_LIST_LIMIT;
    }

    /**
     * Specify the number of top species to list.
     *
     * @param topSpecies 	the number of species to list
     */
    public NetworkSummary setTopSpecies(int topSpecies) {
        this.topSpecies = topSpecies;
        return this;
    }

    /**
     * Specify the maximum number of constant functions or leaks to list.
     *
     * @param listLimit 	the maximum list size
     */
    public NetworkSummary setListLimit(int listLimit) {
        this.listLimit = listLimit;
        return this;
    }

    /**
     * @return TRUE if the network has too many species for a full display
     */
    public boolean isTooLarge() {
        return this.network.size() > this.maxSpecies;
    }

    /**
     * @return the lines of the summary
     */
    public List<String> render() {
        List<String> retVal = new ArrayList<String>();
        if (this.isTooLarge()) {
            retVal.add("═══ NETWORK ANALYSIS (Summary Only) ═══");
            retVal.add("");
            retVal.add(String.format("Warning: %d species exceeds visualization limit (%d)", this.network.size(),
                    this.maxSpecies));
        } else
            retVal.add("═══ NETWORK ANALYSIS ═══");
        retVal.add("");
        retVal.add("Species Count: " + this.network.size());
        retVal.add("Total Population: " + this.network.getTotalPopulation());
        retVal.add("Total Reactions: " + this.analysis.getTotalReactions());
        retVal.add("Closed Reactions: " + this.analysis.getClosedReactions());
        retVal.add("Open (Leak) Reactions: " + this.analysis.getOpenReactions());
        retVal.add(String.format("Closure Ratio: %.1f%%", this.analysis.getClosureRatio() * 100.0));
        // List the most abundant species.
        retVal.add("");
        retVal.add("═══ SPECIES (by abundance) ═══");
        retVal.add("");
        List<Species> top = this.ranking.getTop(this.topSpecies);
        for (int i = 0; i < top.size(); i++) {
            Species species = top.get(i);
            retVal.add(String.format("%d. %s", i + 1, LabelFormatter.shorten(species.getLabel(), 20)));
            retVal.add(String.format("   Count: %d (%.1f%%)", species.getCount(), this.ranking.getPercent(species)));
        }
        int hidden = this.ranking.size() - top.size();
        if (hidden > 0)
            retVal.add(String.format("   ... and %d more species", hidden));
        // List the constant functions.
        Map<Integer, Integer> universals = this.analysis.getUniversalNodes();
        if (! universals.isEmpty()) {
            retVal.add("");
            retVal.add("═══ CONSTANT FUNCTIONS ═══");
            retVal.add("(Always produce same result)");
            retVal.add("");
            universals.entrySet().stream().limit(this.listLimit)
                    .forEach(x -> retVal.add("  " + this.shortLabel(x.getKey(), 16) + " → "
                            + this.shortLabel(x.getValue(), 12)));
        }
        // List the leaks.
        List<ReactionLink> leaks = this.analysis.getLeaks();
        if (! leaks.isEmpty()) {
            retVal.add("");
            retVal.add("═══ LEAK REACTIONS ═══");
            retVal.add("(Produce external results)");
            retVal.add("");
            leaks.stream().limit(this.listLimit)
                    .forEach(x -> retVal.add("  " + this.shortLabel(x.getSource(), 12) + "("
                            + this.shortLabel(x.getTarget(), 12) + ") → ?"));
            if (leaks.size() > this.listLimit)
                retVal.add(String.format("  ... and %d more", leaks.size() - this.listLimit));
        }
        return retVal;
    }

    /**
     * @return the shortened label of a species
     *
     * @param id		ID of the species
     * @param maxLen	maximum display length
     */
    private String shortLabel(int id, int maxLen) {
        return LabelFormatter.shorten(this.network.getLabel(id), maxLen);
    }

    /**
     * Write the summary to an output report.
     *
     * @param writer	output print writer
     */
    public void write(PrintWriter writer) {
        for (String line : this.render())
            writer.println(line);
    }

}
