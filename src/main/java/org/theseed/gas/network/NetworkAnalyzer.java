/**
 *
 */
package org.theseed.gas.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object analyzes the structure of a reaction network.  It counts closed and open reactions,
 * lists the leaks, determines the distinct products of each species when used as a function, and
 * classifies species as constant functions or identity-like.
 *
 * Every listed reaction is counted, even when a (source, target) pair repeats.  A species is a
 * constant function if its closed reactions yield exactly one distinct product.  A species is
 * identity-like if every reaction it drives returns the argument; a species that never acts as a
 * function qualifies trivially.
 *
 * @author Bruce Parrello
 *
 */
public class NetworkAnalyzer {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(NetworkAnalyzer.class);
    /** network to analyze */
    private final ReactionNetwork network;

    /**
     * Construct an analyzer for a reaction network.
     *
     * @param network	network to analyze
     */
    public NetworkAnalyzer(ReactionNetwork network) {
        this.network = network;
    }

    /**
     * @return the analysis of a reaction network
     *
     * @param network	network to analyze
     */
    public static NetworkAnalysis analyze(ReactionNetwork network) {
        return new NetworkAnalyzer(network).analyze();
    }

    /**
     * @return the analysis of this object's reaction network
     */
    public NetworkAnalysis analyze() {
        Set<Integer> ids = this.network.getIds();
        final int hashSize = ids.size() * 4 / 3 + 1;
        Map<Integer, Set<Integer>> producers = new LinkedHashMap<Integer, Set<Integer>>(hashSize);
        for (int id : ids)
            producers.put(id, new TreeSet<Integer>());
        // This will track the species that have failed the identity test.
        Set<Integer> nonIdentities = new HashSet<Integer>(hashSize);
        List<ReactionLink> leaks = new ArrayList<ReactionLink>();
        int total = 0;
        int closed = 0;
        for (ReactionLink link : this.network.getLinks()) {
            total++;
            if (link.isClosed()) {
                closed++;
                producers.get(link.getSource()).add(link.getResult());
            } else
                leaks.add(link);
            if (! link.isIdentity())
                nonIdentities.add(link.getSource());
        }
        // Now we classify the species.
        Map<Integer, Integer> universals = new LinkedHashMap<Integer, Integer>();
        List<Integer> identities = new ArrayList<Integer>();
        for (Map.Entry<Integer, Set<Integer>> producerEntry : producers.entrySet()) {
            int id = producerEntry.getKey();
            Set<Integer> products = producerEntry.getValue();
            if (products.size() == 1)
                universals.put(id, products.iterator().next());
            if (! nonIdentities.contains(id))
                identities.add(id);
            producerEntry.setValue(Collections.unmodifiableSet(products));
        }
        NetworkAnalysis retVal = new NetworkAnalysis(total, closed, leaks, producers, universals, identities);
        log.debug("{} reactions analyzed: {} closed, {} open, {} constant functions, {} identity-like species.",
                total, closed, total - closed, universals.size(), identities.size());
        return retVal;
    }

    /**
     * @return the network being analyzed
     */
    public ReactionNetwork getNetwork() {
        return this.network;
    }

}
