/**
 *
 */
package org.theseed.gas;

import java.io.IOException;
import java.io.PrintWriter;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.gas.network.NetworkAnalysis;
import org.theseed.gas.network.NetworkAnalyzer;
import org.theseed.gas.network.ReactionNetwork;
import org.theseed.gas.report.NetworkSummary;
import org.theseed.gas.report.ReactionMatrix;
import org.theseed.gas.utils.ParseFailureException;

/**
 * This command produces the full analysis report for a reaction network:  the summary of reaction
 * counts, abundant species, constant functions, and leaks, followed by the reaction matrix.  If the
 * network has more species than the display ceiling, the matrix is skipped.
 *
 * The positional parameter is the name of the network JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * --maxSpecies		maximum number of species for which the matrix is displayed (default 150)
 * --top			number of abundant species to list (default 8)
 * --limit			maximum number of constant functions and leaks to list (default 5)
 *
 * @author Bruce Parrello
 *
 */
public class AnalyzeProcessor extends BaseNetworkReportProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(AnalyzeProcessor.class);

    // COMMAND-LINE OPTIONS

    /** display ceiling */
    @Option(name = "--maxSpecies", metaVar = "150", usage = "maximum number of species for a matrix display")
    private int maxSpecies;

    /** number of top species to list */
    @Option(name = "--top", metaVar = "10", usage = "number of most abundant species to list")
    private int topSpecies;

    /** maximum size of the function and leak lists */
    @Option(name = "--limit", metaVar = "10", usage = "maximum number of constant functions and leaks to list")
    private int listLimit;

    @Override
    protected void setReporterDefaults() {
        this.maxSpecies = NetworkSummary.DEFAULT_MAX_SPECIES;
        this.topSpecies = NetworkSummary.DEFAULT_TOP_SPECIES;
        this.listLimit = NetworkSummary.DEFAULT_LIST_LIMIT;
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        if (this.maxSpecies < 0)
            throw new ParseFailureException("Maximum species count cannot be negative.");
        if (this.topSpecies < 0)
            throw new ParseFailureException("Top-species count cannot be negative.");
        if (this.listLimit < 0)
            throw new ParseFailureException("List limit cannot be negative.");
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        ReactionNetwork network = this.getNetwork();
        NetworkAnalysis analysis = NetworkAnalyzer.analyze(network);
        log.info("{}.", analysis);
        NetworkSummary summary = new NetworkSummary(network, analysis, this.maxSpecies)
                .setTopSpecies(this.topSpecies).setListLimit(this.listLimit);
        if (summary.isTooLarge()) {
            log.warn("Network has {} species, more than the limit of {}.  Reaction matrix skipped.",
                    network.size(), this.maxSpecies);
            summary.write(writer);
        } else {
            ReactionMatrix.of(network).write(writer);
            writer.println();
            summary.write(writer);
        }
    }

}
