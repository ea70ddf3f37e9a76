/**
 *
 */
package org.theseed.gas;

import java.io.IOException;
import java.io.PrintWriter;

import org.kohsuke.args4j.Option;
import org.theseed.gas.network.ReactionNetwork;
import org.theseed.gas.report.NetworkSummary;
import org.theseed.gas.report.ReactionMatrix;
import org.theseed.gas.utils.ParseFailureException;

/**
 * This command displays the reaction matrix for a network.  Row I, column J shows the product of
 * applying species I to species J, or "X" if the product is outside the population.  Networks
 * larger than the display ceiling are rejected unless the matrix is forced.
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
 * --force			display the matrix even if the network is too large
 *
 * @author Bruce Parrello
 *
 */
public class MatrixProcessor extends BaseNetworkReportProcessor {

    // COMMAND-LINE OPTIONS

    /** display ceiling */
    @Option(name = "--maxSpecies", metaVar = "150", usage = "maximum number of species for a matrix display")
    private int maxSpecies;

    /** if specified, the ceiling is ignored */
    @Option(name = "--force", usage = "if specified, the matrix will be displayed regardless of size")
    private boolean force;

    @Override
    protected void setReporterDefaults() {
        this.maxSpecies = NetworkSummary.DEFAULT_MAX_SPECIES;
        this.force = false;
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        int size = this.getNetwork().size();
        if (! this.force && size > this.maxSpecies)
            throw new ParseFailureException("Network has " + size + " species, which exceeds the matrix limit of "
                    + this.maxSpecies + ".  Use --force to override.");
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        ReactionNetwork network = this.getNetwork();
        if (! network.isDense())
            log.warn("Species IDs in {} are not contiguous.  Matrix rows are labeled by ID.", this.getNetworkFile());
        ReactionMatrix.of(network).write(writer);
    }

}
