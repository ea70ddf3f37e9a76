/**
 *
 */
package org.theseed.gas;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

import org.kohsuke.args4j.Option;
import org.theseed.gas.network.LabelFormatter;
import org.theseed.gas.network.Species;
import org.theseed.gas.network.SpeciesRanking;
import org.theseed.gas.utils.ParseFailureException;

/**
 * This command lists the species of a network from most abundant to least.  Species with equal
 * counts are listed in their original order.
 *
 * The positional parameter is the name of the network JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * --top	number of species to list (default 0, meaning all)
 * --len	maximum length of a short label (default 20)
 *
 * @author Bruce Parrello
 *
 */
public class SpeciesProcessor extends BaseNetworkReportProcessor {

    // COMMAND-LINE OPTIONS

    /** number of species to list */
    @Option(name = "--top", metaVar = "10", usage = "number of species to list (0 for all)")
    private int top;

    /** short-label length */
    @Option(name = "--len", metaVar = "12", usage = "maximum length of a short label")
    private int labelLen;

    @Override
    protected void setReporterDefaults() {
        this.top = 0;
        this.labelLen = 20;
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        if (this.top < 0)
            throw new ParseFailureException("Species count cannot be negative.");
        if (this.labelLen < 1)
            throw new ParseFailureException("Label length must be positive.");
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        SpeciesRanking ranking = new SpeciesRanking(this.getNetwork());
        List<Species> species = (this.top == 0 ? ranking.getRanked() : ranking.getTop(this.top));
        log.info("Listing {} of {} species.  Total population is {}.", species.size(), ranking.size(),
                ranking.getTotal());
        writer.println("rank\tid\tcount\tpercent\tshort_label\tlabel");
        int rank = 0;
        for (Species item : species) {
            rank++;
            writer.format("%d\t%d\t%d\t%.2f\t%s\t%s%n", rank, item.getId(), item.getCount(),
                    ranking.getPercent(item), LabelFormatter.shorten(item.getLabel(), this.labelLen),
                    item.getLabel());
        }
    }

}
