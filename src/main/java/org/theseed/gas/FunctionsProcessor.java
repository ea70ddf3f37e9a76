/**
 *
 */
package org.theseed.gas;

import java.io.IOException;
import java.io.PrintWriter;

import org.apache.commons.lang3.StringUtils;
import org.theseed.gas.network.NetworkAnalysis;
import org.theseed.gas.network.NetworkAnalyzer;
import org.theseed.gas.network.ReactionGraph;
import org.theseed.gas.network.ReactionNetwork;
import org.theseed.gas.network.Species;
import org.theseed.gas.utils.ParseFailureException;

/**
 * This command reports the behavior of each species when used as a function.  For each species we
 * list the number of distinct arguments it was applied to, the distinct products it yields, the
 * product if it is a constant function, and whether it is identity-like.
 *
 * The positional parameter is the name of the network JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * @author Bruce Parrello
 *
 */
public class FunctionsProcessor extends BaseNetworkReportProcessor {

    @Override
    protected void setReporterDefaults() {
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        ReactionNetwork network = this.getNetwork();
        NetworkAnalysis analysis = NetworkAnalyzer.analyze(network);
        ReactionGraph graph = ReactionGraph.full(network);
        log.info("{} constant functions and {} identity-like species found.", analysis.getUniversalNodes().size(),
                analysis.getIdentityLike().size());
        writer.println("id\tlabel\targuments\tproducts\tconstant\tidentity");
        for (Species species : network.getSpecies()) {
            int id = species.getId();
            Integer constant = analysis.getUniversalNodes().get(id);
            writer.format("%d\t%s\t%d\t%s\t%s\t%s%n", id, species.getLabel(), graph.getOutEdges(id).size(),
                    StringUtils.join(analysis.getProducts(id), ","),
                    (constant == null ? "" : constant.toString()),
                    (analysis.isIdentityLike(id) ? "Y" : ""));
        }
    }

}
