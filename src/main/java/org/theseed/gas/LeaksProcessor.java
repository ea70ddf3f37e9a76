/**
 *
 */
package org.theseed.gas;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

import org.theseed.gas.network.NetworkAnalyzer;
import org.theseed.gas.network.ReactionLink;
import org.theseed.gas.network.ReactionNetwork;
import org.theseed.gas.utils.ParseFailureException;

/**
 * This command lists the leak reactions of a network, that is, the reactions whose product is
 * outside the tracked population.  The leaks are listed in input order.
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
public class LeaksProcessor extends BaseNetworkReportProcessor {

    @Override
    protected void setReporterDefaults() {
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        ReactionNetwork network = this.getNetwork();
        List<ReactionLink> leaks = NetworkAnalyzer.analyze(network).getLeaks();
        log.info("{} leak reactions found.", leaks.size());
        writer.println("source\ttarget\tsource_label\ttarget_label");
        for (ReactionLink leak : leaks)
            writer.format("%d\t%d\t%s\t%s%n", leak.getSource(), leak.getTarget(),
                    network.getLabel(leak.getSource()), network.getLabel(leak.getTarget()));
    }

}
