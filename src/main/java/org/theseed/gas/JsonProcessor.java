/**
 *
 */
package org.theseed.gas;

import java.io.IOException;
import java.io.PrintWriter;

import org.theseed.gas.network.NetworkAnalysis;
import org.theseed.gas.network.NetworkAnalyzer;
import org.theseed.gas.utils.ParseFailureException;

import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This command writes the analysis of a network as a JSON object, for use by plotting tools.
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
public class JsonProcessor extends BaseNetworkReportProcessor {

    @Override
    protected void setReporterDefaults() {
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        NetworkAnalysis analysis = NetworkAnalyzer.analyze(this.getNetwork());
        writer.println(Jsoner.prettyPrint(analysis.toJson().toJson()));
    }

}
