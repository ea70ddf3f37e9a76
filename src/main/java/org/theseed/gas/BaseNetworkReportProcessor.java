/**
 *
 */
package org.theseed.gas;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.gas.utils.ParseFailureException;

/**
 * This is a base class for reports about reaction networks.
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
public abstract class BaseNetworkReportProcessor extends BaseNetworkProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseNetworkReportProcessor.class);
    /** output stream */
    private OutputStream outStream;

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, usage = "output file for report (if not STDOUT)")
    private File outFile;

    @Override
    protected void setNetworkDefaults() {
        this.outFile = null;
        this.setReporterDefaults();
    }

    /**
     * Set the option defaults for the subclass.
     */
    protected abstract void setReporterDefaults();

    @Override
    protected void validateNetworkParms() throws IOException, ParseFailureException {
        // Validate the subclass first, so we do not create an output file for a bad command.
        this.validateReporterParms();
        if (this.outFile == null) {
            log.info("Output will be to the standard output.");
            this.outStream = System.out;
        } else {
            log.info("Output will be to {}.", this.outFile);
            this.outStream = new FileOutputStream(this.outFile);
        }
    }

    /**
     * Validate and process the subclass parameters and options.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateReporterParms() throws IOException, ParseFailureException;

    @Override
    protected final void runCommand() throws Exception {
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(this.outStream, StandardCharsets.UTF_8));
        try {
            this.runReporter(writer);
        } finally {
            writer.flush();
            // Insure the output file is closed, but leave the standard output open.
            if (this.outFile != null)
                writer.close();
        }
    }

    /**
     * Execute the command and produce the report.
     *
     *  @param writer	print writer to receive the report
     *
     *  @throws Exception
     */
    protected abstract void runReporter(PrintWriter writer) throws Exception;

}
