/**
 *
 */
package org.theseed.gas.utils;

import java.io.IOException;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * This is the base class for all command processors.  The subclass declares its options and
 * positional parameters using args4j annotations.  The base class handles the help and
 * debug-logging options, parses the command line, and wraps the actual command so that
 * failures are logged.
 *
 * The command-line options common to all processors are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseProcessor implements Runnable {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseProcessor.class);
    /** TRUE if the command failed */
    private boolean failed;
    /** start time of the command, in milliseconds */
    private long startTime;

    // COMMAND-LINE OPTIONS

    /** help option */
    @Option(name = "-h", aliases = { "--help" }, help = true, usage = "display command-line usage")
    private boolean help;

    /** debug-message flag */
    @Option(name = "-v", aliases = { "--verbose", "--debug" }, usage = "show more detailed progress messages")
    private boolean debug;

    /**
     * Parse the command-line parameters and options.
     *
     * @param args	command-line arguments
     *
     * @return TRUE if the command is ready to run, FALSE if it should be skipped
     */
    public boolean parseCommand(String[] args) {
        boolean retVal = false;
        this.help = false;
        this.debug = false;
        this.failed = false;
        this.setDefaults();
        CmdLineParser parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
            if (this.help) {
                parser.printUsage(System.err);
            } else {
                if (this.debug)
                    setLogLevel(Level.DEBUG);
                retVal = this.validateParms();
            }
        } catch (CmdLineException | ParseFailureException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            this.failed = true;
        } catch (IOException e) {
            log.error("Error validating parameters: {}", e.toString());
            this.failed = true;
        }
        return retVal;
    }

    /**
     * Set the level of the root logger.
     *
     * @param level		new logging level
     */
    private static void setLogLevel(Level level) {
        Logger rootLogger = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (rootLogger instanceof ch.qos.logback.classic.Logger)
            ((ch.qos.logback.classic.Logger) rootLogger).setLevel(level);
    }

    @Override
    public void run() {
        this.startTime = System.currentTimeMillis();
        try {
            this.runCommand();
            log.info("Command completed in {} seconds.", (System.currentTimeMillis() - this.startTime) / 1000.0);
        } catch (Exception e) {
            log.error("Command failed: {}", e.toString(), e);
            this.failed = true;
        }
    }

    /**
     * @return TRUE if the command failed during parsing or execution
     */
    public boolean isFailed() {
        return this.failed;
    }

    /**
     * Set the default values of the command-line options.
     */
    protected abstract void setDefaults();

    /**
     * Validate the command-line options and parameters.
     *
     * @return TRUE if the command should run, FALSE if it should be skipped
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract boolean validateParms() throws IOException, ParseFailureException;

    /**
     * Run the command.
     *
     * @throws Exception
     */
    protected abstract void runCommand() throws Exception;

}
