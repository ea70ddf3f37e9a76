/**
 *
 */
package org.theseed.gas;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.gas.network.MalformedNetworkException;
import org.theseed.gas.network.NetworkRecord;
import org.theseed.gas.network.ReactionNetwork;
import org.theseed.gas.utils.BaseProcessor;
import org.theseed.gas.utils.ParseFailureException;

/**
 * This is a base class for commands against an exported reaction network.
 *
 * The positional parameter is the name of the network JSON file produced by the simulator's
 * graph export.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * @author Bruce Parrello
 *
 */
public abstract class BaseNetworkProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseNetworkProcessor.class);
    /** reaction network */
    private ReactionNetwork network;

    // COMMAND-LINE OPTIONS

    /** network JSON file */
    @Argument(index = 0, metaVar = "network.json", usage = "JSON file for exported reaction network",
            required = true)
    private File networkFile;

    @Override
    protected final void setDefaults() {
        this.setNetworkDefaults();
    }

    /**
     * Set the default options for the subclass.
     */
    protected abstract void setNetworkDefaults();

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        if (! this.networkFile.canRead())
            throw new FileNotFoundException("Network file " + this.networkFile + " is not found or unreadable.");
        log.info("Loading network from {}.", this.networkFile);
        try {
            NetworkRecord record = NetworkRecord.load(this.networkFile);
            this.network = new ReactionNetwork(record);
        } catch (MalformedNetworkException e) {
            throw new ParseFailureException("Invalid network in " + this.networkFile + ": " + e.getMessage(), e);
        }
        log.info("Found {} species and {} reactions.", this.network.size(), this.network.getLinks().size());
        this.validateNetworkParms();
        return true;
    }

    /**
     * Validate and process the subclass parameters and options.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateNetworkParms() throws IOException, ParseFailureException;

    /**
     * @return the reaction network
     */
    protected ReactionNetwork getNetwork() {
        return this.network;
    }

    /**
     * @return the network file name
     */
    protected File getNetworkFile() {
        return this.networkFile;
    }

}
