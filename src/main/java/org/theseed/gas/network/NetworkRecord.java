/**
 *
 */
package org.theseed.gas.network;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This object contains the raw reaction-network record exported by the simulator.  It holds the
 * species entries and the reaction entries in the order they were listed.  Nothing is validated
 * here beyond the presence of the required fields:  cross-reference checking is done when a
 * {@link ReactionNetwork} is built from the record.
 *
 * The JSON form is an object with a "nodes" array of {id, label, count} objects and a "links"
 * array of {source, target, result} objects, where a result of -1 indicates the product is
 * outside the population.
 *
 * @author Bruce Parrello
 *
 */
public class NetworkRecord {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(NetworkRecord.class);
    /** species entries, in input order */
    private final List<Species> nodes;
    /** reaction entries, in input order */
    private final List<ReactionLink> links;

    /**
     * Construct a network record from lists of species and reactions.
     *
     * @param nodes		species entries
     * @param links		reaction entries
     */
    public NetworkRecord(List<Species> nodes, List<ReactionLink> links) {
        this.nodes = List.copyOf(nodes);
        this.links = List.copyOf(links);
    }

    /**
     * Construct a network record from a JSON object.
     *
     * @param networkObject		JSON object containing "nodes" and "links" arrays
     *
     * @throws MalformedNetworkException
     */
    public NetworkRecord(JsonObject networkObject) throws MalformedNetworkException {
        JsonArray nodeList = getArray(networkObject, "nodes");
        List<Species> nodeParts = new ArrayList<Species>(nodeList.size());
        for (Object nodeItem : nodeList)
            nodeParts.add(new Species(asObject(nodeItem, "nodes")));
        JsonArray linkList = getArray(networkObject, "links");
        List<ReactionLink> linkParts = new ArrayList<ReactionLink>(linkList.size());
        for (Object linkItem : linkList)
            linkParts.add(new ReactionLink(asObject(linkItem, "links")));
        this.nodes = Collections.unmodifiableList(nodeParts);
        this.links = Collections.unmodifiableList(linkParts);
    }

    /**
     * Load a network record from a JSON file.
     *
     * @param inFile	file containing the network JSON
     *
     * @return the network record read
     *
     * @throws IOException
     * @throws MalformedNetworkException
     */
    public static NetworkRecord load(File inFile) throws IOException, MalformedNetworkException {
        NetworkRecord retVal;
        try (Reader reader = new FileReader(inFile, StandardCharsets.UTF_8)) {
            retVal = load(reader, inFile.toString());
        }
        log.info("{} species and {} reactions read from {}.", retVal.getNodes().size(),
                retVal.getLinks().size(), inFile);
        return retVal;
    }

    /**
     * Load a network record from a JSON stream.
     *
     * @param reader	reader positioned on the network JSON
     * @param source	name of the input source, for error messages
     *
     * @return the network record read
     *
     * @throws IOException
     * @throws MalformedNetworkException
     */
    public static NetworkRecord load(Reader reader, String source) throws IOException, MalformedNetworkException {
        Object parsed;
        try {
            parsed = Jsoner.deserialize(reader);
        } catch (JsonException e) {
            throw new IOException("JSON error in " + source + ": " + e.toString());
        }
        if (! (parsed instanceof JsonObject))
            throw new MalformedNetworkException("Network JSON in " + source + " is not an object.");
        return new NetworkRecord((JsonObject) parsed);
    }

    /**
     * @return the named array from a JSON object, or an empty array if it is absent
     *
     * @param networkObject		source JSON object
     * @param name				name of the array
     *
     * @throws MalformedNetworkException
     */
    private static JsonArray getArray(JsonObject networkObject, String name) throws MalformedNetworkException {
        Object retVal = networkObject.get(name);
        if (retVal == null)
            retVal = new JsonArray();
        else if (! (retVal instanceof JsonArray))
            throw new MalformedNetworkException("Network field \"" + name + "\" is not an array.");
        return (JsonArray) retVal;
    }

    /**
     * @return an array element as a JSON object
     *
     * @param item		array element to convert
     * @param name		name of the containing array
     *
     * @throws MalformedNetworkException
     */
    private static JsonObject asObject(Object item, String name) throws MalformedNetworkException {
        if (! (item instanceof JsonObject))
            throw new MalformedNetworkException("Entry in \"" + name + "\" is not an object: " + item);
        return (JsonObject) item;
    }

    /**
     * @return the species entries, in input order
     */
    public List<Species> getNodes() {
        return this.nodes;
    }

    /**
     * @return the reaction entries, in input order
     */
    public List<ReactionLink> getLinks() {
        return this.links;
    }

}
