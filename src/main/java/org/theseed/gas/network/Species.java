/**
 *
 */
package org.theseed.gas.network;

import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object represents a single species in a Turing gas population.  A species is one distinct
 * lambda expression, identified by an ID number, labeled with its serialized form, and carrying the
 * number of copies observed in the population.
 *
 * @author Bruce Parrello
 *
 */
public class Species {

    // FIELDS
    /** ID number of this species */
    private final int id;
    /** serialized expression */
    private final String label;
    /** number of copies in the population */
    private final int count;

    private static enum SpeciesKeys implements JsonKey {
        ID(null), LABEL(""), COUNT(0);

        private final Object m_value;

        private SpeciesKeys(final Object value) {
            this.m_value = value;
        }

        /** This is the string used as a key in the incoming JsonObject map.
         */
        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        /** This is the default value used when the key is not found.
         */
        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    /**
     * Construct a species.
     *
     * @param id		ID number (must be non-negative)
     * @param label		serialized expression
     * @param count		population count (must be non-negative)
     *
     * @throws MalformedNetworkException
     */
    public Species(int id, String label, int count) throws MalformedNetworkException {
        if (id < 0)
            throw new MalformedNetworkException("Species ID " + id + " is negative.");
        if (count < 0)
            throw new MalformedNetworkException("Species " + id + " has negative count " + count + ".");
        this.id = id;
        this.label = (label == null ? "" : label);
        this.count = count;
    }

    /**
     * Construct a species from a JSON node entry.
     *
     * @param nodeObject	JSON object for the node
     *
     * @throws MalformedNetworkException
     */
    public Species(JsonObject nodeObject) throws MalformedNetworkException {
        this(JsonFields.getInt(nodeObject, SpeciesKeys.ID, "Species"), readLabel(nodeObject),
                JsonFields.getInt(nodeObject, SpeciesKeys.COUNT, "Species"));
    }

    /**
     * @return the label of a JSON node entry, or an empty string if there is none
     *
     * @param nodeObject	JSON object for the node
     *
     * @throws MalformedNetworkException
     */
    private static String readLabel(JsonObject nodeObject) throws MalformedNetworkException {
        Object retVal = nodeObject.get(SpeciesKeys.LABEL.getKey());
        if (retVal != null && ! (retVal instanceof String))
            throw new MalformedNetworkException("Species label is not a string: " + nodeObject.toJson());
        return (String) retVal;
    }

    /**
     * @return the species ID number
     */
    public int getId() {
        return this.id;
    }

    /**
     * @return the serialized expression
     */
    public String getLabel() {
        return this.label;
    }

    /**
     * @return the population count
     */
    public int getCount() {
        return this.count;
    }

    @Override
    public String toString() {
        return "Species " + this.id + " (" + this.label + ")";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.id;
        result = prime * result + this.label.hashCode();
        result = prime * result + this.count;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Species other = (Species) obj;
        return (this.id == other.id && this.count == other.count && this.label.equals(other.label));
    }

}
