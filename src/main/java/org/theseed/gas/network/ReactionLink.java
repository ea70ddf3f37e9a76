/**
 *
 */
package org.theseed.gas.network;

import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object represents one observed reaction:  the application of a source species to a target
 * species, yielding a result.  If the result is not a tracked species, the result is {@link #OPEN}
 * and the reaction leaks out of the population.
 *
 * @author Bruce Parrello
 *
 */
public class ReactionLink {

    // FIELDS
    /** result ID for a reaction whose product is outside the tracked population */
    public static final int OPEN = -1;
    /** ID of the applied (function) species */
    private final int source;
    /** ID of the argument species */
    private final int target;
    /** ID of the product species, or OPEN */
    private final int result;

    private static enum LinkKeys implements JsonKey {
        SOURCE(null), TARGET(null), RESULT(OPEN);

        private final Object m_value;

        private LinkKeys(final Object value) {
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
     * Construct a reaction link.
     *
     * @param source	ID of the function species
     * @param target	ID of the argument species
     * @param result	ID of the product species, or OPEN
     */
    public ReactionLink(int source, int target, int result) {
        this.source = source;
        this.target = target;
        this.result = result;
    }

    /**
     * Construct a reaction link from a JSON link entry.
     *
     * @param linkObject	JSON object for the link
     *
     * @throws MalformedNetworkException
     */
    public ReactionLink(JsonObject linkObject) throws MalformedNetworkException {
        this(JsonFields.getInt(linkObject, LinkKeys.SOURCE, "Reaction"),
                JsonFields.getInt(linkObject, LinkKeys.TARGET, "Reaction"),
                JsonFields.getInt(linkObject, LinkKeys.RESULT, "Reaction"));
    }

    /**
     * @return the ID of the function species
     */
    public int getSource() {
        return this.source;
    }

    /**
     * @return the ID of the argument species
     */
    public int getTarget() {
        return this.target;
    }

    /**
     * @return the ID of the product species, or OPEN
     */
    public int getResult() {
        return this.result;
    }

    /**
     * @return TRUE if the product is a tracked species
     */
    public boolean isClosed() {
        return (this.result != OPEN);
    }

    /**
     * @return TRUE if the product is identical to the argument
     */
    public boolean isIdentity() {
        return (this.result == this.target);
    }

    @Override
    public String toString() {
        return this.source + "(" + this.target + ") -> " + (this.isClosed() ? String.valueOf(this.result) : "?");
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.source;
        result = prime * result + this.target;
        result = prime * result + this.result;
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
        ReactionLink other = (ReactionLink) obj;
        return (this.source == other.source && this.target == other.target && this.result == other.result);
    }

}
