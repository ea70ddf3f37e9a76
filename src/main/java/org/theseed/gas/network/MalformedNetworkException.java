/**
 *
 */
package org.theseed.gas.network;

/**
 * This exception is thrown when a network record is structurally invalid:  a species ID is
 * duplicated or negative, a reaction refers to a species that does not exist, or a required
 * field is missing.  The analysis that encounters it produces no result.
 *
 * @author Bruce Parrello
 *
 */
public class MalformedNetworkException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = 8127464290531176520L;

    /**
     * Construct a malformed-network exception.
     *
     * @param message	description of the defect
     */
    public MalformedNetworkException(String message) {
        super(message);
    }

}
