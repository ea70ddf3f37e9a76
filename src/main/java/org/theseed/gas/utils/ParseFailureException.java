/**
 *
 */
package org.theseed.gas.utils;

/**
 * This exception is thrown when a command's parameters are invalid or inconsistent.
 *
 * @author Bruce Parrello
 *
 */
public class ParseFailureException extends Exception {

    /** serialization version ID */
    private static final long serialVersionUID = -3746218095543278261L;

    /**
     * Construct a parse failure with a message.
     *
     * @param message	description of the problem
     */
    public ParseFailureException(String message) {
        super(message);
    }

    /**
     * Construct a parse failure with a message and a cause.
     *
     * @param message	description of the problem
     * @param cause		underlying exception
     */
    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
