/**
 *
 */
package org.theseed.gas.network;

import org.apache.commons.lang3.StringUtils;

/**
 * This class shortens expression labels for compact display.  A label that fits is returned
 * unchanged.  A long label with at most one period is cut off and marked with "..".  A long label
 * with more periods is shown as its first segment followed by the number of remaining segments,
 * which for a lambda expression indicates the binder depth.
 *
 * @author Bruce Parrello
 *
 */
public class LabelFormatter {

    /** default maximum display length */
    public static final int DEFAULT_MAX_LEN = 12;

    private LabelFormatter() { }

    /**
     * @return a label shortened to the default display length
     *
     * @param label		label to shorten
     */
    public static String shorten(String label) {
        return shorten(label, DEFAULT_MAX_LEN);
    }

    /**
     * @return a label shortened for display
     *
     * @param label		label to shorten
     * @param maxLen	maximum length of a label displayed in full
     */
    public static String shorten(String label, int maxLen) {
        String retVal = StringUtils.defaultString(label);
        if (retVal.length() > maxLen) {
            String[] parts = StringUtils.splitPreserveAllTokens(retVal, '.');
            if (parts.length <= 2)
                retVal = StringUtils.left(retVal, maxLen - 2) + "..";
            else
                retVal = parts[0] + "..(" + (parts.length - 1) + ")";
        }
        return retVal;
    }

}
