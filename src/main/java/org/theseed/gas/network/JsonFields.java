/**
 *
 */
package org.theseed.gas.network;

import java.math.BigDecimal;

import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This class reads integer fields from the JSON entries of a network record.  Unlike the
 * json-simple accessors, it rejects values that are not exact integers in the range of an
 * {@code int}, so a bad ID can never be truncated onto a real one.
 *
 * @author Bruce Parrello
 *
 */
class JsonFields {

    private JsonFields() { }

    /**
     * @return the integer value of a field in a JSON entry
     *
     * If the field is absent, the key's default is returned.  A key with a null default is required.
     *
     * @param entry		JSON object containing the field
     * @param key		key of the field
     * @param type		type of entry, for error messages
     *
     * @throws MalformedNetworkException
     */
    static int getInt(JsonObject entry, JsonKey key, String type) throws MalformedNetworkException {
        int retVal;
        final String name = key.getKey();
        if (! entry.containsKey(name)) {
            Object dflt = key.getValue();
            if (dflt == null)
                throw new MalformedNetworkException(type + " entry has no " + name + ": " + entry.toJson());
            retVal = (Integer) dflt;
        } else {
            Object value = entry.get(name);
            if (! (value instanceof Number))
                throw new MalformedNetworkException(type + " field \"" + name + "\" is not a number: "
                        + entry.toJson());
            try {
                retVal = new BigDecimal(value.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new MalformedNetworkException(type + " field \"" + name + "\" is not a valid integer: "
                        + value);
            }
        }
        return retVal;
    }

}
