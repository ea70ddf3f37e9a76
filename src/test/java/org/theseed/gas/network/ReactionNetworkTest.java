/**
 *
 */
package org.theseed.gas.network;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
class ReactionNetworkTest {

    @Test
    void testLoad() throws IOException, MalformedNetworkException {
        NetworkRecord record = NetworkRecord.load(new File("data", "small_network.json"));
        assertThat(record.getNodes().size(), equalTo(3));
        assertThat(record.getLinks(), contains(new ReactionLink(0, 1, 1), new ReactionLink(0, 2, 1),
                new ReactionLink(1, 0, ReactionLink.OPEN)));
        ReactionNetwork network = new ReactionNetwork(record);
        assertThat(network.size(), equalTo(3));
        assertThat(network.getIds(), contains(0, 1, 2));
        assertThat(network.getLabel(0), equalTo("\\x.x"));
        assertThat(network.getLabel(1), equalTo("\\x.\\y.x"));
        assertThat(network.getLabel(2), equalTo("\\x.\\y.\\z.x z (y z)"));
        assertThat(network.getLabel(9), equalTo("9"));
        assertThat(network.getCount(0), equalTo(5));
        assertThat(network.getCount(2), equalTo(2));
        assertThat(network.getCount(9), equalTo(0));
        assertThat(network.getTotalPopulation(), equalTo(10L));
        assertThat(network.getLabels().keySet(), equalTo(network.getCounts().keySet()));
        assertThat("Network not dense.", network.isDense());
        assertThat(network.getSpecies(2).getCount(), equalTo(2));
        assertThat(network.getSpecies(5), nullValue());
        assertThat("Species 1 not found.", network.contains(1));
        assertThat("Species 3 found.", ! network.contains(3));
    }

    @Test
    void testDefaults() throws IOException, MalformedNetworkException {
        String json = "{\"nodes\": [{\"id\": 4, \"label\": \"Q\"}], \"links\": [{\"source\": 4, \"target\": 4}]}";
        NetworkRecord record = NetworkRecord.load(new StringReader(json), "test string");
        Species node = record.getNodes().get(0);
        assertThat(node.getCount(), equalTo(0));
        ReactionLink link = record.getLinks().get(0);
        assertThat(link.getResult(), equalTo(ReactionLink.OPEN));
        assertThat("Default link is closed.", ! link.isClosed());
        ReactionNetwork network = new ReactionNetwork(record);
        assertThat("Network should not be dense.", ! network.isDense());
        record = NetworkRecord.load(new StringReader("{}"), "empty string");
        assertThat(record.getNodes(), empty());
        assertThat(record.getLinks(), empty());
        network = new ReactionNetwork(record);
        assertThat(network.size(), equalTo(0));
        assertThat(network.getTotalPopulation(), equalTo(0L));
        assertThat("Empty network not dense.", network.isDense());
    }

    @Test
    void testMalformed() throws MalformedNetworkException {
        List<Species> nodes = List.of(new Species(0, "A", 1), new Species(1, "B", 2));
        // Duplicate IDs.
        assertThrows(MalformedNetworkException.class, () -> new ReactionNetwork(
                List.of(new Species(0, "A", 1), new Species(0, "B", 2)), List.of()));
        // Bad source, target, and result.
        assertThrows(MalformedNetworkException.class, () -> new ReactionNetwork(nodes,
                List.of(new ReactionLink(2, 0, 1))));
        assertThrows(MalformedNetworkException.class, () -> new ReactionNetwork(nodes,
                List.of(new ReactionLink(0, 5, ReactionLink.OPEN))));
        assertThrows(MalformedNetworkException.class, () -> new ReactionNetwork(nodes,
                List.of(new ReactionLink(0, 1, 3))));
        assertThrows(MalformedNetworkException.class, () -> new ReactionNetwork(nodes,
                List.of(new ReactionLink(0, 1, -4))));
        // Negative ID and count.
        assertThrows(MalformedNetworkException.class, () -> new Species(-1, "A", 1));
        assertThrows(MalformedNetworkException.class, () -> new Species(1, "A", -1));
        // The good version works.
        ReactionNetwork network = new ReactionNetwork(nodes, List.of(new ReactionLink(0, 1, 0)));
        assertThat(network.getLinks().size(), equalTo(1));
    }

    @Test
    void testBadFiles() {
        assertThrows(MalformedNetworkException.class, () -> new ReactionNetwork(
                NetworkRecord.load(new File("data", "bad_reference.json"))));
        assertThrows(MalformedNetworkException.class, () -> NetworkRecord.load(new File("data", "missing_source.json")));
        assertThrows(IOException.class, () -> NetworkRecord.load(new File("data", "bad_syntax.json")));
        assertThrows(MalformedNetworkException.class, () -> NetworkRecord.load(new StringReader("[1, 2]"), "array"));
        assertThrows(MalformedNetworkException.class, () -> NetworkRecord.load(new StringReader("{\"nodes\": 4}"), "number"));
        assertThrows(MalformedNetworkException.class, () -> NetworkRecord.load(new StringReader("{\"nodes\": [4]}"), "bad node"));
        assertThrows(MalformedNetworkException.class, () -> NetworkRecord.load(
                new StringReader("{\"nodes\": [{\"label\": \"A\", \"count\": 1}]}"), "no id"));
    }

    @Test
    void testBadNumbers() {
        // IDs that do not fit, or are not whole, are rejected rather than truncated.
        assertMalformed("{\"nodes\": [{\"id\": 4294967296, \"label\": \"A\"}], "
                + "\"links\": [{\"source\": 0, \"target\": 0, \"result\": 0}]}");
        assertMalformed("{\"nodes\": [{\"id\": 1.9, \"label\": \"A\"}]}");
        assertMalformed("{\"nodes\": [{\"id\": 0, \"count\": 2.5}]}");
        assertMalformed("{\"links\": [{\"source\": 0, \"target\": -2147483649}]}");
        // Values of the wrong type are rejected.
        assertMalformed("{\"links\": [{\"source\": 0, \"target\": 0, \"result\": null}]}");
        assertMalformed("{\"nodes\": [{\"id\": 0, \"count\": \"many\"}]}");
        assertMalformed("{\"links\": [{\"source\": true, \"target\": 0}]}");
        assertMalformed("{\"nodes\": [{\"id\": \"0\"}]}");
        assertMalformed("{\"nodes\": [{\"id\": 0, \"label\": [1]}]}");
    }

    @Test
    void testWholeNumbers() throws IOException, MalformedNetworkException {
        String json = "{\"nodes\": [{\"id\": 0, \"count\": 3.0}, {\"id\": 2147483647}], "
                + "\"links\": [{\"source\": 0, \"target\": 2147483647, \"result\": -1.0}]}";
        NetworkRecord record = NetworkRecord.load(new StringReader(json), "whole numbers");
        assertThat(record.getNodes().get(0).getCount(), equalTo(3));
        assertThat(record.getNodes().get(1).getId(), equalTo(Integer.MAX_VALUE));
        assertThat(record.getLinks(), contains(new ReactionLink(0, Integer.MAX_VALUE, ReactionLink.OPEN)));
    }

    @Test
    void testUnicodeLabels() throws IOException, MalformedNetworkException {
        ReactionNetwork network = new ReactionNetwork(NetworkRecord.load(new File("data", "unicode_network.json")));
        assertThat(network.getLabel(0), equalTo("\u03bbx.x"));
        assertThat(network.getLabel(1), equalTo("\u03bbx.\u03bby.x"));
    }

    /**
     * Verify that a JSON network string fails to load with a malformed-network error.
     *
     * @param json		JSON string to load
     */
    private static void assertMalformed(String json) {
        assertThrows(MalformedNetworkException.class, () -> NetworkRecord.load(new StringReader(json), json));
    }

}
