/**
 *
 */
package org.theseed.gas.network;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
class LabelFormatterTest {

    @Test
    void testShorten() {
        assertThat(LabelFormatter.shorten("\\x.x"), equalTo("\\x.x"));
        assertThat(LabelFormatter.shorten("abcdefghijkl"), equalTo("abcdefghijkl"));
        assertThat(LabelFormatter.shorten(""), equalTo(""));
        assertThat(LabelFormatter.shorten(null), equalTo(""));
        // No periods, or only one, means a simple cutoff.
        assertThat(LabelFormatter.shorten("abcdefghijklm"), equalTo("abcdefghij.."));
        assertThat(LabelFormatter.shorten("\\x.x x x x x x x"), equalTo("\\x.x x x x.."));
        // More periods means a depth display.
        assertThat(LabelFormatter.shorten("\\x.\\y.\\z.x z (y z)"), equalTo("\\x..(3)"));
        assertThat(LabelFormatter.shorten("\\x.\\y.\\z.x z (y z)", 20), equalTo("\\x.\\y.\\z.x z (y z)"));
        assertThat(LabelFormatter.shorten("\\f.\\x.f (f x) (f x)", 16), equalTo("\\f..(2)"));
        // Empty segments count.
        assertThat(LabelFormatter.shorten("abcdefghijk..b"), equalTo("abcdefghijk..(2)"));
        assertThat(LabelFormatter.shorten(".a.b.c.d.e.f.g"), equalTo("..(7)"));
        // Tiny limits are handled.
        assertThat(LabelFormatter.shorten("abcdef", 1), equalTo(".."));
        assertThat(LabelFormatter.shorten("abcdef", 0), equalTo(".."));
    }

    @Test
    void testIdempotent() {
        List<String> labels = List.of("\\x.x", "abcdefghijklm", "\\x.x x x x x x x", "\\x.\\y.\\z.x z (y z)",
                "abcdefghijk..b", ".a.b.c.d.e.f.g", "\\a.\\b.\\c.\\d.\\e.\\f.a b c d e f", "",
                "(\\x.x x) (\\x.x x)", "\\x.\\y.y");
        for (String label : labels) {
            String shortened = LabelFormatter.shorten(label);
            assertThat(label, LabelFormatter.shorten(shortened), equalTo(shortened));
        }
    }

    @Test
    void testLongFirstSegment() {
        // A long first segment keeps the depth form too long, and shortening it again recounts its two periods.
        String once = LabelFormatter.shorten("abcdefghijk.a.b.c");
        assertThat(once, equalTo("abcdefghijk..(3)"));
        String twice = LabelFormatter.shorten(once);
        assertThat(twice, equalTo("abcdefghijk..(2)"));
        assertThat(LabelFormatter.shorten(twice), equalTo(twice));
    }

}
