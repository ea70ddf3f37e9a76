/**
 *
 */
package org.theseed.gas;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theseed.gas.utils.BaseProcessor;

import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * @author Bruce Parrello
 *
 */
class TestProcessors {

    @TempDir
    Path tempDir;

    /**
     * Run a command processor and return its output lines.
     *
     * @param processor		processor to run
     * @param outName		name to give the output file
     * @param parms			command-line parameters other than the output file
     *
     * @return the lines of output
     *
     * @throws IOException
     */
    private List<String> runCommand(BaseProcessor processor, String outName, String... parms) throws IOException {
        File outFile = this.tempDir.resolve(outName).toFile();
        String[] args = new String[parms.length + 2];
        args[0] = "-o";
        args[1] = outFile.toString();
        System.arraycopy(parms, 0, args, 2, parms.length);
        boolean ok = processor.parseCommand(args);
        assertThat(outName, ok);
        processor.run();
        assertThat(outName, ! processor.isFailed());
        return Files.readAllLines(outFile.toPath(), StandardCharsets.UTF_8);
    }

    @Test
    void testAnalyze() throws IOException {
        List<String> lines = this.runCommand(new AnalyzeProcessor(), "analyze.txt", "data/small_network.json");
        assertThat(lines, hasItem("═══ REACTION MATRIX ═══"));
        assertThat(lines, hasItem("  0  │   X   1   1 "));
        assertThat(lines, hasItem("═══ NETWORK ANALYSIS ═══"));
        assertThat(lines, hasItem("Closure Ratio: 66.7%"));
        // With a low ceiling, the matrix is skipped.
        lines = this.runCommand(new AnalyzeProcessor(), "summary.txt", "--maxSpecies", "2", "--top", "1",
                "data/small_network.json");
        assertThat(lines, not(hasItem("═══ REACTION MATRIX ═══")));
        assertThat(lines.get(0), equalTo("═══ NETWORK ANALYSIS (Summary Only) ═══"));
        assertThat(lines, hasItem("   ... and 2 more species"));
    }

    @Test
    void testMatrix() throws IOException {
        List<String> lines = this.runCommand(new MatrixProcessor(), "matrix.txt", "data/duplicates.json");
        assertThat(lines, hasItem("  0  │   X   3   X   X "));
        assertThat(lines, hasItem("  1  │   X   X   X   X "));
        // The ceiling is enforced unless the matrix is forced.
        MatrixProcessor processor = new MatrixProcessor();
        boolean ok = processor.parseCommand(new String[] { "--maxSpecies", "2", "data/duplicates.json" });
        assertThat("Matrix accepted over ceiling.", ! ok);
        assertThat("Matrix failure not recorded.", processor.isFailed());
        lines = this.runCommand(new MatrixProcessor(), "forced.txt", "--maxSpecies", "2", "--force",
                "data/duplicates.json");
        assertThat(lines, hasItem("  0  │   X   3   X   X "));
    }

    @Test
    void testSpecies() throws IOException {
        List<String> lines = this.runCommand(new SpeciesProcessor(), "species.txt", "--len", "6",
                "data/small_network.json");
        assertThat(lines, contains("rank\tid\tcount\tpercent\tshort_label\tlabel",
                "1\t0\t5\t50.00\t\\x.x\t\\x.x",
                "2\t1\t3\t30.00\t\\x..(2)\t\\x.\\y.x",
                "3\t2\t2\t20.00\t\\x..(3)\t\\x.\\y.\\z.x z (y z)"));
    }

    @Test
    void testLeaksAndFunctions() throws IOException {
        List<String> lines = this.runCommand(new LeaksProcessor(), "leaks.txt", "data/small_network.json");
        assertThat(lines, contains("source\ttarget\tsource_label\ttarget_label",
                "1\t0\t\\x.\\y.x\t\\x.x"));
        lines = this.runCommand(new FunctionsProcessor(), "functions.txt", "data/duplicates.json");
        assertThat(lines, contains("id\tlabel\targuments\tproducts\tconstant\tidentity",
                "0\tA\t1\t2,3\t\t",
                "1\tB\t1\t2\t2\t",
                "2\tC\t0\t\t\tY",
                "3\tD\t0\t\t\tY"));
    }

    @Test
    void testJson() throws IOException, JsonException {
        List<String> lines = this.runCommand(new JsonProcessor(), "analysis.json", "data/small_network.json");
        JsonObject json = (JsonObject) Jsoner.deserialize(String.join("\n", lines));
        assertThat(json.getInteger(Jsoner.mintJsonKey("total_reactions", 0)), equalTo(3));
        assertThat(json.getInteger(Jsoner.mintJsonKey("open_reactions", 0)), equalTo(1));
        assertThat(json.containsKey("identity_like"), equalTo(true));
    }

    @Test
    void testBadInput() {
        AnalyzeProcessor processor = new AnalyzeProcessor();
        boolean ok = processor.parseCommand(new String[] { "data/bad_reference.json" });
        assertThat("Bad network accepted.", ! ok);
        assertThat("Bad network failure not recorded.", processor.isFailed());
        processor = new AnalyzeProcessor();
        ok = processor.parseCommand(new String[] { "data/no_such_file.json" });
        assertThat("Missing file accepted.", ! ok);
    }

}
