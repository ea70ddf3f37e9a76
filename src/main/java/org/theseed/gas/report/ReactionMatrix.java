/**
 *
 */
package org.theseed.gas.report;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.theseed.gas.network.MalformedNetworkException;
import org.theseed.gas.network.ReactionGraph;
import org.theseed.gas.network.ReactionLink;
import org.theseed.gas.network.ReactionNetwork;

/**
 * This object renders a reaction network as a text matrix.  Row I, column J shows the result of
 * applying species I to species J, or "X" if there is no such reaction or its product is outside
 * the population.  Rows and columns are labeled with the species IDs in ascending order, so a
 * network with IDs 0 through N-1 produces the conventional N-by-N layout.
 *
 * When a (source, target) pair is listed more than once, the last listing determines the cell.
 *
 * @author Bruce Parrello
 *
 */
public class ReactionMatrix {

    // FIELDS
    /** graph of all reactions, providing the resolved results */
    private final ReactionGraph graph;
    /** species IDs in ascending order */
    private final List<Integer> ids;
    /** marker for a cell with no tracked result */
    public static final String NO_RESULT = "X";
    /** row-label prefix for the header line */
    private static final String CORNER = "     │ ";
    /** rule character */
    private static final String RULE = "─";

    /**
     * Construct a reaction matrix from a reaction graph.
     *
     * @param graph		graph containing the resolved reactions
     */
    public ReactionMatrix(ReactionGraph graph) {
        this.graph = graph;
        this.ids = new ArrayList<Integer>(graph.getNodes());
        this.ids.sort(null);
    }

    /**
     * @return a reaction matrix for all the reactions in a network
     *
     * @param network	reaction network to display
     *
     * @throws MalformedNetworkException
     */
    public static ReactionMatrix of(ReactionNetwork network) throws MalformedNetworkException {
        return new ReactionMatrix(ReactionGraph.full(network));
    }

    /**
     * @return the row and column IDs, in order
     */
    public List<Integer> getIds() {
        return this.ids;
    }

    /**
     * @return the result in the cell for the specified species pair, or OPEN if there is none
     *
     * @param source	ID of the function (row) species
     * @param target	ID of the argument (column) species
     */
    public int getCell(int source, int target) {
        return this.graph.getResult(source, target);
    }

    /**
     * @return the lines of the matrix, beginning with the header and the rule
     */
    public List<String> render() {
        List<String> retVal = new ArrayList<String>(this.ids.size() + 2);
        StringBuilder header = new StringBuilder(CORNER.length() + this.ids.size() * 4);
        header.append(CORNER);
        for (int i = 0; i < this.ids.size(); i++) {
            if (i > 0)
                header.append(' ');
            header.append(String.format("%3d", this.ids.get(i)));
        }
        retVal.add(header.toString());
        retVal.add(StringUtils.repeat(RULE, header.length()));
        for (int source : this.ids) {
            StringBuilder row = new StringBuilder(header.length() + 2);
            row.append(String.format("%3d  │ ", source));
            for (int target : this.ids) {
                int result = this.getCell(source, target);
                if (result == ReactionLink.OPEN)
                    row.append("  ").append(NO_RESULT).append(' ');
                else
                    row.append(String.format("%3d ", result));
            }
            retVal.add(row.toString());
        }
        return retVal;
    }

    /**
     * Write the matrix, with its title and legend, to an output report.
     *
     * @param writer	output print writer
     */
    public void write(PrintWriter writer) {
        writer.println("═══ REACTION MATRIX ═══");
        writer.println("(Row applies to Column → Result)");
        writer.println();
        for (String line : this.render())
            writer.println(line);
        writer.println();
        writer.println("Legend: " + NO_RESULT + " = produces expression outside population");
    }

}
