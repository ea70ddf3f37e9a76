package org.theseed.gas;

import java.util.Arrays;

import org.theseed.gas.utils.BaseProcessor;

/**
 * Commands for analyzing the reaction networks exported from a lambda-calculus Turing gas.
 *
 * analyze		summary report and reaction matrix
 * matrix		reaction matrix only
 * species		species ranked by abundance
 * leaks		reactions whose products are outside the population
 * functions	behavior of each species as a function
 * json			analysis results in JSON form
 */
public class App
{
    public static void main( String[] args )
    {
        if (args.length < 1) {
            System.err.println("Usage: App <command> [options] <network.json>");
            System.err.println("Commands: analyze, matrix, species, leaks, functions, json");
            System.exit(1);
        }
        // Get the control parameter.
        String command = args[0];
        String[] newArgs = Arrays.copyOfRange(args, 1, args.length);
        BaseProcessor processor;
        // Determine the command to process.
        switch (command) {
        case "analyze" :
            processor = new AnalyzeProcessor();
            break;
        case "matrix" :
            processor = new MatrixProcessor();
            break;
        case "species" :
            processor = new SpeciesProcessor();
            break;
        case "leaks" :
            processor = new LeaksProcessor();
            break;
        case "functions" :
            processor = new FunctionsProcessor();
            break;
        case "json" :
            processor = new JsonProcessor();
            break;
        default:
            throw new RuntimeException("Invalid command " + command);
        }
        // Process it.
        boolean ok = processor.parseCommand(newArgs);
        if (ok) {
            processor.run();
        }
        if (processor.isFailed())
            System.exit(1);
    }
}
