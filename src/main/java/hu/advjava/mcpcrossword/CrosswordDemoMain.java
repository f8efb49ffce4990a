package hu.advjava.mcpcrossword;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class CrosswordDemoMain {
    private static final Logger log = LogManager.getLogger(CrosswordDemoMain.class);

    static final String USAGE = "Usage: CrosswordDemoMain structure words [output]";

    // Example usage:
    //   CrosswordDemoMain data/structure0.txt data/words0.txt out.png
    // Without arguments the bundled SIMPLE example is solved.
    public static void main(String[] args) {
        if (args.length == 1 || args.length > 3) {
            System.err.println(USAGE);
            System.exit(1);
        }
        try {
            System.out.println(run(args));
        } catch (IOException | StructureException e) {
            log.error("Cannot generate crossword", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
        }
    }

    /** Solves the puzzle named by the arguments and returns what should be printed. */
    static String run(String[] args) throws IOException {
        Crossword crossword;
        List<String> words;
        if (args.length == 0) {
            crossword = ExampleCrossword.SIMPLE.toCrossword();
            words = ExampleCrossword.SIMPLE.getWords();
        } else {
            crossword = CrosswordIO.loadStructure(new File(args[0]));
            words = CrosswordIO.loadWords(new File(args[1]));
        }

        var creator = new CrosswordCreator(crossword, words);
        var assignment = creator.solve();
        if (assignment.isEmpty()) return "No solution.";

        if (args.length == 3) {
            CrosswordIO.save(new File(args[2]), crossword, assignment.get());
        }
        return CrosswordIO.render(crossword, assignment.get());
    }
}
