package hu.advjava.mcpcrossword;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import javax.imageio.ImageIO;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reading structure and word files, and writing filled grids as text or images.
 */
public final class CrosswordIO {
    private static final Logger log = LogManager.getLogger(CrosswordIO.class);

    public static final char BLOCK = '█';

    static final int CELL_SIZE = 100;
    static final int CELL_BORDER = 2;
    private static final int FONT_SIZE = 80;

    private CrosswordIO() {
    }

    /**
     * Load a grid structure: one line per row, {@code _} for an open cell, anything else blocked.
     * Throws {@link StructureException} if the rows differ in width.
     */
    public static Crossword loadStructure(File file) throws IOException {
        List<String> rows = new ArrayList<>(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8));
        // a trailing newline produces no extra row, trailing blank lines do
        while (!rows.isEmpty() && rows.get(rows.size() - 1).isEmpty()) rows.remove(rows.size() - 1);
        if (rows.isEmpty()) throw new IOException("Empty structure file: " + file);
        Crossword crossword = Crossword.parse(rows);
        log.info("Loaded {}x{} structure with {} slots from {}",
                crossword.getHeight(), crossword.getWidth(), crossword.getSlots().size(), file);
        return crossword;
    }

    /**
     * Load a word list: one word per line, trimmed and upper-cased. Blank lines and repeats are
     * dropped, file order is kept.
     */
    public static List<String> loadWords(File file) throws IOException {
        try (var lines = Files.lines(file.toPath(), StandardCharsets.UTF_8)) {
            List<String> words = lines.map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .map(line -> line.toUpperCase(Locale.ROOT))
                    .distinct()
                    .toList();
            log.info("Loaded {} words from {}", words.size(), file);
            return words;
        }
    }

    /** Letters of the assignment placed on the grid; {@code null} where nothing is filled in. */
    public static Character[][] letterGrid(Crossword crossword, Map<Slot, String> assignment) {
        Character[][] letters = new Character[crossword.getHeight()][crossword.getWidth()];
        assignment.forEach((slot, word) -> IntStream.range(0, word.length()).forEach(k -> {
            int[] cell = slot.cell(k);
            letters[cell[0]][cell[1]] = word.charAt(k);
        }));
        return letters;
    }

    /** One line per row: letters, a space for an empty open cell, {@value #BLOCK} for a blocked one. */
    public static String render(Crossword crossword, Map<Slot, String> assignment) {
        Character[][] letters = letterGrid(crossword, assignment);
        return IntStream.range(0, crossword.getHeight())
                .mapToObj(r -> IntStream.range(0, crossword.getWidth())
                        .mapToObj(c -> !crossword.isOpen(r, c) ? String.valueOf(BLOCK)
                                : letters[r][c] == null ? " " : String.valueOf(letters[r][c]))
                        .collect(Collectors.joining()))
                .collect(Collectors.joining(System.lineSeparator()));
    }

    /**
     * Save a filled grid. Image extensions ImageIO can write ({@code .png}, {@code .jpg}, ...) give a
     * drawing of the grid; anything else gets the text rendering.
     */
    public static void save(File file, Crossword crossword, Map<Slot, String> assignment) throws IOException {
        String format = extension(file);
        if (Arrays.asList(ImageIO.getWriterFormatNames()).contains(format)) {
            if (!ImageIO.write(draw(crossword, assignment), format, file)) {
                throw new IOException("No image writer for " + format);
            }
        } else {
            try (PrintWriter pw = new PrintWriter(file, StandardCharsets.UTF_8)) {
                pw.println(render(crossword, assignment));
            }
        }
        log.info("Saved crossword to {}", file);
    }

    static BufferedImage draw(Crossword crossword, Map<Slot, String> assignment) {
        int interior = CELL_SIZE - 2 * CELL_BORDER;
        Character[][] letters = letterGrid(crossword, assignment);

        BufferedImage img = new BufferedImage(crossword.getWidth() * CELL_SIZE, crossword.getHeight() * CELL_SIZE,
                BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, img.getWidth(), img.getHeight());
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, FONT_SIZE));
            FontMetrics fm = g.getFontMetrics();

            for (int r = 0; r < crossword.getHeight(); r++) {
                for (int c = 0; c < crossword.getWidth(); c++) {
                    if (!crossword.isOpen(r, c)) continue;
                    int x = c * CELL_SIZE + CELL_BORDER;
                    int y = r * CELL_SIZE + CELL_BORDER;
                    g.setColor(Color.WHITE);
                    g.fillRect(x, y, interior, interior);
                    if (letters[r][c] != null) {
                        String letter = String.valueOf(letters[r][c]);
                        g.setColor(Color.BLACK);
                        g.drawString(letter,
                                x + (interior - fm.stringWidth(letter)) / 2,
                                y + (interior - fm.getHeight()) / 2 + fm.getAscent());
                    }
                }
            }
        } finally {
            g.dispose();
        }
        return img;
    }

    private static String extension(File file) {
        String name = file.getName();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
