package com.scorebench.evaluator.bundle;

import java.util.ArrayList;
import java.util.List;

/**
 * The scores.txt a scoring program leaves in its output archive:
 *
 *   accuracy: 0.87
 *   f1: 0.5
 *
 * One "label: value" per line, exactly one colon, value a floating-point number.
 * Blank lines are ignored; any other line that does not fit is collected in
 * {@link #rejected()} instead of failing the whole file.
 */
public record ScoresFile(List<Score> scores, List<String> rejected) {

    public static final String FILE_NAME = "scores.txt";

    public record Score(String label, double value) {}

    public static ScoresFile parse(String text) {
        List<Score>  scores   = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (String raw : text.split("\\r?\\n")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;

            String[] parts = line.split(":", -1);
            if (parts.length != 2 || parts[0].isBlank()) {
                rejected.add(line);
                continue;
            }
            try {
                scores.add(new Score(parts[0].strip(), Double.parseDouble(parts[1].strip())));
            } catch (NumberFormatException e) {
                rejected.add(line);
            }
        }
        return new ScoresFile(List.copyOf(scores), List.copyOf(rejected));
    }
}
