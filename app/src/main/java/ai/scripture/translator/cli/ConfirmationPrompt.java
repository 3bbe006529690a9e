package ai.scripture.translator.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Asks the operator a yes/no question before a long-running write.
 */
@FunctionalInterface
public interface ConfirmationPrompt {

    boolean confirm(String question);

    static ConfirmationPrompt console() {
        return question -> {
            PrintStream out = System.out;
            out.print(question + " (y/n): ");
            out.flush();
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            try {
                String answer = reader.readLine();
                return isYes(answer);
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to read confirmation from console", ex);
            }
        };
    }

    static boolean isYes(String answer) {
        if (answer == null) {
            return false;
        }
        String normalized = answer.strip().toLowerCase(Locale.ROOT);
        return normalized.equals("y") || normalized.equals("yes");
    }
}
