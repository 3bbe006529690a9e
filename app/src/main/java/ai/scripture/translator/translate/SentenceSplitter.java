package ai.scripture.translator.translate;

import java.util.ArrayList;
import java.util.List;

/**
 * Breaks an oversized text into sentence-sized fragments at Devanagari full stops and line breaks.
 */
public class SentenceSplitter {

    public static final String DEFAULT_BOUNDARIES = "।॥\n";
    public static final int DEFAULT_MIN_FRAGMENT_LENGTH = 100;
    public static final int DEFAULT_MIN_CONTENT_LENGTH = 3;

    private final String boundaries;
    private final int minFragmentLength;
    private final int minContentLength;

    public SentenceSplitter() {
        this(DEFAULT_BOUNDARIES, DEFAULT_MIN_FRAGMENT_LENGTH, DEFAULT_MIN_CONTENT_LENGTH);
    }

    /**
     * @param boundaries        characters after which a fragment may end
     * @param minFragmentLength a boundary only splits once the running fragment is longer than this
     * @param minContentLength  trimmed fragments shorter than this are dropped
     */
    public SentenceSplitter(String boundaries, int minFragmentLength, int minContentLength) {
        if (boundaries == null || boundaries.isEmpty()) {
            throw new IllegalArgumentException("boundaries must not be empty");
        }
        if (minFragmentLength < 0 || minContentLength < 1) {
            throw new IllegalArgumentException("fragment length floors must be positive");
        }
        this.boundaries = boundaries;
        this.minFragmentLength = minFragmentLength;
        this.minContentLength = minContentLength;
    }

    public List<String> split(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> fragments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            current.append(ch);
            if (boundaries.indexOf(ch) >= 0 && current.length() > minFragmentLength) {
                addIfMeaningful(fragments, current);
                current.setLength(0);
            }
        }
        addIfMeaningful(fragments, current);
        return fragments;
    }

    private void addIfMeaningful(List<String> fragments, CharSequence raw) {
        String fragment = raw.toString().strip();
        if (fragment.length() >= minContentLength) {
            fragments.add(fragment);
        }
    }
}
