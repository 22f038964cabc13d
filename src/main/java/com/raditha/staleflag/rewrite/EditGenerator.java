package com.raditha.staleflag.rewrite;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Chunk;
import com.github.difflib.patch.Patch;
import com.raditha.staleflag.model.Edit;
import com.raditha.staleflag.model.EditKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a rewritten text back into line edits against the original.
 * Uses java-diff-utils; the deltas it produces never overlap.
 */
public class EditGenerator {

    private static final Comparator<Edit> APPLICATION_ORDER = Comparator
            .comparingInt(Edit::orderingKey)
            .thenComparing(e -> e.kind() == EditKind.INSERT);

    private EditGenerator() {
        /* this is only a utility class */
    }

    /**
     * Edits that turn {@code original} into {@code rewritten}, bottom of the file first.
     */
    public static List<Edit> computeEdits(String original, String rewritten) {
        List<String> source = lines(original);
        List<String> target = lines(rewritten);
        Patch<String> patch = DiffUtils.diff(source, target);

        List<Edit> edits = new ArrayList<>();
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            Chunk<String> from = delta.getSource();
            int start = from.getPosition() + 1;
            int end = from.getPosition() + from.size();
            switch (delta.getType()) {
                case CHANGE -> edits.add(new Edit(EditKind.REPLACE, start, end, delta.getTarget().getLines()));
                case DELETE -> edits.add(new Edit(EditKind.DELETE, start, end, List.of()));
                case INSERT -> edits.add(new Edit(EditKind.INSERT, start, start - 1, delta.getTarget().getLines()));
                default -> {
                    // EQUAL deltas carry no change
                }
            }
        }
        edits.sort(APPLICATION_ORDER);
        return edits;
    }

    /**
     * Apply edits to the original text.
     *
     * @throws IllegalArgumentException if two edits overlap or an edit lies outside the text
     */
    public static String apply(String original, List<Edit> edits) {
        for (int i = 0; i < edits.size(); i++) {
            for (int j = i + 1; j < edits.size(); j++) {
                if (edits.get(i).overlaps(edits.get(j))) {
                    throw new IllegalArgumentException("Overlapping edits: " + edits.get(i) + " and " + edits.get(j));
                }
            }
        }
        List<String> text = new ArrayList<>(lines(original));
        List<Edit> ordered = new ArrayList<>(edits);
        ordered.sort(APPLICATION_ORDER);
        for (Edit edit : ordered) {
            int from = edit.startLine() - 1;
            if (from + edit.span() > text.size()) {
                throw new IllegalArgumentException("Edit beyond end of text: " + edit);
            }
            for (int k = 0; k < edit.span(); k++) {
                text.remove(from);
            }
            text.addAll(from, edit.lines());
        }
        return String.join("\n", text);
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\n", -1));
    }
}
