package org.handhistory.service.parsing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cuts raw text with a room delimiter pattern and records where the empty fragments are.
 * Never fails: a document without the expected markers just yields boundaries that later
 * stages cannot use.
 */
public final class SectionSplitter {

    private SectionSplitter() {}

    public static SplitText split(String raw, Pattern delimiter) {
        // limit -1 keeps trailing empty fragments
        List<String> fragments = Arrays.asList(delimiter.split(raw == null ? "" : raw, -1));
        List<Integer> boundaries = new ArrayList<>();
        for (int i = 0; i < fragments.size(); i++) {
            if (fragments.get(i).isEmpty()) boundaries.add(i);
        }
        return new SplitText(fragments, boundaries);
    }
}
