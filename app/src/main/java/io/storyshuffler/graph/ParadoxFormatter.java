package io.storyshuffler.graph;

import java.util.List;

/**
 * Renders cycles as the paradox messages shown beneath a section.
 */
public final class ParadoxFormatter {

    private static final String HEADER = "Paradox detected:\n";

    private ParadoxFormatter() {
    }

    public static String format(List<Cycle> cycles) {
        StringBuilder builder = new StringBuilder();
        for (Cycle cycle : cycles) {
            builder.append(HEADER);
            List<Integer> vertices = cycle.vertices();
            for (int i = 1; i < vertices.size(); i++) {
                builder.append("\t§").append(vertices.get(i - 1))
                        .append(" must come before §").append(vertices.get(i))
                        .append('\n');
            }
        }
        return builder.toString();
    }
}
