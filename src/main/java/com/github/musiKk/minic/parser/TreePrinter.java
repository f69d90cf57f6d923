package com.github.musiKk.minic.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a node and its children as a box-drawn tree, one node per line.
 */
public class TreePrinter {

    public static String render(Node node) {
        return String.join("\n", lines(node));
    }

    static List<String> lines(Node node) {
        List<String> result = new ArrayList<>();
        result.add(node.label());
        var children = node.children();
        for (int i = 0; i < children.size(); i++) {
            boolean last = i == children.size() - 1;
            var childLines = lines(children.get(i));
            for (int j = 0; j < childLines.size(); j++) {
                String prefix;
                if (j == 0) {
                    prefix = last ? "└ " : "├ ";
                } else {
                    prefix = last ? "  " : "│ ";
                }
                result.add(prefix + childLines.get(j));
            }
        }
        return result;
    }

}
