package com.maxdemarzi.minimizer.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public final class Variables {

    private Variables() {
    }

    /**
     * Every letter in the expression, upper-cased, without duplicates and in
     * alphabetical order. The first name is the most significant bit of a
     * minterm index.
     */
    public static List<String> extract(String expression) {
        Set<String> names = new TreeSet<>();
        if (expression != null) {
            for (char ch : expression.toCharArray()) {
                if (Tokenizer.isLetter(ch)) {
                    names.add(String.valueOf(Character.toUpperCase(ch)));
                }
            }
        }
        return new ArrayList<>(names);
    }
}
