package com.maxdemarzi.minimizer.quine;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.List;
import java.util.stream.Collectors;

/**
 * How a cover is written out. The minimizer itself treats both the same;
 * for POS the caller is expected to hand in the maxterms.
 */
public enum Mode {
    SOP("0") {
        @Override
        String render(Implicant implicant, List<String> variables) {
            return implicant.getProductTerm(variables);
        }

        @Override
        String separator() {
            return " + ";
        }
    },
    POS("1") {
        @Override
        String render(Implicant implicant, List<String> variables) {
            return implicant.getSumTerm(variables);
        }

        @Override
        String separator() {
            return "";
        }
    };

    private final String emptyText;

    Mode(String emptyText) {
        this.emptyText = emptyText;
    }

    abstract String render(Implicant implicant, List<String> variables);

    abstract String separator();

    /**
     * The text for a cover with no implicants: "0" for SOP, "1" for POS.
     */
    public String emptyText() {
        return emptyText;
    }

    public String render(List<Implicant> implicants, List<String> variables) {
        if (implicants.isEmpty()) {
            return emptyText;
        }
        return implicants.stream()
                .map(implicant -> render(implicant, variables))
                .collect(Collectors.joining(separator()));
    }

    public static Mode parse(String mode) {
        Validate.notBlank(mode, "mode");
        String normalized = StringUtils.upperCase(StringUtils.trim(mode));
        for (Mode candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown mode '" + mode + "', expected SOP or POS");
    }
}
