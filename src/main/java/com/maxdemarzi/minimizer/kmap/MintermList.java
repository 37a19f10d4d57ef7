package com.maxdemarzi.minimizer.kmap;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.collections.api.IntIterable;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.primitive.IntLists;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minterm and don't-care indices in the textual form {@code 0,1,5,7+d(2,3)}.
 * Both lists are kept sorted and free of duplicates.
 */
public final class MintermList {

    private static final Pattern DONT_CARES = Pattern.compile("\\+\\s*d\\s*\\(([^)]+)\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEPARATOR = Pattern.compile("[,\\s]+");

    public static final MintermList EMPTY = new MintermList(IntLists.immutable.empty(), IntLists.immutable.empty());

    private final ImmutableIntList minterms;
    private final ImmutableIntList dontcares;

    private MintermList(ImmutableIntList minterms, ImmutableIntList dontcares) {
        this.minterms = minterms;
        this.dontcares = dontcares;
    }

    public static MintermList of(IntIterable minterms, IntIterable dontcares) {
        return new MintermList(normalize(minterms), normalize(dontcares));
    }

    /**
     * Reads comma or whitespace separated indices with an optional
     * {@code +d(...)} group. Entries that are not non-negative integers are
     * skipped.
     */
    public static MintermList parse(String text) {
        if (StringUtils.isBlank(text)) {
            return EMPTY;
        }
        String main = text;
        MutableIntList dontcares = IntLists.mutable.empty();

        Matcher matcher = DONT_CARES.matcher(text);
        if (matcher.find()) {
            readIndices(matcher.group(1), dontcares);
            main = text.substring(0, matcher.start());
        }
        MutableIntList minterms = IntLists.mutable.empty();
        readIndices(main, minterms);
        return of(minterms, dontcares);
    }

    private static void readIndices(String part, MutableIntList into) {
        for (String entry : SEPARATOR.split(part)) {
            if (StringUtils.isNumeric(entry)) {
                int index = NumberUtils.toInt(entry, -1);
                if (index >= 0) {
                    into.add(index);
                }
            }
        }
    }

    private static ImmutableIntList normalize(IntIterable indices) {
        return IntLists.immutable.with(indices.toSortedArray()).distinct();
    }

    public ImmutableIntList getMinterms() {
        return minterms;
    }

    public ImmutableIntList getDontcares() {
        return dontcares;
    }

    public boolean isEmpty() {
        return minterms.isEmpty() && dontcares.isEmpty();
    }

    public String format() {
        String text = minterms.makeString(",");
        if (dontcares.notEmpty()) {
            text += " +d(" + dontcares.makeString(",") + ")";
        }
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MintermList)) return false;
        MintermList that = (MintermList) o;
        return minterms.equals(that.minterms) && dontcares.equals(that.dontcares);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minterms, dontcares);
    }

    @Override
    public String toString() {
        return format();
    }
}
