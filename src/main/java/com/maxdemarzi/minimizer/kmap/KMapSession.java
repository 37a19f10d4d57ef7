package com.maxdemarzi.minimizer.kmap;

import com.maxdemarzi.minimizer.expression.EvalException;
import com.maxdemarzi.minimizer.expression.LexException;
import com.maxdemarzi.minimizer.expression.ParseException;
import com.maxdemarzi.minimizer.quine.Minimization;
import com.maxdemarzi.minimizer.quine.Mode;
import com.maxdemarzi.minimizer.quine.QuineMcCluskey;
import com.maxdemarzi.minimizer.quine.TruthTable;
import org.apache.commons.lang3.Validate;
import org.eclipse.collections.api.IntIterable;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.primitive.IntLists;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The state of one Karnaugh map: its variables, the output form and the
 * value of every cell. Sessions are immutable; every change returns a new
 * one.
 * <p>
 * Maxterms are derived here. In POS form the minimizer is handed every cell
 * that is neither a 1 nor a don't-care.
 */
public final class KMapSession {

    private final List<String> variables;
    private final Mode mode;
    private final CellState[] cells;

    private KMapSession(List<String> variables, Mode mode, CellState[] cells) {
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.mode = mode;
        this.cells = cells;
    }

    public static KMapSession forVariables(List<String> variables, Mode mode) {
        Validate.notNull(variables, "variables");
        Validate.notNull(mode, "mode");
        Validate.isTrue(variables.size() <= KMapLayout.MAX_VARIABLES,
                "K-maps are limited to %d variables, got %d", KMapLayout.MAX_VARIABLES, variables.size());
        CellState[] cells = new CellState[1 << variables.size()];
        Arrays.fill(cells, CellState.ZERO);
        return new KMapSession(variables, mode, cells);
    }

    /**
     * Evaluates the expression over its variables and marks the true rows.
     * Only the first four variables get a map; an expression with more
     * leaves that map blank.
     */
    public static KMapSession fromExpression(String expression, Mode mode) throws LexException, ParseException, EvalException {
        TruthTable table = TruthTable.of(expression);
        List<String> variables = table.variables();
        KMapSession session = forVariables(variables.subList(0, Math.min(variables.size(), KMapLayout.MAX_VARIABLES)), mode);
        if (variables.size() > KMapLayout.MAX_VARIABLES) {
            return session;
        }
        return session.paint(table.minTerms(), IntLists.immutable.empty());
    }

    public List<String> getVariables() {
        return variables;
    }

    public Mode getMode() {
        return mode;
    }

    public int size() {
        return cells.length;
    }

    public CellState get(int minterm) {
        Validate.inclusiveBetween(0, cells.length - 1, minterm, "Minterm %d outside a %d-cell map", minterm, cells.length);
        return cells[minterm];
    }

    public Optional<KMapLayout> layout() {
        return KMapLayout.forVariables(variables);
    }

    public KMapSession withMode(Mode newMode) {
        Validate.notNull(newMode, "mode");
        return new KMapSession(variables, newMode, cells.clone());
    }

    public KMapSession toggle(int minterm) {
        CellState[] next = cells.clone();
        next[minterm] = get(minterm).next();
        return new KMapSession(variables, mode, next);
    }

    /**
     * Clears the map, then sets the given cells. Indices that do not fit the
     * map are ignored; a don't-care wins over a 1 for the same cell.
     */
    public KMapSession paint(IntIterable minterms, IntIterable dontcares) {
        CellState[] next = new CellState[cells.length];
        Arrays.fill(next, CellState.ZERO);
        minterms.forEach(m -> {
            if (m >= 0 && m < next.length) {
                next[m] = CellState.ONE;
            }
        });
        dontcares.forEach(d -> {
            if (d >= 0 && d < next.length) {
                next[d] = CellState.DONT_CARE;
            }
        });
        return new KMapSession(variables, mode, next);
    }

    public KMapSession importTerms(String text) {
        MintermList terms = MintermList.parse(text);
        return paint(terms.getMinterms(), terms.getDontcares());
    }

    public MintermList exportTerms() {
        return MintermList.of(minterms(), dontcares());
    }

    public KMapSession reset() {
        return paint(IntLists.immutable.empty(), IntLists.immutable.empty());
    }

    public ImmutableIntList minterms() {
        return cellsIn(CellState.ONE);
    }

    public ImmutableIntList dontcares() {
        return cellsIn(CellState.DONT_CARE);
    }

    /**
     * What the minimizer should cover: the 1 cells for SOP, the 0 cells for
     * POS. Don't-cares are passed through either way.
     */
    public MintermList effectiveTerms() {
        ImmutableIntList covered = mode == Mode.POS ? cellsIn(CellState.ZERO) : minterms();
        return MintermList.of(covered, dontcares());
    }

    public Minimization simplify() {
        if (variables.isEmpty()) {
            return Minimization.constant(mode, cells[0] == CellState.ONE ? "1" : "0");
        }
        MintermList terms = effectiveTerms();
        return QuineMcCluskey.minimize(terms.getMinterms(), terms.getDontcares(), variables, mode);
    }

    private ImmutableIntList cellsIn(CellState state) {
        MutableIntList indices = IntLists.mutable.empty();
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == state) {
                indices.add(i);
            }
        }
        return indices.toImmutable();
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder(mode.name()).append(' ').append(variables).append(' ');
        for (CellState cell : cells) {
            text.append(cell.getSymbol());
        }
        return text.toString();
    }
}
