package com.maxdemarzi.minimizer;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.maxdemarzi.minimizer.expression.ExpressionException;
import com.maxdemarzi.minimizer.expression.Parser;
import com.maxdemarzi.minimizer.expression.PostfixExpression;
import com.maxdemarzi.minimizer.expression.Token;
import com.maxdemarzi.minimizer.expression.Tokenizer;
import com.maxdemarzi.minimizer.expression.Variables;
import com.maxdemarzi.minimizer.kmap.KMapLayout;
import com.maxdemarzi.minimizer.kmap.KMapSession;
import com.maxdemarzi.minimizer.kmap.MintermList;
import com.maxdemarzi.minimizer.quine.Minimization;
import com.maxdemarzi.minimizer.quine.Mode;
import com.maxdemarzi.minimizer.quine.QuineMcCluskey;
import com.maxdemarzi.minimizer.quine.TruthTable;
import com.maxdemarzi.minimizer.quine.TruthTableRow;
import com.maxdemarzi.minimizer.results.KMapCellResult;
import com.maxdemarzi.minimizer.results.MinimizationResult;
import com.maxdemarzi.minimizer.results.TruthTableRowResult;
import com.maxdemarzi.minimizer.results.ValidationResult;
import org.apache.commons.lang3.tuple.Triple;
import org.eclipse.collections.api.IntIterable;
import org.eclipse.collections.api.list.primitive.IntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.neo4j.logging.Log;
import org.neo4j.procedure.Context;
import org.neo4j.procedure.Description;
import org.neo4j.procedure.Name;
import org.neo4j.procedure.Procedure;
import org.neo4j.procedure.UserFunction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

public class Procedures {

    // Minimization is exponential in the variable count, so the procedures
    // refuse anything beyond what a K-map can show
    public static final int MAX_TRUTH_TABLE_VARIABLES = TruthTable.MAX_VARIABLES;
    public static final int MAX_KMAP_VARIABLES = KMapLayout.MAX_VARIABLES;

    // This gives us a log instance that outputs messages to the
    // standard log, normally found under `data/log/neo4j.log`
    @Context
    public Log log;

    // This cache stores minimized covers by (terms, variables, mode)
    public static final LoadingCache<Triple<MintermList, List<String>, Mode>, Minimization> minimizationCache = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterAccess(60, TimeUnit.MINUTES)
            .build(Procedures::computeMinimization);

    static Minimization computeMinimization(Triple<MintermList, List<String>, Mode> key) {
        MintermList terms = key.getLeft();
        return QuineMcCluskey.minimize(terms.getMinterms(), terms.getDontcares(), key.getMiddle(), key.getRight());
    }

    @Procedure(name = "com.maxdemarzi.minimizer.validate", mode = org.neo4j.procedure.Mode.READ)
    @Description("CALL com.maxdemarzi.minimizer.validate(expression)")
    public Stream<ValidationResult> validate(@Name(value = "expression") String expression) {
        try {
            List<Token> tokens = Tokenizer.tokenize(expression);
            PostfixExpression postfix = Parser.parse(tokens);
            return Stream.of(new ValidationResult(true, (long) tokens.size(),
                    Variables.extract(expression), postfix.toString(), null));
        } catch (ExpressionException e) {
            log.debug("Invalid expression '%s': %s", expression, e.getMessage());
            return Stream.of(new ValidationResult(false, 0L, Collections.emptyList(), null, e.getMessage()));
        }
    }

    @Procedure(name = "com.maxdemarzi.minimizer.truthTable", mode = org.neo4j.procedure.Mode.READ)
    @Description("CALL com.maxdemarzi.minimizer.truthTable(expression)")
    public Stream<TruthTableRowResult> truthTable(@Name(value = "expression") String expression) {
        TruthTable table = tabulate(expression);
        return table.getRows().stream().map(row -> new TruthTableRowResult(
                (long) row.getMinterm(), bits(row), (long) row.getOutput()));
    }

    @Procedure(name = "com.maxdemarzi.minimizer.simplify", mode = org.neo4j.procedure.Mode.READ)
    @Description("CALL com.maxdemarzi.minimizer.simplify(expression, mode)")
    public Stream<MinimizationResult> simplify(
            @Name(value = "expression") String expression,
            @Name(value = "mode", defaultValue = "SOP") String mode) {
        Mode form = Mode.parse(mode);
        TruthTable table = tabulate(expression);
        List<Long> minterms = toLongs(table.minTerms());

        // Bigger tables are fine, they just do not get a K-map or a minimized form
        if (table.variables().size() > MAX_KMAP_VARIABLES) {
            log.debug("Not minimizing '%s', %d variables", expression, table.variables().size());
            return Stream.of(new MinimizationResult(table.variables(), minterms, Collections.emptyList(),
                    Collections.emptyList(), null));
        }

        KMapSession session = KMapSession.forVariables(table.variables(), form)
                .paint(table.minTerms(), IntLists.immutable.empty());
        Minimization minimization = simplify(session);
        return Stream.of(new MinimizationResult(table.variables(), minterms, Collections.emptyList(),
                minimization.getPatterns(), minimization.getExpression()));
    }

    @Procedure(name = "com.maxdemarzi.minimizer.minimize", mode = org.neo4j.procedure.Mode.READ)
    @Description("CALL com.maxdemarzi.minimizer.minimize(minterms, dontcares, variables, mode)")
    public Stream<MinimizationResult> minimize(
            @Name(value = "minterms") List<Long> minterms,
            @Name(value = "dontcares", defaultValue = "[]") List<Long> dontcares,
            @Name(value = "variables") List<String> variables,
            @Name(value = "mode", defaultValue = "SOP") String mode) {
        checkKMapBound(variables);
        MintermList terms = MintermList.of(toInts(minterms), toInts(dontcares));
        log.debug("Minimizing %s over %s as %s", terms, variables, mode);
        Minimization minimization = minimizationCache.get(Triple.of(terms, new ArrayList<>(variables), Mode.parse(mode)));
        return Stream.of(new MinimizationResult(variables, toLongs(terms.getMinterms()), toLongs(terms.getDontcares()),
                minimization.getPatterns(), minimization.getExpression()));
    }

    @Procedure(name = "com.maxdemarzi.minimizer.fromTerms", mode = org.neo4j.procedure.Mode.READ)
    @Description("CALL com.maxdemarzi.minimizer.fromTerms('0,1,5,7+d(2,3)', variables, mode)")
    public Stream<MinimizationResult> fromTerms(
            @Name(value = "terms") String terms,
            @Name(value = "variables") List<String> variables,
            @Name(value = "mode", defaultValue = "SOP") String mode) {
        checkKMapBound(variables);
        KMapSession session = KMapSession.forVariables(variables, Mode.parse(mode)).importTerms(terms);
        Minimization minimization = simplify(session);
        return Stream.of(new MinimizationResult(variables, toLongs(session.minterms()), toLongs(session.dontcares()),
                minimization.getPatterns(), minimization.getExpression()));
    }

    @Procedure(name = "com.maxdemarzi.minimizer.kmap", mode = org.neo4j.procedure.Mode.READ)
    @Description("CALL com.maxdemarzi.minimizer.kmap(variables)")
    public Stream<KMapCellResult> kmap(@Name(value = "variables") List<String> variables) {
        KMapLayout layout = KMapLayout.forVariables(variables).orElseThrow(() -> {
            log.warn("No K-map layout for %d variables", variables.size());
            return new IllegalArgumentException("K-maps need 1 to " + MAX_KMAP_VARIABLES + " variables, got " + variables.size());
        });
        return layout.cells().stream().map(cell -> new KMapCellResult((long) cell.getRow(), (long) cell.getColumn(),
                (long) cell.getMinterm(), layout.rowLabel(), layout.columnLabel()));
    }

    @UserFunction(name = "com.maxdemarzi.minimizer.simplified")
    @Description("RETURN com.maxdemarzi.minimizer.simplified(expression, mode)")
    public String simplified(
            @Name(value = "expression") String expression,
            @Name(value = "mode", defaultValue = "SOP") String mode) {
        return simplify(expression, mode).findFirst().map(result -> result.expression).orElse(null);
    }

    @UserFunction(name = "com.maxdemarzi.minimizer.evaluate")
    @Description("RETURN com.maxdemarzi.minimizer.evaluate(expression, {A: true, B: 0})")
    public Boolean evaluate(
            @Name(value = "expression") String expression,
            @Name(value = "assignment") Map<String, Object> assignment) {
        Map<String, Boolean> environment = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : assignment.entrySet()) {
            environment.put(entry.getKey().toUpperCase(), truthy(entry.getValue()));
        }
        try {
            return PostfixExpression.compile(expression).evaluate(environment);
        } catch (ExpressionException e) {
            log.warn("Could not evaluate '%s': %s", expression, e.getMessage());
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    private Minimization simplify(KMapSession session) {
        if (session.getVariables().isEmpty()) {
            return session.simplify();
        }
        MintermList terms = session.effectiveTerms();
        log.debug("Minimizing %s over %s as %s", terms, session.getVariables(), session.getMode());
        return minimizationCache.get(Triple.of(terms, session.getVariables(), session.getMode()));
    }

    private TruthTable tabulate(String expression) {
        List<String> variables = Variables.extract(expression);
        if (variables.size() > MAX_TRUTH_TABLE_VARIABLES) {
            log.warn("Rejecting '%s', %d variables", expression, variables.size());
            throw new IllegalArgumentException("Truth tables are limited to " + MAX_TRUTH_TABLE_VARIABLES
                    + " variables, got " + variables.size());
        }
        try {
            return TruthTable.build(variables, PostfixExpression.compile(expression));
        } catch (ExpressionException e) {
            log.warn("Could not tabulate '%s': %s", expression, e.getMessage());
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    private void checkKMapBound(List<String> variables) {
        if (variables.size() > MAX_KMAP_VARIABLES) {
            log.warn("Rejecting minimization over %d variables", variables.size());
            throw new IllegalArgumentException("Minimization is limited to " + MAX_KMAP_VARIABLES
                    + " variables, got " + variables.size());
        }
    }

    private static Map<String, Object> bits(TruthTableRow row) {
        Map<String, Object> bits = new LinkedHashMap<>();
        row.getAssignment().forEach((name, value) -> bits.put(name, value ? 1L : 0L));
        return bits;
    }

    private static boolean truthy(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue() != 0;
        }
        throw new IllegalArgumentException("Expected a boolean or 0/1, got " + value);
    }

    private IntList toInts(List<Long> values) {
        MutableIntList ints = IntLists.mutable.empty();
        for (Long value : values) {
            try {
                ints.add(Math.toIntExact(value));
            } catch (ArithmeticException e) {
                log.warn("Rejecting term index %d", value);
                throw new IllegalArgumentException("Term index " + value + " is out of range", e);
            }
        }
        return ints;
    }

    private static List<Long> toLongs(IntIterable values) {
        List<Long> longs = new ArrayList<>(values.size());
        values.forEach(value -> longs.add((long) value));
        return longs;
    }
}
