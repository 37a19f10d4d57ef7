package com.maxdemarzi.minimizer.quine;

import com.bpodgursky.jbool_expressions.And;
import com.bpodgursky.jbool_expressions.Expression;
import com.bpodgursky.jbool_expressions.Literal;
import com.bpodgursky.jbool_expressions.Not;
import com.bpodgursky.jbool_expressions.Or;
import com.bpodgursky.jbool_expressions.Variable;
import com.bpodgursky.jbool_expressions.parsers.ExprParser;
import com.bpodgursky.jbool_expressions.rules.RuleSet;
import com.maxdemarzi.minimizer.expression.Variables;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Checks evaluation and minimization against jbool_expressions, which parses
 * the same operators with its own grammar.
 */
public class ExpressionOracleTest {

    private static final List<String> FORMULAS = Arrays.asList(
            "A & !B | C",
            "!A & B | C",
            "(A | B) & (!C | D)",
            "!(A & B) | (C & !D)",
            "A & (B | !C) & !(D & A)",
            "(A | !B | C) & (!A | D)",
            "!A & !B & !C & !D | A & B & C & D"
    );

    @Test
    void shouldEvaluateLikeJbool() throws Exception {
        for (String formula : FORMULAS) {
            TruthTable ours = TruthTable.of(formula);
            Expression<String> theirs = ExprParser.parse(formula);

            for (TruthTableRow row : ours.getRows()) {
                assertEquals(isTrue(theirs, row.getAssignment()), row.isTrue(),
                        formula + " at m" + row.getMinterm());
            }
        }
    }

    @Test
    void shouldMinimizeToEquivalentCovers() throws Exception {
        for (String formula : FORMULAS) {
            TruthTable table = TruthTable.of(formula);
            List<String> variables = Variables.extract(formula);
            Expression<String> original = ExprParser.parse(formula);

            Minimization sop = QuineMcCluskey.minimize(table.minTerms(), IntLists.immutable.empty(), variables, Mode.SOP);
            Minimization pos = QuineMcCluskey.minimize(table.maxTerms(), IntLists.immutable.empty(), variables, Mode.POS);
            Expression<String> sum = toSumOfProducts(sop.getImplicants(), variables);
            Expression<String> product = toProductOfSums(pos.getImplicants(), variables);

            for (TruthTableRow row : table.getRows()) {
                boolean expected = isTrue(original, row.getAssignment());
                assertEquals(expected, isTrue(sum, row.getAssignment()), sop.getExpression() + " for " + formula);
                assertEquals(expected, isTrue(product, row.getAssignment()), pos.getExpression() + " for " + formula);
            }
        }
    }

    private static boolean isTrue(Expression<String> expression, Map<String, Boolean> assignment) {
        Expression<String> assigned = RuleSet.assign(expression, new HashMap<>(assignment));
        return assigned.equals(Literal.getTrue());
    }

    private static Expression<String> toSumOfProducts(List<Implicant> implicants, List<String> variables) {
        if (implicants.isEmpty()) {
            return Literal.getFalse();
        }
        List<Expression<String>> products = new ArrayList<>();
        for (Implicant implicant : implicants) {
            List<Expression<String>> literals = literals(implicant, variables, '0');
            products.add(literals.isEmpty() ? Literal.<String>getTrue() : And.of(literals));
        }
        return Or.of(products);
    }

    private static Expression<String> toProductOfSums(List<Implicant> implicants, List<String> variables) {
        if (implicants.isEmpty()) {
            return Literal.getTrue();
        }
        List<Expression<String>> sums = new ArrayList<>();
        for (Implicant implicant : implicants) {
            List<Expression<String>> literals = literals(implicant, variables, '1');
            sums.add(literals.isEmpty() ? Literal.<String>getTrue() : Or.of(literals));
        }
        return And.of(sums);
    }

    private static List<Expression<String>> literals(Implicant implicant, List<String> variables, char negated) {
        List<Expression<String>> literals = new ArrayList<>();
        String pattern = implicant.getPattern();
        for (int i = 0; i < pattern.length(); i++) {
            char symbol = pattern.charAt(i);
            if (symbol == Implicant.DASH) {
                continue;
            }
            Expression<String> variable = Variable.of(variables.get(i));
            literals.add(symbol == negated ? Not.of(variable) : variable);
        }
        return literals;
    }
}
