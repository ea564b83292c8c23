package com.grpatch.parser;

import com.grpatch.grammar.Gr1cFormulaBaseVisitor;
import com.grpatch.grammar.Gr1cFormulaParser;
import com.grpatch.model.Valuation;
import javax.annotation.Nullable;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Evaluates a propositional gr1c formula over a pair of states. Truth values are 0 and 1, so
 * boolean variables can be compared with integers just like gr1c does.
 */
public final class FormulaEvaluator extends Gr1cFormulaBaseVisitor<Integer> {
    private final Valuation current;
    @Nullable
    private final Valuation next;

    public FormulaEvaluator(Valuation current, @Nullable Valuation next) {
        this.current = current;
        this.next = next;
    }

    /**
     * Evaluates {@code formula}. Primed variables are looked up in {@code next}.
     *
     * @throws IllegalArgumentException if the formula does not parse, contains temporal operators or
     *     refers to a variable missing from the states
     */
    public static boolean holds(String formula, Valuation current, @Nullable Valuation next) {
        return ParseUtil.parse(formula, new FormulaEvaluator(current, next)) != 0;
    }

    private static int truth(boolean value) {
        return value ? 1 : 0;
    }

    @Override
    public Integer visitFormula(Gr1cFormulaParser.FormulaContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Integer visitNested(Gr1cFormulaParser.NestedContext ctx) {
        return visit(ctx.inner);
    }

    @Override
    public Integer visitUnary(Gr1cFormulaParser.UnaryContext ctx) {
        if (ctx.op.getType() == Gr1cFormulaParser.NOT) {
            return truth(visit(ctx.inner) == 0);
        }
        throw new ParseCancellationException("Temporal operator %s cannot be evaluated on a state"
            .formatted(ctx.op.getText()));
    }

    @Override
    public Integer visitComparison(Gr1cFormulaParser.ComparisonContext ctx) {
        int left = visit(ctx.left);
        int right = visit(ctx.right);
        return switch (ctx.op.getType()) {
            case Gr1cFormulaParser.EQ -> truth(left == right);
            case Gr1cFormulaParser.NEQ -> truth(left != right);
            case Gr1cFormulaParser.LT -> truth(left < right);
            case Gr1cFormulaParser.LE -> truth(left <= right);
            case Gr1cFormulaParser.GT -> truth(left > right);
            case Gr1cFormulaParser.GE -> truth(left >= right);
            default -> throw new ParseCancellationException("Unsupported operator " + ctx.op.getText());
        };
    }

    @Override
    public Integer visitConjunction(Gr1cFormulaParser.ConjunctionContext ctx) {
        return truth(visit(ctx.left) != 0 && visit(ctx.right) != 0);
    }

    @Override
    public Integer visitDisjunction(Gr1cFormulaParser.DisjunctionContext ctx) {
        return truth(visit(ctx.left) != 0 || visit(ctx.right) != 0);
    }

    @Override
    public Integer visitImplication(Gr1cFormulaParser.ImplicationContext ctx) {
        return truth(visit(ctx.left) == 0 || visit(ctx.right) != 0);
    }

    @Override
    public Integer visitEquivalence(Gr1cFormulaParser.EquivalenceContext ctx) {
        return truth((visit(ctx.left) != 0) == (visit(ctx.right) != 0));
    }

    @Override
    public Integer visitBooleanConstant(Gr1cFormulaParser.BooleanConstantContext ctx) {
        return truth(ctx.constant.getType() == Gr1cFormulaParser.TRUE);
    }

    @Override
    public Integer visitInteger(Gr1cFormulaParser.IntegerContext ctx) {
        return Integer.parseInt(ctx.value.getText());
    }

    @Override
    public Integer visitVariable(Gr1cFormulaParser.VariableContext ctx) {
        String name = ctx.name.getText();
        Valuation state = current;
        if (ctx.PRIME() != null) {
            if (next == null) {
                throw new ParseCancellationException("Primed variable %s without successor state".formatted(name));
            }
            state = next;
        }
        if (!state.contains(name)) {
            throw new ParseCancellationException("Undefined variable " + name);
        }
        return state.get(name);
    }
}
