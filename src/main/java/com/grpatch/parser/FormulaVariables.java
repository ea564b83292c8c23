package com.grpatch.parser;

import com.grpatch.grammar.Gr1cFormulaBaseVisitor;
import com.grpatch.grammar.Gr1cFormulaParser;
import java.util.LinkedHashSet;
import java.util.Set;

/** Collects the names of the variables occurring in a formula, primed occurrences included. */
public final class FormulaVariables extends Gr1cFormulaBaseVisitor<Set<String>> {
    private final Set<String> variables = new LinkedHashSet<>();

    private FormulaVariables() {
    }

    public static Set<String> of(String formula) {
        return ParseUtil.parse(formula, new FormulaVariables());
    }

    @Override
    public Set<String> visitFormula(Gr1cFormulaParser.FormulaContext ctx) {
        visit(ctx.expression());
        return variables;
    }

    @Override
    public Set<String> visitVariable(Gr1cFormulaParser.VariableContext ctx) {
        variables.add(ctx.name.getText());
        return variables;
    }

    @Override
    protected Set<String> defaultResult() {
        return variables;
    }
}
