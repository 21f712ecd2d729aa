package com.acme.nummern.script.formula;

import java.util.List;
import java.util.Objects;

/**
 * Right-hand side chosen for a formula, most readable form first.
 */
public sealed interface FormulaRendering
    permits FormulaRendering.AggregateCall, FormulaRendering.InlineExpression, FormulaRendering.GenericFormula {

    /** Python expression to assign to the target identifier. */
    String expression();

    record AggregateCall(String helper, List<String> arguments) implements FormulaRendering {
        public AggregateCall {
            Objects.requireNonNull(helper, "helper");
            arguments = List.copyOf(arguments);
        }

        @Override
        public String expression() {
            return helper + "(" + String.join(", ", arguments) + ")";
        }
    }

    record InlineExpression(String expression) implements FormulaRendering {
        public InlineExpression {
            Objects.requireNonNull(expression, "expression");
        }
    }

    /** {@code source} is the formula body handed to the runtime's evaluator. */
    record GenericFormula(String source, String expression) implements FormulaRendering {
        public GenericFormula {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(expression, "expression");
        }
    }
}
