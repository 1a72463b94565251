package io.prepro.core.directive;

import io.prepro.core.exception.DirectiveSyntaxException;
import io.prepro.core.variable.SymbolTable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// A parsed `#if` expression.
///
/// For {@link ConditionOperator#EQUALS} and {@link ConditionOperator#NOT_EQUALS}
/// `left` and `right` are the unexpanded operands. For
/// {@link ConditionOperator#DEFINED} and {@link ConditionOperator#UNDEFINED}
/// `left` is the variable name and `right` is null.
///
/// @param operator the operator, not null
/// @param left first operand or variable name, not null
/// @param right second operand, null for `defined`/`undefined`
public record Condition(ConditionOperator operator, String left, String right) {

    private static final Pattern DEFINED_PATTERN =
            Pattern.compile("(?<op>defined|undefined)\\s*\\((?<name>[^)]*)\\)");

    /// Parses the argument of an `#if` directive.
    ///
    /// @param expression the text after `#if`, trimmed, not null
    /// @param lineNumber input line used in error messages
    /// @return the condition, never null
    /// @throws DirectiveSyntaxException if the expression is malformed
    public static Condition parse(String expression, int lineNumber) {
        Matcher defined = DEFINED_PATTERN.matcher(expression);
        if (defined.matches()) {
            String name = defined.group("name").trim();
            if (!SymbolTable.isValidName(name)) {
                throw invalid(expression, lineNumber);
            }
            ConditionOperator op =
                    defined.group("op").equals("defined")
                            ? ConditionOperator.DEFINED
                            : ConditionOperator.UNDEFINED;
            return new Condition(op, name, null);
        }

        int eq = expression.indexOf("==");
        int ne = expression.indexOf("!=");
        int pos;
        ConditionOperator op;
        if (eq >= 0 && (ne < 0 || eq < ne)) {
            pos = eq;
            op = ConditionOperator.EQUALS;
        } else if (ne >= 0) {
            pos = ne;
            op = ConditionOperator.NOT_EQUALS;
        } else {
            throw invalid(expression, lineNumber);
        }

        String left = expression.substring(0, pos).trim();
        String right = expression.substring(pos + 2).trim();
        if (left.isEmpty() || right.isEmpty()) {
            throw invalid(expression, lineNumber);
        }
        return new Condition(op, left, right);
    }

    private static DirectiveSyntaxException invalid(String expression, int lineNumber) {
        return new DirectiveSyntaxException(
                lineNumber, "Invalid [#if] expression: [" + expression + "]");
    }
}
