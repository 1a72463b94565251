package io.prepro.core.directive;

import io.prepro.core.exception.DirectiveSyntaxException;
import io.prepro.core.variable.SymbolTable;
import io.prepro.core.variable.VariableExpander;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Executes directives against the symbol table and the conditional stack.
///
/// ### Directives
/// - `#define NAME[=VALUE]`: stores VALUE verbatim (not expanded); only while active
/// - `#if LHS == RHS`, `#if LHS != RHS`: operands expanded, trimmed, compared case sensitively
/// - `#if defined(NAME)`, `#if undefined(NAME)`: symbol table membership
/// - `#else`, `#endif`
/// - `#switch VALUE`, `#case VALUE`, `#default`, `#endswitch`: first matching case wins
///
/// Inside an inactive block directives are still checked for syntax and
/// structure, but nothing is defined and no operand is expanded.
///
/// @implNote **Not thread-safe**. Owned by a single
/// {@link io.prepro.core.PreprocessReader}.
public class DirectiveInterpreter {

    private static final Logger logger = Logger.getLogger(DirectiveInterpreter.class.getName());

    private static final Pattern DEFINE_PATTERN =
            Pattern.compile("(?<name>[A-Za-z0-9_.\\-]+)\\s*(?:=(?<value>.*))?");

    private final char statementMarker;
    private final SymbolTable symbols;
    private final VariableExpander expander;
    private final ConditionalStack stack = new ConditionalStack();

    /// Creates an interpreter.
    ///
    /// @param statementMarker marker used in error messages
    /// @param symbols target of `#define` and source of `defined(...)`, not null
    /// @param expander expands `#if`, `#switch` and `#case` operands, not null
    public DirectiveInterpreter(char statementMarker, SymbolTable symbols, VariableExpander expander) {
        this.statementMarker = statementMarker;
        this.symbols = symbols;
        this.expander = expander;
    }

    /// Returns whether ordinary lines at the current position are emitted.
    public boolean isActive() {
        return stack.isActive();
    }

    /// Returns the number of open blocks.
    public int depth() {
        return stack.depth();
    }

    /// Executes a directive.
    ///
    /// @param directive the parsed directive, not null
    /// @param lineNumber input line of the directive
    /// @throws DirectiveSyntaxException if the directive is malformed or out of place
    public void execute(Directive directive, int lineNumber) {
        DirectiveKind kind = directive.kind();
        if (kind.takesArgument() && !directive.hasArgument()) {
            throw syntax(lineNumber, "Missing argument for " + label(kind) + ": " + directive.line());
        }
        if (!kind.takesArgument() && directive.hasArgument()) {
            throw syntax(lineNumber, "Unexpected text after " + label(kind) + ": " + directive.line());
        }

        switch (kind) {
            case DEFINE -> define(directive, lineNumber);
            case IF -> openIf(directive, lineNumber);
            case ELSE -> enterElse(directive, lineNumber);
            case ENDIF -> close(FrameKind.IF, directive, lineNumber);
            case SWITCH -> openSwitch(directive, lineNumber);
            case CASE -> enterCase(directive, lineNumber);
            case DEFAULT -> enterDefault(directive, lineNumber);
            case ENDSWITCH -> close(FrameKind.SWITCH, directive, lineNumber);
        }
    }

    /// Verifies that every block has been closed.
    ///
    /// @param lineNumber last input line, used in the error message
    /// @throws DirectiveSyntaxException if an `#if` or `#switch` is still open
    public void verifyClosed(int lineNumber) {
        Optional<Frame> open = stack.peek();
        if (open.isPresent()) {
            Frame frame = open.get();
            DirectiveKind opener = frame.kind() == FrameKind.IF ? DirectiveKind.IF : DirectiveKind.SWITCH;
            throw syntax(lineNumber, "Unclosed " + label(opener) + " opened at line " + frame.openedAt() + ".");
        }
    }

    private void define(Directive directive, int lineNumber) {
        Matcher match = DEFINE_PATTERN.matcher(directive.argument());
        if (!match.matches()) {
            throw syntax(lineNumber, "Invalid " + label(DirectiveKind.DEFINE) + ": " + directive.line());
        }
        if (!stack.isActive()) {
            return;
        }

        String name = match.group("name");
        String value = match.group("value") == null ? "" : match.group("value").trim();
        symbols.set(name, value);
        logger.fine("Defined " + name + " at line " + lineNumber);
    }

    private void openIf(Directive directive, int lineNumber) {
        Condition condition = Condition.parse(directive.argument(), lineNumber);
        boolean result = stack.isActive() && evaluate(condition, lineNumber);
        stack.pushIf(result, lineNumber);
        logger.fine("Opened " + label(DirectiveKind.IF) + " at line " + lineNumber + " -> " + result);
    }

    private boolean evaluate(Condition condition, int lineNumber) {
        return switch (condition.operator()) {
            case DEFINED -> symbols.contains(condition.left());
            case UNDEFINED -> !symbols.contains(condition.left());
            case EQUALS -> operand(condition.left(), lineNumber).equals(operand(condition.right(), lineNumber));
            case NOT_EQUALS -> !operand(condition.left(), lineNumber).equals(operand(condition.right(), lineNumber));
        };
    }

    private String operand(String text, int lineNumber) {
        return expander.expand(text, lineNumber).trim();
    }

    private void enterElse(Directive directive, int lineNumber) {
        Frame frame = top(FrameKind.IF, directive, lineNumber);
        if (!frame.enterElse()) {
            throw syntax(lineNumber, "Duplicate " + label(DirectiveKind.ELSE) + ": " + directive.line());
        }
    }

    private void openSwitch(Directive directive, int lineNumber) {
        String value = stack.isActive() ? operand(directive.argument(), lineNumber) : directive.argument();
        stack.pushSwitch(value, lineNumber);
        logger.fine("Opened " + label(DirectiveKind.SWITCH) + " at line " + lineNumber + " on [" + value + "]");
    }

    private void enterCase(Directive directive, int lineNumber) {
        Frame frame = top(FrameKind.SWITCH, directive, lineNumber);
        if (frame.isDefaultSeen()) {
            throw syntax(
                    lineNumber,
                    label(DirectiveKind.CASE) + " cannot follow " + label(DirectiveKind.DEFAULT) + ": " + directive.line());
        }

        String value = frame.isParentActive() ? operand(directive.argument(), lineNumber) : directive.argument();
        if (!frame.enterCase(value)) {
            throw syntax(lineNumber, "Duplicate " + label(DirectiveKind.CASE) + " value [" + value + "]: " + directive.line());
        }
    }

    private void enterDefault(Directive directive, int lineNumber) {
        Frame frame = top(FrameKind.SWITCH, directive, lineNumber);
        if (frame.isDefaultSeen()) {
            throw syntax(lineNumber, "Duplicate " + label(DirectiveKind.DEFAULT) + ": " + directive.line());
        }
        frame.enterDefault();
    }

    private void close(FrameKind kind, Directive directive, int lineNumber) {
        top(kind, directive, lineNumber);
        Frame frame = stack.pop();
        logger.fine("Closed block opened at line " + frame.openedAt() + " at line " + lineNumber);
    }

    private Frame top(FrameKind expected, Directive directive, int lineNumber) {
        Frame frame = stack.peek().orElse(null);
        if (frame == null || frame.kind() != expected) {
            DirectiveKind opener = expected == FrameKind.IF ? DirectiveKind.IF : DirectiveKind.SWITCH;
            throw syntax(
                    lineNumber,
                    label(directive.kind()) + " is not within " + label(opener) + ": " + directive.line());
        }
        return frame;
    }

    private String label(DirectiveKind kind) {
        return "[" + statementMarker + kind.keyword() + "]";
    }

    private static DirectiveSyntaxException syntax(int lineNumber, String message) {
        return new DirectiveSyntaxException(lineNumber, message);
    }
}
