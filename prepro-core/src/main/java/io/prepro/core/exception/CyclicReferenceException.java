package io.prepro.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a variable's expansion transitively depends on itself.
public class CyclicReferenceException extends PreprocessException {

    @Serial private static final long serialVersionUID = -3914172908165523917L;

    private final List<String> chain;

    /// Creates exception for a reference cycle.
    ///
    /// @param lineNumber 1-based input line
    /// @param chain variable names in expansion order, ending with the repeated name
    public CyclicReferenceException(int lineNumber, List<String> chain) {
        super(lineNumber, "Cyclic variable reference: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    /// Returns the expansion chain that closed the cycle.
    ///
    /// @return unmodifiable list of names, never null
    public List<String> getChain() {
        return chain;
    }
}
