package io.prepro.core.directive;

import java.util.HashSet;
import java.util.Set;

/// One open `#if` or `#switch` block on the {@link ConditionalStack}.
///
/// ### Contracts
/// - **Invariant**: {@link #isActive()} is `true` only when the enclosing
///   context was active and this frame's own branch is selected
/// - **Invariant**: `parentActive` never changes after the frame is pushed,
///   so no directive inside an inactive block can enable output
///
/// @implNote Mutable; owned by a single {@link ConditionalStack}.
public final class Frame {

    private final FrameKind kind;
    private final boolean parentActive;
    private final int openedAt;
    private final String switchValue;
    private final Set<String> caseValues = new HashSet<>();
    private boolean selected;
    private boolean branchTaken;
    private boolean elseSeen;
    private boolean defaultSeen;

    private Frame(FrameKind kind, boolean parentActive, int openedAt, boolean selected, String switchValue) {
        this.kind = kind;
        this.parentActive = parentActive;
        this.openedAt = openedAt;
        this.selected = selected;
        this.branchTaken = selected;
        this.switchValue = switchValue;
    }

    /// Creates the frame for an `#if` block.
    ///
    /// @param parentActive whether the enclosing context is emission-active
    /// @param condition the evaluated condition
    /// @param openedAt input line of the `#if`
    /// @return new frame, never null
    static Frame ifFrame(boolean parentActive, boolean condition, int openedAt) {
        return new Frame(FrameKind.IF, parentActive, openedAt, condition, null);
    }

    /// Creates the frame for a `#switch` block. No branch is selected until a
    /// matching `#case` or a `#default`.
    ///
    /// @param parentActive whether the enclosing context is emission-active
    /// @param switchValue the expanded switch value, not null
    /// @param openedAt input line of the `#switch`
    /// @return new frame, never null
    static Frame switchFrame(boolean parentActive, String switchValue, int openedAt) {
        return new Frame(FrameKind.SWITCH, parentActive, openedAt, false, switchValue);
    }

    public FrameKind kind() {
        return kind;
    }

    /// Returns whether lines in this frame's current branch are emitted.
    public boolean isActive() {
        return parentActive && selected;
    }

    public boolean isParentActive() {
        return parentActive;
    }

    public boolean isSelected() {
        return selected;
    }

    /// Returns the input line that opened this block.
    public int openedAt() {
        return openedAt;
    }

    public String switchValue() {
        return switchValue;
    }

    /// Switches to the `#else` branch.
    ///
    /// @return `false` if the frame already saw an `#else`
    boolean enterElse() {
        if (elseSeen) {
            return false;
        }
        elseSeen = true;
        selected = !branchTaken;
        branchTaken = true;
        return true;
    }

    /// Starts a `#case` branch. The first matching case is selected; later
    /// cases are not, even when they match.
    ///
    /// @param value the case value
    /// @return `false` if the value was already used by a case in this switch
    boolean enterCase(String value) {
        if (!caseValues.add(value)) {
            return false;
        }
        if (!branchTaken && value.equals(switchValue)) {
            selected = true;
            branchTaken = true;
        } else {
            selected = false;
        }
        return true;
    }

    /// Starts the `#default` branch, selected only when no case matched.
    void enterDefault() {
        defaultSeen = true;
        selected = !branchTaken;
        branchTaken = true;
    }

    boolean isDefaultSeen() {
        return defaultSeen;
    }
}
