package io.prepro.core.directive;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/// Stack of open `#if` and `#switch` blocks.
///
/// The context is emission-active when the stack is empty or the top frame
/// is active. Because each frame captures its parent's activity when pushed,
/// checking the top frame is equivalent to checking every frame.
///
/// @implNote **Not thread-safe**.
public class ConditionalStack {

    private final Deque<Frame> frames = new ArrayDeque<>();

    /// Returns whether lines at the current position are emitted.
    ///
    /// @return `true` outside any block or inside a selected branch of active blocks
    public boolean isActive() {
        Frame top = frames.peek();
        return top == null || top.isActive();
    }

    /// Opens an `#if` block.
    ///
    /// @param condition the evaluated condition
    /// @param lineNumber input line of the directive
    /// @return the pushed frame, never null
    public Frame pushIf(boolean condition, int lineNumber) {
        Frame frame = Frame.ifFrame(isActive(), condition, lineNumber);
        frames.push(frame);
        return frame;
    }

    /// Opens a `#switch` block.
    ///
    /// @param switchValue the expanded value, not null
    /// @param lineNumber input line of the directive
    /// @return the pushed frame, never null
    public Frame pushSwitch(String switchValue, int lineNumber) {
        Frame frame = Frame.switchFrame(isActive(), switchValue, lineNumber);
        frames.push(frame);
        return frame;
    }

    /// Returns the innermost open block.
    ///
    /// @return top frame, or empty when no block is open
    public Optional<Frame> peek() {
        return Optional.ofNullable(frames.peek());
    }

    /// Closes the innermost block.
    ///
    /// @return the removed frame, never null
    /// @throws java.util.NoSuchElementException if no block is open
    public Frame pop() {
        return frames.pop();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int depth() {
        return frames.size();
    }
}
