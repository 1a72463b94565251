package io.prepro.core.directive;

/// The block a {@link Frame} belongs to.
public enum FrameKind {
    IF,
    SWITCH
}
