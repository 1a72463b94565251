package io.prepro.core.directive;

/// Operators accepted by `#if`.
public enum ConditionOperator {

    /// `lhs == rhs`
    EQUALS,

    /// `lhs != rhs`
    NOT_EQUALS,

    /// `defined(name)`
    DEFINED,

    /// `undefined(name)`
    UNDEFINED
}
