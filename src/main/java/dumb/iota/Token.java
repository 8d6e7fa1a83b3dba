package dumb.iota;

/** Lexical tokens of the two-symbol surface syntax. */
public enum Token {
    /** Application marker, {@code *} by default. */
    STAR,
    /** The base combinator, {@code i} by default. */
    IDENTITY
}
