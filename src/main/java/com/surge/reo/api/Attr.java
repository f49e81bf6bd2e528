package com.surge.reo.api;

/**
 * Reserved attribute names of the SODG model.
 *
 * Every other edge label is a user-chosen identifier. The positional argument
 * labels {@code α0}, {@code α1}, ... are produced by {@link #alpha(int)}.
 */
public final class Attr {
    /** Enclosing (parent) object. */
    public static final String RHO = "ρ";
    /** Native function marker; the target vertex carries the function name. */
    public static final String LAMBDA = "λ";
    /** Literal data; the target vertex carries the payload. */
    public static final String DELTA = "Δ";
    /** Copy / decoratee reference. */
    public static final String PI = "π";
    /** Scope in which a copy was constructed. */
    public static final String XI = "ξ";
    /** Attribute call; the target vertex carries a locator. */
    public static final String BETA = "β";
    /** Application; the target vertex is the callee expression. */
    public static final String EPSILON = "ε";
    /** Prefix of positional arguments. */
    public static final String ALPHA = "α";

    /** Root namespace head of a locator. */
    public static final String PHI = "Φ";
    /** ASCII alias of {@link #PHI}. */
    public static final String Q = "Q";

    private Attr() {
    }

    public static String alpha(int position) {
        return ALPHA + position;
    }

    public static boolean isAlpha(String name) {
        if (name.length() < 2 || !name.startsWith(ALPHA))
            return false;
        for (int i = ALPHA.length(); i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i)))
                return false;
        }
        return true;
    }

    /**
     * True for names with reserved meaning. Positional arguments are not
     * system names: they are bindings like any user attribute.
     */
    public static boolean isSystem(String name) {
        return switch (name) {
            case RHO, LAMBDA, DELTA, PI, XI, BETA, EPSILON -> true;
            default -> false;
        };
    }
}
