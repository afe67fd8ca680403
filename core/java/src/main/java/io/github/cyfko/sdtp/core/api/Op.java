package io.github.cyfko.sdtp.core.api;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Enumeration of the operators a filter document may use.
 * <p>
 * Leaf operators compare one column against zero, one or several literals; combinators compose
 * child filters. Each operator has a canonical code (the spelling written back on the wire) and
 * may accept aliases, including the operator names of the earlier data-plane protocol
 * ({@code IN_LIST}, {@code IN_RANGE}, {@code REGEX_MATCH}, {@code ALL}, {@code ANY}).
 * </p>
 *
 * <p><strong>Operand shapes:</strong></p>
 * <pre>{@code
 * {"operator": "GT",      "column": "age",  "value": 35}
 * {"operator": "IN",      "column": "name", "value": ["a", "b"]}
 * {"operator": "BETWEEN", "column": "age",  "value": [30, 40]}
 * {"operator": "REGEX",   "column": "name", "value": "^A.*"}
 * {"operator": "ISNULL",  "column": "name"}
 * {"operator": "AND",     "arguments": [ ... ]}
 * }</pre>
 *
 * <p><strong>Alias table:</strong></p>
 * <ul>
 *     <li>EQ / = / ==</li>
 *     <li>NE / != / &lt;&gt;</li>
 *     <li>LT / &lt;</li>
 *     <li>LE / &lt;= / LTE</li>
 *     <li>GT / &gt;</li>
 *     <li>GE / &gt;= / GTE</li>
 *     <li>IN / IN_LIST</li>
 *     <li>BETWEEN / IN_RANGE / RANGE</li>
 *     <li>REGEX / REGEX_MATCH / MATCHES</li>
 *     <li>ISNULL / IS_NULL / IS NULL</li>
 *     <li>NOTNULL / NOT_NULL / IS NOT NULL</li>
 *     <li>AND / ALL / &amp;</li>
 *     <li>OR / ANY / |</li>
 *     <li>NOT / !</li>
 * </ul>
 *
 * <p>The legacy {@code NONE} combinator has no constant of its own: the parser rewrites it as
 * {@code NOT(OR(...))}.</p>
 *
 * @since 1.0.0
 */
public enum Op {

    /** Value equality: "=" */
    EQ(Kind.COMPARISON, "EQ", "=", "=="),

    /** Value inequality: "!=" */
    NE(Kind.COMPARISON, "NE", "!=", "<>"),

    /** Strictly less than: "&lt;" */
    LT(Kind.ORDERING, "LT", "<"),

    /** Less than or equal: "&lt;=" */
    LE(Kind.ORDERING, "LE", "<=", "LTE"),

    /** Strictly greater than: "&gt;" */
    GT(Kind.ORDERING, "GT", ">"),

    /** Greater than or equal: "&gt;=" */
    GE(Kind.ORDERING, "GE", ">=", "GTE"),

    /** Membership in a non-empty literal set. */
    IN(Kind.MEMBERSHIP, "IN", "IN_LIST"),

    /** Inclusive range; the pair is normalized to {@code low <= high}. */
    BETWEEN(Kind.RANGE, "BETWEEN", "IN_RANGE", "RANGE"),

    /** Full-pattern regular expression match, string columns only. */
    REGEX(Kind.PATTERN, "REGEX", "REGEX_MATCH", "MATCHES"),

    /** Column value is absent. */
    ISNULL(Kind.NULL_CHECK, "ISNULL", "IS_NULL", "IS NULL"),

    /** Column value is present. */
    NOTNULL(Kind.NULL_CHECK, "NOTNULL", "NOT_NULL", "IS NOT NULL"),

    /** Conjunction of one or more children, short-circuiting on the first false. */
    AND(Kind.COMBINATOR, "AND", "ALL", "&"),

    /** Disjunction of one or more children, short-circuiting on the first true. */
    OR(Kind.COMBINATOR, "OR", "ANY", "|"),

    /** Negation of exactly one child. */
    NOT(Kind.COMBINATOR, "NOT", "!");

    /**
     * Families of operators sharing the same operand rules.
     */
    public enum Kind {
        COMPARISON,
        ORDERING,
        MEMBERSHIP,
        RANGE,
        PATTERN,
        NULL_CHECK,
        COMBINATOR
    }

    private final Kind kind;
    private final String code;
    private final List<String> aliases;

    Op(Kind kind, String code, String... aliases) {
        this.kind = kind;
        this.code = code;
        this.aliases = List.of(aliases);
    }

    /**
     * @return the operator family
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Returns the canonical spelling, the one written when a filter is rendered back to the wire.
     *
     * @return the canonical code, e.g. {@code "BETWEEN"}
     */
    public String code() {
        return code;
    }

    /**
     * Finds an operator by its code or one of its aliases, ignoring case and surrounding blanks.
     *
     * @param value spelling found in a filter document
     * @return the operator, or empty if the spelling is unknown
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static Optional<Op> fromString(String value) {
        String trimmed = value.trim().toUpperCase(Locale.ROOT);
        for (Op op : values()) {
            if (op.code.equals(trimmed) || op.aliases.contains(trimmed)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    /**
     * @return {@code true} for AND, OR and NOT
     */
    public boolean isCombinator() {
        return kind == Kind.COMBINATOR;
    }

    /**
     * @return {@code true} if a leaf using this operator must carry a {@code value}
     */
    public boolean requiresValue() {
        return kind != Kind.COMBINATOR && kind != Kind.NULL_CHECK;
    }

    /**
     * @return {@code true} if this operator needs the column type to be ordered
     */
    public boolean requiresOrdering() {
        return kind == Kind.ORDERING || kind == Kind.RANGE;
    }
}
