package io.github.cyfko.querier.core.api;

/**
 * Kind of substring match performed by a {@link QueryPredicate.Substring} node.
 *
 * @author Frank KOSSI
 */
public enum SubstringKind {
    CONTAINS,
    STARTS_WITH,
    ENDS_WITH;

    /**
     * Tests a candidate text against a literal.
     *
     * @param text    candidate text, never null
     * @param literal literal searched for, never null
     * @return whether the candidate matches
     */
    public boolean test(String text, String literal) {
        return switch (this) {
            case CONTAINS -> text.contains(literal);
            case STARTS_WITH -> text.startsWith(literal);
            case ENDS_WITH -> text.endsWith(literal);
        };
    }
}
