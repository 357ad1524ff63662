package Engine;

/**
 * State changes that are checked against the interactive allow-list.
 */
public enum Mutation {
    INPUT,
    INTERNAL_VARIABLE,
    UNINTERPRETED,
    AXIOM,
    CONSTRAINT,
    ASSERTION,
    TACTIC,
    GOAL,
    KIND,
    LABEL,
    TABLE,
    ARRAY
}
