package com.tagstore.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Disjunction over a list of comparisons.
 *
 * An OR-group is never empty: {@link #anyOf(List)} drops {@code IN} clauses whose
 * value list is empty and yields nothing when no clause is left, so a caller can
 * never send a condition that matches everything or nothing by accident.
 */
public class OrExpression implements Expression {
    private final List<ComparisonExpression> clauses;

    private OrExpression(List<ComparisonExpression> clauses) {
        this.clauses = List.copyOf(clauses);
    }

    public static Optional<OrExpression> anyOf(List<ComparisonExpression> candidates) {
        List<ComparisonExpression> kept = new ArrayList<>();
        for (ComparisonExpression candidate : candidates) {
            if (ComparisonExpression.IN.equals(candidate.getOperator()) && candidate.getValues().isEmpty()) {
                continue;
            }
            kept.add(candidate);
        }
        if (kept.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new OrExpression(kept));
    }

    public List<ComparisonExpression> getClauses() {
        return clauses;
    }

    @Override
    public String toString() {
        return clauses.stream()
            .map(ComparisonExpression::toString)
            .collect(Collectors.joining(" OR ", "(", ")"));
    }
}
