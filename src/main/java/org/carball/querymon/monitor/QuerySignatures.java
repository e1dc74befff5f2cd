package org.carball.querymon.monitor;

import org.carball.querymon.model.query.QueryClause;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the structural signature used to group calls. Only the model, the action and
 * the kinds of clauses present take part; literal values never do.
 */
public final class QuerySignatures {

    private QuerySignatures() {
        // Utility class - prevent instantiation
    }

    public static String hash(String model, String action, Set<QueryClause> clauses) {
        String shape = Arrays.stream(QueryClause.values())
                .filter(clauses::contains)
                .map(QueryClause::getArgumentKey)
                .collect(Collectors.joining(","));
        return model + "." + action + "{" + shape + "}";
    }

    /**
     * Recovers the clause kinds from a hash built by {@link #hash}. Unknown or missing
     * shapes yield an empty set.
     */
    public static Set<QueryClause> clausesOf(String queryHash) {
        Set<QueryClause> clauses = EnumSet.noneOf(QueryClause.class);
        if (queryHash == null) {
            return clauses;
        }
        int open = queryHash.indexOf('{');
        int close = queryHash.lastIndexOf('}');
        if (open < 0 || close <= open) {
            return clauses;
        }
        Set<String> keys = new HashSet<>(Arrays.asList(queryHash.substring(open + 1, close).split(",")));
        for (QueryClause clause : QueryClause.values()) {
            if (keys.contains(clause.getArgumentKey())) {
                clauses.add(clause);
            }
        }
        return clauses;
    }
}
