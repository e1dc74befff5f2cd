package org.carball.querymon.model.query;

/**
 * Clause kinds that make up the structural shape of a query. Only presence is
 * recorded, never the clause contents.
 */
public enum QueryClause {
    WHERE("where"),
    INCLUDE("include"),
    SELECT("select"),
    ORDER_BY("orderBy");

    private final String argumentKey;

    QueryClause(String argumentKey) {
        this.argumentKey = argumentKey;
    }

    public String getArgumentKey() {
        return argumentKey;
    }
}
