package org.carball.querymon.monitor;

import org.carball.querymon.model.query.QueryClause;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class QuerySignaturesTest {

    @Test
    void shouldOrderClausesCanonically() {
        // Given
        Set<QueryClause> clauses = EnumSet.of(QueryClause.ORDER_BY, QueryClause.WHERE, QueryClause.INCLUDE);

        // When
        String hash = QuerySignatures.hash("Task", "findMany", clauses);

        // Then
        assertThat(hash).isEqualTo("Task.findMany{where,include,orderBy}");
    }

    @Test
    void shouldProduceEmptyShapeWithoutClauses() {
        assertThat(QuerySignatures.hash("User", "count", Set.of())).isEqualTo("User.count{}");
    }

    @Test
    void shouldRecoverClausesFromHash() {
        assertThat(QuerySignatures.clausesOf("Task.findMany{where,select}"))
                .containsExactlyInAnyOrder(QueryClause.WHERE, QueryClause.SELECT);
        assertThat(QuerySignatures.clausesOf("User.count{}")).isEmpty();
        assertThat(QuerySignatures.clausesOf("garbage")).isEmpty();
        assertThat(QuerySignatures.clausesOf(null)).isEmpty();
    }

    @Test
    void shouldPercentileByNearestRank() {
        // Given
        long[] sorted = {10, 20, 30, 40, 50, 60, 70, 80, 90, 100};

        // Then
        assertThat(Percentiles.of(sorted, 50)).isEqualTo(50);
        assertThat(Percentiles.of(sorted, 95)).isEqualTo(100);
        assertThat(Percentiles.of(sorted, 0)).isEqualTo(10);
        assertThat(Percentiles.of(new long[0], 99)).isZero();
    }
}
