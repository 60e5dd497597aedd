package com.example.legalrag.service;

import com.example.legalrag.service.SparqlQueryBuilder.Shape;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SparqlQueryBuilderTest {

    @Test
    void eliQueryPagesAndFiltersByCelexYear() {
        String query = SparqlQueryBuilder.build(Shape.ELI, 25, 50, 2018);

        assertThat(query)
            .contains("eli:celex ?celex")
            .contains("SUBSTR(STR(?celex), 2, 4)) >= 2018")
            .endsWith("LIMIT 25 OFFSET 50");
    }

    @Test
    void cdmQueryFiltersByIssuedDate() {
        String query = SparqlQueryBuilder.build(Shape.CDM, 10, 0, 2020);

        assertThat(query)
            .contains("cdm:expression_belongs_to_work")
            .contains("\"2020-01-01T00:00:00\"^^xsd:dateTime")
            .endsWith("LIMIT 10 OFFSET 0");
    }

    @Test
    void noYearFilterWithoutSinceYear() {
        assertThat(SparqlQueryBuilder.build(Shape.ELI, 10, 0, null)).doesNotContain(">= ");
        assertThat(SparqlQueryBuilder.build(Shape.CDM, 10, 0, null)).doesNotContain("xsd:dateTime)");
    }
}
