package com.example.legalrag.service;

/**
 * SPARQL shapes used to list recent regulations and directives from the Publications Office triple store.
 */
public final class SparqlQueryBuilder {

    public enum Shape {
        /** ELI ontology, grouped by CELEX. */
        ELI,
        /** CDM ontology, expression-level; used when the ELI shape returns nothing. */
        CDM
    }

    private SparqlQueryBuilder() {}

    public static String build(Shape shape, int limit, int offset, Integer sinceYear) {
        return switch (shape) {
            case ELI -> eli(limit, offset, sinceYear);
            case CDM -> cdm(limit, offset, sinceYear);
        };
    }

    static String eli(int limit, int offset, Integer sinceYear) {
        String yearFilter = sinceYear != null
            ? "FILTER(xsd:integer(SUBSTR(STR(?celex), 2, 4)) >= " + sinceYear + ")"
            : "";
        return """
            PREFIX eli: <http://data.europa.eu/eli/ontology#>
            PREFIX dct: <http://purl.org/dc/terms/>
            PREFIX xsd: <http://www.w3.org/2001/XMLSchema#>
            SELECT ?celex (SAMPLE(?work) AS ?work) (SAMPLE(?expression) AS ?expression)
                   (SAMPLE(?title) AS ?title) (SAMPLE(?lang) AS ?lang) (MAX(?issued) AS ?issued)
            FROM <http://publications.europa.eu/resource/dataset/cellar>
            WHERE {
              ?work eli:celex ?celex .
              FILTER(REGEX(STR(?celex), '^3[0-9]{4}[RL]'))
              %s
              OPTIONAL {
                ?work eli:is_realized_by ?expression .
                OPTIONAL { ?expression dct:issued ?issued }
                OPTIONAL { ?expression eli:title ?title }
                OPTIONAL { ?expression dct:language ?lang }
              }
            }
            GROUP BY ?celex
            ORDER BY DESC(?issued)
            LIMIT %d OFFSET %d
            """.formatted(yearFilter, limit, offset).trim();
    }

    static String cdm(int limit, int offset, Integer sinceYear) {
        String sinceFilter = sinceYear != null
            ? "FILTER(BOUND(?issued) && ?issued >= \"" + sinceYear + "-01-01T00:00:00\"^^xsd:dateTime)"
            : "";
        return """
            PREFIX cdm: <http://publications.europa.eu/ontology/cdm#>
            PREFIX cmr: <http://publications.europa.eu/ontology/cdm/cmr#>
            PREFIX xsd: <http://www.w3.org/2001/XMLSchema#>
            PREFIX owl: <http://www.w3.org/2002/07/owl#>
            SELECT ?celex ?work ?expression ?title ?lang ?issued WHERE {
              ?expression a cdm:expression ;
                          cdm:expression_belongs_to_work ?work ;
                          cdm:expression_title ?title .
              OPTIONAL { ?expression cmr:lang ?langLiteral }
              OPTIONAL { ?expression cdm:expression_uses_language ?langRes }
              OPTIONAL { ?expression cmr:lastModificationDate ?issued }
              ?work owl:sameAs ?same .
              FILTER(CONTAINS(STR(?same), "/resource/celex/"))
              BIND(REPLACE(STR(?same), ".*/resource/celex/([^.]+).*$", "$1") AS ?celex)
              BIND(
                IF(BOUND(?langLiteral) && (STR(?langLiteral) = 'ro' || STR(?langLiteral) = 'ron' || STR(?langLiteral) = 'rum'), 'ro',
                  IF(BOUND(?langLiteral) && (STR(?langLiteral) = 'en' || STR(?langLiteral) = 'eng'), 'en',
                    IF(BOUND(?langRes) && CONTAINS(STR(?langRes), '/ROU'), 'ro',
                      IF(BOUND(?langRes) && CONTAINS(STR(?langRes), '/ENG'), 'en', UNDEF))))
              AS ?lang)
              FILTER(BOUND(?lang))
              FILTER(REGEX(?celex, '^3[0-9]{4}[RL]'))
              %s
            }
            LIMIT %d OFFSET %d
            """.formatted(sinceFilter, limit, offset).trim();
    }
}
