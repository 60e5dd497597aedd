package com.example.legalrag.repository;

import com.example.legalrag.config.RagProperties;
import com.example.legalrag.dto.DiscoveryRecord;
import com.example.legalrag.dto.Passage;
import com.example.legalrag.dto.RetrievedPassage;
import com.example.legalrag.util.VectorScores;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.IntStream;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcPassageStore implements PassageStore {

    private static final int BATCH_SIZE = 128;

    private static final String UPSERT_DOCUMENT_SQL = """
        INSERT INTO documents (document_id, title, lang, issued, source_uri, ingested_at)
        VALUES (?, ?, ?, ?, ?, now())
        ON CONFLICT (document_id) DO UPDATE
        SET title = EXCLUDED.title,
            lang = EXCLUDED.lang,
            issued = EXCLUDED.issued,
            source_uri = EXCLUDED.source_uri,
            ingested_at = EXCLUDED.ingested_at
        """;

    private static final String DELETE_CHUNKS_SQL = "DELETE FROM document_chunks WHERE document_id = ?";

    private static final String INSERT_CHUNK_SQL =
        "INSERT INTO document_chunks (document_id, chunk_index, content, embedding) VALUES (?, ?, ?, ?::vector)";

    private static final String NEAREST_SQL = """
        WITH q AS (
          SELECT ?::vector AS v
        )
        SELECT c.document_id, c.chunk_index, c.content,
               (c.embedding <=> (SELECT v FROM q)) AS distance
        FROM document_chunks c
        ORDER BY c.embedding <=> (SELECT v FROM q) ASC
        LIMIT ?
        """;

    private final JdbcTemplate jdbc;
    private final RagProperties ragProperties;

    @Override
    @Transactional
    public void replaceDocument(DiscoveryRecord document, List<Passage> passages, List<float[]> vectors) {
        if (passages.size() != vectors.size()) {
            throw new IllegalArgumentException("Got " + passages.size() + " passages but " + vectors.size() + " vectors");
        }
        jdbc.update(UPSERT_DOCUMENT_SQL,
            document.id(), document.title(), document.language(), document.issued(), document.sourceLocation());

        int removed = jdbc.update(DELETE_CHUNKS_SQL, document.id());

        List<Object[]> params = IntStream.range(0, passages.size())
            .mapToObj(i -> new Object[]{
                document.id(), passages.get(i).index(), passages.get(i).text(),
                VectorScores.toPgVectorLiteral(vectors.get(i))})
            .toList();

        IntStream.iterate(0, start -> start < params.size(), start -> start + BATCH_SIZE)
            .forEach(start -> jdbc.batchUpdate(INSERT_CHUNK_SQL,
                params.subList(start, Math.min(start + BATCH_SIZE, params.size()))));

        log.debug("Replaced {} stored chunks of {} with {}", removed, document.id(), passages.size());
    }

    @Override
    public List<RetrievedPassage> query(float[] vector, int k) {
        int limit = Math.max(1, Math.min(k, ragProperties.getSearch().getMaxK()));
        return jdbc.query(NEAREST_SQL, (rs, i) -> new RetrievedPassage(
                rs.getString("document_id"),
                rs.getInt("chunk_index"),
                rs.getString("content"),
                VectorScores.similarityFromDistance(rs.getDouble("distance"))
            ),
            VectorScores.toPgVectorLiteral(vector),
            limit
        );
    }

    @Override
    public List<String> listDocumentIds() {
        return jdbc.queryForList("SELECT DISTINCT document_id FROM document_chunks ORDER BY document_id", String.class);
    }

    @Override
    @Transactional
    public int deleteDocument(String documentId) {
        int chunks = jdbc.update(DELETE_CHUNKS_SQL, documentId);
        jdbc.update("DELETE FROM documents WHERE document_id = ?", documentId);
        return chunks;
    }
}
