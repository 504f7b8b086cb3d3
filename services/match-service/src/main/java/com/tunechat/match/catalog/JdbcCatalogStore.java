package com.tunechat.match.catalog;

import com.tunechat.match.semantic.InvalidVectorException;
import com.tunechat.match.semantic.VectorCodec;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * PostgreSQL + pgvector catalog. Song ids are UUIDs; ids that are not valid UUIDs can never
 * match a row and are dropped before querying.
 */
public class JdbcCatalogStore implements CatalogStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcCatalogStore.class);

    private static final String SONG_COLUMNS =
        "s.id::text AS id, s.title, s.artist, s.year, s.popularity, s.tags, s.phrases, s.mbid, "
            + "s.is_placeholder, s.embedding_vector::text AS embedding_text ";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final int efSearch;
    private final RowMapper<Song> songRowMapper = this::mapSong;

    public JdbcCatalogStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, int efSearch) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.efSearch = Math.max(1, efSearch);
    }

    @Override
    public Optional<Song> findById(String songId) {
        UUID id = toUuid(songId);
        if (id == null) {
            return Optional.empty();
        }
        try {
            List<Song> rows = jdbcTemplate.query(
                "SELECT " + SONG_COLUMNS + "FROM songs s WHERE s.id = ?",
                songRowMapper,
                id
            );
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (DataAccessException e) {
            throw new CatalogUnavailableException("catalog_find_by_id_failed", e);
        }
    }

    @Override
    public List<Song> findByIds(Collection<String> songIds) {
        if (songIds == null || songIds.isEmpty()) {
            return List.of();
        }
        Set<UUID> ids = new LinkedHashSet<>();
        for (String songId : songIds) {
            UUID id = toUuid(songId);
            if (id != null) {
                ids.add(id);
            }
        }
        if (ids.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(",", Collections.nCopies(ids.size(), "?"));
        List<Song> rows;
        try {
            rows = jdbcTemplate.query(
                "SELECT " + SONG_COLUMNS + "FROM songs s WHERE s.is_placeholder = false AND s.id IN (" + placeholders + ")",
                songRowMapper,
                ids.toArray()
            );
        } catch (DataAccessException e) {
            throw new CatalogUnavailableException("catalog_find_by_ids_failed", e);
        }
        Map<String, Song> byId = new LinkedHashMap<>();
        for (Song song : rows) {
            byId.put(song.id(), song);
        }
        List<Song> ordered = new ArrayList<>(byId.size());
        for (UUID id : ids) {
            Song song = byId.get(id.toString());
            if (song != null) {
                ordered.add(song);
            }
        }
        return ordered;
    }

    @Override
    public List<Song> findTopByPopularity(int limit, Set<String> excludedTags) {
        if (limit <= 0) {
            return List.of();
        }
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(SONG_COLUMNS)
            .append("FROM songs s WHERE s.is_placeholder = false ");
        if (excludedTags != null && !excludedTags.isEmpty()) {
            sql.append("AND NOT EXISTS (SELECT 1 FROM unnest(s.tags) AS t(tag) WHERE lower(t.tag) IN (")
                .append(String.join(",", Collections.nCopies(excludedTags.size(), "?")))
                .append(")) ");
            excludedTags.stream().map(tag -> tag.toLowerCase(Locale.ROOT)).sorted().forEach(args::add);
        }
        sql.append("ORDER BY s.popularity DESC, s.id LIMIT ?");
        args.add(limit);
        try {
            return jdbcTemplate.query(sql.toString(), songRowMapper, args.toArray());
        } catch (DataAccessException e) {
            throw new CatalogUnavailableException("catalog_popularity_failed", e);
        }
    }

    @Override
    public long countEligible() {
        try {
            Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM songs WHERE embedding_vector IS NOT NULL AND is_placeholder = false",
                Long.class
            );
            return count == null ? 0L : count;
        } catch (DataAccessException e) {
            throw new CatalogUnavailableException("catalog_count_failed", e);
        }
    }

    @Override
    public List<VectorNeighbor> nearestNeighbors(VectorSpace space, float[] queryVector, int k) {
        if (queryVector == null || queryVector.length == 0 || k <= 0) {
            return List.of();
        }
        String literal = VectorCodec.toLiteral(queryVector);
        String sql = space == VectorSpace.ABOUTNESS
            ? "SELECT sa.song_id::text AS song_id, (sa.aboutness_vector <=> ?::vector) AS distance "
                + "FROM song_aboutness sa JOIN songs s ON s.id = sa.song_id "
                + "WHERE sa.aboutness_vector IS NOT NULL AND s.is_placeholder = false "
                + "ORDER BY sa.aboutness_vector <=> ?::vector LIMIT ?"
            : "SELECT s.id::text AS song_id, (s.embedding_vector <=> ?::vector) AS distance "
                + "FROM songs s WHERE s.embedding_vector IS NOT NULL AND s.is_placeholder = false "
                + "ORDER BY s.embedding_vector <=> ?::vector LIMIT ?";
        int candidates = Math.max(efSearch, k);
        try {
            List<VectorNeighbor> neighbors = transactionTemplate.execute(status -> {
                // hnsw.ef_search bounds how many rows the index scan can return
                jdbcTemplate.queryForObject(
                    "SELECT set_config('hnsw.ef_search', ?, true)",
                    String.class,
                    Integer.toString(candidates)
                );
                return jdbcTemplate.query(
                    sql,
                    (rs, rowNum) -> new VectorNeighbor(rs.getString("song_id"), rs.getDouble("distance")),
                    literal,
                    literal,
                    k
                );
            });
            return neighbors == null ? List.of() : neighbors;
        } catch (DataAccessException e) {
            throw new CatalogUnavailableException("catalog_ann_failed space=" + space.name().toLowerCase(), e);
        }
    }

    private Song mapSong(ResultSet rs, int rowNum) throws SQLException {
        int year = rs.getInt("year");
        Integer yearValue = rs.wasNull() ? null : year;
        return new Song(
            rs.getString("id"),
            rs.getString("title"),
            rs.getString("artist"),
            yearValue,
            rs.getInt("popularity"),
            readTextArray(rs.getArray("tags")),
            readTextArray(rs.getArray("phrases")),
            parseEmbedding(rs.getString("id"), rs.getString("embedding_text")),
            rs.getBoolean("is_placeholder"),
            rs.getString("mbid")
        );
    }

    // a malformed stored vector leaves the song usable for lexical and popularity matching
    private float[] parseEmbedding(String songId, String literal) {
        try {
            return VectorCodec.parseLiteral(literal);
        } catch (InvalidVectorException e) {
            log.warn("ignoring stored embedding for song {}: {}", songId, e.getMessage());
            return null;
        }
    }

    private Set<String> readTextArray(Array array) throws SQLException {
        if (array == null) {
            return Set.of();
        }
        Object raw = array.getArray();
        if (!(raw instanceof Object[] values)) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object value : values) {
            if (value != null) {
                result.add(value.toString());
            }
        }
        return result;
    }

    private UUID toUuid(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
