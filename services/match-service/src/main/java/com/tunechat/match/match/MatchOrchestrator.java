package com.tunechat.match.match;

import com.tunechat.match.catalog.CatalogStore;
import com.tunechat.match.catalog.CatalogUnavailableException;
import com.tunechat.match.catalog.Song;
import com.tunechat.match.lexicon.PhraseLexicon;
import com.tunechat.match.lexicon.PhraseMatch;
import com.tunechat.match.lexicon.PhraseMatchType;
import com.tunechat.match.lexicon.TextNormalizer;
import com.tunechat.match.moderation.ModerationAnnotation;
import com.tunechat.match.semantic.SemanticHit;
import com.tunechat.match.semantic.SemanticSearchProperties;
import com.tunechat.match.semantic.SemanticSearcher;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the lexicon, semantic and popularity strategies in order, stopping at the first one that
 * yields candidates, then filters, calibrates and picks alternates.
 */
@Service
public class MatchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(MatchOrchestrator.class);

    static final String FALLBACK_NO_CANDIDATES = "lexicon_and_semantic_empty";
    static final String FALLBACK_FILTERED_OUT = "filters_removed_all_candidates";

    private final PhraseLexicon lexicon;
    private final SemanticSearcher semanticSearcher;
    private final CatalogStore catalogStore;
    private final ConfidenceCalibrator calibrator;
    private final DiversitySelector diversitySelector;
    private final MatchOrchestratorProperties properties;
    private final SemanticSearchProperties semanticProperties;
    private final MeterRegistry meterRegistry;

    public MatchOrchestrator(
        PhraseLexicon lexicon,
        SemanticSearcher semanticSearcher,
        CatalogStore catalogStore,
        ConfidenceCalibrator calibrator,
        DiversitySelector diversitySelector,
        MatchOrchestratorProperties properties,
        SemanticSearchProperties semanticProperties,
        MeterRegistry meterRegistry
    ) {
        this.lexicon = lexicon;
        this.semanticSearcher = semanticSearcher;
        this.catalogStore = catalogStore;
        this.calibrator = calibrator;
        this.diversitySelector = diversitySelector;
        this.properties = properties;
        this.semanticProperties = semanticProperties;
        this.meterRegistry = meterRegistry;
    }

    public MatchResult matchSongs(String text, boolean allowExplicit, String userId, RecentHistory recentHistory) {
        return matchSongs(text, allowExplicit, userId, recentHistory, null);
    }

    public MatchResult matchSongs(
        String text,
        boolean allowExplicit,
        String userId,
        RecentHistory recentHistory,
        ModerationAnnotation moderation
    ) {
        long started = System.nanoTime();
        String normalized = TextNormalizer.normalize(text);
        RecentHistory history = recentHistory == null ? RecentHistory.empty() : recentHistory;
        String fallbackReason = null;

        List<MatchCandidate> candidates = lexiconCandidates(normalized);
        if (candidates.isEmpty()) {
            candidates = semanticCandidates(normalized);
        }
        if (candidates.isEmpty()) {
            fallbackReason = FALLBACK_NO_CANDIDATES;
            candidates = popularityFallback(false);
        }

        candidates = applyRecencyFilter(candidates, history);
        if (!allowExplicit) {
            candidates = removeExplicit(candidates);
        }
        if (candidates.isEmpty()) {
            fallbackReason = fallbackReason == null ? FALLBACK_FILTERED_OUT : fallbackReason;
            candidates = popularityFallback(!allowExplicit);
        }
        if (candidates.isEmpty()) {
            log.error("no eligible songs in catalog allow_explicit={}", allowExplicit);
            throw new EmptyCatalogException("no eligible songs available in catalog");
        }

        List<MatchCandidate> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble(MatchCandidate::rawScore).reversed());
        MatchCandidate primary = sorted.get(0);

        double confidence = calibrator.calibrate(sorted.stream().map(MatchCandidate::rawScore).toList());
        List<MatchCandidate> alternates = List.of();
        if (confidence < properties.getConfidenceThreshold()) {
            boolean relaxed = historySpansEras(history);
            alternates = diversitySelector.select(
                primary,
                sorted.subList(1, sorted.size()),
                relaxed,
                properties.getMaxAlternates()
            );
        }

        String strategy = primary.strategy().stage();
        MatchExplanation explanation = explain(primary, sorted.size(), fallbackReason, moderation);
        recordMetrics(strategy, fallbackReason);

        long tookMs = (System.nanoTime() - started) / 1_000_000L;
        log.info(
            "match completed user={} strategy={} primary=\"{}\" score={} confidence={} alternates={} candidates={} took_ms={}",
            userId,
            strategy,
            primary.song().displayName(),
            primary.rawScore(),
            confidence,
            alternates.size(),
            sorted.size(),
            tookMs
        );
        return new MatchResult(primary, alternates, confidence, strategy, explanation);
    }

    private List<MatchCandidate> lexiconCandidates(String normalized) {
        List<PhraseMatch> matches = lexicon.findPhraseMatches(normalized);
        if (matches.isEmpty()) {
            return List.of();
        }
        // song id -> best match; catalog ids may come back in a different case
        Map<String, PhraseMatch> best = new LinkedHashMap<>();
        Map<String, String> requestedIds = new LinkedHashMap<>();
        for (PhraseMatch match : matches) {
            for (String songId : match.songIds()) {
                String key = key(songId);
                requestedIds.putIfAbsent(key, songId);
                PhraseMatch current = best.get(key);
                if (current == null || match.confidence() > current.confidence()) {
                    best.put(key, match);
                }
            }
        }

        List<Song> songs;
        try {
            songs = catalogStore.findByIds(requestedIds.values());
        } catch (CatalogUnavailableException e) {
            log.warn("lexicon strategy skipped, catalog lookup failed: {}", e.getMessage());
            return List.of();
        }

        List<MatchCandidate> candidates = new ArrayList<>(songs.size());
        for (Song song : songs) {
            PhraseMatch match = best.get(key(song.id()));
            if (match == null) {
                continue;
            }
            MatchStrategy strategy = match.matchType() == PhraseMatchType.EXACT ? MatchStrategy.EXACT : MatchStrategy.PHRASE;
            candidates.add(new MatchCandidate(
                song,
                match.confidence(),
                strategy,
                MatchReason.phrase(match.phrase(), match.matchType().label())
            ));
        }
        log.debug("lexicon strategy matches={} hydrated={}", matches.size(), candidates.size());
        return candidates;
    }

    private List<MatchCandidate> semanticCandidates(String normalized) {
        List<SemanticHit> hits = semanticSearcher.search(normalized, semanticProperties.getK());
        if (hits.isEmpty()) {
            return List.of();
        }
        Map<String, SemanticHit> hitsById = new LinkedHashMap<>();
        for (SemanticHit hit : hits) {
            hitsById.putIfAbsent(key(hit.songId()), hit);
        }

        List<Song> songs;
        try {
            songs = catalogStore.findByIds(hits.stream().map(SemanticHit::songId).toList());
        } catch (CatalogUnavailableException e) {
            log.warn("semantic strategy skipped, catalog lookup failed: {}", e.getMessage());
            return List.of();
        }

        String mood = MoodDetector.detect(normalized);
        List<MatchCandidate> candidates = new ArrayList<>();
        for (Song song : songs) {
            if (candidates.size() >= semanticProperties.getResultLimit()) {
                break;
            }
            SemanticHit hit = hitsById.get(key(song.id()));
            if (hit == null) {
                continue;
            }
            MatchStrategy strategy = hit.isBlended() ? MatchStrategy.ABOUTNESS_RERANK : MatchStrategy.EMBEDDING;
            candidates.add(new MatchCandidate(
                song,
                hit.score(),
                strategy,
                MatchReason.semantic(mood, hit.similarity(), hit.metaDistance(), hit.aboutnessDistance())
            ));
        }
        if (candidates.isEmpty()) {
            log.warn("semantic hits={} but none hydrated to an eligible song", hits.size());
        }
        return candidates;
    }

    private List<MatchCandidate> popularityFallback(boolean excludeExplicit) {
        int size = Math.max(1, properties.getFallbackSize());
        Set<String> excludedTags = excludeExplicit ? explicitTags() : Set.of();
        List<MatchCandidate> candidates = new ArrayList<>(size);
        for (Song song : catalogStore.findTopByPopularity(size, excludedTags)) {
            candidates.add(new MatchCandidate(
                song,
                properties.getFallbackScore(),
                MatchStrategy.POPULARITY_FALLBACK,
                MatchReason.fallback()
            ));
        }
        log.debug("popularity fallback exclude_explicit={} candidates={}", excludeExplicit, candidates.size());
        return candidates;
    }

    private List<MatchCandidate> applyRecencyFilter(List<MatchCandidate> candidates, RecentHistory history) {
        if (history.isEmpty() || candidates.isEmpty()) {
            return candidates;
        }
        Set<String> recent = history.idKeys();
        List<MatchCandidate> filtered = candidates.stream()
            .filter(candidate -> !recent.contains(key(candidate.song().id())))
            .toList();
        if (filtered.size() < properties.getRecencyFloor()) {
            log.debug("recency filter skipped kept={} floor={}", filtered.size(), properties.getRecencyFloor());
            return candidates;
        }
        return filtered;
    }

    private List<MatchCandidate> removeExplicit(List<MatchCandidate> candidates) {
        Set<String> explicitTags = explicitTags();
        return candidates.stream()
            .filter(candidate -> !candidate.song().hasAnyTag(explicitTags))
            .toList();
    }

    private boolean historySpansEras(RecentHistory history) {
        if (history.isEmpty()) {
            return false;
        }
        try {
            List<Song> recentSongs = catalogStore.findByIds(history.mostRecent(properties.getHistoryWindow()));
            return DiversitySelector.spansMultipleEras(recentSongs);
        } catch (CatalogUnavailableException e) {
            log.debug("recent history lookup failed, keeping diversity strict: {}", e.getMessage());
            return false;
        }
    }

    private MatchExplanation explain(
        MatchCandidate primary,
        int totalCandidates,
        String fallbackReason,
        ModerationAnnotation moderation
    ) {
        MatchReason reason = primary.reason();
        List<String> tags = primary.song().tags().stream().sorted().toList();
        return new MatchExplanation(
            reason.matchedPhrase(),
            reason.matchType(),
            reason.similarity(),
            reason.mood(),
            tags,
            fallbackReason,
            reason.metaDistance(),
            reason.aboutnessDistance(),
            primary.rawScore(),
            totalCandidates,
            moderation
        );
    }

    private void recordMetrics(String strategy, String fallbackReason) {
        meterRegistry.counter("ms_match_strategy_total", "strategy", strategy).increment();
        if (fallbackReason != null) {
            meterRegistry.counter("ms_match_fallback_total", "reason", fallbackReason).increment();
        }
    }

    private Set<String> explicitTags() {
        List<String> tags = properties.getExplicitTags();
        if (tags == null) {
            return Set.of();
        }
        return tags.stream().map(tag -> tag.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    }

    private static String key(String songId) {
        return songId.toLowerCase(Locale.ROOT);
    }
}
