package com.tunechat.match.api;

import com.tunechat.match.api.dto.MatchResponse;
import com.tunechat.match.catalog.Song;
import com.tunechat.match.match.MatchCandidate;
import com.tunechat.match.match.MatchExplanation;
import com.tunechat.match.match.MatchResult;
import com.tunechat.match.moderation.ModerationAnnotation;
import com.tunechat.match.moderation.PolicyDecision;
import java.util.ArrayList;
import java.util.List;

final class MatchResponseMapper {
    private MatchResponseMapper() {
    }

    static MatchResponse matched(MatchResult result) {
        MatchResponse response = new MatchResponse();
        response.setStrategy(result.strategy());
        response.setConfidence(result.confidence());
        response.setPrimary(songView(result.primary()));
        List<MatchResponse.SongView> alternates = new ArrayList<>(result.alternates().size());
        for (MatchCandidate alternate : result.alternates()) {
            alternates.add(songView(alternate));
        }
        response.setAlternates(alternates);
        response.setWhy(why(result.explanation()));
        ModerationAnnotation annotation = result.explanation().moderation();
        if (annotation != null) {
            MatchResponse.ModerationView moderation = new MatchResponse.ModerationView();
            moderation.setCategory(annotation.category().label());
            moderation.setWasFiltered(annotation.wasFiltered());
            moderation.setOriginalText(annotation.originalText());
            response.setModeration(moderation);
        }
        return response;
    }

    static MatchResponse blocked(PolicyDecision decision) {
        MatchResponse response = new MatchResponse();
        response.setBlocked(true);
        MatchResponse.PolicyView policy = new MatchResponse.PolicyView();
        policy.setCategory(decision.category() == null ? null : decision.category().label());
        policy.setReason(decision.reason());
        policy.setMessage(decision.message());
        response.setPolicy(policy);
        return response;
    }

    private static MatchResponse.SongView songView(MatchCandidate candidate) {
        Song song = candidate.song();
        MatchResponse.SongView view = new MatchResponse.SongView();
        view.setId(song.id());
        view.setTitle(song.title());
        view.setArtist(song.artist());
        view.setYear(song.year());
        view.setPopularity(song.popularity());
        view.setTags(song.tags().stream().sorted().toList());
        view.setScore(candidate.rawScore());
        view.setStrategy(candidate.strategy().tag());
        view.setCanonicalId(song.canonicalId());
        return view;
    }

    private static MatchResponse.Why why(MatchExplanation explanation) {
        MatchResponse.Why why = new MatchResponse.Why();
        why.setMatchedPhrase(explanation.matchedPhrase());
        why.setMatchType(explanation.matchType());
        why.setSimilarity(explanation.similarity());
        why.setMood(explanation.mood());
        why.setTags(explanation.tags());
        why.setFallbackReason(explanation.fallbackReason());
        why.setMetaDistance(explanation.metaDistance());
        why.setAboutnessDistance(explanation.aboutnessDistance());
        why.setPrimaryScore(explanation.primaryScore());
        why.setTotalCandidates(explanation.totalCandidates());
        return why;
    }
}
