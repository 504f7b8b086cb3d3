package com.tunechat.match.api;

import com.tunechat.match.api.dto.AddPhraseRequest;
import com.tunechat.match.api.dto.ErrorResponse;
import com.tunechat.match.api.dto.LexiconPhraseResponse;
import com.tunechat.match.api.dto.LexiconStatsResponse;
import com.tunechat.match.lexicon.LexiconStats;
import com.tunechat.match.lexicon.PhraseLexicon;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/lexicon")
public class LexiconAdminController {
    private static final Logger log = LoggerFactory.getLogger(LexiconAdminController.class);

    private final PhraseLexicon lexicon;

    public LexiconAdminController(PhraseLexicon lexicon) {
        this.lexicon = lexicon;
    }

    @PostMapping("/phrases")
    public ResponseEntity<?> addPhrase(
        @RequestBody(required = false) AddPhraseRequest request,
        @RequestHeader(value = RequestIdUtil.TRACE_ID_HEADER, required = false) String traceHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_ID_HEADER, required = false) String requestHeader
    ) {
        String traceId = RequestIdUtil.resolveOrGenerate(traceHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestHeader);
        if (request == null || request.getPhrase() == null || request.getPhrase().isBlank()) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "phrase is required", traceId, requestId)
            );
        }
        if (request.getSongIds() == null || request.getSongIds().isEmpty()) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "song_ids is required", traceId, requestId)
            );
        }

        String phrase;
        try {
            phrase = lexicon.addPhrase(request.getPhrase(), request.getSongIds());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", e.getMessage(), traceId, requestId)
            );
        }
        log.info("lexicon phrase added phrase=\"{}\" song_ids={}", phrase, request.getSongIds().size());
        return ResponseEntity.ok(new LexiconPhraseResponse(phrase, List.copyOf(lexicon.songIdsFor(phrase))));
    }

    @GetMapping("/stats")
    public LexiconStatsResponse stats() {
        LexiconStats stats = lexicon.stats();
        LexiconStatsResponse response = new LexiconStatsResponse();
        response.setTotalPhrases(stats.totalPhrases());
        response.setTotalSongMappings(stats.totalSongMappings());
        response.setAverageSongsPerPhrase(stats.averageSongsPerPhrase());
        response.setIndexedWords(stats.indexedWords());
        return response;
    }

    @GetMapping("/words/{word}")
    public Map<String, Object> phrasesForWord(@PathVariable("word") String word) {
        return Map.of("word", word, "phrases", lexicon.phrasesForWord(word));
    }
}
