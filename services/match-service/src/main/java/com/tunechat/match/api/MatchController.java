package com.tunechat.match.api;

import com.tunechat.match.api.dto.ErrorResponse;
import com.tunechat.match.api.dto.MatchRequest;
import com.tunechat.match.api.dto.MatchResponse;
import com.tunechat.match.match.RecentHistory;
import com.tunechat.match.moderation.ChatMatchOutcome;
import com.tunechat.match.moderation.ModerationGate;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MatchController {
    private final ModerationGate moderationGate;

    public MatchController(ModerationGate moderationGate) {
        this.moderationGate = moderationGate;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/match")
    public ResponseEntity<?> match(
        @RequestBody(required = false) MatchRequest request,
        @RequestHeader(value = RequestIdUtil.TRACE_ID_HEADER, required = false) String traceHeader,
        @RequestHeader(value = RequestIdUtil.REQUEST_ID_HEADER, required = false) String requestHeader
    ) {
        long started = System.nanoTime();
        String traceId = RequestIdUtil.resolveOrGenerate(traceHeader);
        String requestId = RequestIdUtil.resolveOrGenerate(requestHeader);

        if (request == null || request.getText() == null) {
            return ResponseEntity.badRequest().body(
                new ErrorResponse("bad_request", "text is required", traceId, requestId)
            );
        }

        boolean allowExplicit = Boolean.TRUE.equals(request.getAllowExplicit());
        ChatMatchOutcome outcome = moderationGate.process(
            request.getText(),
            allowExplicit,
            request.getUserId(),
            new RecentHistory(request.getRecentSongIds())
        );

        MatchResponse response = outcome.isBlocked()
            ? MatchResponseMapper.blocked(outcome.policy())
            : MatchResponseMapper.matched(outcome.match());
        response.setTraceId(traceId);
        response.setRequestId(requestId);
        response.setTookMs((System.nanoTime() - started) / 1_000_000L);
        return ResponseEntity.ok(response);
    }
}
