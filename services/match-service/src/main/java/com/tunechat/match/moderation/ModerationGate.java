package com.tunechat.match.moderation;

import com.tunechat.match.match.MatchOrchestrator;
import com.tunechat.match.match.MatchResult;
import com.tunechat.match.match.RecentHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Screens chat text before matching. Allowed text is matched as-is, filtered text is matched
 * through its replacement, and hard-blocked text never reaches the orchestrator.
 */
@Service
public class ModerationGate {
    private static final Logger log = LoggerFactory.getLogger(ModerationGate.class);

    private final ModerationClient moderationClient;
    private final MatchOrchestrator orchestrator;
    private final ModerationProperties properties;

    public ModerationGate(
        ModerationClient moderationClient,
        MatchOrchestrator orchestrator,
        ModerationProperties properties
    ) {
        this.moderationClient = moderationClient;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    public ChatMatchOutcome process(String text, boolean allowExplicit, String userId, RecentHistory recentHistory) {
        ModerationConfig config = new ModerationConfig(properties.isStrictMode(), properties.isAllowNsfw());
        ModerationResult verdict;
        try {
            verdict = moderationClient.moderate(text, config);
        } catch (ModerationUnavailableException e) {
            if (!properties.isFailOpen()) {
                log.warn("moderation unavailable, declining message: {}", e.getMessage());
                return ChatMatchOutcome.blocked(new PolicyDecision(null, e.getMessage(), PolicyDecision.DEFAULT_MESSAGE));
            }
            log.warn("moderation unavailable, treating message as clean: {}", e.getMessage());
            verdict = ModerationResult.clean();
        }

        if (verdict.allowed()) {
            MatchResult result = orchestrator.matchSongs(
                text,
                allowExplicit,
                userId,
                recentHistory,
                ModerationAnnotation.clean(text)
            );
            return ChatMatchOutcome.matched(result);
        }

        if (verdict.hasReplacement()) {
            log.info(
                "moderation substituted message user={} category={}",
                userId,
                verdict.category().label()
            );
            MatchResult result = orchestrator.matchSongs(
                verdict.replacementText(),
                allowExplicit,
                userId,
                recentHistory,
                new ModerationAnnotation(verdict.category(), true, text)
            );
            return ChatMatchOutcome.matched(result);
        }

        log.info("moderation blocked message user={} category={}", userId, verdict.category().label());
        return ChatMatchOutcome.blocked(PolicyDecision.decline(verdict.category(), verdict.reason()));
    }
}
