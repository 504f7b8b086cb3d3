package com.tunechat.match.moderation;

import com.tunechat.match.match.MatchResult;

/**
 * Either a match or a policy decision, never both.
 */
public record ChatMatchOutcome(MatchResult match, PolicyDecision policy) {
    public static ChatMatchOutcome matched(MatchResult match) {
        return new ChatMatchOutcome(match, null);
    }

    public static ChatMatchOutcome blocked(PolicyDecision policy) {
        return new ChatMatchOutcome(null, policy);
    }

    public boolean isBlocked() {
        return policy != null;
    }
}
