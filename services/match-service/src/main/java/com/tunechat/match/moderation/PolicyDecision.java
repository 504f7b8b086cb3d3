package com.tunechat.match.moderation;

/**
 * Returned instead of a match when a message is declined.
 */
public record PolicyDecision(ModerationCategory category, String reason, String message) {
    static final String DEFAULT_MESSAGE = "Unable to process this message. Please try something else.";

    public static PolicyDecision decline(ModerationCategory category, String reason) {
        return new PolicyDecision(category, reason, messageFor(category));
    }

    static String messageFor(ModerationCategory category) {
        if (category == null) {
            return DEFAULT_MESSAGE;
        }
        switch (category) {
            case SLUR:
                return "Message contains inappropriate language and cannot be processed.";
            case HARASSMENT:
                return "Content appears to contain harmful language. Please try a different message.";
            case NSFW:
                return "This room has family-friendly settings enabled. Please try a different message.";
            case SPAM:
                return "Message appears to be spam. Please try a simpler query.";
            default:
                return DEFAULT_MESSAGE;
        }
    }
}
