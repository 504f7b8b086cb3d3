package com.tunechat.match.match;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

final class MoodDetector {
    static final String NEUTRAL = "neutral";

    // first match wins
    private static final Map<String, Pattern> MOODS = new LinkedHashMap<>();

    static {
        MOODS.put("happy", Pattern.compile("happy|joy|upbeat|dance|party|celebrate"));
        MOODS.put("sad", Pattern.compile("sad|depressed|cry|lonely|heartbreak"));
        MOODS.put("angry", Pattern.compile("angry|mad|rage|furious|hate"));
        MOODS.put("romantic", Pattern.compile("love|romantic|kiss|heart|valentine"));
        MOODS.put("chill", Pattern.compile("chill|relax|calm|peaceful|mellow"));
        MOODS.put("energetic", Pattern.compile("energy|pump|workout|intense|power"));
    }

    private MoodDetector() {
    }

    static String detect(String text) {
        if (text == null || text.isBlank()) {
            return NEUTRAL;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Pattern> mood : MOODS.entrySet()) {
            if (mood.getValue().matcher(lower).find()) {
                return mood.getKey();
            }
        }
        return NEUTRAL;
    }
}
