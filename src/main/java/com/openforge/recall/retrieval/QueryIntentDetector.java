package com.openforge.recall.retrieval;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class QueryIntentDetector {

    private static final Pattern TELL_ABOUT = Pattern.compile("^(tell me|explain|describe).*(about|regarding)");
    private static final Pattern OPINION    = Pattern.compile("(what do you think|opinion|how do you feel).*(on|about)");
    private static final Pattern REMIND     = Pattern.compile("(remind me|remember when)");
    private static final Pattern HOW_TO     = Pattern.compile("(how (do|can) (i|you))");

    public QueryIntent detect(String message) {
        if (message == null || message.isBlank()) return QueryIntent.GENERAL;
        String lower = message.toLowerCase(Locale.ROOT).trim();
        if (TELL_ABOUT.matcher(lower).find()) return QueryIntent.TELL_ABOUT;
        if (OPINION.matcher(lower).find())    return QueryIntent.OPINION;
        if (REMIND.matcher(lower).find())     return QueryIntent.REMIND;
        if (HOW_TO.matcher(lower).find())     return QueryIntent.HOW_TO;
        return QueryIntent.GENERAL;
    }
}
