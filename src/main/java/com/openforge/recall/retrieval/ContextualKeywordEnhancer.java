package com.openforge.recall.retrieval;

import com.openforge.recall.persona.PersonaMode;
import com.openforge.recall.persona.PersonaState;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Widens the base keywords with terms from the recent conversation and with
 * domain vocabulary implied by the persona and the tone of the message.
 *
 * Order of the result:
 *
 *   base keywords          always kept, never cut by the cap
 *   history keywords       up to max-history-keywords
 *   preset + mode terms    first matching preset only, then mode; up to 4
 *   emotional terms        up to 2
 *
 * Also builds the text embedded for the semantic lanes, which carries the
 * last message of the conversation when there is one.
 */
@Component
public class ContextualKeywordEnhancer {

    private static final int MAX_PERSONA_TERMS   = 4;
    private static final int MAX_EMOTIONAL_TERMS = 2;

    private record Cue(Pattern pattern, List<String> terms) {}

    private static final List<Cue> PRESET_CUES = List.of(
            new Cue(Pattern.compile("gaming|patch"),
                    List.of("dead by daylight", "gaming", "killer", "survivor", "patch", "bhvr")),
            new Cue(Pattern.compile("story"),
                    List.of("family", "newark", "italian", "childhood", "stories", "memories")),
            new Cue(Pattern.compile("roast|unhinged"),
                    List.of("roast", "insults", "comeback", "trash talk")));

    private static final List<Cue> EMOTIONAL_CUES = List.of(
            new Cue(Pattern.compile("angry|mad|pissed|frustrated"), List.of("frustration", "anger")),
            new Cue(Pattern.compile("happy|excited|awesome"),       List.of("joy", "excitement")),
            new Cue(Pattern.compile("sad|depressed|upset"),         List.of("sadness", "support")),
            new Cue(Pattern.compile("question|how|what|why"),       List.of("question", "explanation")));

    private final int maxTerms;
    private final int maxHistoryTerms;

    @Autowired
    public ContextualKeywordEnhancer(RetrievalProperties props) {
        this(props.maxEnhancedKeywords(), props.maxHistoryKeywords());
    }

    public ContextualKeywordEnhancer(int maxTerms, int maxHistoryTerms) {
        this.maxTerms        = maxTerms;
        this.maxHistoryTerms = maxHistoryTerms;
    }

    public List<String> enhance(List<String> baseKeywords, String message, PersonaState persona) {
        return enhance(baseKeywords, List.of(), message, persona);
    }

    public List<String> enhance(List<String> baseKeywords, List<String> historyKeywords,
                                String message, PersonaState persona) {
        Set<String> out = new LinkedHashSet<>(baseKeywords);

        addUpTo(out, historyKeywords, maxHistoryTerms);
        addUpTo(out, personaTerms(persona), MAX_PERSONA_TERMS);

        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        List<String> emotional = new ArrayList<>();
        for (Cue cue : EMOTIONAL_CUES) {
            if (cue.pattern().matcher(lower).find()) emotional.addAll(cue.terms());
        }
        addUpTo(out, emotional, MAX_EMOTIONAL_TERMS);

        int cap = Math.max(maxTerms, baseKeywords.size());
        return out.stream().limit(cap).toList();
    }

    /**
     * Text to embed for the semantic lanes.  When the conversation's last
     * message differs from the current one it is quoted in front of it.
     */
    public static String contextualQuery(String message, List<String> recentMessages) {
        if (recentMessages == null || recentMessages.isEmpty()) return message;
        String last = recentMessages.get(recentMessages.size() - 1);
        if (last == null || last.isBlank() || last.equals(message)) return message;
        return "In context of: \"" + last + "\" - User asks: " + message;
    }

    /** Only the first matching preset cue contributes. */
    private static List<String> personaTerms(PersonaState persona) {
        if (persona == null) return List.of();
        List<String> terms = new ArrayList<>();
        if (persona.preset() != null) {
            String preset = persona.preset().toLowerCase(Locale.ROOT);
            for (Cue cue : PRESET_CUES) {
                if (cue.pattern().matcher(preset).find()) {
                    terms.addAll(cue.terms());
                    break;
                }
            }
        }
        terms.addAll(modeTerms(persona.mode()));
        return terms.size() > MAX_PERSONA_TERMS ? terms.subList(0, MAX_PERSONA_TERMS) : terms;
    }

    private static List<String> modeTerms(PersonaMode mode) {
        return switch (mode) {
            case PODCAST   -> List.of("episode", "show", "podcast");
            case STREAMING -> List.of("stream", "twitch", "viewers");
            case DISCORD   -> List.of("server", "discord", "channel");
            case CHAT      -> List.of();
        };
    }

    /** Adds up to {@code limit} terms that are not already present. */
    private static void addUpTo(Set<String> out, List<String> candidates, int limit) {
        int added = 0;
        for (String term : candidates) {
            if (added == limit) return;
            if (out.add(term)) added++;
        }
    }
}
