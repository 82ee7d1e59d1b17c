package guraa.sitephoto.service;

import guraa.sitephoto.model.Phase;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads site, task and phase hints out of free-text captions and command arguments.
 * Phase words are accepted in Malay and English, including common chat abbreviations.
 */
@Component
public class CaptionHints {

    public static final String TASK_GRASS = "grass_cutting";
    public static final String TASK_DRAINAGE = "drainage_cleaning";

    static final List<String> BEFORE_WORDS = List.of("sebelum", "sblm", "sblum", "sebelom", "before");
    static final List<String> AFTER_WORDS = List.of("selepas", "slps", "slpas", "after", "lepas");
    static final List<String> DRAINAGE_WORDS = List.of("longkang", "parit", "drain");

    private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[\\s,;/\\-_.]+");
    private static final Pattern ZONE_LETTER = Pattern.compile("\\bzone\\s*([a-z])\\b");

    private final SiteRegistry siteRegistry;

    public CaptionHints(SiteRegistry siteRegistry) {
        this.siteRegistry = siteRegistry;
    }

    /**
     * Phase named by a single word, e.g. a command argument.
     */
    public Optional<Phase> phaseFromWord(String word) {
        if (word == null) {
            return Optional.empty();
        }
        String w = word.trim().toLowerCase(Locale.ROOT);
        if (BEFORE_WORDS.contains(w)) {
            return Optional.of(Phase.BEFORE);
        }
        if (AFTER_WORDS.contains(w)) {
            return Optional.of(Phase.AFTER);
        }
        return Optional.empty();
    }

    /**
     * Phase mentioned anywhere in a caption. Before-words win when both appear.
     */
    public Optional<Phase> phaseFromCaption(String caption) {
        String text = normalise(caption);
        if (BEFORE_WORDS.stream().anyMatch(text::contains)) {
            return Optional.of(Phase.BEFORE);
        }
        if (AFTER_WORDS.stream().anyMatch(text::contains)) {
            return Optional.of(Phase.AFTER);
        }
        return Optional.empty();
    }

    /**
     * Site named by an alias token, or by a "zone X" phrase.
     */
    public Optional<String> siteFromText(String text) {
        String t = normalise(text);
        for (String token : TOKEN_SEPARATORS.split(t)) {
            Optional<String> site = siteRegistry.resolve(token);
            if (site.isPresent()) {
                return site;
            }
        }
        Matcher zone = ZONE_LETTER.matcher(t);
        if (zone.find()) {
            return siteRegistry.resolve(zone.group(1));
        }
        return Optional.empty();
    }

    /**
     * Task implied by a caption: drainage keywords select drainage cleaning, anything else grass cutting.
     */
    public String taskFromCaption(String caption) {
        String text = normalise(caption);
        return DRAINAGE_WORDS.stream().anyMatch(text::contains) ? TASK_DRAINAGE : TASK_GRASS;
    }

    private static String normalise(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
