package guraa.sitephoto.service;

import guraa.sitephoto.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Known sites and the short aliases senders use for them.
 */
@Slf4j
@Component
public class SiteRegistry {

    public static final String UNSPECIFIED = "UNSPECIFIED";

    private static final Map<String, List<String>> DEFAULT_SITES = defaultSites();

    private final Map<String, String> siteByAlias = new ConcurrentHashMap<>();
    private final Map<String, List<String>> aliasesBySite = new LinkedHashMap<>();

    public SiteRegistry(AppProperties properties) {
        Map<String, List<String>> configured = properties.getSites();
        Map<String, List<String>> sites = configured == null || configured.isEmpty() ? DEFAULT_SITES : configured;
        sites.forEach((name, aliases) -> {
            register(name, null);
            if (aliases != null) {
                aliases.forEach(alias -> register(name, alias));
            }
        });
        log.info("Site registry initialised with {} sites", aliasesBySite.size());
    }

    /**
     * Resolve a token to a canonical site name.
     *
     * @param token A site name or alias, any case
     * @return The canonical (upper-case) site name
     */
    public Optional<String> resolve(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(siteByAlias.get(token.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Add a site at runtime.
     *
     * @param name The site name
     * @param shortcut Optional extra alias
     * @return false if the site already exists
     */
    public synchronized boolean addSite(String name, String shortcut) {
        String site = name.trim().toUpperCase(Locale.ROOT);
        if (aliasesBySite.containsKey(site)) {
            return false;
        }
        register(site, null);
        if (shortcut != null && !shortcut.isBlank()) {
            register(site, shortcut);
        }
        log.info("Added site {} (shortcut: {})", site, shortcut);
        return true;
    }

    public synchronized Map<String, List<String>> getSites() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        aliasesBySite.forEach((site, aliases) -> copy.put(site, List.copyOf(aliases)));
        return copy;
    }

    private synchronized void register(String name, String alias) {
        String site = name.trim().toUpperCase(Locale.ROOT);
        List<String> aliases = aliasesBySite.computeIfAbsent(site, key -> new ArrayList<>());
        String key = (alias == null ? site : alias.trim()).toLowerCase(Locale.ROOT);
        if (!aliases.contains(key)) {
            aliases.add(key);
        }
        siteByAlias.put(key, site);
    }

    private static Map<String, List<String>> defaultSites() {
        Map<String, List<String>> sites = new LinkedHashMap<>();
        sites.put("ALPHA", List.of("alpha", "a"));
        sites.put("BRAVO", List.of("bravo", "b"));
        sites.put("CHARLIE", List.of("charlie", "c"));
        sites.put("DELTA", List.of("delta", "d"));
        sites.put("ECHO", List.of("echo", "e"));
        return sites;
    }
}
