package guraa.sitephoto.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the application
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Storage storage = new Storage();
    private final Phase phase = new Phase();
    private final Matching matching = new Matching();
    private final Reports reports = new Reports();

    /**
     * Known sites and their aliases, e.g. {@code ALPHA -> [alpha, a]}.
     */
    private Map<String, List<String>> sites = new LinkedHashMap<>();

    /**
     * Task directory names recognised when listing the catalog.
     */
    private List<String> tasks = new ArrayList<>(List.of("grass_cutting", "drainage_cleaning"));

    public Storage getStorage() {
        return storage;
    }

    public Phase getPhase() {
        return phase;
    }

    public Matching getMatching() {
        return matching;
    }

    public Reports getReports() {
        return reports;
    }

    public Map<String, List<String>> getSites() {
        return sites;
    }

    public void setSites(Map<String, List<String>> sites) {
        this.sites = sites;
    }

    public List<String> getTasks() {
        return tasks;
    }

    public void setTasks(List<String> tasks) {
        this.tasks = tasks;
    }

    /**
     * Storage configuration properties
     */
    public static class Storage {
        private String saveRoot;

        public String getSaveRoot() {
            return saveRoot;
        }

        public void setSaveRoot(String saveRoot) {
            this.saveRoot = saveRoot;
        }
    }

    /**
     * Time-of-day window used to classify photos as before or after
     */
    public static class Phase {
        private int beforeHour = 12;
        private int afterHour = 15;
        private String zoneId = "UTC";

        public int getBeforeHour() {
            return beforeHour;
        }

        public void setBeforeHour(int beforeHour) {
            this.beforeHour = beforeHour;
        }

        public int getAfterHour() {
            return afterHour;
        }

        public void setAfterHour(int afterHour) {
            this.afterHour = afterHour;
        }

        public String getZoneId() {
            return zoneId;
        }

        public void setZoneId(String zoneId) {
            this.zoneId = zoneId;
        }
    }

    /**
     * Feature matching tuning knobs
     */
    public static class Matching {
        private int maxSide = 1600;
        private int maxFeatures = 600;
        private int topK = 5;
        private double ratio = 0.75;
        private double minScore = 0.0;
        private String pairingMode = "GREEDY";
        private boolean allowSharedAfter = false;
        private int timeoutMinutes = 10;
        private int threads = Runtime.getRuntime().availableProcessors();

        public int getMaxSide() {
            return maxSide;
        }

        public void setMaxSide(int maxSide) {
            this.maxSide = maxSide;
        }

        public int getMaxFeatures() {
            return maxFeatures;
        }

        public void setMaxFeatures(int maxFeatures) {
            this.maxFeatures = maxFeatures;
        }

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public double getRatio() {
            return ratio;
        }

        public void setRatio(double ratio) {
            this.ratio = ratio;
        }

        public double getMinScore() {
            return minScore;
        }

        public void setMinScore(double minScore) {
            this.minScore = minScore;
        }

        public String getPairingMode() {
            return pairingMode;
        }

        public void setPairingMode(String pairingMode) {
            this.pairingMode = pairingMode;
        }

        public boolean isAllowSharedAfter() {
            return allowSharedAfter;
        }

        public void setAllowSharedAfter(boolean allowSharedAfter) {
            this.allowSharedAfter = allowSharedAfter;
        }

        public int getTimeoutMinutes() {
            return timeoutMinutes;
        }

        public void setTimeoutMinutes(int timeoutMinutes) {
            this.timeoutMinutes = timeoutMinutes;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    /**
     * Report job bookkeeping
     */
    public static class Reports {
        private long resultExpirationMinutes = 60;

        public long getResultExpirationMinutes() {
            return resultExpirationMinutes;
        }

        public void setResultExpirationMinutes(long resultExpirationMinutes) {
            this.resultExpirationMinutes = resultExpirationMinutes;
        }
    }
}
