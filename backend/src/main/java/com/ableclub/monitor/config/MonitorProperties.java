package com.ableclub.monitor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {
    private static final String DEFAULT_USER_AGENT = "ableclub-monitor/0.1 (+contact)";

    private Scheduler scheduler = new Scheduler();
    private Job job = new Job();
    private Scraper scraper = new Scraper();
    private Notify notify = new Notify();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Job getJob() {
        return job;
    }

    public void setJob(Job job) {
        this.job = job;
    }

    public Scraper getScraper() {
        return scraper;
    }

    public void setScraper(Scraper scraper) {
        this.scraper = scraper;
    }

    public Notify getNotify() {
        return notify;
    }

    public void setNotify(Notify notify) {
        this.notify = notify;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration historyRetention = Duration.ofDays(90);
        private int workerThreads = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getHistoryRetention() {
            if (historyRetention == null || historyRetention.isNegative() || historyRetention.isZero()) {
                return Duration.ofDays(90);
            }
            return historyRetention;
        }

        public void setHistoryRetention(Duration historyRetention) {
            this.historyRetention = historyRetention;
        }

        public int getWorkerThreads() {
            return Math.max(1, workerThreads);
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = Math.max(1, workerThreads);
        }
    }

    /**
     * Raw job settings. They are validated when the job is registered, so a
     * broken value fails startup instead of being silently clamped.
     */
    public static class Job {
        private String name = "event-notification-pipeline";
        private Duration interval = Duration.ofHours(1);
        private int maxRetries = 3;
        private List<Duration> backoffSchedule = new ArrayList<>(List.of(
            Duration.ofMinutes(1),
            Duration.ofMinutes(2),
            Duration.ofMinutes(3)
        ));
        private int pauseThreshold = 3;
        private Duration pauseDuration = Duration.ofHours(6);

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public List<Duration> getBackoffSchedule() {
            return backoffSchedule;
        }

        public void setBackoffSchedule(List<Duration> backoffSchedule) {
            this.backoffSchedule = backoffSchedule;
        }

        public int getPauseThreshold() {
            return pauseThreshold;
        }

        public void setPauseThreshold(int pauseThreshold) {
            this.pauseThreshold = pauseThreshold;
        }

        public Duration getPauseDuration() {
            return pauseDuration;
        }

        public void setPauseDuration(Duration pauseDuration) {
            this.pauseDuration = pauseDuration;
        }
    }

    public static class Scraper {
        private String baseUrl = "https://ableclub.advantech.com.tw";
        private String eventsPath = "/Taiwan/zh-tw/Event";
        private String userAgent;
        private int timeoutSeconds = 20;
        private int maxPages = 20;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getEventsPath() {
            return eventsPath;
        }

        public void setEventsPath(String eventsPath) {
            this.eventsPath = eventsPath;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public String getEventsUrl() {
            String base = baseUrl == null ? "" : baseUrl.trim();
            if (base.endsWith("/")) {
                base = base.substring(0, base.length() - 1);
            }
            String path = eventsPath == null ? "" : eventsPath.trim();
            if (!path.isEmpty() && !path.startsWith("/")) {
                path = "/" + path;
            }
            return base + path;
        }
    }

    public static class Notify {
        private List<String> adminAddresses = new ArrayList<>();
        private int requestTimeoutSeconds = 10;
        private Telegram telegram = new Telegram();
        private Email email = new Email();

        public List<String> getAdminAddresses() {
            if (adminAddresses == null) {
                return List.of();
            }
            return adminAddresses.stream()
                .filter(address -> address != null && !address.isBlank())
                .map(String::trim)
                .toList();
        }

        public void setAdminAddresses(List<String> adminAddresses) {
            this.adminAddresses = adminAddresses;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public Telegram getTelegram() {
            return telegram;
        }

        public void setTelegram(Telegram telegram) {
            this.telegram = telegram;
        }

        public Email getEmail() {
            return email;
        }

        public void setEmail(Email email) {
            this.email = email;
        }
    }

    public static class Telegram {
        private String apiBaseUrl = "https://api.telegram.org";
        private String botToken;

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }

        public String getBotToken() {
            return botToken;
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }

        public boolean isConfigured() {
            return botToken != null && !botToken.isBlank()
                && apiBaseUrl != null && !apiBaseUrl.isBlank();
        }
    }

    public static class Email {
        private String relayUrl;
        private String apiKey;
        private String fromAddress = "monitor@ableclub.local";

        public String getRelayUrl() {
            return relayUrl;
        }

        public void setRelayUrl(String relayUrl) {
            this.relayUrl = relayUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getFromAddress() {
            return fromAddress;
        }

        public void setFromAddress(String fromAddress) {
            this.fromAddress = fromAddress;
        }

        public boolean isConfigured() {
            return relayUrl != null && !relayUrl.isBlank();
        }
    }
}
