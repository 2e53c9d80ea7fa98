package com.studfee.harvester.config;

import com.studfee.harvester.crawl.model.FactYearMapping;
import com.studfee.harvester.crawl.resolve.ResolutionMethod;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) "
            + "Chrome/124.0.0.0 Safari/537.36";
    private static final int MAX_ATTEMPTS_CAP = 5;

    private String userAgent;
    private int requestTimeoutSeconds = 12;
    private int requestMaxAttempts = 3;
    private int retryDelayMinMs = 1000;
    private int retryDelayMaxMs = 4000;
    private int pageDelayMinMs = 1000;
    private int pageDelayMaxMs = 2500;
    private Crawl crawl = new Crawl();
    private Site site = new Site();
    private Resolution resolution = new Resolution();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxAttempts() {
        return Math.min(MAX_ATTEMPTS_CAP, Math.max(1, requestMaxAttempts));
    }

    public void setRequestMaxAttempts(int requestMaxAttempts) {
        this.requestMaxAttempts = requestMaxAttempts;
    }

    public int getRetryDelayMinMs() {
        return Math.max(0, retryDelayMinMs);
    }

    public void setRetryDelayMinMs(int retryDelayMinMs) {
        this.retryDelayMinMs = retryDelayMinMs;
    }

    public int getRetryDelayMaxMs() {
        return Math.max(getRetryDelayMinMs(), retryDelayMaxMs);
    }

    public void setRetryDelayMaxMs(int retryDelayMaxMs) {
        this.retryDelayMaxMs = retryDelayMaxMs;
    }

    public int getPageDelayMinMs() {
        return Math.max(0, pageDelayMinMs);
    }

    public void setPageDelayMinMs(int pageDelayMinMs) {
        this.pageDelayMinMs = pageDelayMinMs;
    }

    public int getPageDelayMaxMs() {
        return Math.max(getPageDelayMinMs(), pageDelayMaxMs);
    }

    public void setPageDelayMaxMs(int pageDelayMaxMs) {
        this.pageDelayMaxMs = pageDelayMaxMs;
    }

    public Crawl getCrawl() {
        return crawl;
    }

    public void setCrawl(Crawl crawl) {
        this.crawl = crawl;
    }

    public Site getSite() {
        return site;
    }

    public void setSite(Site site) {
        this.site = site;
    }

    public Resolution getResolution() {
        return resolution;
    }

    public void setResolution(Resolution resolution) {
        this.resolution = resolution;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Crawl {
        private int firstPageYear = 2006;
        private int lastPageYear = 2025;
        private String sectionMarker = "Weanlings";
        private int factYearMin = 1990;
        private int factYearMax = 2030;
        private FactYearMapping factYearMapping = FactYearMapping.EMBEDDED_YEAR;

        public int getFirstPageYear() {
            return firstPageYear;
        }

        public void setFirstPageYear(int firstPageYear) {
            this.firstPageYear = firstPageYear;
        }

        public int getLastPageYear() {
            return lastPageYear;
        }

        public void setLastPageYear(int lastPageYear) {
            this.lastPageYear = lastPageYear;
        }

        public String getSectionMarker() {
            return sectionMarker;
        }

        public void setSectionMarker(String sectionMarker) {
            this.sectionMarker = sectionMarker;
        }

        public int getFactYearMin() {
            return factYearMin;
        }

        public void setFactYearMin(int factYearMin) {
            this.factYearMin = factYearMin;
        }

        public int getFactYearMax() {
            return factYearMax;
        }

        public void setFactYearMax(int factYearMax) {
            this.factYearMax = factYearMax;
        }

        public FactYearMapping getFactYearMapping() {
            return factYearMapping == null ? FactYearMapping.EMBEDDED_YEAR : factYearMapping;
        }

        public void setFactYearMapping(FactYearMapping factYearMapping) {
            this.factYearMapping = factYearMapping;
        }

        /**
         * Fails fast on a page-year range that would crawl nothing.
         */
        public void validateRange() {
            if (firstPageYear > lastPageYear) {
                throw new IllegalStateException(
                    "harvester.crawl.first-page-year (" + firstPageYear
                        + ") must not be after last-page-year (" + lastPageYear + ")"
                );
            }
        }
    }

    public static class Site {
        private String baseUrl = "https://www.bloodhorse.com/stallion-register";
        private int probeYear = 2000;

        public String getBaseUrl() {
            if (baseUrl == null || baseUrl.isBlank()) {
                return "";
            }
            String trimmed = baseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getProbeYear() {
            return probeYear;
        }

        public void setProbeYear(int probeYear) {
            this.probeYear = probeYear;
        }
    }

    public static class Resolution {
        private List<ResolutionMethod> strategies =
            new ArrayList<>(List.of(ResolutionMethod.PROBE_REDIRECT, ResolutionMethod.SEARCH_QUERY));

        public List<ResolutionMethod> getStrategies() {
            return strategies;
        }

        public void setStrategies(List<ResolutionMethod> strategies) {
            this.strategies = strategies == null ? new ArrayList<>() : new ArrayList<>(strategies);
        }
    }

    public static class Cli {
        private boolean run;
        private String input = "sires.csv";
        private String output = "stud_fees.csv";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getInput() {
            return input;
        }

        public void setInput(String input) {
            this.input = input;
        }

        public String getOutput() {
            return output;
        }

        public void setOutput(String output) {
            this.output = output;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
