package io.hearthwarrio.pagelens.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of the agent configuration. Instances are produced by {@link ConfigLoader} and already validated.
 */
public class PagelensConfig {

    @JsonProperty("browser")
    private BrowserSettings browser = new BrowserSettings();
    @JsonProperty("performance")
    private PerformanceSettings performance = new PerformanceSettings();
    @JsonProperty("stealth")
    private StealthSettings stealth = new StealthSettings();
    @JsonProperty("self_healing")
    private SelfHealingSettings selfHealing = new SelfHealingSettings();
    @JsonProperty("sessions")
    private SessionSettings sessions = new SessionSettings();
    @JsonProperty("downloads")
    private DownloadSettings downloads = new DownloadSettings();
    @JsonProperty("extraction")
    private ExtractionSettings extraction = new ExtractionSettings();
    @JsonProperty("task")
    private TaskSettings task = new TaskSettings();
    @JsonProperty("logging")
    private LoggingSettings logging = new LoggingSettings();

    /**
     * Clamps numeric values to their lower bounds and fills missing sections.
     *
     * @throws IllegalArgumentException for values that cannot be repaired (unknown strategy, bad cache scope)
     */
    PagelensConfig validate() {
        if (browser == null) {
            browser = new BrowserSettings();
        }
        if (performance == null) {
            performance = new PerformanceSettings();
        }
        if (stealth == null) {
            stealth = new StealthSettings();
        }
        if (selfHealing == null) {
            selfHealing = new SelfHealingSettings();
        }
        if (sessions == null) {
            sessions = new SessionSettings();
        }
        if (downloads == null) {
            downloads = new DownloadSettings();
        }
        if (extraction == null) {
            extraction = new ExtractionSettings();
        }
        if (task == null) {
            task = new TaskSettings();
        }
        if (logging == null) {
            logging = new LoggingSettings();
        }
        browser.validate();
        performance.validate();
        stealth.validate();
        selfHealing.validate();
        sessions.validate();
        downloads.validate();
        extraction.validate();
        task.validate();
        logging.validate();
        return this;
    }

    public BrowserSettings getBrowser() {
        return browser;
    }

    public PerformanceSettings getPerformance() {
        return performance;
    }

    public StealthSettings getStealth() {
        return stealth;
    }

    public SelfHealingSettings getSelfHealing() {
        return selfHealing;
    }

    public SessionSettings getSessions() {
        return sessions;
    }

    public DownloadSettings getDownloads() {
        return downloads;
    }

    public ExtractionSettings getExtraction() {
        return extraction;
    }

    public TaskSettings getTask() {
        return task;
    }

    public LoggingSettings getLogging() {
        return logging;
    }
}
