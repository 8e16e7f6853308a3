package com.testament.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "testament")
public class TestamentProperties {

    private Run run = new Run();
    private Logs logs = new Logs();
    private String lastFailedFile = ".testament/last-failed";
    private Map<String, String> suiteAlias = new LinkedHashMap<>();
    private Map<String, String> suiteDisabled = new LinkedHashMap<>();

    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }
    public Logs getLogs() { return logs; }
    public void setLogs(Logs logs) { this.logs = logs; }
    public String getLastFailedFile() { return lastFailedFile; }
    public void setLastFailedFile(String lastFailedFile) { this.lastFailedFile = lastFailedFile; }

    /** Alias name to a space-separated list of selectors or other aliases. */
    public Map<String, String> getSuiteAlias() { return suiteAlias; }
    public void setSuiteAlias(Map<String, String> suiteAlias) { this.suiteAlias = suiteAlias; }

    /** Selector or alias to the reason it is disabled. */
    public Map<String, String> getSuiteDisabled() { return suiteDisabled; }
    public void setSuiteDisabled(Map<String, String> suiteDisabled) { this.suiteDisabled = suiteDisabled; }

    public static class Run {
        private int maxWorkers = 20;
        private boolean noConcurrency = false;
        private boolean stopOnFail = false;
        private Long seed;

        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }
        public boolean isNoConcurrency() { return noConcurrency; }
        public void setNoConcurrency(boolean noConcurrency) { this.noConcurrency = noConcurrency; }
        public boolean isStopOnFail() { return stopOnFail; }
        public void setStopOnFail(boolean stopOnFail) { this.stopOnFail = stopOnFail; }
        public Long getSeed() { return seed; }
        public void setSeed(Long seed) { this.seed = seed; }
    }

    public static class Logs {
        private String folder = "logs";
        private int maxSubFolders = 10;

        public String getFolder() { return folder; }
        public void setFolder(String folder) { this.folder = folder; }
        public int getMaxSubFolders() { return maxSubFolders; }
        public void setMaxSubFolders(int maxSubFolders) { this.maxSubFolders = maxSubFolders; }
    }
}
