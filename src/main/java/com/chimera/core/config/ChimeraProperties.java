package com.chimera.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "chimera")
public class ChimeraProperties {

    private Agent agent = new Agent();
    private Link link = new Link();
    private Sweep sweep = new Sweep();
    private Catalog catalog = new Catalog();

    // -- Flat accessors (delegate to nested) --
    public int getDeadAfterMissedBeacons() { return agent.deadAfterMissedBeacons; }
    public int getDefaultSleepSeconds() { return agent.defaultSleepSeconds; }
    public int getDefaultJitterSeconds() { return agent.defaultJitterSeconds; }
    public Duration getLinkTimeout() { return Duration.ofSeconds(link.timeoutSeconds); }
    public long getSweepIntervalSeconds() { return sweep.intervalSeconds; }
    public boolean isSweepEnabled() { return sweep.enabled; }
    public String getCatalogPath() { return catalog.path; }

    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Link getLink() { return link; }
    public void setLink(Link link) { this.link = link; }
    public Sweep getSweep() { return sweep; }
    public void setSweep(Sweep sweep) { this.sweep = sweep; }
    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }

    public static class Agent {
        private int deadAfterMissedBeacons = 3;
        private int defaultSleepSeconds = 60;
        private int defaultJitterSeconds = 0;

        public int getDeadAfterMissedBeacons() { return deadAfterMissedBeacons; }
        public void setDeadAfterMissedBeacons(int deadAfterMissedBeacons) { this.deadAfterMissedBeacons = deadAfterMissedBeacons; }
        public int getDefaultSleepSeconds() { return defaultSleepSeconds; }
        public void setDefaultSleepSeconds(int defaultSleepSeconds) { this.defaultSleepSeconds = defaultSleepSeconds; }
        public int getDefaultJitterSeconds() { return defaultJitterSeconds; }
        public void setDefaultJitterSeconds(int defaultJitterSeconds) { this.defaultJitterSeconds = defaultJitterSeconds; }
    }

    public static class Link {
        private long timeoutSeconds = 300;

        public long getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(long timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Sweep {
        private boolean enabled = true;
        private long intervalSeconds = 5;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public long getIntervalSeconds() { return intervalSeconds; }
        public void setIntervalSeconds(long intervalSeconds) { this.intervalSeconds = intervalSeconds; }
    }

    public static class Catalog {
        private String path = "./catalog";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }
}
