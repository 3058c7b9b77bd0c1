package com.waypoint.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "waypoint")
public class WaypointProperties {

    private String stateDir = ".waypoint";
    private Lock lock = new Lock();
    private Backup backup = new Backup();

    public String getStateDir() {
        return stateDir;
    }

    public void setStateDir(String stateDir) {
        this.stateDir = stateDir;
    }

    public Lock getLock() {
        return lock;
    }

    public void setLock(Lock lock) {
        this.lock = lock;
    }

    public Backup getBackup() {
        return backup;
    }

    public void setBackup(Backup backup) {
        this.backup = backup;
    }

    public static class Lock {
        /** How long to wait for another invocation to release the state lock. */
        private Duration timeout = Duration.ofSeconds(5);
        private Duration pollInterval = Duration.ofMillis(50);
        /** Holder metadata older than this is reported as left behind by a crashed process. */
        private Duration staleAfter = Duration.ofMinutes(10);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }
    }

    public static class Backup {
        private int retain = 10;

        public int getRetain() {
            return retain;
        }

        public void setRetain(int retain) {
            this.retain = retain;
        }
    }
}
