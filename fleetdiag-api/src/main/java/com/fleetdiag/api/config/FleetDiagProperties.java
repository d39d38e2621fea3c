package com.fleetdiag.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("fleetdiag")
public class FleetDiagProperties {
    private String instanceId;
    private String sharedRoot = "/home/site";
    private Lock lock = new Lock();
    private Session session = new Session();
    private Tools tools = new Tools();

    public String getInstanceId() {
        return instanceId;
    }

    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    public String getSharedRoot() {
        return sharedRoot;
    }

    public void setSharedRoot(String sharedRoot) {
        this.sharedRoot = sharedRoot;
    }

    public Lock getLock() {
        return lock;
    }

    public void setLock(Lock lock) {
        this.lock = lock;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public Tools getTools() {
        return tools;
    }

    public void setTools(Tools tools) {
        this.tools = tools;
    }

    public static class Lock {
        private Duration timeout = Duration.ofMinutes(20);
        private Duration settleDelay = Duration.ofSeconds(1);
        private String submissionResource = "session-submit";

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getSettleDelay() {
            return settleDelay;
        }

        public void setSettleDelay(Duration settleDelay) {
            this.settleDelay = settleDelay;
        }

        public String getSubmissionResource() {
            return submissionResource;
        }

        public void setSubmissionResource(String submissionResource) {
            this.submissionResource = submissionResource;
        }
    }

    public static class Session {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofMinutes(1);
        private Duration maxDuration = Duration.ofMinutes(15);
        private boolean cancelOnForcedCompletion = false;
        private int collectionThreads = 2;
        private Duration instanceTtl = Duration.ofMinutes(5);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getMaxDuration() {
            return maxDuration;
        }

        public void setMaxDuration(Duration maxDuration) {
            this.maxDuration = maxDuration;
        }

        public boolean isCancelOnForcedCompletion() {
            return cancelOnForcedCompletion;
        }

        public void setCancelOnForcedCompletion(boolean cancelOnForcedCompletion) {
            this.cancelOnForcedCompletion = cancelOnForcedCompletion;
        }

        public int getCollectionThreads() {
            return collectionThreads;
        }

        public void setCollectionThreads(int collectionThreads) {
            this.collectionThreads = collectionThreads;
        }

        public Duration getInstanceTtl() {
            return instanceTtl;
        }

        public void setInstanceTtl(Duration instanceTtl) {
            this.instanceTtl = instanceTtl;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Tools {
        private String outputDir; // defaults to <shared-root>/data/diagnostics
        private Long targetPid; // defaults to this process
        private MemoryDump memoryDump = new MemoryDump();
        private Profiler profiler = new Profiler();

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }

        public Long getTargetPid() {
            return targetPid;
        }

        public void setTargetPid(Long targetPid) {
            this.targetPid = targetPid;
        }

        public MemoryDump getMemoryDump() {
            return memoryDump;
        }

        public void setMemoryDump(MemoryDump memoryDump) {
            this.memoryDump = memoryDump;
        }

        public Profiler getProfiler() {
            return profiler;
        }

        public void setProfiler(Profiler profiler) {
            this.profiler = profiler;
        }
    }

    public static class MemoryDump {
        private String command = "jcmd {pid} GC.heap_dump {output}";
        private Duration timeout = Duration.ofMinutes(10);

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Profiler {
        private String command = "jcmd {pid} JFR.start duration={durationSeconds}s filename={output}";
        private Duration timeout = Duration.ofMinutes(2);
        private Duration defaultDuration = Duration.ofSeconds(60);
        private Duration flushGrace = Duration.ofSeconds(30);

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getDefaultDuration() {
            return defaultDuration;
        }

        public void setDefaultDuration(Duration defaultDuration) {
            this.defaultDuration = defaultDuration;
        }

        public Duration getFlushGrace() {
            return flushGrace;
        }

        public void setFlushGrace(Duration flushGrace) {
            this.flushGrace = flushGrace;
        }
    }
}
