package com.fleetdiag.api.config;

import com.fleetdiag.core.lock.OperationLock;
import com.fleetdiag.core.store.InstanceRegistry;
import com.fleetdiag.core.store.SessionStore;
import com.fleetdiag.engine.health.DiagnosticsHealthIndicator;
import com.fleetdiag.engine.lifecycle.GracefulShutdownHandler;
import com.fleetdiag.engine.lock.FencingLockFactory;
import com.fleetdiag.engine.metrics.SessionMetrics;
import com.fleetdiag.engine.persistence.file.FileInstanceRegistry;
import com.fleetdiag.engine.persistence.file.FileSessionStore;
import com.fleetdiag.engine.session.DiagnosticToolRegistry;
import com.fleetdiag.engine.session.SessionOrchestrator;
import com.fleetdiag.scheduler.SessionRunnerScheduler;
import com.fleetdiag.tools.CpuTraceTool;
import com.fleetdiag.tools.MemoryDumpTool;
import com.fleetdiag.tools.ProcessDiagnosticTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the lock, the shared-storage session store, the diagnostic tools and the
 * session runner from {@link FleetDiagProperties}.
 *
 * Shared root layout: {@code locks/}, {@code sessions/}, {@code instances/} and,
 * unless configured elsewhere, {@code data/diagnostics/} for tool output.
 */
@Configuration
@EnableConfigurationProperties(FleetDiagProperties.class)
public class FleetDiagConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FleetDiagConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FencingLockFactory fencingLockFactory(
            FleetDiagProperties properties,
            InstanceRegistry instanceRegistry,
            Clock clock,
            SessionMetrics metrics) {
        FleetDiagProperties.Lock lock = properties.getLock();
        return new FencingLockFactory(
            sharedRoot(properties).resolve("locks"),
            instanceRegistry.localInstanceId(),
            clock,
            lock.getTimeout(),
            lock.getSettleDelay(),
            metrics
        );
    }

    @Bean
    public OperationLock submissionLock(FleetDiagProperties properties, FencingLockFactory lockFactory) {
        return lockFactory.forResource(properties.getLock().getSubmissionResource());
    }

    @Bean
    public InstanceRegistry instanceRegistry(FleetDiagProperties properties, Clock clock) {
        String instanceId = InstanceIdentity.resolve(properties.getInstanceId());
        log.info("Running as instance {} on shared root {}", instanceId, properties.getSharedRoot());
        return new FileInstanceRegistry(
            sharedRoot(properties).resolve("instances"),
            instanceId,
            clock,
            properties.getSession().getInstanceTtl()
        );
    }

    @Bean
    public SessionStore sessionStore(
            FleetDiagProperties properties,
            InstanceRegistry instanceRegistry,
            @Qualifier("submissionLock") OperationLock submissionLock,
            Clock clock) {
        return new FileSessionStore(sharedRoot(properties).resolve("sessions"), instanceRegistry, submissionLock, clock);
    }

    @Bean
    public MemoryDumpTool memoryDumpTool(FleetDiagProperties properties) {
        FleetDiagProperties.MemoryDump memoryDump = properties.getTools().getMemoryDump();
        return new MemoryDumpTool(
            ProcessDiagnosticTool.splitCommand(memoryDump.getCommand()),
            toolOutputDir(properties),
            targetPid(properties),
            memoryDump.getTimeout()
        );
    }

    @Bean
    public CpuTraceTool cpuTraceTool(FleetDiagProperties properties) {
        FleetDiagProperties.Profiler profiler = properties.getTools().getProfiler();
        return new CpuTraceTool(
            ProcessDiagnosticTool.splitCommand(profiler.getCommand()),
            toolOutputDir(properties),
            targetPid(properties),
            profiler.getTimeout(),
            profiler.getDefaultDuration(),
            profiler.getFlushGrace()
        );
    }

    @Bean
    public DiagnosticToolRegistry diagnosticToolRegistry(MemoryDumpTool memoryDumpTool, CpuTraceTool cpuTraceTool) {
        return new DiagnosticToolRegistry(List.of(memoryDumpTool, cpuTraceTool));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService collectionExecutor(FleetDiagProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getSession().getCollectionThreads(), r -> {
            Thread t = new Thread(r, "diagnostic-collection-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public SessionOrchestrator sessionOrchestrator(
            FleetDiagProperties properties,
            SessionStore sessionStore,
            InstanceRegistry instanceRegistry,
            DiagnosticToolRegistry toolRegistry,
            @Qualifier("collectionExecutor") ExecutorService collectionExecutor,
            Clock clock,
            SessionMetrics metrics) {
        FleetDiagProperties.Session session = properties.getSession();
        return new SessionOrchestrator(
            sessionStore,
            instanceRegistry,
            toolRegistry,
            collectionExecutor,
            clock,
            metrics,
            session.getMaxDuration(),
            session.isCancelOnForcedCompletion()
        );
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SessionRunnerScheduler sessionRunnerScheduler(
            FleetDiagProperties properties,
            SessionOrchestrator orchestrator) {
        FleetDiagProperties.Session session = properties.getSession();
        return new SessionRunnerScheduler(orchestrator, session::isEnabled, session.getPollInterval());
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler(
            FleetDiagProperties properties,
            SessionOrchestrator orchestrator,
            FencingLockFactory lockFactory,
            SessionRunnerScheduler scheduler) {
        GracefulShutdownHandler handler = new GracefulShutdownHandler(
            orchestrator, lockFactory, properties.getSession().getShutdownTimeout());
        handler.onStop(scheduler::stop);
        return handler;
    }

    @Bean
    public DiagnosticsHealthIndicator diagnosticsHealthIndicator(
            FleetDiagProperties properties,
            SessionStore sessionStore,
            SessionOrchestrator orchestrator,
            @Qualifier("submissionLock") OperationLock submissionLock,
            Clock clock) {
        return new DiagnosticsHealthIndicator(sharedRoot(properties), sessionStore, orchestrator, submissionLock, clock);
    }

    private static Path sharedRoot(FleetDiagProperties properties) {
        return Path.of(properties.getSharedRoot());
    }

    private static Path toolOutputDir(FleetDiagProperties properties) {
        String configured = properties.getTools().getOutputDir();
        if (configured != null && !configured.isBlank()) {
            return Path.of(configured);
        }
        return sharedRoot(properties).resolve("data").resolve("diagnostics");
    }

    private static long targetPid(FleetDiagProperties properties) {
        Long configured = properties.getTools().getTargetPid();
        return configured != null ? configured : ProcessHandle.current().pid();
    }
}
