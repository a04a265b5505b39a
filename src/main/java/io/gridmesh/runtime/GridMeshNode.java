package io.gridmesh.runtime;

import io.gridmesh.authz.AuthorizationEngine;
import io.gridmesh.config.CachedConfiguration;
import io.gridmesh.config.ConfigurationSource;
import io.gridmesh.config.GridSettings;
import io.gridmesh.config.NodePaths;
import io.gridmesh.jobs.ConfiguredSiteAccess;
import io.gridmesh.jobs.JobQueue;
import io.gridmesh.matching.FairShareTracker;
import io.gridmesh.matching.MatchingEngine;
import io.gridmesh.matching.ResourceLoadAccounting;
import io.gridmesh.observability.AuditLogger;
import io.gridmesh.observability.AuditTrail;
import io.gridmesh.registry.ResourceRegistry;
import io.gridmesh.rpc.GridTls;
import io.gridmesh.rpc.RpcServer;
import io.gridmesh.rpc.ServiceDispatcher;
import io.gridmesh.security.GroupRegistry;
import io.gridmesh.service.JobManagerService;
import io.gridmesh.service.MatcherService;
import io.gridmesh.storage.Database;
import io.gridmesh.storage.JobJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public final class GridMeshNode implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GridMeshNode.class);
    private static final long TLS_CHECK_INTERVAL_MS = 5_000L;

    private final CachedConfiguration config;
    private final GridSettings settings;
    private final JobQueue queue;
    private final ResourceRegistry registry;
    private final ServiceDispatcher dispatcher;
    private final RpcServer server;
    private final RpcServer.TlsMaterial tlsMaterial;
    private final AuditLogger audit;
    private final ScheduledExecutorService maintenance;

    private GridMeshNode(
            CachedConfiguration config,
            GridSettings settings,
            JobQueue queue,
            ResourceRegistry registry,
            ServiceDispatcher dispatcher,
            RpcServer server,
            RpcServer.TlsMaterial tlsMaterial,
            AuditLogger audit
    ) {
        this.config = config;
        this.settings = settings;
        this.queue = queue;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.server = server;
        this.tlsMaterial = tlsMaterial;
        this.audit = audit;
        this.maintenance = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gridmesh-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    public static GridMeshNode create(Path configFile, NodePaths paths, Integer portOverride, Clock clock)
            throws IOException, GeneralSecurityException {
        CachedConfiguration bootstrap = CachedConfiguration.open(configFile, 0L, clock);
        GridSettings settings = GridSettings.from(bootstrap);
        CachedConfiguration config = CachedConfiguration.open(configFile, settings.configRefreshMs(), clock);
        Path base = configFile.toAbsolutePath().getParent();
        RpcServer.TlsMaterial tlsMaterial = new RpcServer.TlsMaterial(
                resolve(base, config.require("/Security/HostCertificate")),
                resolve(base, config.require("/Security/HostKey")),
                resolve(base, config.require("/Security/TrustRoots")),
                config.getString("/Security/RevocationFile").map(p -> resolve(base, p)).orElse(null),
                clock
        );

        Database database = new Database(paths);
        database.init();
        JobJournal journal = new JobJournal(database);
        AuditLogger audit = new AuditLogger(paths.auditFile(), paths.setup(),
                config.getString("/Security/AuditSigningSecret", ""), clock);

        GroupRegistry groups = new GroupRegistry(config);
        AuthorizationEngine authorization = new AuthorizationEngine(audit);
        JobQueue queue = new JobQueue(new ConfiguredSiteAccess(config), clock);
        int recovered = journal.recoverInto(queue);
        queue.addListener(journal);

        ResourceRegistry registry = new ResourceRegistry(() -> GridSettings.from(config).resourceSilenceMs(), clock,
                queue::countHeldBy);
        queue.addListener(new ResourceLoadAccounting(registry));
        registry.onEviction(resource -> queue.releaseAllMatchedTo(resource.resourceId()));

        FairShareTracker fairShare = new FairShareTracker(clock, settings.fairShareHalfLifeMs(), settings.fairShareWindowMs(),
                group -> config.getDouble("/Operations/FairShare/Shares/" + group, 1.0));
        MatchingEngine engine = new MatchingEngine(queue, fairShare, authorization,
                settings.maxClaimAttempts(), settings.tierScanLimit());

        ServiceDispatcher dispatcher = new ServiceDispatcher(authorization, config,
                settings.dispatcherWorkers(), settings.defaultTimeoutMs());
        new MatcherService(registry, queue, engine).register(dispatcher);
        new JobManagerService(queue, audit).register(dispatcher);

        int port = portOverride == null ? settings.port() : portOverride;
        RpcServer server = new RpcServer(new InetSocketAddress(settings.bind(), port), tlsMaterial.load(),
                dispatcher, groups, settings.serverWorkers(), clock);
        log.info("Node prepared: setup={} root={} recoveredJobs={}", paths.setup(), paths.rootDir(), recovered);
        return new GridMeshNode(config, settings, queue, registry, dispatcher, server, tlsMaterial, audit);
    }

    public static ServiceDispatcher policyView(ConfigurationSource config, Clock clock) {
        GridSettings settings = GridSettings.from(config);
        AuthorizationEngine authorization = new AuthorizationEngine();
        JobQueue queue = new JobQueue(new ConfiguredSiteAccess(config), clock);
        ResourceRegistry registry = new ResourceRegistry(settings::resourceSilenceMs, clock);
        FairShareTracker fairShare = new FairShareTracker(clock, settings.fairShareHalfLifeMs(),
                settings.fairShareWindowMs(), group -> 1.0);
        MatchingEngine engine = new MatchingEngine(queue, fairShare, authorization,
                settings.maxClaimAttempts(), settings.tierScanLimit());
        ServiceDispatcher dispatcher = new ServiceDispatcher(authorization, config, 1, settings.defaultTimeoutMs());
        new MatcherService(registry, queue, engine).register(dispatcher);
        new JobManagerService(queue, AuditTrail.NONE).register(dispatcher);
        return dispatcher;
    }

    public void start() {
        server.start();
        long evictEvery = Math.max(1_000L, Math.min(30_000L, settings.resourceSilenceMs() / 2));
        maintenance.scheduleWithFixedDelay(this::evictSilentResources, evictEvery, evictEvery, TimeUnit.MILLISECONDS);
        maintenance.scheduleWithFixedDelay(this::refreshConfiguration,
                settings.configRefreshMs(), settings.configRefreshMs(), TimeUnit.MILLISECONDS);
        maintenance.scheduleWithFixedDelay(() -> server.reloadTlsIfChanged(tlsMaterial),
                TLS_CHECK_INTERVAL_MS, TLS_CHECK_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    void evictSilentResources() {
        try {
            registry.evictExpired();
        } catch (RuntimeException e) {
            log.error("Resource eviction pass failed", e);
        }
    }

    void refreshConfiguration() {
        if (config.maybeRefresh()) {
            log.info("Configuration refreshed; new policies apply to subsequent calls");
        }
    }

    public int port() {
        return server.port();
    }

    public JobQueue queue() {
        return queue;
    }

    public ResourceRegistry registry() {
        return registry;
    }

    public ServiceDispatcher dispatcher() {
        return dispatcher;
    }

    public ConfigurationSource configuration() {
        return config;
    }

    public Optional<AuditLogger> audit() {
        return Optional.ofNullable(audit);
    }

    @Override
    public void close() {
        maintenance.shutdownNow();
        server.close();
        dispatcher.close();
        log.info("Node stopped");
    }

    private static Path resolve(Path base, String value) {
        Path path = Path.of(value);
        return path.isAbsolute() || base == null ? path : base.resolve(path).normalize();
    }
}
