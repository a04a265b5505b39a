package io.gridmesh.cli;

import io.gridmesh.authz.MethodPolicy;
import io.gridmesh.config.CachedConfiguration;
import io.gridmesh.config.NodePaths;
import io.gridmesh.observability.AuditLogger;
import io.gridmesh.rpc.ServiceDispatcher;
import io.gridmesh.runtime.GridMeshNode;
import io.gridmesh.security.Property;
import io.gridmesh.security.RevocationPolicy;
import io.gridmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "gridmesh",
        mixinStandardHelpOptions = true,
        version = "gridmesh 1.0.0-SNAPSHOT",
        description = "Grid workload node: secure RPC, job queue and matcher",
        subcommands = {
                GridMeshCommand.ServeCommand.class,
                GridMeshCommand.PoliciesCommand.class,
                GridMeshCommand.RevocationTemplateCommand.class,
                GridMeshCommand.AuditVerifyCommand.class
        }
)
public final class GridMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--setup"}, description = "Setup name (separate journal and audit per setup)", defaultValue = "default")
    String setup;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve | policies | revocation-template | audit-verify");
    }

    NodePaths paths() {
        return NodePaths.fromRoot(root, setup);
    }

    @Command(name = "serve", description = "Run the TLS RPC endpoint with the Matcher and JobManager services")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        GridMeshCommand parent;

        @Option(names = {"--config"}, required = true, description = "JSON configuration file")
        String config;

        @Option(names = {"--port"}, description = "Override /Server/Port")
        Integer port;

        @Override
        public Integer call() throws Exception {
            GridMeshNode node = GridMeshNode.create(Path.of(config), parent.paths(), port, Clock.systemUTC());
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                node.close();
                stopped.countDown();
            }, "gridmesh-shutdown"));
            node.start();
            System.out.println("GridMesh listening on port " + node.port() + ", setup=" + parent.paths().setup());
            stopped.await();
            return 0;
        }
    }

    @Command(name = "policies", description = "Print the effective method policies for a configuration")
    static final class PoliciesCommand implements Callable<Integer> {
        @Option(names = {"--config"}, required = true, description = "JSON configuration file")
        String config;

        @Override
        public Integer call() {
            CachedConfiguration source = CachedConfiguration.open(Path.of(config), 0L);
            Map<String, Object> out = new LinkedHashMap<>();
            try (ServiceDispatcher dispatcher = GridMeshNode.policyView(source, Clock.systemUTC())) {
                for (Map.Entry<String, MethodPolicy> entry : dispatcher.policies().entrySet()) {
                    MethodPolicy policy = entry.getValue();
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("combinator", policy.combinator().name());
                    row.put("required", policy.required().stream().map(Property::name).sorted().toList());
                    out.put(entry.getKey(), row);
                }
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "revocation-template",
            description = "Generate a revocation list for /Security/RevocationFile")
    static final class RevocationTemplateCommand implements Callable<Integer> {
        @Option(names = {"--out"}, required = true, description = "Output revocation file path")
        String out;

        @Option(names = {"--serial"}, split = ",",
                description = "Optional comma-separated certificate serial hex entries")
        List<String> serials = List.of();

        @Option(names = {"--fingerprint"}, split = ",",
                description = "Optional comma-separated sha256 fingerprint entries")
        List<String> fingerprints = List.of();

        @Override
        public Integer call() throws Exception {
            Path outPath = Path.of(out);
            if (outPath.getParent() != null) {
                Files.createDirectories(outPath.getParent());
            }
            RevocationPolicy.writeTemplate(outPath, serials, fingerprints);
            RevocationPolicy policy = RevocationPolicy.load(outPath.toString());
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("output", outPath.toString());
            result.put("revokedSerialCount", policy.revokedSerialNumbers().size());
            result.put("revokedFingerprintCount", policy.revokedSha256Fingerprints().size());
            result.put("revokedEntryCount", policy.entryCount());
            System.out.println(Jsons.toJson(result));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the hash chain of the audit log")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        GridMeshCommand parent;

        @Option(names = {"--secret"}, defaultValue = "", description = "Signing secret the node was configured with")
        String secret;

        @Override
        public Integer call() throws Exception {
            NodePaths paths = parent.paths();
            int rows = new AuditLogger(paths.auditFile(), paths.setup(), secret).verifyChain();
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("file", paths.auditFile().toString());
            result.put("ok", rows >= 0);
            result.put("rows", Math.max(rows, 0));
            System.out.println(Jsons.toJson(result));
            return rows >= 0 ? 0 : 2;
        }
    }
}
