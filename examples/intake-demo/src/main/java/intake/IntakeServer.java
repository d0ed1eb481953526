package intake;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import deskmigrator.adapter.AdapterRegistry;
import deskmigrator.adapter.FileSnapshotSourceAdapter;
import deskmigrator.adapter.LoggingAuditSink;
import deskmigrator.alert.MigrationAlertLogger;
import deskmigrator.config.MigrationConfig;
import deskmigrator.config.MigrationConfigLoader;
import deskmigrator.engine.JobOrchestrator;
import deskmigrator.exceptions.ValidationException;
import deskmigrator.job.JobAcknowledgement;
import deskmigrator.job.JobRequestParser;
import deskmigrator.job.MigrationJob;
import deskmigrator.progress.JobListener;
import deskmigrator.scanner.AdapterResolver;
import deskmigrator.scanner.AdapterScanner;
import deskmigrator.state.JobTracker;
import deskmigrator.worker.InMemoryJobQueue;
import deskmigrator.worker.MigrationWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;

/**
 * HTTP front end that accepts migration jobs and runs them on an in-process worker.
 *
 * <p>Snapshot blobs and {@code index.yml} are read from
 * {@code migration.snapshot.base.dir} (default {@code snapshots}, relative to the
 * working directory). Target adapters are discovered in {@code intake.adapters}.
 *
 * <h2>HTTP Endpoints:</h2>
 * <ul>
 *   <li>POST /migration - Submit a job (JSON body), returns 202 with the acknowledgement</li>
 *   <li>GET /jobs - Active jobs and recent history</li>
 *   <li>GET /jobs/{id} - One job's status</li>
 *   <li>POST /jobs/{id}/cancel - Cancel a queued or running job</li>
 *   <li>GET /health - Liveness</li>
 * </ul>
 *
 * <h2>Usage:</h2>
 * <pre>
 * cd examples/intake-demo
 * java -cp ... intake.IntakeServer [port]
 *
 * curl -X POST localhost:8080/migration -d @request.json
 * </pre>
 */
public class IntakeServer {

    private static final Logger log = LoggerFactory.getLogger(IntakeServer.class);

    private static final String ADAPTER_PACKAGE = "intake.adapters";
    private static final long startTimeMs = System.currentTimeMillis();

    private final MigrationWorker worker;
    private final JobRequestParser parser = new JobRequestParser();

    IntakeServer(MigrationWorker worker) {
        this.worker = worker;
    }

    public static void main(String[] args) throws Exception {
        int port = args.length > 0 ? Integer.parseInt(args[0]) : 8080;
        MigrationConfig config = MigrationConfigLoader.loadOrDefaults();
        MigrationAlertLogger.setAlertLevel(config.alertLevel());

        AdapterRegistry adapters = new AdapterResolver().resolve(
                AdapterScanner.scan(ADAPTER_PACKAGE),
                AdapterRegistry.builder().defaultSource(new FileSnapshotSourceAdapter(config.snapshotBaseDir())));

        JobOrchestrator orchestrator = JobOrchestrator.builder()
                .adapters(adapters)
                .snapshotStore(SnapshotIndex.load(config.snapshotBaseDir()))
                .auditSink(new LoggingAuditSink())
                .config(config)
                .build();

        JobListener listener = new JobListener() {
            @Override
            public void onProgress(String jobId, int percent) {
                log.info("Job {} progress {}%", jobId, percent);
            }
        };
        MigrationWorker worker = new MigrationWorker(orchestrator, new InMemoryJobQueue(),
                new JobTracker(config.historySize()), listener);
        worker.start();

        HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);
        server.setExecutor(Executors.newFixedThreadPool(4));
        new IntakeServer(worker).register(server);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop(1);
            try {
                worker.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "intake-shutdown"));

        log.info("Intake started on http://localhost:{}", port);
        log.info("Endpoints:");
        log.info("  POST /migration         - Submit a migration job");
        log.info("  GET  /jobs              - Active jobs and history");
        log.info("  GET  /jobs/{id}         - Job status");
        log.info("  POST /jobs/{id}/cancel  - Cancel a job");
        log.info("  GET  /health            - Liveness");

        Thread.currentThread().join();
    }

    void register(HttpServer server) {
        server.createContext("/migration", exchange -> {
            if ("POST".equals(exchange.getRequestMethod())) {
                handleSubmit(exchange);
            } else {
                sendError(exchange, 405, "Method Not Allowed");
            }
        });

        server.createContext("/jobs", exchange -> {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();
            if ("/jobs".equals(path) || "/jobs/".equals(path)) {
                if ("GET".equals(method)) {
                    sendJson(exchange, 200, worker.tracker().toMap());
                } else {
                    sendError(exchange, 405, "Method Not Allowed");
                }
            } else if (path.endsWith("/cancel")) {
                if ("POST".equals(method)) {
                    handleCancel(exchange, path.substring("/jobs/".length(), path.length() - "/cancel".length()));
                } else {
                    sendError(exchange, 405, "Method Not Allowed");
                }
            } else if ("GET".equals(method)) {
                handleStatus(exchange, path.substring("/jobs/".length()));
            } else {
                sendError(exchange, 405, "Method Not Allowed");
            }
        });

        server.createContext("/health", exchange -> {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "UP");
            response.put("timestamp", Instant.now());
            response.put("uptime_ms", System.currentTimeMillis() - startTimeMs);
            response.put("active_jobs", worker.tracker().activeJobIds().size());
            sendJson(exchange, 200, response);
        });
    }

    private void handleSubmit(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        MigrationJob job;
        try {
            job = parser.parse(body, JobRequestParser.newJobId());
        } catch (ValidationException e) {
            log.warn("Rejected job request: {}", e.getMessage());
            sendError(exchange, 400, e.getMessage());
            return;
        }

        JobAcknowledgement ack = worker.submit(job);
        sendJson(exchange, 202, ack.toMap());
    }

    private void handleStatus(HttpExchange exchange, String jobId) throws IOException {
        Optional<Map<String, Object>> status = worker.tracker().toMap(jobId);
        if (status.isPresent()) {
            sendJson(exchange, 200, status.get());
        } else {
            sendError(exchange, 404, "Unknown job: " + jobId);
        }
    }

    private void handleCancel(HttpExchange exchange, String jobId) throws IOException {
        if (worker.cancel(jobId)) {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("jobId", jobId);
            response.put("cancelRequested", true);
            sendJson(exchange, 202, response);
        } else {
            sendError(exchange, 404, "No active job: " + jobId);
        }
    }

    private static void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", message);
        sendJson(exchange, statusCode, response);
    }

    private static void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = JsonWriter.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=UTF-8");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
