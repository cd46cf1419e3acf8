package io.stepgraph.config;

import java.io.IOException;
import java.io.Reader;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Immutable worker configuration.
 *
 * <p>Values resolve from defaults, then an optional {@code .env} file in the data root,
 * then the process environment. Keys are matched case-insensitively.
 */
public final class StepGraphConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_WORKER_NAME = "stepgraph-worker";
    public static final int DEFAULT_POOL_SIZE = 5;
    public static final long DEFAULT_ACQUIRE_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 200L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 5_000L;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final int DEFAULT_MAX_STEPS_PER_RUN = 0;
    public static final int DEFAULT_PAGE_SIZE = 100;

    static final String ENV_FILE = ".env";

    private final Path rootDir;
    private final String databaseUrl;
    private final String databaseUser;
    private final String databasePassword;
    private final int poolSize;
    private final long acquireTimeoutMs;
    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final int workerThreads;
    private final int maxStepsPerRun;
    private final int pageSize;
    private final String workerName;
    private final boolean debug;

    public StepGraphConfig(
            Path rootDir,
            String databaseUrl,
            String databaseUser,
            String databasePassword,
            int poolSize,
            long acquireTimeoutMs,
            int maxAttempts,
            long baseBackoffMs,
            long maxBackoffMs,
            int workerThreads,
            int maxStepsPerRun,
            int pageSize,
            String workerName,
            boolean debug
    ) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1, got " + poolSize);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got " + workerThreads);
        }
        if (maxStepsPerRun < 0) {
            throw new IllegalArgumentException("maxStepsPerRun must be >= 0, got " + maxStepsPerRun);
        }
        this.rootDir = rootDir;
        this.databaseUrl = databaseUrl;
        this.databaseUser = databaseUser;
        this.databasePassword = databasePassword;
        this.poolSize = poolSize;
        this.acquireTimeoutMs = Math.max(1L, acquireTimeoutMs);
        this.maxAttempts = maxAttempts;
        this.baseBackoffMs = Math.max(0L, baseBackoffMs);
        this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
        this.workerThreads = workerThreads;
        this.maxStepsPerRun = maxStepsPerRun;
        this.pageSize = Math.max(1, pageSize);
        this.workerName = workerName == null || workerName.isBlank() ? DEFAULT_WORKER_NAME : workerName.trim();
        this.debug = debug;
    }

    public static StepGraphConfig fromRoot(String root) {
        return load(root, Map.of());
    }

    public static StepGraphConfig fromEnvironment(String root) {
        return load(root, System.getenv());
    }

    public static StepGraphConfig load(String root, Map<String, String> environment) {
        Path base = (root == null || root.isBlank() ? Paths.get(DEFAULT_ROOT) : Paths.get(root))
                .toAbsolutePath()
                .normalize();
        Map<String, String> settings = new HashMap<>(readEnvFile(base.resolve(ENV_FILE)));
        if (environment != null) {
            environment.forEach((k, v) -> {
                if (k != null && v != null) {
                    settings.put(k.toUpperCase(Locale.ROOT), v);
                }
            });
        }

        String rawUrl = firstNonBlank(settings.get("STEPGRAPH_DATABASE_URL"), settings.get("DATABASE_URL"));
        DatabaseUrl url = rawUrl == null
                ? new DatabaseUrl("jdbc:sqlite:" + base.resolve("stepgraph.db"), null, null)
                : normalizeDatabaseUrl(rawUrl);
        String user = firstNonBlank(settings.get("STEPGRAPH_DATABASE_USER"), url.user());
        String password = firstNonBlank(settings.get("STEPGRAPH_DATABASE_PASSWORD"), url.password());

        return new StepGraphConfig(
                base,
                url.jdbcUrl(),
                user,
                password,
                intSetting(settings, firstPresent(settings, "STEPGRAPH_POOL_SIZE", "CHECKPOINTER_POOL_SIZE"), DEFAULT_POOL_SIZE),
                longSetting(settings, "STEPGRAPH_ACQUIRE_TIMEOUT_MS", DEFAULT_ACQUIRE_TIMEOUT_MS),
                intSetting(settings, "STEPGRAPH_MAX_ATTEMPTS", DEFAULT_MAX_ATTEMPTS),
                longSetting(settings, "STEPGRAPH_BASE_BACKOFF_MS", DEFAULT_BASE_BACKOFF_MS),
                longSetting(settings, "STEPGRAPH_MAX_BACKOFF_MS", DEFAULT_MAX_BACKOFF_MS),
                intSetting(settings, "STEPGRAPH_WORKER_THREADS", DEFAULT_WORKER_THREADS),
                intSetting(settings, "STEPGRAPH_MAX_STEPS", DEFAULT_MAX_STEPS_PER_RUN),
                intSetting(settings, "STEPGRAPH_PAGE_SIZE", DEFAULT_PAGE_SIZE),
                firstNonBlank(firstNonBlank(settings.get("STEPGRAPH_WORKER_NAME"), settings.get("WORKER_NAME")), DEFAULT_WORKER_NAME),
                Boolean.parseBoolean(firstNonBlank(firstNonBlank(settings.get("STEPGRAPH_DEBUG"), settings.get("DEBUG")), "false").trim())
        );
    }

    /**
     * Converts the connection strings used by the API backend into JDBC form.
     *
     * <p>Accepts {@code jdbc:*} URLs unchanged, {@code postgresql[+driver]://user:pass@host:port/db}
     * and {@code sqlite:///path}.
     */
    public static DatabaseUrl normalizeDatabaseUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("database url must not be blank");
        }
        String url = raw.trim();
        if (url.startsWith("jdbc:")) {
            return new DatabaseUrl(url, null, null);
        }
        if (url.startsWith("sqlite:///")) {
            return new DatabaseUrl("jdbc:sqlite:" + url.substring("sqlite:///".length()), null, null);
        }
        int schemeEnd = url.indexOf("://");
        if (schemeEnd < 0) {
            throw new IllegalArgumentException("Unsupported database url: " + redact(url));
        }
        String scheme = url.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
        int plus = scheme.indexOf('+');
        String dialect = plus < 0 ? scheme : scheme.substring(0, plus);
        if (!"postgresql".equals(dialect) && !"postgres".equals(dialect)) {
            throw new IllegalArgumentException("Unsupported database url scheme: " + scheme);
        }
        URI uri;
        try {
            uri = new URI("postgresql" + url.substring(schemeEnd));
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed database url: " + redact(url), e);
        }
        String user = null;
        String password = null;
        String userInfo = uri.getRawUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int colon = userInfo.indexOf(':');
            if (colon < 0) {
                user = decode(userInfo);
            } else {
                user = decode(userInfo.substring(0, colon));
                password = decode(userInfo.substring(colon + 1));
            }
        }
        StringBuilder jdbc = new StringBuilder("jdbc:postgresql://").append(uri.getHost());
        if (uri.getPort() > 0) {
            jdbc.append(':').append(uri.getPort());
        }
        jdbc.append(uri.getRawPath() == null ? "" : uri.getRawPath());
        if (uri.getRawQuery() != null) {
            jdbc.append('?').append(uri.getRawQuery());
        }
        return new DatabaseUrl(jdbc.toString(), user, password);
    }

    /**
     * Strips user info and password parameters so a url can be logged.
     */
    public static String redact(String url) {
        if (url == null) {
            return "";
        }
        String out = url;
        int at = out.lastIndexOf('@');
        int schemeEnd = out.indexOf("://");
        if (at > 0 && schemeEnd >= 0 && at > schemeEnd) {
            out = out.substring(0, schemeEnd + 3) + "***@" + out.substring(at + 1);
        }
        return out.replaceAll("(?i)(password=)[^&;]*", "$1***");
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path auditDir() {
        return rootDir.resolve("audit");
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public String redactedDatabaseUrl() {
        return redact(databaseUrl);
    }

    public String databaseUser() {
        return databaseUser;
    }

    public String databasePassword() {
        return databasePassword;
    }

    public boolean isSqlite() {
        return databaseUrl.startsWith("jdbc:sqlite:");
    }

    public int poolSize() {
        return poolSize;
    }

    public long acquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public long baseBackoffMs() {
        return baseBackoffMs;
    }

    public long maxBackoffMs() {
        return maxBackoffMs;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public int maxStepsPerRun() {
        return maxStepsPerRun;
    }

    public int pageSize() {
        return pageSize;
    }

    public String workerName() {
        return workerName;
    }

    public boolean debug() {
        return debug;
    }

    public StepGraphConfig withDatabaseUrl(String url) {
        DatabaseUrl normalized = normalizeDatabaseUrl(url);
        return new StepGraphConfig(rootDir, normalized.jdbcUrl(),
                firstNonBlank(normalized.user(), databaseUser), firstNonBlank(normalized.password(), databasePassword),
                poolSize, acquireTimeoutMs, maxAttempts, baseBackoffMs, maxBackoffMs,
                workerThreads, maxStepsPerRun, pageSize, workerName, debug);
    }

    public StepGraphConfig withPoolSize(int size) {
        return new StepGraphConfig(rootDir, databaseUrl, databaseUser, databasePassword,
                size, acquireTimeoutMs, maxAttempts, baseBackoffMs, maxBackoffMs,
                workerThreads, maxStepsPerRun, pageSize, workerName, debug);
    }

    public StepGraphConfig withRetry(int attempts, long baseMs, long maxMs) {
        return new StepGraphConfig(rootDir, databaseUrl, databaseUser, databasePassword,
                poolSize, acquireTimeoutMs, attempts, baseMs, maxMs,
                workerThreads, maxStepsPerRun, pageSize, workerName, debug);
    }

    public StepGraphConfig withWorkerThreads(int threads) {
        return new StepGraphConfig(rootDir, databaseUrl, databaseUser, databasePassword,
                poolSize, acquireTimeoutMs, maxAttempts, baseBackoffMs, maxBackoffMs,
                threads, maxStepsPerRun, pageSize, workerName, debug);
    }

    public StepGraphConfig withMaxStepsPerRun(int maxSteps) {
        return new StepGraphConfig(rootDir, databaseUrl, databaseUser, databasePassword,
                poolSize, acquireTimeoutMs, maxAttempts, baseBackoffMs, maxBackoffMs,
                workerThreads, maxSteps, pageSize, workerName, debug);
    }

    public StepGraphConfig withPageSize(int size) {
        return new StepGraphConfig(rootDir, databaseUrl, databaseUser, databasePassword,
                poolSize, acquireTimeoutMs, maxAttempts, baseBackoffMs, maxBackoffMs,
                workerThreads, maxStepsPerRun, size, workerName, debug);
    }

    public StepGraphConfig withDebug(boolean enabled) {
        return new StepGraphConfig(rootDir, databaseUrl, databaseUser, databasePassword,
                poolSize, acquireTimeoutMs, maxAttempts, baseBackoffMs, maxBackoffMs,
                workerThreads, maxStepsPerRun, pageSize, workerName, enabled);
    }

    private static Map<String, String> readEnvFile(Path file) {
        Map<String, String> out = new HashMap<>();
        if (!Files.isRegularFile(file)) {
            return out;
        }
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
        for (String name : props.stringPropertyNames()) {
            out.put(name.trim().toUpperCase(Locale.ROOT), unquote(props.getProperty(name).trim()));
        }
        return out;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static int intSetting(Map<String, String> settings, String key, int fallback) {
        String raw = settings.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static long longSetting(Map<String, String> settings, String key, long fallback) {
        String raw = settings.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    /**
     * Returns the first key with a non-blank value, or the first key when none is set.
     */
    private static String firstPresent(Map<String, String> settings, String key, String fallbackKey) {
        String value = settings.get(key);
        return value == null || value.isBlank() ? fallbackKey : key;
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second == null || second.isBlank() ? null : second;
    }

    // userinfo is percent-encoded only; '+' stays literal
    private static String decode(String value) {
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    public record DatabaseUrl(String jdbcUrl, String user, String password) {
    }
}
