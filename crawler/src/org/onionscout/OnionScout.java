package org.onionscout;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.sun.net.httpserver.HttpServer;
import org.jetbrains.annotations.Nullable;
import org.onionscout.config.ConfigurationException;
import org.onionscout.config.ScoutConfig;
import org.onionscout.transport.ProxyCheck;
import org.onionscout.transport.ProxySettings;
import org.onionscout.transport.SocksProxyTransport;
import org.onionscout.webapp.Webapp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;

public class OnionScout {
    private static final Logger log = LoggerFactory.getLogger(OnionScout.class);
    static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) throws Exception {
        Path configFile = null;
        boolean dumpConfig = false;
        var overrides = YAML.createObjectNode();
        var seeds = new ArrayList<String>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> configFile = Path.of(args[++i]);
                case "--dump-config" -> dumpConfig = true;
                case "--workers", "-w" -> section(overrides, "crawl").put("workers", Integer.parseInt(args[++i]));
                case "--timeout" -> section(overrides, "crawl").put("timeout", args[++i]);
                case "--pages" -> section(overrides, "crawl").put("pageBudget", Long.parseLong(args[++i]));
                case "--retry-limit" -> section(overrides, "crawl").put("retryLimit", Integer.parseInt(args[++i]));
                case "--courtesy" -> section(overrides, "crawl").put("courtesyInterval", args[++i]);
                case "--db" -> section(overrides, "storage").put("database", args[++i]);
                case "--export", "-o" -> section(overrides, "storage").put("export", args[++i]);
                case "--reset" -> section(overrides, "storage").put("reset", true);
                case "--host" -> section(overrides, "web").put("host", args[++i]);
                case "--port", "-p" -> section(overrides, "web").put("port", Integer.parseInt(args[++i]));
                case "--no-web" -> section(overrides, "web").put("enabled", false);
                case "--proxy-host" -> section(overrides, "proxy").put("host", args[++i]);
                case "--proxy-port" -> section(overrides, "proxy").put("port", Integer.parseInt(args[++i]));
                case "--fallback-port" -> section(overrides, "proxy").put("fallbackPort", Integer.parseInt(args[++i]));
                case "--no-verify" -> section(overrides, "proxy").put("verify", false);
                case "--seed", "-s" -> seeds.add(args[++i]);
                case "--help", "-h" -> {
                    printUsage();
                    System.exit(0);
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    seeds.add(args[i]);
                }
            }
        }

        ScoutConfig config;
        try {
            config = loadConfig(configFile, overrides, seeds);
        } catch (ConfigurationException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }
        if (dumpConfig) {
            System.out.println(YAML.writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }

        ProxySettings proxySettings = config.proxy().toSettings();
        if (config.proxy().verify() && !proxySettings.isDirect()) {
            var selected = new ProxyCheck(config.crawl().timeout()).selectPort(proxySettings);
            if (selected.isEmpty()) {
                log.error("No working Tor SOCKS proxy at {} on port {} or {}", proxySettings.host(),
                        proxySettings.port(), proxySettings.fallbackPort());
                System.exit(3);
            }
            proxySettings = selected.get();
        }

        Database db;
        try {
            db = Database.open(config.storage().database());
        } catch (MigrationException e) {
            log.error("Refusing to start: {}", e.getMessage(), e);
            System.exit(4);
            return;
        }
        var transport = new SocksProxyTransport(proxySettings);
        var supervisor = new CrawlSupervisor(config, db, transport);

        HttpServer httpServer = null;
        if (config.web().enabled()) {
            System.setProperty("sun.net.httpserver.nodelay", "true");
            httpServer = HttpServer.create(new InetSocketAddress(config.web().host(), config.web().port()), 0);
            httpServer.createContext("/", new Webapp(supervisor));
            httpServer.setExecutor(Executors.newCachedThreadPool());
            httpServer.start();
            log.info("Dashboard API listening on http://{}:{}/api/", config.web().host(),
                    httpServer.getAddress().getPort());
        }

        HttpServer server = httpServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                supervisor.close();
                if (server != null) server.stop(0);
                transport.close();
                db.close();
            } catch (Exception e) {
                System.err.println("Error shutting down crawl: " + e.getMessage());
                e.printStackTrace(System.err);
            }
        }, "shutdown-hook"));

        try {
            supervisor.start();
        } catch (ConfigurationException e) {
            log.error("Refusing to start: {}", e.getMessage());
            System.exit(2);
        }
        supervisor.awaitTermination();
        if (httpServer == null) {
            System.exit(0);
        }
        log.info("Crawl finished, dashboard API still available. Press Ctrl-C to exit.");
    }

    private static ObjectNode section(ObjectNode root, String name) {
        return root.has(name) ? (ObjectNode) root.get(name) : root.putObject(name);
    }

    /**
     * Builds the run configuration: bundled defaults, deep-merged with the config file if given, then the command
     * line overrides. Seeds given on the command line are added to those in the file.
     */
    static ScoutConfig loadConfig(@Nullable Path configFile, ObjectNode overrides, List<String> seeds)
            throws ConfigurationException {
        try {
            JsonNode tree;
            try (InputStream stream = OnionScout.class.getResourceAsStream("config/defaults.yaml")) {
                if (stream == null) throw new ConfigurationException("Missing bundled config/defaults.yaml");
                tree = YAML.readTree(stream);
            }
            if (configFile != null) {
                if (!Files.exists(configFile)) throw new ConfigurationException("Config file not found: " + configFile);
                JsonNode fileTree = YAML.readTree(configFile.toFile());
                if (fileTree.isObject()) {
                    tree = deepMerge(tree, fileTree);
                } else if (!fileTree.isMissingNode() && !fileTree.isNull()) {
                    throw new ConfigurationException("Config file " + configFile + " is not a YAML mapping");
                }
            }
            tree = deepMerge(tree, overrides);
            if (!seeds.isEmpty()) {
                ArrayNode seedArray = YAML.createArrayNode();
                tree.path("seeds").forEach(seedArray::add);
                seeds.forEach(seedArray::add);
                ((ObjectNode) tree).set("seeds", seedArray);
            }
            return YAML.treeToValue(tree, ScoutConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read configuration: " + e.getMessage(), e);
        }
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                JsonNode baseValue = merged.get(key);
                merged.set(key, deepMerge(baseValue, overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }

    private static void printUsage() {
        System.out.println("Usage: onionscout [options] [SEED...]");
        System.out.println("Options:");
        System.out.println("  -c, --config FILE        YAML config merged over the defaults");
        System.out.println("  -s, --seed ADDRESS       Address to start crawling from (repeatable)");
        System.out.println("  -w, --workers N          Concurrent fetch workers");
        System.out.println("      --timeout DURATION   Per-request timeout, e.g. 90s");
        System.out.println("      --pages N            Page budget across runs of this database");
        System.out.println("      --retry-limit N      Retries of a failed address before giving up");
        System.out.println("      --courtesy DURATION  Minimum spacing between requests to one host");
        System.out.println("      --db FILE            SQLite database");
        System.out.println("  -o, --export FILE        Write a JSON export when the crawl stops");
        System.out.println("      --reset              Discard previous crawl state");
        System.out.println("      --host HOST          Dashboard API listen host");
        System.out.println("  -p, --port PORT          Dashboard API listen port");
        System.out.println("      --no-web             Don't start the dashboard API");
        System.out.println("      --proxy-host HOST    Tor SOCKS host");
        System.out.println("      --proxy-port PORT    Tor SOCKS port");
        System.out.println("      --fallback-port PORT Port tried if the SOCKS port fails the check");
        System.out.println("      --no-verify          Skip the startup Tor check");
        System.out.println("      --dump-config        Print the effective configuration and exit");
    }
}
