package org.onionscout;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Writes the whole knowledge base as one JSON document: progress counters, then every host with its pages and
 * each page's findings and extracts. Hosts are read in small batches, one transaction per host, so an export can
 * run while the crawl keeps writing.
 */
public class Exporter {
    private static final Logger log = LoggerFactory.getLogger(Exporter.class);
    static final int HOST_BATCH_SIZE = 100;
    static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    private final Database db;

    public Exporter(Database db) {
        this.db = db;
    }

    /**
     * Exports to a file, replacing it atomically so readers never see a partial document.
     *
     * @return the number of hosts exported
     */
    public long export(Path path) throws IOException {
        Path absolute = path.toAbsolutePath();
        if (absolute.getParent() != null) Files.createDirectories(absolute.getParent());
        Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        long hosts;
        try (OutputStream out = Files.newOutputStream(temp)) {
            hosts = export(out);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        Files.move(temp, absolute, REPLACE_EXISTING, ATOMIC_MOVE);
        log.atInfo().addKeyValue("hosts", hosts).log("Exported to {}", absolute);
        return hosts;
    }

    /**
     * Writes the export document to a stream, leaving it open.
     *
     * @return the number of hosts exported
     */
    public long export(OutputStream out) throws IOException {
        long count = 0;
        try (JsonGenerator generator = JSON.getFactory().createGenerator(out)) {
            generator.writeStartObject();
            generator.writeStringField("exported", Instant.now().toString());
            generator.writeObjectField("progress", db.progress().current());
            generator.writeArrayFieldStart("hosts");
            long afterId = 0;
            while (true) {
                List<Host> batch = db.hosts().batchAfter(afterId, HOST_BATCH_SIZE);
                if (batch.isEmpty()) break;
                for (Host host : batch) {
                    generator.writeTree(hostNode(host));
                    count++;
                }
                afterId = batch.get(batch.size() - 1).id();
            }
            generator.writeEndArray();
            generator.writeEndObject();
        }
        return count;
    }

    private ObjectNode hostNode(Host host) {
        return db.inTransaction(tx -> {
            List<Page> pages = tx.pages().forHost(host.id());
            var findingsByPage = new HashMap<Long, List<Finding>>();
            var extractsByPage = new HashMap<Long, List<Extract>>();
            if (!pages.isEmpty()) {
                List<Long> pageIds = pages.stream().map(Page::id).toList();
                for (Finding finding : tx.findings().forPages(pageIds)) {
                    findingsByPage.computeIfAbsent(finding.pageId(), id -> new ArrayList<>()).add(finding);
                }
                for (Extract extract : tx.extracts().forPages(pageIds)) {
                    extractsByPage.computeIfAbsent(extract.pageId(), id -> new ArrayList<>()).add(extract);
                }
            }
            ObjectNode hostNode = JSON.valueToTree(host);
            ArrayNode pagesNode = hostNode.putArray("pages");
            for (Page page : pages) {
                ObjectNode pageNode = JSON.valueToTree(page);
                pageNode.set("findings", JSON.valueToTree(findingsByPage.getOrDefault(page.id(), List.of())));
                pageNode.set("extracts", JSON.valueToTree(extractsByPage.getOrDefault(page.id(), List.of())));
                pagesNode.add(pageNode);
            }
            return hostNode;
        });
    }
}
