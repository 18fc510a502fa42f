package de.mirkosertic.mcp.codeindex.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.mcp.codeindex.index.IndexedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store that keeps all documents in a single JSON file ({@code documents.json})
 * below the configured store directory.
 * <p>
 * The complete file is rewritten on every mutation. Writes go to a temporary file first
 * which is then moved over the old one, so a crash never leaves a half written file behind.
 */
public class JsonFileDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileDocumentStore.class);

    static final String STORE_FILE = "documents.json";

    private final Path storeDirectory;
    private final Path storeFile;
    private final ObjectMapper objectMapper;
    private final Map<String, IndexedDocument> documents = new LinkedHashMap<>();

    public JsonFileDocumentStore(final Path storeDirectory) {
        this.storeDirectory = storeDirectory;
        this.storeFile = storeDirectory.resolve(STORE_FILE);
        this.objectMapper = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Loads the store file if it exists.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public synchronized void init() throws IOException {
        documents.clear();
        if (!Files.exists(storeFile)) {
            logger.info("No document store found at {}, starting empty", storeFile);
            return;
        }

        try (final Reader reader = Files.newBufferedReader(storeFile)) {
            final List<IndexedDocument> loaded = objectMapper.readValue(reader, new TypeReference<>() {
            });
            if (loaded != null) {
                for (final IndexedDocument document : loaded) {
                    documents.put(document.id(), document);
                }
            }
        }
        logger.info("Loaded {} documents from {}", documents.size(), storeFile);
    }

    @Override
    public void reload() throws IOException {
        init();
    }

    @Override
    public synchronized Optional<IndexedDocument> get(final String id) {
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public synchronized void put(final IndexedDocument document) throws IOException {
        final IndexedDocument previous = documents.put(document.id(), document);
        try {
            save();
        } catch (final IOException e) {
            if (previous != null) {
                documents.put(document.id(), previous);
            } else {
                documents.remove(document.id());
            }
            throw e;
        }
    }

    @Override
    public synchronized boolean remove(final String id) throws IOException {
        final IndexedDocument previous = documents.remove(id);
        if (previous == null) {
            return false;
        }
        try {
            save();
        } catch (final IOException e) {
            documents.put(id, previous);
            throw e;
        }
        return true;
    }

    @Override
    public synchronized Collection<IndexedDocument> all() {
        return List.copyOf(documents.values());
    }

    @Override
    public synchronized int size() {
        return documents.size();
    }

    public Path getStoreFile() {
        return storeFile;
    }

    private void save() throws IOException {
        if (!Files.exists(storeDirectory)) {
            Files.createDirectories(storeDirectory);
        }

        final Path tempFile = storeDirectory.resolve(STORE_FILE + ".tmp");
        try (final Writer writer = Files.newBufferedWriter(tempFile,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, new ArrayList<>(documents.values()));
        }
        Files.move(tempFile, storeFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug("Saved {} documents to {}", documents.size(), storeFile);
    }
}
