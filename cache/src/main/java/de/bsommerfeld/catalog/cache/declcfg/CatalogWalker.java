package de.bsommerfeld.catalog.cache.declcfg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.catalog.core.error.CatalogException;
import de.bsommerfeld.catalog.core.error.InvalidCatalogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks a declarative source catalog directory in lexical order and emits
 * every JSON object found in its {@code .json} files as a {@link Meta}.
 * Subtrees matched by an {@code .indexignore} file are skipped; the ignore
 * files themselves are never treated as content.
 */
public class CatalogWalker {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogWalker.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String JSON_SUFFIX = ".json";

    @FunctionalInterface
    public interface MetaVisitor {

        void visit(Path file, Meta meta) throws IOException, CatalogException;
    }

    /**
     * Visits every object below {@code root}.
     *
     * @throws InvalidCatalogException if a file is not a stream of JSON
     *                                 objects or an object lacks a schema
     */
    public void walk(Path root, MetaVisitor visitor) throws IOException, CatalogException {
        for (Path file : files(root)) {
            readFile(file, visitor);
        }
    }

    /** Content files below {@code root} in walk order, ignore rules applied. */
    public List<Path> files(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("catalog source " + root + " is not a directory");
        }
        List<Path> files = new ArrayList<>();
        collect(root, new ArrayList<>(), files);
        return files;
    }

    private void collect(Path dir, List<IndexIgnore> inherited, List<Path> files) throws IOException {
        List<IndexIgnore> rules = inherited;
        Path ignoreFile = dir.resolve(IndexIgnore.FILE_NAME);
        if (Files.isRegularFile(ignoreFile)) {
            rules = new ArrayList<>(inherited);
            rules.add(IndexIgnore.read(ignoreFile));
        }

        List<Path> children;
        try (Stream<Path> listing = Files.list(dir)) {
            children = listing.sorted().collect(Collectors.toList());
        }
        for (Path child : children) {
            if (child.getFileName().toString().equals(IndexIgnore.FILE_NAME) || isIgnored(child, rules)) {
                continue;
            }
            if (Files.isDirectory(child)) {
                collect(child, rules, files);
            } else if (child.getFileName().toString().endsWith(JSON_SUFFIX)) {
                files.add(child);
            } else {
                LOG.trace("Skipping non-JSON file {}", child);
            }
        }
    }

    private static boolean isIgnored(Path path, List<IndexIgnore> rules) {
        for (IndexIgnore rule : rules) {
            if (rule.ignores(path)) {
                LOG.debug("Ignoring {}", path);
                return true;
            }
        }
        return false;
    }

    private void readFile(Path file, MetaVisitor visitor) throws IOException, CatalogException {
        try (MappingIterator<JsonNode> objects = MAPPER.readerFor(JsonNode.class).readValues(file.toFile())) {
            while (objects.hasNextValue()) {
                visitor.visit(file, toMeta(objects.nextValue()));
            }
        } catch (JsonProcessingException e) {
            throw new InvalidCatalogException("parse " + file + ": " + e.getOriginalMessage(), e);
        }
    }

    static Meta toMeta(JsonNode node) throws JsonProcessingException, InvalidCatalogException {
        String json = MAPPER.writeValueAsString(node);
        if (!node.isObject()) {
            throw new InvalidCatalogException(String.format("object '%s' is not a JSON object", json));
        }
        String schema = node.path("schema").asText("");
        if (schema.isEmpty()) {
            throw new InvalidCatalogException(String.format("object '%s' is missing root schema field", json));
        }
        String name = node.path("name").asText("");
        String packageName = Meta.SCHEMA_PACKAGE.equals(schema) ? name : node.path("package").asText("");
        return new Meta(schema, packageName, name, MAPPER.writeValueAsBytes(node));
    }
}
