package com.gedcomtree.service;

import com.gedcomtree.config.GedcomProperties;
import com.gedcomtree.config.GedcomProperties.TreeDefinition;
import com.gedcomtree.model.Element;
import com.gedcomtree.model.TreeSummary;
import com.gedcomtree.parser.GedcomDocument;
import com.gedcomtree.parser.GedcomParser;
import com.gedcomtree.query.RelationshipQueries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parses the configured GEDCOM trees on first use and keeps them in memory.
 *
 * <p>Documents handed out are shared and must be treated as read-only.
 */
@Service
public class GedcomTreeService {

    private static final Logger log = LoggerFactory.getLogger(GedcomTreeService.class);

    private final GedcomProperties properties;
    private final ResourceLoader resourceLoader;
    private final Map<String, RelationshipQueries> loaded = new ConcurrentHashMap<>();

    public GedcomTreeService(GedcomProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    /**
     * Summaries of all configured trees. Trees that fail to load are left out.
     */
    public List<TreeSummary> listTrees() {
        List<TreeSummary> summaries = new ArrayList<>();
        for (TreeDefinition tree : properties.getTrees()) {
            try {
                summaries.add(summarize(tree, queriesFor(tree).getDocument()));
            } catch (RuntimeException e) {
                log.warn("Skipping tree '{}': {}", tree.getSlug(), e.getMessage());
            }
        }
        return summaries;
    }

    public Optional<TreeSummary> getTree(String slug) {
        return findTree(slug).map(tree -> summarize(tree, queriesFor(tree).getDocument()));
    }

    public Optional<GedcomDocument> getDocument(String slug) {
        return queries(slug).map(RelationshipQueries::getDocument);
    }

    /**
     * Query engine over the tree with the given slug.
     *
     * @return empty if no such tree is configured
     * @throws com.gedcomtree.exception.GedcomFormatViolationException if a strict tree does not parse
     */
    public Optional<RelationshipQueries> queries(String slug) {
        return findTree(slug).map(this::queriesFor);
    }

    /** Pointer for a bare cross-reference id, e.g. {@code @I1@} for {@code I1}. */
    public static String toPointer(String id) {
        return id.startsWith("@") ? id : "@" + id + "@";
    }

    /**
     * Drops the cached document so the next request parses the file again.
     *
     * @return false if no such tree is configured
     */
    public boolean reload(String slug) {
        if (findTree(slug).isEmpty()) {
            return false;
        }
        loaded.remove(slug);
        log.info("Tree '{}' will be re-read on next use", slug);
        return true;
    }

    private Optional<TreeDefinition> findTree(String slug) {
        return Optional.ofNullable(properties.getTreeBySlug(slug));
    }

    private RelationshipQueries queriesFor(TreeDefinition tree) {
        return loaded.computeIfAbsent(tree.getSlug(), slug -> new RelationshipQueries(load(tree)));
    }

    private GedcomDocument load(TreeDefinition tree) {
        boolean strict = properties.isStrict(tree);
        Resource resource = resourceLoader.getResource(tree.getLocation());
        try (InputStream in = resource.getInputStream()) {
            GedcomDocument document = new GedcomParser(strict).parse(in);
            // build the indexes now; afterwards requests only read them
            document.getElementList();
            document.getElementDictionary();
            log.info("Loaded tree '{}' from {} ({} records, strict={})",
                    tree.getSlug(), tree.getLocation(), document.getRootChildElements().size(), strict);
            return document;
        } catch (IOException e) {
            log.error("Failed to read tree '{}' from {}", tree.getSlug(), tree.getLocation(), e);
            throw new UncheckedIOException(e);
        } catch (RuntimeException e) {
            log.error("Failed to parse tree '{}' from {}: {}", tree.getSlug(), tree.getLocation(), e.getMessage());
            throw e;
        }
    }

    private TreeSummary summarize(TreeDefinition tree, GedcomDocument document) {
        int individuals = 0;
        int families = 0;
        for (Element record : document.getRootChildElements()) {
            if (record.isIndividual()) {
                individuals++;
            } else if (record.isFamily()) {
                families++;
            }
        }
        return new TreeSummary(
            tree.getSlug(),
            tree.getDisplayName(),
            properties.isStrict(tree),
            document.getRootChildElements().size(),
            document.getElementList().size(),
            individuals,
            families
        );
    }
}
