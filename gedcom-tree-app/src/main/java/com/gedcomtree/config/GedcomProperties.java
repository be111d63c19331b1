package com.gedcomtree.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * GEDCOM trees served by the application.
 * Define trees in application.yml under 'gedcom.trees'
 */
@Configuration
@ConfigurationProperties(prefix = "gedcom")
public class GedcomProperties {

    /** Parse mode for trees that do not set their own. */
    private boolean strict = true;

    private List<TreeDefinition> trees = new ArrayList<>();

    public boolean isStrict() { return strict; }
    public void setStrict(boolean strict) { this.strict = strict; }

    public List<TreeDefinition> getTrees() { return trees; }
    public void setTrees(List<TreeDefinition> trees) { this.trees = trees; }

    public TreeDefinition getTreeBySlug(String slug) {
        return trees.stream()
            .filter(t -> t.getSlug().equals(slug))
            .findFirst()
            .orElse(null);
    }

    public boolean isStrict(TreeDefinition tree) {
        return tree.getStrict() != null ? tree.getStrict() : strict;
    }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class TreeDefinition {
        private String slug;
        private String displayName;
        private String location;     // Spring resource location, e.g. classpath:gedcom/sample.ged
        private Boolean strict;      // null = use gedcom.strict

        // Getters and setters for Spring Boot binding
        public String getSlug() { return slug; }
        public void setSlug(String slug) { this.slug = slug; }

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }

        public Boolean getStrict() { return strict; }
        public void setStrict(Boolean strict) { this.strict = strict; }
    }
}
