package com.familygraph.config;

import com.familygraph.service.ValueAliasField;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine configuration. Define aliases and relationship types in application.yml
 * under 'familygraph'.
 */
@Configuration
@ConfigurationProperties(prefix = "familygraph")
public class GraphEngineProperties {

    // User property name -> canonical property name; first match wins, so order matters
    private Map<String, String> propertyAliases = new LinkedHashMap<>();

    // Per field: user value (lower case) -> canonical value
    private Map<ValueAliasField, Map<String, String>> valueAliases = new EnumMap<>(ValueAliasField.class);

    // User-defined relationship types; an id matching a built-in replaces it
    private List<RelationshipTypeProperties> relationshipTypes = new ArrayList<>();

    private List<String> hiddenRelationshipTypes = new ArrayList<>();

    // Identifiers of this shape are foreign handles an import failed to translate (GEDCOM xrefs)
    private String unresolvedReferencePattern = "^@[^@\\s]+@$";

    private NoteTypeDetection noteTypeDetection = new NoteTypeDetection();

    private Analytics analytics = new Analytics();

    // Build the first snapshot when the application starts
    private boolean loadOnStartup = true;

    public Map<String, String> getPropertyAliases() { return propertyAliases; }
    public void setPropertyAliases(Map<String, String> propertyAliases) { this.propertyAliases = propertyAliases; }

    public Map<ValueAliasField, Map<String, String>> getValueAliases() { return valueAliases; }
    public void setValueAliases(Map<ValueAliasField, Map<String, String>> valueAliases) { this.valueAliases = valueAliases; }

    public List<RelationshipTypeProperties> getRelationshipTypes() { return relationshipTypes; }
    public void setRelationshipTypes(List<RelationshipTypeProperties> relationshipTypes) { this.relationshipTypes = relationshipTypes; }

    public List<String> getHiddenRelationshipTypes() { return hiddenRelationshipTypes; }
    public void setHiddenRelationshipTypes(List<String> hiddenRelationshipTypes) { this.hiddenRelationshipTypes = hiddenRelationshipTypes; }

    public String getUnresolvedReferencePattern() { return unresolvedReferencePattern; }
    public void setUnresolvedReferencePattern(String unresolvedReferencePattern) { this.unresolvedReferencePattern = unresolvedReferencePattern; }

    public NoteTypeDetection getNoteTypeDetection() { return noteTypeDetection; }
    public void setNoteTypeDetection(NoteTypeDetection noteTypeDetection) { this.noteTypeDetection = noteTypeDetection; }

    public Analytics getAnalytics() { return analytics; }
    public void setAnalytics(Analytics analytics) { this.analytics = analytics; }

    public boolean isLoadOnStartup() { return loadOnStartup; }
    public void setLoadOnStartup(boolean loadOnStartup) { this.loadOnStartup = loadOnStartup; }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class RelationshipTypeProperties {
        private String id;
        private String name;
        private String description;
        private String category = "social";
        private String color = "#6b7280";
        private String lineStyle = "solid";
        private String inverse;
        private boolean symmetric;
        private boolean includeOnFamilyTree;
        private String familyGraphMapping;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }

        public String getColor() { return color; }
        public void setColor(String color) { this.color = color; }

        public String getLineStyle() { return lineStyle; }
        public void setLineStyle(String lineStyle) { this.lineStyle = lineStyle; }

        public String getInverse() { return inverse; }
        public void setInverse(String inverse) { this.inverse = inverse; }

        public boolean isSymmetric() { return symmetric; }
        public void setSymmetric(boolean symmetric) { this.symmetric = symmetric; }

        public boolean isIncludeOnFamilyTree() { return includeOnFamilyTree; }
        public void setIncludeOnFamilyTree(boolean includeOnFamilyTree) { this.includeOnFamilyTree = includeOnFamilyTree; }

        public String getFamilyGraphMapping() { return familyGraphMapping; }
        public void setFamilyGraphMapping(String familyGraphMapping) { this.familyGraphMapping = familyGraphMapping; }
    }

    public static class NoteTypeDetection {
        // "cr_type" or "type"; the other one is checked as a fallback
        private String primaryTypeProperty = "cr_type";
        private boolean enableTagDetection = true;

        public String getPrimaryTypeProperty() { return primaryTypeProperty; }
        public void setPrimaryTypeProperty(String primaryTypeProperty) { this.primaryTypeProperty = primaryTypeProperty; }

        public boolean isEnableTagDetection() { return enableTagDetection; }
        public void setEnableTagDetection(boolean enableTagDetection) { this.enableTagDetection = enableTagDetection; }
    }

    public static class Analytics {
        private int topConnections = 5;

        public int getTopConnections() { return topConnections; }
        public void setTopConnections(int topConnections) { this.topConnections = topConnections; }
    }
}
