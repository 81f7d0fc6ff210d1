package com.familygraph.model;

import java.util.List;

import static com.familygraph.model.FamilyGraphMapping.ADOPTIVE_PARENT;
import static com.familygraph.model.FamilyGraphMapping.CHILD;
import static com.familygraph.model.FamilyGraphMapping.FOSTER_PARENT;
import static com.familygraph.model.FamilyGraphMapping.GUARDIAN;
import static com.familygraph.model.FamilyGraphMapping.PARENT;
import static com.familygraph.model.FamilyGraphMapping.SPOUSE;
import static com.familygraph.model.FamilyGraphMapping.STEPPARENT;
import static com.familygraph.model.LineStyle.DASHED;
import static com.familygraph.model.LineStyle.DOTTED;
import static com.familygraph.model.LineStyle.SOLID;
import static com.familygraph.model.RelationshipCategory.DNA;
import static com.familygraph.model.RelationshipCategory.FAMILY;
import static com.familygraph.model.RelationshipCategory.FEUDAL;
import static com.familygraph.model.RelationshipCategory.LEGAL;
import static com.familygraph.model.RelationshipCategory.PROFESSIONAL;
import static com.familygraph.model.RelationshipCategory.RELIGIOUS;
import static com.familygraph.model.RelationshipCategory.SOCIAL;

/**
 * Built-in relationship catalog. Step and adoptive types are on family trees
 * by default; foster, guardian and ward are not.
 */
public final class DefaultRelationshipTypes {

    public static final String SPOUSE_TYPE = "spouse";
    public static final String PARENTS_TYPE = "parents";
    public static final String CHILDREN_TYPE = "children";
    public static final String STEP_PARENT_TYPE = "step_parent";
    public static final String ADOPTIVE_PARENT_TYPE = "adoptive_parent";
    public static final String ADOPTED_CHILD_TYPE = "adopted_child";
    public static final String FOSTER_PARENT_TYPE = "foster_parent";
    public static final String GUARDIAN_TYPE = "guardian";

    public static final List<RelationshipTypeDefinition> ALL = List.of(
        // Family
        type(SPOUSE_TYPE, "Spouse", FAMILY, "#a855f7", SOLID, null, true, true, SPOUSE),
        type(PARENTS_TYPE, "Parent", FAMILY, "#22c55e", SOLID, CHILDREN_TYPE, false, true, PARENT),
        type(CHILDREN_TYPE, "Child", FAMILY, "#22c55e", SOLID, PARENTS_TYPE, false, true, CHILD),
        type("sibling", "Sibling", FAMILY, "#84cc16", SOLID, null, true, false, null),

        // Legal/guardianship
        type(GUARDIAN_TYPE, "Guardian", LEGAL, "#14b8a6", SOLID, "ward", false, false, GUARDIAN),
        type("ward", "Ward", LEGAL, "#14b8a6", SOLID, GUARDIAN_TYPE, false, false, CHILD),
        type(STEP_PARENT_TYPE, "Step-parent", LEGAL, "#14b8a6", DASHED, "step_child", false, true, STEPPARENT),
        type("step_child", "Step-child", LEGAL, "#14b8a6", DASHED, STEP_PARENT_TYPE, false, true, CHILD),
        type(ADOPTIVE_PARENT_TYPE, "Adoptive parent", LEGAL, "#06b6d4", DOTTED, ADOPTED_CHILD_TYPE, false, true, ADOPTIVE_PARENT),
        type(ADOPTED_CHILD_TYPE, "Adopted child", LEGAL, "#06b6d4", DOTTED, ADOPTIVE_PARENT_TYPE, false, true, CHILD),
        type(FOSTER_PARENT_TYPE, "Foster parent", LEGAL, "#0ea5e9", SOLID, "foster_child", false, false, FOSTER_PARENT),
        type("foster_child", "Foster child", LEGAL, "#0ea5e9", SOLID, FOSTER_PARENT_TYPE, false, false, CHILD),

        // Religious/spiritual
        type("godparent", "Godparent", RELIGIOUS, "#3b82f6", SOLID, "godchild", false, false, null),
        type("godchild", "Godchild", RELIGIOUS, "#3b82f6", SOLID, "godparent", false, false, null),
        type("mentor", "Mentor", RELIGIOUS, "#8b5cf6", SOLID, "disciple", false, false, null),
        type("disciple", "Disciple", RELIGIOUS, "#8b5cf6", SOLID, "mentor", false, false, null),

        // Professional
        type("master", "Master", PROFESSIONAL, "#f97316", SOLID, "apprentice", false, false, null),
        type("apprentice", "Apprentice", PROFESSIONAL, "#f97316", SOLID, "master", false, false, null),
        type("employer", "Employer", PROFESSIONAL, "#ea580c", SOLID, "employee", false, false, null),
        type("employee", "Employee", PROFESSIONAL, "#ea580c", SOLID, "employer", false, false, null),

        // Social
        type("witness", "Witness", SOCIAL, "#6b7280", DASHED, null, false, false, null),
        type("neighbor", "Neighbor", SOCIAL, "#9ca3af", DASHED, null, true, false, null),
        type("companion", "Companion", SOCIAL, "#22c55e", SOLID, null, true, false, null),
        type("betrothed", "Betrothed", SOCIAL, "#ec4899", DASHED, null, true, false, null),

        // Feudal/world-building
        type("liege", "Liege lord", FEUDAL, "#eab308", SOLID, "vassal", false, false, null),
        type("vassal", "Vassal", FEUDAL, "#eab308", SOLID, "liege", false, false, null),
        type("ally", "Ally", FEUDAL, "#10b981", DASHED, null, true, false, null),
        type("rival", "Rival", FEUDAL, "#ef4444", DASHED, null, true, false, null),

        type("dna_match", "DNA match", DNA, "#9333ea", DASHED, null, true, false, null)
    );

    private DefaultRelationshipTypes() {
    }

    private static RelationshipTypeDefinition type(String id, String name, RelationshipCategory category,
                                                   String color, LineStyle lineStyle, String inverse,
                                                   boolean symmetric, boolean includeOnFamilyTree,
                                                   FamilyGraphMapping mapping) {
        return new RelationshipTypeDefinition(id, name, null, category, color, lineStyle, inverse,
            symmetric, true, includeOnFamilyTree, mapping);
    }
}
