package com.gedcomtree.query;

import com.gedcomtree.exception.GedcomDomainException;
import com.gedcomtree.exception.NotAFamilyException;
import com.gedcomtree.exception.NotAnIndividualException;
import com.gedcomtree.model.Element;
import com.gedcomtree.model.FamilyMemberFilter;
import com.gedcomtree.model.IndividualElement;
import com.gedcomtree.model.Marriage;
import com.gedcomtree.parser.GedcomDocument;
import com.gedcomtree.parser.GedcomParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for RelationshipQueries over test-family.ged (three generations of Smiths,
 * see GedcomParserTest for the diagram) and over small hand-built documents.
 */
class RelationshipQueriesTest {

    private RelationshipQueries queries;
    private GedcomDocument document;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/gedcom/test-family.ged")) {
            document = GedcomParser.strict().parse(in);
        }
        queries = new RelationshipQueries(document);
    }

    private Element record(String pointer) {
        return document.findByPointer(pointer).orElseThrow();
    }

    private static List<String> pointers(List<? extends Element> elements) {
        return elements.stream().map(Element::getPointer).toList();
    }

    @Nested
    @DisplayName("families and members")
    class Families {

        @Test
        void findsFamiliesByRole() {
            assertThat(pointers(queries.getFamilies(record("@I3@"), FamilyRole.SPOUSE))).containsExactly("@F2@");
            assertThat(pointers(queries.getFamilies(record("@I3@"), FamilyRole.CHILD))).containsExactly("@F1@");
            assertThat(queries.getFamilies(record("@I1@"), FamilyRole.CHILD)).isEmpty();
        }

        @Test
        void membersFilteredByRole() {
            Element f1 = record("@F1@");

            assertThat(pointers(queries.getFamilyMembers(f1, FamilyMemberFilter.PARENTS))).containsExactly("@I1@", "@I2@");
            assertThat(pointers(queries.getFamilyMembers(f1, FamilyMemberFilter.CHILDREN))).containsExactly("@I3@");
            assertThat(pointers(queries.getFamilyMembers(f1, FamilyMemberFilter.HUSBAND))).containsExactly("@I1@");
        }

        @Test
        void membersSkipDanglingLinks() {
            Element f2 = record("@F2@");

            assertThat(pointers(queries.getFamilyMembers(f2, FamilyMemberFilter.ALL)))
                .containsExactly("@I3@", "@I4@", "@I5@");
            assertThat(pointers(queries.getFamilyMembers(f2, FamilyMemberFilter.CHILDREN))).containsExactly("@I5@");
            assertThat(pointers(queries.getFamilyMembers(f2, FamilyMemberFilter.WIFE))).containsExactly("@I4@");
        }

        @Test
        void membersSkipLinksToNonIndividuals() {
            GedcomDocument doc = GedcomParser.strict().parse(
                "0 @I1@ INDI\n1 FAMS @F1@\n0 @F1@ FAM\n1 HUSB @I1@\n1 WIFE @F1@\n");
            RelationshipQueries q = new RelationshipQueries(doc);

            assertThat(pointers(q.getFamilyMembers(doc.findByPointer("@F1@").orElseThrow(), FamilyMemberFilter.PARENTS)))
                .containsExactly("@I1@");
        }

        @Test
        void childrenComeFromSpouseFamilies() {
            assertThat(pointers(queries.getChildren(record("@I1@")))).containsExactly("@I3@");
            assertThat(queries.getChildren(record("@I5@"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("parents and ancestors")
    class Ancestry {

        @Test
        void allParentsIncludeAdoptive() {
            assertThat(pointers(queries.getParents(record("@I5@"), ParentType.ALL))).containsExactly("@I3@", "@I4@");
        }

        @Test
        void naturalParentsFollowQualifiers() {
            assertThat(pointers(queries.getParents(record("@I5@"), ParentType.NATURAL))).containsExactly("@I3@");
            assertThat(pointers(queries.getParents(record("@I3@"), ParentType.NATURAL))).containsExactly("@I1@", "@I2@");
        }

        @Test
        void ancestorsListParentsBeforeGrandparents() {
            assertThat(pointers(queries.getAncestors(record("@I5@"), ParentType.ALL)))
                .containsExactly("@I3@", "@I4@", "@I1@", "@I2@");
        }

        @Test
        void naturalAncestorsUseNaturalParentsAtEveryLevel() {
            assertThat(pointers(queries.getAncestors(record("@I5@"), ParentType.NATURAL)))
                .containsExactly("@I3@", "@I1@", "@I2@");
        }

        @Test
        void descendantsWalkDownGenerations() {
            assertThat(pointers(queries.getDescendants(record("@I1@")))).containsExactly("@I3@", "@I5@");
            assertThat(queries.getDescendants(record("@I5@"))).isEmpty();
        }

        @Test
        void pathFollowsNaturalParents() {
            assertThat(queries.findPathToAncestor(record("@I5@"), record("@I1@")))
                .hasValueSatisfying(path -> assertThat(pointers(path)).containsExactly("@I5@", "@I3@", "@I1@"));
        }

        @Test
        void noPathThroughAdoptiveParent() {
            assertThat(queries.findPathToAncestor(record("@I5@"), record("@I4@"))).isEmpty();
        }

        @Test
        void pathToSelfIsSingleElement() {
            assertThat(queries.findPathToAncestor(record("@I5@"), record("@I5@")))
                .hasValueSatisfying(path -> assertThat(pointers(path)).containsExactly("@I5@"));
        }
    }

    @Nested
    @DisplayName("pointer cycles")
    class Cycles {

        // A is the child of B, B of C, and C of A
        private static final String CYCLE =
            "0 @A@ INDI\n1 FAMC @F1@\n1 FAMS @F3@\n"
                + "0 @B@ INDI\n1 FAMC @F2@\n1 FAMS @F1@\n"
                + "0 @C@ INDI\n1 FAMC @F3@\n1 FAMS @F2@\n"
                + "0 @D@ INDI\n"
                + "0 @F1@ FAM\n1 HUSB @B@\n1 CHIL @A@\n2 _FREL Natural\n"
                + "0 @F2@ FAM\n1 HUSB @C@\n1 CHIL @B@\n2 _FREL Natural\n"
                + "0 @F3@ FAM\n1 HUSB @A@\n1 CHIL @C@\n2 _FREL Natural\n";

        private GedcomDocument cycle;
        private RelationshipQueries q;

        @BeforeEach
        void setUp() {
            cycle = GedcomParser.strict().parse(CYCLE);
            q = new RelationshipQueries(cycle);
        }

        private IndividualElement person(String pointer) {
            return (IndividualElement) cycle.findByPointer(pointer).orElseThrow();
        }

        @Test
        void ancestorsTerminateAndExcludeStart() {
            assertThat(pointers(q.getAncestors(person("@A@"), ParentType.ALL))).containsExactly("@B@", "@C@");
            assertThat(pointers(q.getAncestors(person("@A@"), ParentType.NATURAL))).containsExactly("@B@", "@C@");
        }

        @Test
        void descendantsTerminate() {
            assertThat(pointers(q.getDescendants(person("@A@")))).containsExactly("@C@", "@B@");
        }

        @Test
        void pathSearchTerminates() {
            assertThat(q.findPathToAncestor(person("@A@"), person("@C@")))
                .hasValueSatisfying(path -> assertThat(pointers(path)).containsExactly("@A@", "@B@", "@C@"));
            assertThat(q.findPathToAncestor(person("@A@"), person("@D@"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("marriages")
    class Marriages {

        @Test
        void readsDateAndPlace() {
            assertThat(queries.getMarriages(record("@I1@")))
                .containsExactly(new Marriage("3 JUN 1875", "Leeds, England"));
        }

        @Test
        void yearsComeFromLastDateToken() {
            assertThat(queries.getMarriageYears(record("@I1@"))).containsExactly(1875);
            assertThat(queries.getMarriageYears(record("@I3@"))).containsExactly(1903);
            assertThat(queries.getMarriageYears(record("@I5@"))).isEmpty();
        }

        @Test
        void undatedMarriagesHaveNoYear() {
            GedcomDocument doc = GedcomParser.strict().parse(
                "0 @I1@ INDI\n1 FAMS @F1@\n0 @F1@ FAM\n1 HUSB @I1@\n1 MARR\n2 PLAC Hull\n");
            RelationshipQueries q = new RelationshipQueries(doc);
            Element husband = doc.findByPointer("@I1@").orElseThrow();

            assertThat(q.getMarriages(husband)).containsExactly(new Marriage("", "Hull"));
            assertThat(q.getMarriageYears(husband)).isEmpty();
        }

        @Test
        void matchesYearAndRange() {
            assertThat(queries.marriageYearMatch(record("@I4@"), 1903)).isTrue();
            assertThat(queries.marriageYearMatch(record("@I4@"), 1875)).isFalse();
            assertThat(queries.marriageRangeMatch(record("@I2@"), 1870, 1875)).isTrue();
            assertThat(queries.marriageRangeMatch(record("@I2@"), 1876, 1900)).isFalse();
        }
    }

    @Nested
    @DisplayName("criteria and misuse")
    class CriteriaAndMisuse {

        @Test
        void findsMatchingIndividualsInFileOrder() {
            assertThat(pointers(queries.findIndividuals("surname=smith"))).containsExactly("@I1@", "@I3@", "@I5@");
            assertThat(pointers(queries.findIndividuals("surname=smith:birth_range=1870-1910")))
                .containsExactly("@I3@", "@I5@");
        }

        @Test
        void criteriaMatchOnIndividual() {
            assertThat(queries.criteriaMatch(record("@I2@"), "name=mary:birth=1855")).isTrue();
        }

        @Test
        void individualQueriesRejectFamilies() {
            Element family = record("@F1@");

            assertThatThrownBy(() -> queries.getParents(family, ParentType.ALL))
                .isInstanceOf(NotAnIndividualException.class)
                .hasMessageContaining("INDI");
            assertThatThrownBy(() -> queries.getAncestors(family, ParentType.NATURAL))
                .isInstanceOf(GedcomDomainException.class);
            assertThatThrownBy(() -> queries.criteriaMatch(family, "surname=smith"))
                .isInstanceOf(NotAnIndividualException.class);
        }

        @Test
        void familyQueriesRejectIndividuals() {
            assertThatThrownBy(() -> queries.getFamilyMembers(record("@I1@"), FamilyMemberFilter.ALL))
                .isInstanceOf(NotAFamilyException.class)
                .hasMessageContaining("FAM");
        }
    }
}
