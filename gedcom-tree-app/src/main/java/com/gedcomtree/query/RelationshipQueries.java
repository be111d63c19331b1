package com.gedcomtree.query;

import com.gedcomtree.exception.NotAFamilyException;
import com.gedcomtree.exception.NotAnIndividualException;
import com.gedcomtree.model.Element;
import com.gedcomtree.model.FamilyElement;
import com.gedcomtree.model.FamilyMemberFilter;
import com.gedcomtree.model.GedcomTags;
import com.gedcomtree.model.IndividualElement;
import com.gedcomtree.model.Marriage;
import com.gedcomtree.parser.GedcomDocument;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Family, parent, ancestor and marriage queries over a parsed document.
 *
 * <p>Links are resolved through the document's pointer index. A link whose pointer is
 * unknown, or names a record of the wrong kind, is skipped. Passing an element of the
 * wrong kind to a query raises a {@link com.gedcomtree.exception.GedcomDomainException}.
 * Traversals remember the individuals they have seen, so pointer cycles end the walk.
 */
public class RelationshipQueries {

    private final GedcomDocument document;

    public RelationshipQueries(GedcomDocument document) {
        this.document = document;
    }

    public GedcomDocument getDocument() {
        return document;
    }

    // ========== FAMILIES ==========

    /**
     * Families the individual links to with the role's tag ({@code FAMS} or {@code FAMC}),
     * in link order.
     */
    public List<FamilyElement> getFamilies(Element individual, FamilyRole role) {
        requireIndividual(individual);
        Map<String, Element> records = document.getElementDictionary();

        List<FamilyElement> families = new ArrayList<>();
        for (Element link : individual.getChildElements()) {
            if (link.getTag().equals(role.linkTag())
                    && records.get(link.getValue()) instanceof FamilyElement family) {
                families.add(family);
            }
        }
        return families;
    }

    /** Individuals linked from the family by the filter's tags, in link order. */
    public List<IndividualElement> getFamilyMembers(Element family, FamilyMemberFilter filter) {
        FamilyElement fam = requireFamily(family);
        return resolveIndividuals(fam.getMemberPointers(filter));
    }

    // ========== PARENTS AND ANCESTORS ==========

    /**
     * Parents from every family the individual is a child of. For {@link ParentType#NATURAL}
     * the individual's {@code CHIL} link in each family is checked on its own: a
     * {@code _MREL Natural} qualifier adds the wife, a {@code _FREL Natural} one the husband.
     */
    public List<IndividualElement> getParents(Element individual, ParentType type) {
        IndividualElement person = requireIndividual(individual);
        List<IndividualElement> parents = new ArrayList<>();

        for (FamilyElement family : getFamilies(person, FamilyRole.CHILD)) {
            if (type == ParentType.ALL) {
                parents.addAll(getFamilyMembers(family, FamilyMemberFilter.PARENTS));
                continue;
            }
            for (Element link : family.getChildElements()) {
                if (!GedcomTags.CHILD.equals(link.getTag()) || !link.getValue().equals(person.getPointer())) {
                    continue;
                }
                for (Element qualifier : link.getChildElements()) {
                    if (!GedcomTags.NATURAL.equals(qualifier.getValue())) {
                        continue;
                    }
                    if (GedcomTags.MOTHER_RELATION.equals(qualifier.getTag())) {
                        parents.addAll(getFamilyMembers(family, FamilyMemberFilter.WIFE));
                    } else if (GedcomTags.FATHER_RELATION.equals(qualifier.getTag())) {
                        parents.addAll(getFamilyMembers(family, FamilyMemberFilter.HUSBAND));
                    }
                }
            }
        }
        return parents;
    }

    /**
     * All ancestors: the individual's parents first, then each parent's ancestors in turn.
     * Every ancestor is listed once and the individual never lists itself, even when the
     * data loops back.
     */
    public List<IndividualElement> getAncestors(Element individual, ParentType type) {
        IndividualElement person = requireIndividual(individual);
        return expand(person, p -> getParents(p, type));
    }

    /** Children of every family the individual is a spouse in, then theirs, and so on. */
    public List<IndividualElement> getDescendants(Element individual) {
        IndividualElement person = requireIndividual(individual);
        return expand(person, this::getChildren);
    }

    public List<IndividualElement> getChildren(Element individual) {
        List<IndividualElement> children = new ArrayList<>();
        for (FamilyElement family : getFamilies(individual, FamilyRole.SPOUSE)) {
            children.addAll(getFamilyMembers(family, FamilyMemberFilter.CHILDREN));
        }
        return children;
    }

    /**
     * Depth-first search along natural parents from descendant to ancestor. The first path
     * found wins, taking parents in link order at each step; it is not necessarily the
     * shortest.
     *
     * @return descendant, parent, grandparent, ..., ancestor; empty if there is no such path
     */
    public Optional<List<IndividualElement>> findPathToAncestor(Element descendant, Element ancestor) {
        IndividualElement from = requireIndividual(descendant);
        IndividualElement to = requireIndividual(ancestor);

        List<IndividualElement> path = new ArrayList<>();
        Set<IndividualElement> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        if (searchPath(from, to, path, visited)) {
            return Optional.of(path);
        }
        return Optional.empty();
    }

    private boolean searchPath(IndividualElement current, IndividualElement target,
                               List<IndividualElement> path, Set<IndividualElement> visited) {
        if (!visited.add(current)) {
            return false;
        }
        path.add(current);

        if (current == target || (!target.getPointer().isEmpty()
                && current.getPointer().equals(target.getPointer()))) {
            return true;
        }

        for (IndividualElement parent : getParents(current, ParentType.NATURAL)) {
            if (searchPath(parent, target, path, visited)) {
                return true;
            }
        }

        path.remove(path.size() - 1);
        return false;
    }

    // ========== MARRIAGES ==========

    /** Marriage (date, place) pairs from every family the individual is a spouse in. */
    public List<Marriage> getMarriages(Element individual) {
        List<Marriage> marriages = new ArrayList<>();
        for (FamilyElement family : getFamilies(individual, FamilyRole.SPOUSE)) {
            marriages.addAll(family.getMarriages());
        }
        return marriages;
    }

    /** Years of dated marriages. Dates whose last token is not a number are left out. */
    public List<Integer> getMarriageYears(Element individual) {
        List<Integer> years = new ArrayList<>();
        for (Marriage marriage : getMarriages(individual)) {
            Integer year = marriage.year();
            if (year != null) {
                years.add(year);
            }
        }
        return years;
    }

    public boolean marriageYearMatch(Element individual, int year) {
        return getMarriageYears(individual).contains(year);
    }

    public boolean marriageRangeMatch(Element individual, int fromYear, int toYear) {
        for (int year : getMarriageYears(individual)) {
            if (fromYear <= year && year <= toYear) {
                return true;
            }
        }
        return false;
    }

    // ========== CRITERIA ==========

    /** See {@link CriteriaMatcher} for the criteria syntax. */
    public boolean criteriaMatch(Element individual, String criteria) {
        return CriteriaMatcher.matches(requireIndividual(individual), criteria);
    }

    /** Logical individual records matching the criteria, in file order. */
    public List<IndividualElement> findIndividuals(String criteria) {
        List<IndividualElement> matches = new ArrayList<>();
        for (IndividualElement individual : document.getIndividuals()) {
            if (CriteriaMatcher.matches(individual, criteria)) {
                matches.add(individual);
            }
        }
        return matches;
    }

    // ========== HELPERS ==========

    private List<IndividualElement> resolveIndividuals(List<String> pointers) {
        Map<String, Element> records = document.getElementDictionary();
        List<IndividualElement> individuals = new ArrayList<>();
        for (String pointer : pointers) {
            if (records.get(pointer) instanceof IndividualElement individual) {
                individuals.add(individual);
            }
        }
        return individuals;
    }

    /*
     * Lists next(start), then expands each of those in order before moving on, the same
     * order plain recursion gives. An explicit stack keeps long chains off the call stack.
     */
    private static List<IndividualElement> expand(IndividualElement start,
                                                  Function<IndividualElement, List<IndividualElement>> next) {
        Set<IndividualElement> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(start);
        List<IndividualElement> result = new ArrayList<>();
        Deque<Iterator<IndividualElement>> stack = new ArrayDeque<>();
        stack.push(unseen(next.apply(start), seen, result).iterator());

        while (!stack.isEmpty()) {
            Iterator<IndividualElement> it = stack.peek();
            if (!it.hasNext()) {
                stack.pop();
                continue;
            }
            stack.push(unseen(next.apply(it.next()), seen, result).iterator());
        }
        return result;
    }

    private static List<IndividualElement> unseen(List<IndividualElement> candidates,
                                                  Set<IndividualElement> seen, List<IndividualElement> result) {
        List<IndividualElement> fresh = new ArrayList<>();
        for (IndividualElement candidate : candidates) {
            if (seen.add(candidate)) {
                fresh.add(candidate);
                result.add(candidate);
            }
        }
        return fresh;
    }

    private static IndividualElement requireIndividual(Element element) {
        Objects.requireNonNull(element, "element");
        if (element instanceof IndividualElement individual) {
            return individual;
        }
        throw new NotAnIndividualException(element.describe());
    }

    private static FamilyElement requireFamily(Element element) {
        Objects.requireNonNull(element, "element");
        if (element instanceof FamilyElement family) {
            return family;
        }
        throw new NotAFamilyException(element.describe());
    }
}
