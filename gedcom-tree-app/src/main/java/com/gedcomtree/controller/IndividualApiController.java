package com.gedcomtree.controller;

import com.gedcomtree.exception.NotAnIndividualException;
import com.gedcomtree.model.Element;
import com.gedcomtree.model.FamilyElement;
import com.gedcomtree.model.FamilyMemberFilter;
import com.gedcomtree.model.FamilySummary;
import com.gedcomtree.model.IndividualElement;
import com.gedcomtree.model.IndividualSummary;
import com.gedcomtree.model.Marriage;
import com.gedcomtree.query.FamilyRole;
import com.gedcomtree.query.ParentType;
import com.gedcomtree.query.RelationshipQueries;
import com.gedcomtree.service.GedcomTreeService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;
import java.util.function.BiFunction;

/**
 * Relationship queries over one configured tree. Individuals are addressed by their bare
 * cross-reference id: {@code I1} for {@code @I1@}.
 */
@RestController
@RequestMapping("/api/trees/{slug}/individuals")
public class IndividualApiController {

    private final GedcomTreeService treeService;

    public IndividualApiController(GedcomTreeService treeService) {
        this.treeService = treeService;
    }

    // ========== READ OPERATIONS ==========

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getIndividual(@PathVariable String slug, @PathVariable String id) {
        return withRecord(slug, id, (queries, record) -> {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("individual", summaryOf(record));
            response.put("parents", summaries(queries.getParents(record, ParentType.ALL)));
            response.put("children", summaries(queries.getChildren(record)));
            response.put("families", familySummaries(queries, record, FamilyRole.SPOUSE));
            return response;
        });
    }

    @GetMapping("/search")
    public ResponseEntity<List<IndividualSummary>> search(@PathVariable String slug, @RequestParam String criteria) {
        return treeService.queries(slug)
            .map(queries -> ResponseEntity.ok(summaries(queries.findIndividuals(criteria))))
            .orElse(ResponseEntity.notFound().build());
    }

    // ========== RELATIONSHIPS ==========

    @GetMapping("/{id}/parents")
    public ResponseEntity<List<IndividualSummary>> getParents(
            @PathVariable String slug,
            @PathVariable String id,
            @RequestParam(defaultValue = "false") boolean natural) {
        return withRecord(slug, id, (queries, record) -> summaries(queries.getParents(record, parentType(natural))));
    }

    @GetMapping("/{id}/ancestors")
    public ResponseEntity<List<IndividualSummary>> getAncestors(
            @PathVariable String slug,
            @PathVariable String id,
            @RequestParam(defaultValue = "false") boolean natural) {
        return withRecord(slug, id, (queries, record) -> summaries(queries.getAncestors(record, parentType(natural))));
    }

    @GetMapping("/{id}/descendants")
    public ResponseEntity<List<IndividualSummary>> getDescendants(@PathVariable String slug, @PathVariable String id) {
        return withRecord(slug, id, (queries, record) -> summaries(queries.getDescendants(record)));
    }

    @GetMapping("/{id}/families")
    public ResponseEntity<List<FamilySummary>> getFamilies(
            @PathVariable String slug,
            @PathVariable String id,
            @RequestParam(defaultValue = "spouse") String role) {
        FamilyRole familyRole = FamilyRole.valueOf(role.toUpperCase(Locale.ROOT));
        return withRecord(slug, id, (queries, record) -> familySummaries(queries, record, familyRole));
    }

    @GetMapping("/{id}/marriages")
    public ResponseEntity<List<Marriage>> getMarriages(@PathVariable String slug, @PathVariable String id) {
        return withRecord(slug, id, RelationshipQueries::getMarriages);
    }

    /**
     * Natural-parent path from the individual up to the ancestor, or 404 when there is none.
     */
    @GetMapping("/{id}/path/{ancestorId}")
    public ResponseEntity<List<IndividualSummary>> getPathToAncestor(
            @PathVariable String slug,
            @PathVariable String id,
            @PathVariable String ancestorId) {
        Optional<RelationshipQueries> queriesOpt = treeService.queries(slug);
        if (queriesOpt.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        RelationshipQueries queries = queriesOpt.get();

        Optional<Element> descendant = findRecord(queries, id);
        Optional<Element> ancestor = findRecord(queries, ancestorId);
        if (descendant.isEmpty() || ancestor.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        return queries.findPathToAncestor(descendant.get(), ancestor.get())
            .map(path -> ResponseEntity.ok(summaries(path)))
            .orElse(ResponseEntity.notFound().build());
    }

    // ========== HELPER METHODS ==========

    private <T> ResponseEntity<T> withRecord(String slug, String id,
                                             BiFunction<RelationshipQueries, Element, T> query) {
        Optional<RelationshipQueries> queries = treeService.queries(slug);
        Optional<Element> record = queries.flatMap(q -> findRecord(q, id));
        if (queries.isEmpty() || record.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(query.apply(queries.get(), record.get()));
    }

    // looked up in the document the queries run over
    private static Optional<Element> findRecord(RelationshipQueries queries, String id) {
        return queries.getDocument().findByPointer(GedcomTreeService.toPointer(id));
    }

    private static ParentType parentType(boolean natural) {
        return natural ? ParentType.NATURAL : ParentType.ALL;
    }

    private static IndividualSummary summaryOf(Element record) {
        if (record instanceof IndividualElement individual) {
            return IndividualSummary.of(individual);
        }
        throw new NotAnIndividualException(record.describe());
    }

    private static List<IndividualSummary> summaries(List<IndividualElement> individuals) {
        return individuals.stream().map(IndividualSummary::of).toList();
    }

    private static List<FamilySummary> familySummaries(RelationshipQueries queries, Element record, FamilyRole role) {
        List<FamilySummary> result = new ArrayList<>();
        for (FamilyElement family : queries.getFamilies(record, role)) {
            result.add(new FamilySummary(
                family.getPointer(),
                summaries(queries.getFamilyMembers(family, FamilyMemberFilter.PARENTS)),
                summaries(queries.getFamilyMembers(family, FamilyMemberFilter.CHILDREN)),
                family.getMarriages()
            ));
        }
        return result;
    }
}
