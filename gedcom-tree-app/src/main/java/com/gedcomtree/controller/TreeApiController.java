package com.gedcomtree.controller;

import com.gedcomtree.model.TreeSummary;
import com.gedcomtree.parser.GedcomDocument;
import com.gedcomtree.service.GedcomTreeService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/trees")
public class TreeApiController {

    private final GedcomTreeService treeService;

    public TreeApiController(GedcomTreeService treeService) {
        this.treeService = treeService;
    }

    @GetMapping
    public ResponseEntity<List<TreeSummary>> listTrees() {
        return ResponseEntity.ok(treeService.listTrees());
    }

    @GetMapping("/{slug}")
    public ResponseEntity<TreeSummary> getTree(@PathVariable String slug) {
        return treeService.getTree(slug)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * The tree as GEDCOM text, line for line as it was read.
     */
    @GetMapping(value = "/{slug}/gedcom", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> exportGedcom(@PathVariable String slug) {
        return treeService.getDocument(slug)
            .map(GedcomDocument::toGedcomString)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{slug}/reload")
    public ResponseEntity<Void> reload(@PathVariable String slug) {
        if (!treeService.reload(slug)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
