package com.gedcomtree.controller;

import com.gedcomtree.config.GedcomProperties;
import com.gedcomtree.config.GedcomProperties.TreeDefinition;
import com.gedcomtree.exception.GlobalExceptionHandler;
import com.gedcomtree.parser.GedcomParser;
import com.gedcomtree.query.RelationshipQueries;
import com.gedcomtree.service.GedcomTreeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.InputStream;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Standalone MockMvc tests for IndividualApiController over test-family.ged, served by a
 * real GedcomTreeService.
 */
class IndividualApiControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        GedcomProperties properties = new GedcomProperties();
        properties.setTrees(List.of(
            tree("test", "classpath:gedcom/test-family.ged"),
            tree("broken", "classpath:gedcom/level-jump.ged")));

        GedcomTreeService treeService = new GedcomTreeService(properties, new DefaultResourceLoader());
        mockMvc = MockMvcBuilders.standaloneSetup(new IndividualApiController(treeService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static TreeDefinition tree(String slug, String location) {
        TreeDefinition tree = new TreeDefinition();
        tree.setSlug(slug);
        tree.setDisplayName(slug);
        tree.setLocation(location);
        return tree;
    }

    @Test
    @DisplayName("GET individual returns summary, parents, children and spouse families")
    void getIndividual() throws Exception {
        mockMvc.perform(get("/api/trees/test/individuals/I3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.individual.pointer").value("@I3@"))
                .andExpect(jsonPath("$.individual.givenName").value("William"))
                .andExpect(jsonPath("$.individual.surname").value("Smith"))
                .andExpect(jsonPath("$.individual.birthYear").value(1880))
                .andExpect(jsonPath("$.parents[*].pointer", contains("@I1@", "@I2@")))
                .andExpect(jsonPath("$.children[*].pointer", contains("@I5@")))
                .andExpect(jsonPath("$.families[0].pointer").value("@F2@"))
                .andExpect(jsonPath("$.families[0].parents", hasSize(2)))
                .andExpect(jsonPath("$.families[0].marriages[0].date").value("ABT 1903"));
    }

    @Test
    @DisplayName("GET individual for unknown id or tree returns 404")
    void unknownIndividual() throws Exception {
        mockMvc.perform(get("/api/trees/test/individuals/I9"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/trees/nope/individuals/I1"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET individual for a family record returns 400")
    void familyIsNotAnIndividual() throws Exception {
        mockMvc.perform(get("/api/trees/test/individuals/F1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("WRONG_RECORD_TYPE"))
                .andExpect(jsonPath("$.requiredTag").value("INDI"));
    }

    @Test
    @DisplayName("Tree that fails strict parsing returns 422 with the line number")
    void brokenTree() throws Exception {
        mockMvc.perform(get("/api/trees/broken/individuals/I1"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("FORMAT_VIOLATION"))
                .andExpect(jsonPath("$.lineNumber").value(3));
    }

    @Test
    @DisplayName("GET parents distinguishes natural parents")
    void parents() throws Exception {
        mockMvc.perform(get("/api/trees/test/individuals/I5/parents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].pointer", contains("@I3@", "@I4@")));
        mockMvc.perform(get("/api/trees/test/individuals/I5/parents").param("natural", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].pointer", contains("@I3@")));
    }

    @Test
    @DisplayName("GET ancestors and descendants")
    void ancestorsAndDescendants() throws Exception {
        mockMvc.perform(get("/api/trees/test/individuals/I5/ancestors").param("natural", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].pointer", contains("@I3@", "@I1@", "@I2@")));
        mockMvc.perform(get("/api/trees/test/individuals/I1/descendants"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].pointer", contains("@I3@", "@I5@")));
    }

    @Test
    @DisplayName("GET families by role; an unknown role returns 400")
    void families() throws Exception {
        mockMvc.perform(get("/api/trees/test/individuals/I3/families").param("role", "child"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].pointer", contains("@F1@")))
                .andExpect(jsonPath("$[0].children[*].pointer", contains("@I3@")));
        mockMvc.perform(get("/api/trees/test/individuals/I3/families").param("role", "cousin"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("GET marriages")
    void marriages() throws Exception {
        mockMvc.perform(get("/api/trees/test/individuals/I1/marriages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].date").value("3 JUN 1875"))
                .andExpect(jsonPath("$[0].place").value("Leeds, England"));
    }

    @Test
    @DisplayName("GET path to ancestor; 404 when only an adoptive link connects them")
    void pathToAncestor() throws Exception {
        mockMvc.perform(get("/api/trees/test/individuals/I5/path/I1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].pointer", contains("@I5@", "@I3@", "@I1@")));
        mockMvc.perform(get("/api/trees/test/individuals/I5/path/I4"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET search matches criteria; malformed criteria match nobody")
    void search() throws Exception {
        mockMvc.perform(get("/api/trees/test/individuals/search").param("criteria", "surname=smith:birth_range=1870-1910"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].pointer", contains("@I3@", "@I5@")));
        mockMvc.perform(get("/api/trees/test/individuals/search").param("criteria", "birth=soon"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("Records are resolved in the document the queries run over")
    void recordComesFromQueriedDocument() throws Exception {
        RelationshipQueries queries;
        try (InputStream in = getClass().getResourceAsStream("/gedcom/test-family.ged")) {
            queries = new RelationshipQueries(GedcomParser.strict().parse(in));
        }
        GedcomTreeService treeService = mock(GedcomTreeService.class);
        when(treeService.queries("test")).thenReturn(Optional.of(queries));
        MockMvc mocked = MockMvcBuilders.standaloneSetup(new IndividualApiController(treeService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();

        mocked.perform(get("/api/trees/test/individuals/I3/parents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].pointer", contains("@I1@", "@I2@")));
        mocked.perform(get("/api/trees/test/individuals/I5/path/I1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)));

        verify(treeService, times(2)).queries("test");
        verifyNoMoreInteractions(treeService);
    }
}
