package com.cellmodeler.web;

import static org.junit.jupiter.api.Assertions.*;

import com.cellmodeler.config.AppProperties;
import com.cellmodeler.engine.Neighborhood;
import com.cellmodeler.examples.ExampleModel;
import com.cellmodeler.service.SimulationService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.HttpStatus;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.web.server.ResponseStatusException;

class SimulationControllerTest {

    private static final String TWO_STATES = """
            WIDTH 4 HEIGHT 3
            STATE { Off(0, 0, 0, 1) On(255, 255, 255, 1) }
            RULES { IF current is 'Off' AND count(On) >= 1 THEN next is 'On' }
            """;

    private final SimulationService service =
            new SimulationService(new AppProperties(new MockEnvironment()), (TaskExecutor) Runnable::run);

    private final SimulationController controller = new SimulationController(service);

    private static CreateSimulationRequest fromText(String config, String seeding, List<SeedCell> cells) {
        return new CreateSimulationRequest(config, null, seeding, null, cells, null, null, null);
    }

    @Test
    void createReturnsInitialGeneration() {
        SimulationResponse response = controller.create(
                fromText(TWO_STATES, "assigned", List.of(new SeedCell(0, 0, "On"))));
        assertNotNull(response.id());
        assertEquals(0, response.generation());
        assertEquals(4, response.width());
        assertEquals(3, response.height());
        assertEquals(List.of("Off", "On"), response.states().stream().map(SimulationResponse.StateView::name).toList());
        assertEquals(1, response.cells()[0][0]);
        assertEquals(0, response.cells()[2][3]);
    }

    @Test
    void stepAndGetReturnSameGeneration() {
        SimulationResponse created = controller.create(
                fromText(TWO_STATES, "ASSIGNED", List.of(new SeedCell(0, 0, "On"))));
        SimulationResponse stepped = controller.step(created.id(), 1);
        assertEquals(1, stepped.generation());
        assertEquals(1, stepped.cells()[1][1]);
        assertEquals(0, stepped.cells()[2][2]);
        SimulationResponse fetched = controller.get(created.id());
        assertEquals(1, fetched.generation());
        assertArrayEquals(stepped.cells()[1], fetched.cells()[1]);
    }

    @Test
    void createFromExample() {
        SimulationResponse response = controller.create(
                new CreateSimulationRequest(null, "forest-fire", null, null, null, 42L, null, null));
        assertEquals(50, response.width());
        assertEquals(40, response.height());
        assertEquals(3, response.states().size());
    }

    @Test
    void rejectsAmbiguousOrMissingSource() {
        ResponseStatusException both = assertThrows(ResponseStatusException.class,
                () -> controller.create(new CreateSimulationRequest(TWO_STATES, "forest-fire", null, null, null, null, null, null)));
        assertEquals(HttpStatus.BAD_REQUEST, both.getStatusCode());
        ResponseStatusException none = assertThrows(ResponseStatusException.class,
                () -> controller.create(new CreateSimulationRequest(null, null, null, null, null, null, null, null)));
        assertEquals(HttpStatus.BAD_REQUEST, none.getStatusCode());
    }

    @Test
    void rejectsBadSeedingInput() {
        ResponseStatusException policy = assertThrows(ResponseStatusException.class,
                () -> controller.create(fromText(TWO_STATES, "spiral", null)));
        assertEquals(HttpStatus.BAD_REQUEST, policy.getStatusCode());
        ResponseStatusException cells = assertThrows(ResponseStatusException.class,
                () -> controller.create(fromText(TWO_STATES, "uniform", List.of(new SeedCell(0, 0, "On")))));
        assertEquals(HttpStatus.BAD_REQUEST, cells.getStatusCode());
        ResponseStatusException outside = assertThrows(ResponseStatusException.class,
                () -> controller.create(fromText(TWO_STATES, "assigned", List.of(new SeedCell(9, 9, "On")))));
        assertEquals(HttpStatus.BAD_REQUEST, outside.getStatusCode());
    }

    @Test
    void invalidConfigIsBadRequest() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.create(fromText("WIDTH 4 HEIGHT", null, null)));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void unknownSimulationIsNotFound() {
        assertEquals(HttpStatus.NOT_FOUND,
                assertThrows(ResponseStatusException.class, () -> controller.step("missing", 1)).getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND,
                assertThrows(ResponseStatusException.class, () -> controller.get("missing")).getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND,
                assertThrows(ResponseStatusException.class, () -> controller.delete("missing")).getStatusCode());
    }

    @Test
    void stepCountOutOfRangeIsBadRequest() {
        SimulationResponse created = controller.create(fromText(TWO_STATES, null, null));
        assertEquals(HttpStatus.BAD_REQUEST,
                assertThrows(ResponseStatusException.class, () -> controller.step(created.id(), 0)).getStatusCode());
    }

    @Test
    void deleteRemovesSimulation() {
        SimulationResponse created = controller.create(fromText(TWO_STATES, null, null));
        controller.delete(created.id());
        assertThrows(ResponseStatusException.class, () -> controller.get(created.id()));
    }

    @Test
    void configEndpointExportsCanonicalText() {
        SimulationResponse created = controller.create(fromText(TWO_STATES, null, null));
        String exported = controller.config(created.id());
        assertTrue(exported.startsWith("WIDTH 4 HEIGHT 3"));
        assertTrue(exported.contains("IF current is 'Off' AND count(On) >= 1 THEN next is 'On'"));
    }

    @Test
    void validateReportsEveryError() {
        ValidationResponse ok = controller.validate(TWO_STATES);
        assertTrue(ok.valid());
        assertTrue(ok.errors().isEmpty());

        ValidationResponse invalid = controller.validate("""
                WIDTH 4 HEIGHT 3
                STATE { Off(0, 0, 0, 1) On(300, 0, 0, 1) }
                RULES { IF current is 'Ghost' AND count(On) >= 1 THEN next is 'On' WITH PROB 1.5 }
                """);
        assertFalse(invalid.valid());
        assertEquals(3, invalid.errors().size());

        ValidationResponse syntax = controller.validate("WIDTH 4 HEIGHT 3 STATE {");
        assertFalse(syntax.valid());
        assertEquals(1, syntax.errors().size());
    }

    @Test
    void examplesAreListedAndServed() {
        List<ExampleSummary> examples = controller.examples();
        assertEquals(ExampleModel.values().length, examples.size());
        assertEquals("game-of-life", examples.get(0).id());
        assertTrue(controller.example("wireworld").contains("RULES"));
        assertEquals(HttpStatus.NOT_FOUND,
                assertThrows(ResponseStatusException.class, () -> controller.example("nope")).getStatusCode());
    }

    @Test
    void neighborhoodAndWrapComeFromRequest() {
        SimulationResponse created = controller.create(new CreateSimulationRequest(
                TWO_STATES, null, "assigned", null, List.of(new SeedCell(0, 0, "On")), null, "von-neumann", true));
        assertEquals(Neighborhood.VON_NEUMANN, service.find(created.id()).orElseThrow().neighborhood());
        assertTrue(service.find(created.id()).orElseThrow().wrap());

        SimulationResponse stepped = controller.step(created.id(), 1);
        assertEquals(1, stepped.cells()[0][1]);
        assertEquals(1, stepped.cells()[0][3]);
        assertEquals(1, stepped.cells()[2][0]);
        assertEquals(0, stepped.cells()[1][1]);

        SimulationResponse defaults = controller.create(fromText(TWO_STATES, null, null));
        assertEquals(Neighborhood.MOORE, service.find(defaults.id()).orElseThrow().neighborhood());
        assertFalse(service.find(defaults.id()).orElseThrow().wrap());
    }

    @Test
    void unknownNeighborhoodIsBadRequest() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.create(
                new CreateSimulationRequest(TWO_STATES, null, null, null, null, null, "hexagonal", null)));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void oversizedGridIsBadRequest() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.create(
                fromText("WIDTH 65536 HEIGHT 65536 STATE { A(0, 0, 0, 1) } RULES { }", "uniform", null)));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }
}
