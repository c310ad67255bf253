package com.cellmodeler.web;

import com.cellmodeler.engine.CellAssignment;
import com.cellmodeler.engine.Neighborhood;
import com.cellmodeler.engine.SeedService;
import com.cellmodeler.examples.ExampleModel;
import com.cellmodeler.language.ConfigSyntaxException;
import com.cellmodeler.language.ConfigWriter;
import com.cellmodeler.service.ConfigLoader;
import com.cellmodeler.service.GridSnapshot;
import com.cellmodeler.service.SeedingPolicy;
import com.cellmodeler.service.SeedingRequest;
import com.cellmodeler.service.SimulationService;
import com.cellmodeler.service.SimulationSession;
import com.cellmodeler.service.Topology;
import com.cellmodeler.validation.ConfigValidationException;
import com.cellmodeler.validation.ValidationError;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
public class SimulationController {

    private static final Logger log = LoggerFactory.getLogger(SimulationController.class);

    private final SimulationService simulationService;

    public SimulationController(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @PostMapping(path = "/simulations", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public SimulationResponse create(@RequestBody CreateSimulationRequest request) {
        String configText = resolveConfigText(request);
        SeedingRequest seeding = buildSeeding(request);
        Topology topology = buildTopology(request);
        SimulationSession session;
        try {
            session = simulationService.create(configText, seeding, topology);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid simulation: " + ex.getMessage(), ex);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(), ex);
        }
        return SimulationResponse.of(session.snapshot());
    }

    @PostMapping(path = "/simulations/{id}/step", produces = MediaType.APPLICATION_JSON_VALUE)
    public SimulationResponse step(@PathVariable String id, @RequestParam(defaultValue = "1") int count) {
        GridSnapshot snapshot;
        try {
            snapshot = simulationService.step(id, count);
        } catch (NoSuchElementException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        }
        return SimulationResponse.of(snapshot);
    }

    @GetMapping(path = "/simulations/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public SimulationResponse get(@PathVariable String id) {
        return SimulationResponse.of(requireSession(id).snapshot());
    }

    @GetMapping(path = "/simulations/{id}/config", produces = MediaType.TEXT_PLAIN_VALUE)
    public String config(@PathVariable String id) {
        return ConfigWriter.write(requireSession(id).config());
    }

    @DeleteMapping(path = "/simulations/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        if (!simulationService.remove(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown simulation: " + id);
        }
    }

    @PostMapping(path = "/configs/validate", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ValidationResponse validate(@RequestBody String configText) {
        try {
            ConfigLoader.load(configText);
            return new ValidationResponse(true, List.of());
        } catch (ConfigSyntaxException ex) {
            return new ValidationResponse(false, List.of(ex.getMessage()));
        } catch (ConfigValidationException ex) {
            List<String> messages = ex.errors().stream().map(ValidationError::message).toList();
            log.debug("Config rejected with {} validation error(s)", messages.size());
            return new ValidationResponse(false, messages);
        }
    }

    @GetMapping(path = "/examples", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ExampleSummary> examples() {
        return Arrays.stream(ExampleModel.values())
                .map(model -> new ExampleSummary(model.id(), model.displayName()))
                .toList();
    }

    @GetMapping(path = "/examples/{id}", produces = MediaType.TEXT_PLAIN_VALUE)
    public String example(@PathVariable String id) {
        return parseExample(id).loadText();
    }

    private SimulationSession requireSession(String id) {
        return simulationService.find(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown simulation: " + id));
    }

    private String resolveConfigText(CreateSimulationRequest request) {
        boolean hasConfig = StringUtils.hasText(request.config());
        boolean hasExample = StringUtils.hasText(request.example());
        if (hasConfig == hasExample) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Exactly one of config or example must be given");
        }
        return hasConfig ? request.config() : parseExample(request.example()).loadText();
    }

    private ExampleModel parseExample(String id) {
        try {
            return ExampleModel.fromId(id);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        }
    }

    private SeedingRequest buildSeeding(CreateSimulationRequest request) {
        SeedingPolicy policy = parsePolicy(request.seeding());
        List<CellAssignment> cells = new ArrayList<>();
        if (request.cells() != null) {
            for (SeedCell cell : request.cells()) {
                if (!StringUtils.hasText(cell.state())) {
                    throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Seed cell (" + cell.x() + ", " + cell.y() + ") has no state");
                }
                cells.add(new CellAssignment(cell.x(), cell.y(), cell.state()));
            }
        }
        if (!cells.isEmpty() && policy != SeedingPolicy.ASSIGNED) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Cells are only accepted with ASSIGNED seeding");
        }
        long seed = request.randomSeed() != null ? request.randomSeed() : SeedService.DEFAULT_RANDOM_SEED;
        String defaultState = StringUtils.hasText(request.defaultState()) ? request.defaultState().trim() : null;
        return new SeedingRequest(policy, defaultState, cells, seed);
    }

    private Topology buildTopology(CreateSimulationRequest request) {
        Neighborhood neighborhood = null;
        if (StringUtils.hasText(request.neighborhood())) {
            try {
                neighborhood = Neighborhood.parse(request.neighborhood());
            } catch (IllegalArgumentException ex) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
            }
        }
        return new Topology(neighborhood, request.wrap());
    }

    private SeedingPolicy parsePolicy(String seeding) {
        if (!StringUtils.hasText(seeding)) {
            return SeedingPolicy.WEIGHTED;
        }
        String normalized = seeding.trim().toUpperCase(Locale.ROOT);
        try {
            return SeedingPolicy.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported seeding: " + seeding, ex);
        }
    }
}
