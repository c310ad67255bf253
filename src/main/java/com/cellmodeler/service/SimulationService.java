package com.cellmodeler.service;

import com.cellmodeler.config.AppProperties;
import com.cellmodeler.engine.Grid;
import com.cellmodeler.engine.SeedService;
import com.cellmodeler.engine.SimulationDriver;
import com.cellmodeler.model.AutomatonConfig;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

@Service
public class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final AppProperties properties;
    private final TaskExecutor taskExecutor;
    private final ConcurrentMap<String, SimulationSession> sessions = new ConcurrentHashMap<>();

    public SimulationService(
            AppProperties properties,
            @Qualifier("applicationTaskExecutor") TaskExecutor taskExecutor) {
        this.properties = properties;
        this.taskExecutor = taskExecutor;
    }

    public SimulationSession create(String configText, SeedingRequest seeding) {
        return create(configText, seeding, Topology.DEFAULTS);
    }

    public SimulationSession create(String configText, SeedingRequest seeding, Topology topology) {
        Objects.requireNonNull(seeding, "seeding");
        Objects.requireNonNull(topology, "topology");
        if (sessions.size() >= properties.getMaxSessions()) {
            throw sessionLimitReached();
        }
        AutomatonConfig config = ConfigLoader.load(configText);
        long cellCount = config.grid().cellCount();
        if (cellCount > properties.getMaxCells()) {
            throw new IllegalArgumentException("Grid " + config.grid().width() + "x" + config.grid().height()
                    + " has " + cellCount + " cells, more than the limit of " + properties.getMaxCells());
        }
        Grid initial = buildInitialGrid(config, seeding);
        SimulationDriver driver = new SimulationDriver(
                config,
                topology.neighborhoodOr(properties.getNeighborhood()),
                topology.wrapOr(properties.isWrap()),
                taskExecutor,
                properties.getParallelThreshold());
        SimulationSession session = new SimulationSession(UUID.randomUUID().toString(), driver, initial, seeding.randomSeed());
        // re-checked under the lock, concurrent creates may have filled the map meanwhile
        synchronized (sessions) {
            if (sessions.size() >= properties.getMaxSessions()) {
                throw sessionLimitReached();
            }
            sessions.put(session.id(), session);
        }
        log.info("Created simulation {} ({}x{}, {} states, {} rules, seeding={}, neighborhood={}, wrap={})",
                session.id(),
                config.grid().width(),
                config.grid().height(),
                config.states().size(),
                config.rules().size(),
                seeding.policy(),
                driver.neighborhood(),
                driver.wrap());
        return session;
    }

    public GridSnapshot step(String id, int steps) {
        if (steps <= 0 || steps > properties.getMaxStepsPerRequest()) {
            throw new IllegalArgumentException("Steps must be between 1 and " + properties.getMaxStepsPerRequest());
        }
        SimulationSession session = require(id);
        long start = System.nanoTime();
        GridSnapshot snapshot = session.advance(steps);
        Duration spent = Duration.ofNanos(System.nanoTime() - start);
        log.info("Simulation {} advanced {} step(s) to generation {} (spent={})",
                id,
                steps,
                snapshot.generation(),
                String.format(Locale.US, "%.1f ms", spent.toNanos() / 1_000_000.0));
        return snapshot;
    }

    public GridSnapshot snapshot(String id) {
        return require(id).snapshot();
    }

    public Optional<SimulationSession> find(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    public List<SimulationSession> list() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(SimulationSession::createdAt))
                .toList();
    }

    public boolean remove(String id) {
        boolean removed = sessions.remove(id) != null;
        if (removed) {
            log.info("Removed simulation {}", id);
        }
        return removed;
    }

    private IllegalStateException sessionLimitReached() {
        return new IllegalStateException("Session limit of " + properties.getMaxSessions() + " reached");
    }

    private SimulationSession require(String id) {
        return find(id).orElseThrow(() -> new NoSuchElementException("Unknown simulation: " + id));
    }

    private Grid buildInitialGrid(AutomatonConfig config, SeedingRequest seeding) {
        String defaultState = seeding.defaultState() != null
                ? seeding.defaultState()
                : config.states().get(0).name();
        return switch (seeding.policy()) {
            case UNIFORM -> SeedService.uniformGrid(config, defaultState);
            case WEIGHTED -> SeedService.weightedRandomGrid(config, seeding.randomSeed());
            case ASSIGNED -> SeedService.fromAssignments(config, defaultState, seeding.cells());
        };
    }
}
