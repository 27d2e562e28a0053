package com.hellblazer.impetus.simulation;

/**
 * Advances an {@link ODESim} with a single solver step per call, without collision handling.
 *
 * @author hal.hildebrand
 */
public class SimpleAdvance implements AdvanceStrategy {

    public static final double DEFAULT_TIME_STEP = 0.025;

    private final ODESim sim;
    private DiffEqSolver     solver;
    private double           timeStep = DEFAULT_TIME_STEP;

    public SimpleAdvance(ODESim sim) {
        this(sim, new RungeKutta(sim));
    }

    public SimpleAdvance(ODESim sim, DiffEqSolver solver) {
        this.sim = sim;
        this.solver = solver;
    }

    @Override
    public void advance(double timeStep, Memorizable memo) {
        var error = solver.step(timeStep);
        if (error.isPresent()) {
            throw new AdvanceException(AdvanceException.Kind.SOLVER_ERROR, sim.getTime(), error.get().message());
        }
        sim.modifyObjects();
        if (memo != null) {
            memo.memorize();
        }
    }

    @Override
    public double getTime() {
        return sim.getTime();
    }

    @Override
    public double getTimeStep() {
        return timeStep;
    }

    @Override
    public void setTimeStep(double timeStep) {
        if (!(timeStep > 0)) {
            throw new IllegalArgumentException("time step must be positive: " + timeStep);
        }
        this.timeStep = timeStep;
    }

    @Override
    public DiffEqSolver getDiffEqSolver() {
        return solver;
    }

    @Override
    public void setDiffEqSolver(DiffEqSolver solver) {
        this.solver = solver;
    }

    @Override
    public void reset() {
        sim.reset();
    }

    @Override
    public void save() {
        sim.saveInitialState();
    }
}
