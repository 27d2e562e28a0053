package com.hellblazer.impetus.simulation;

import com.hellblazer.impetus.common.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Advances a {@link CollisionSim} through time, finding and handling collisions along the way.
 * <p>
 * Each call to {@link #advance} is subdivided as needed. A sub-step is taken; if it produced collisions that must be
 * handled the state is backed up to the start of the sub-step and a smaller sub-step is chosen, either up to the
 * estimated collision time or by binary search. Once collisions are close enough to the target gap they are resolved
 * with impulses and time continues. Repeated backups without progress are reported as a fatal
 * {@link AdvanceException}.
 * <p>
 * Usage:
 * <pre>
 * var advance = new CollisionAdvance&lt;&gt;(sim);
 * advance.setTimeStep(0.025);
 * while (advance.getTime() &lt; 10) {
 *     advance.advance(advance.getTimeStep());
 * }
 * </pre>
 *
 * @param <T> collision type of the simulation
 * @author hal.hildebrand
 */
public class CollisionAdvance<T extends Collision> implements AdvanceStrategy {

    public static final int MAX_STUCK_COUNT = 30;

    private static final Logger log = LoggerFactory.getLogger(CollisionAdvance.class);

    private static final double TIME_EPSILON   = 1e-16;
    private static final double PROGRESS_STEP  = 1e-7;
    private static final int    BINARY_STEPS   = 2;
    private static final double SORT_PRECISION = 1e7;

    /**
     * Tunable parameters of the collision advance.
     *
     * @param timeStep                   default time step
     * @param maxStuckCount              backups without progress before the step fails
     * @param binarySearchStuckThreshold backups without progress before binary search is forced
     * @param jointSmallImpacts          whether to apply small impulses to joints at the end of each step
     * @param debugLevel                 way-point tracing level
     */
    public record AdvanceConfig(double timeStep, int maxStuckCount, int binarySearchStuckThreshold,
                                boolean jointSmallImpacts, DebugLevel debugLevel) {

        public AdvanceConfig {
            if (!(timeStep > 0)) {
                throw new IllegalArgumentException("time step must be positive: " + timeStep);
            }
            if (binarySearchStuckThreshold < 1 || maxStuckCount < binarySearchStuckThreshold) {
                throw new IllegalArgumentException(
                "stuck thresholds out of order: " + binarySearchStuckThreshold + ", " + maxStuckCount);
            }
            if (debugLevel == null) {
                debugLevel = DebugLevel.NONE;
            }
        }

        public static AdvanceConfig defaultConfig() {
            return new AdvanceConfig(0.025, MAX_STUCK_COUNT, 3, false, DebugLevel.NONE);
        }

        public AdvanceConfig withTimeStep(double timeStep) {
            return new AdvanceConfig(timeStep, maxStuckCount, binarySearchStuckThreshold, jointSmallImpacts,
                                     debugLevel);
        }

        public AdvanceConfig withJointSmallImpacts(boolean jointSmallImpacts) {
            return new AdvanceConfig(timeStep, maxStuckCount, binarySearchStuckThreshold, jointSmallImpacts,
                                     debugLevel);
        }

        public AdvanceConfig withDebugLevel(DebugLevel debugLevel) {
            return new AdvanceConfig(timeStep, maxStuckCount, binarySearchStuckThreshold, jointSmallImpacts,
                                     debugLevel);
        }
    }

    private final CollisionSim<T>  sim;
    private final CollisionTotals  collisionTotals = new CollisionTotals();
    private final CollisionStats   stats           = new CollisionStats();
    private       DiffEqSolver     solver;
    private       AdvanceConfig    config          = AdvanceConfig.defaultConfig();
    private       Set<WayPoint>    wayPoints       = DebugLevel.NONE.wayPoints();

    // per-call state of advance(), no meaning outside of it
    private List<T> collisions        = new ArrayList<>();
    private List<T> removedCollisions = new ArrayList<>();
    private double  currentStep;
    private double  timeAdvanced;
    private double  totalTimeStep;
    private double  nextEstimate      = Double.NaN;
    private double  detectedTime      = Double.NaN;
    private boolean binarySearch;
    private int     binarySteps;
    private int     stuckCount;
    private int     odeSteps;
    private int     backupCount;
    private int     numClose;
    private int     collisionCounter;

    public CollisionAdvance(CollisionSim<T> sim) {
        this(sim, new RungeKutta(sim));
    }

    public CollisionAdvance(CollisionSim<T> sim, DiffEqSolver solver) {
        this.sim = sim;
        this.solver = solver;
    }

    public void configure(AdvanceConfig config) {
        this.config = config;
        if (config.debugLevel() != DebugLevel.CUSTOM) {
            wayPoints = config.debugLevel().wayPoints();
        }
        log.info("Configured collision advance: timeStep={}, maxStuck={}, binarySearchAt={}, jointSmallImpacts={}",
                 config.timeStep(), config.maxStuckCount(), config.binarySearchStuckThreshold(),
                 config.jointSmallImpacts());
    }

    public AdvanceConfig getConfig() {
        return config;
    }

    @Override
    public void advance(double timeStep, Memorizable memo) {
        if (timeStep < TIME_EPSILON) {
            sim.modifyObjects();
            return;
        }
        timeAdvanced = 0;
        totalTimeStep = timeStep;
        currentStep = timeStep;
        binarySteps = 0;
        binarySearch = false;
        detectedTime = Double.NaN;
        nextEstimate = Double.NaN;
        stuckCount = 0;
        backupCount = 0;
        odeSteps = 0;
        collisionCounter = 0;
        numClose = 0;
        stats.clear();
        collisions = new ArrayList<>();
        sim.getVarsList().saveHistory();
        print(WayPoint.START);
        boolean didHandle = false;
        // floating point can leave a remainder like 1.7e-18 from totalTimeStep - timeAdvanced
        while (timeAdvanced < totalTimeStep - TIME_EPSILON) {
            advanceSim(currentStep);
            stats.update(collisions);
            print(WayPoint.ADVANCE_SIM_FINISH);
            boolean didBackup = false;
            if (stats.getNumNeedsHandling() > 0) {
                detectedTime = stats.getDetectedTime();
                backup(currentStep);
                didBackup = true;
                stats.update(collisions);
                print(WayPoint.PRE_COLLISION);
                // a Runge-Kutta step evaluates 4 states, each can find different collisions
                stuckCount++;
                if (stuckCount >= config.binarySearchStuckThreshold()) {
                    if (!binarySearch) {
                        print(WayPoint.MAYBE_STUCK);
                        binarySearch = true;
                    }
                    if (stuckCount >= config.maxStuckCount()) {
                        print(WayPoint.STUCK);
                        fail(AdvanceException.Kind.STUCK, "collision was not resolved after " + stuckCount + " tries");
                    }
                }
            }
            // after a backup an earlier time is not available, so tiny gaps are accepted
            final var allowTiny = didBackup;
            numClose = (int) collisions.stream()
                                       .filter(c -> (c.needsHandling() || !c.contact()) && c.getVelocity() < 0
                                       && c.closeEnough(allowTiny))
                                       .count();
            if (numClose > 0) {
                removedCollisions = new ArrayList<>();
                if (removeDistant()) {
                    print(WayPoint.HANDLE_REMOVE_DISTANT);
                }
                didHandle = handleCollisions(numClose) || didHandle;
                nextEstimate = Double.NaN;
                // the next step is based on the collisions that were too far away to handle
                stats.update(removedCollisions);
            }
            if (!didBackup) {
                // a bouncing ball leads to an infinite series of smaller steps, which is not progress
                if (currentStep > PROGRESS_STEP) {
                    stuckCount = 0;
                }
                timeAdvanced += currentStep;
                print(WayPoint.ADVANCED_NO_BACKUP);
                if (memo != null) {
                    memo.memorize();
                }
                if (binarySearch && ++binarySteps >= BINARY_STEPS) {
                    // the collision disappeared; stop searching and try a full step
                    print(WayPoint.BINARY_SEARCH_FAIL);
                    binarySearch = false;
                    binarySteps = 0;
                    detectedTime = Double.NaN;
                } else if (Double.isFinite(nextEstimate)) {
                    // the estimate did not produce a collision
                    binarySearch = true;
                    print(WayPoint.ESTIMATE_FAILED);
                }
            }
            checkNoneCollide(didBackup);
            calcNextStep(didBackup);
        }
        if (!didHandle && config.jointSmallImpacts() && stats.getNumJoints() > 0) {
            smallImpacts();
        }
        collisionTotals.addCollisions(collisionCounter);
        collisionTotals.addSteps(odeSteps);
        collisionTotals.addBackups(backupCount);
        print(WayPoint.SUMMARY);
        print(WayPoint.FINISH);
    }

    @Override
    public double getTime() {
        return sim.getTime();
    }

    @Override
    public double getTimeStep() {
        return config.timeStep();
    }

    @Override
    public void setTimeStep(double timeStep) {
        config = config.withTimeStep(timeStep);
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
        collisionTotals.reset();
    }

    @Override
    public void save() {
        sim.saveInitialState();
    }

    public CollisionSim<T> getSim() {
        return sim;
    }

    public CollisionTotals getCollisionTotals() {
        return collisionTotals;
    }

    /**
     * @return statistics of the collisions at the end of the last sub-step
     */
    public CollisionStats getStats() {
        return stats;
    }

    /**
     * @return the states recorded at the start of recent advance calls, oldest first
     */
    public List<double[]> getHistory() {
        return sim.getVarsList().getHistory();
    }

    public boolean getJointSmallImpacts() {
        return config.jointSmallImpacts();
    }

    public void setJointSmallImpacts(boolean jointSmallImpacts) {
        config = config.withJointSmallImpacts(jointSmallImpacts);
    }

    public void setDebugLevel(DebugLevel debugLevel) {
        config = config.withDebugLevel(debugLevel);
        if (debugLevel != DebugLevel.CUSTOM) {
            wayPoints = debugLevel.wayPoints();
        }
    }

    public Set<WayPoint> getWayPoints() {
        return EnumSet.copyOf(wayPoints);
    }

    public void setWayPoints(Set<WayPoint> wayPoints) {
        config = config.withDebugLevel(DebugLevel.CUSTOM);
        this.wayPoints = wayPoints.isEmpty() ? EnumSet.noneOf(WayPoint.class) : EnumSet.copyOf(wayPoints);
    }

    @Override
    public String toString() {
        return "CollisionAdvance{solver=" + solver.getName() + ", config=" + config + "}";
    }

    private void advanceSim(double stepSize) {
        collisions = new ArrayList<>();
        sim.saveState();
        print(WayPoint.ADVANCE_SIM_START);
        var error = solver.step(stepSize);
        sim.modifyObjects();
        odeSteps++;
        if (error.isPresent()) {
            if (!error.get().hasCollisions()) {
                fail(AdvanceException.Kind.SOLVER_ERROR, error.get().message());
            }
            // time and vars have not advanced; the collisions come from a solver sub-step
            collisions = collisionsOf(error.get());
            print(WayPoint.ADVANCE_SIM_FAIL);
        } else {
            sim.findCollisions(collisions, sim.getVarsList().getValues(), stepSize);
            print(WayPoint.ADVANCE_SIM_COLLIDING);
        }
        // estimates are rounded for a repeatable order, which matters for the random handling order
        collisions.sort(Comparator.comparingDouble(c -> sortKey(c.getEstimatedTime())));
        collisions.forEach(c -> c.setNeedsHandling(c.isColliding()));
    }

    private static double sortKey(double estimate) {
        return Double.isNaN(estimate) ? Double.POSITIVE_INFINITY : Math.round(SORT_PRECISION * estimate);
    }

    @SuppressWarnings("unchecked")
    private List<T> collisionsOf(StepError error) {
        return new ArrayList<>((List<T>) error.collisions());
    }

    private void backup(double stepSize) {
        print(WayPoint.POST_COLLISION);
        sim.restoreState();
        sim.modifyObjects();
        backupCount++;
        // keep only the penetrating collisions from the future state; needsHandling is unchanged
        var time = sim.getTime();
        collisions.removeIf(c -> !c.isColliding());
        collisions.forEach(c -> c.updateCollision(time));
        // the restored state has no previous position, so only static contacts are found here
        sim.findCollisions(collisions, sim.getVarsList().getValues(), stepSize);
    }

    private boolean handleCollisions(int numClose) {
        print(WayPoint.HANDLE_COLLISION_START);
        print(WayPoint.COLLISIONS_TO_HANDLE);
        if (sim.handleCollisions(collisions, collisionTotals)) {
            sim.modifyObjects();
            var time = sim.getTime();
            collisions.forEach(c -> c.updateCollision(time));
            print(WayPoint.HANDLE_COLLISION_SUCCESS);
            if (binarySearch) {
                collisionTotals.addSearches(1);
            }
            collisionCounter += numClose;
            binarySearch = false;
            binarySteps = 0;
            detectedTime = Double.NaN;
            return true;
        }
        // usually positive velocity before the collision; getting closer should produce an impulse
        binarySearch = true;
        print(WayPoint.HANDLE_COLLISION_FAIL);
        return false;
    }

    private void smallImpacts() {
        if (collisions.isEmpty()) {
            return;
        }
        print(WayPoint.SMALL_IMPACTS_START);
        removeDistant();
        // the outcome does not matter and these impulses are not counted as collisions
        sim.handleCollisions(collisions, collisionTotals);
        sim.modifyObjects();
        print(WayPoint.SMALL_IMPACTS_FINISH);
        print(WayPoint.SMALL_IMPACTS);
    }

    /**
     * Moves collisions that are not touching to the removed list; their estimates determine the next step.
     */
    private boolean removeDistant() {
        boolean removed = false;
        var iterator = collisions.iterator();
        while (iterator.hasNext()) {
            var c = iterator.next();
            if (!c.isTouching()) {
                removedCollisions.add(c);
                iterator.remove();
                removed = true;
            }
        }
        return removed;
    }

    private void checkNoneCollide(boolean didBackup) {
        if (didBackup) {
            // retained collisions describe the abandoned future state
            return;
        }
        var illegal = collisions.stream().filter(Collision::illegalState).count();
        if (illegal > 0) {
            fail(AdvanceException.Kind.ILLEGAL_STATE, "found " + illegal + " penetrating at end of sub-step");
        }
    }

    private void calcNextStep(boolean didBackup) {
        nextEstimate = stats.getEstTime();
        var time = sim.getTime();
        if (!binarySearch) {
            if (nextEstimate < time) {
                binarySearch = true;
                print(WayPoint.ESTIMATE_IN_PAST);
            }
            if (stats.getNumNeedsHandling() > 0 && Double.isNaN(nextEstimate)) {
                binarySearch = true;
                print(WayPoint.NO_ESTIMATE);
            }
        }
        var fullStep = totalTimeStep - timeAdvanced;
        if (binarySearch) {
            nextEstimate = Double.NaN;
            if (didBackup) {
                currentStep = currentStep / 2;
                binarySteps = 0;
            }
            currentStep = Math.min(currentStep, fullStep);
            print(WayPoint.NEXT_STEP_BINARY);
        } else if (!Double.isNaN(nextEstimate)) {
            currentStep = Math.min(Math.max(nextEstimate - time, 0), fullStep);
            print(WayPoint.NEXT_STEP_ESTIMATE);
        } else {
            currentStep = fullStep;
            print(WayPoint.NEXT_STEP_FULL);
        }
        if (!(currentStep > 0) && timeAdvanced < totalTimeStep - TIME_EPSILON) {
            fail(AdvanceException.Kind.TIME_STALLED, "next step " + Util.nfe(currentStep) + " cannot advance time");
        }
    }

    private void fail(AdvanceException.Kind kind, String message) {
        log.error("{}: {} stats={} stuckCount={} history:\n{}", kind, message, stats, stuckCount,
                  sim.getVarsList().printHistory());
        throw new AdvanceException(kind, sim.getTime(), message);
    }

    private void print(WayPoint wayPoint) {
        if (!wayPoints.contains(wayPoint) || !log.isDebugEnabled()) {
            return;
        }
        switch (wayPoint) {
            case SUMMARY -> log.debug("{} time={} steps={} backups={} collisions={} totals={}", wayPoint,
                                      Util.nf7(sim.getTime()), odeSteps, backupCount, collisionCounter,
                                      collisionTotals);
            case NEXT_STEP_BINARY, NEXT_STEP_ESTIMATE, NEXT_STEP_FULL -> log.debug(
            "{} time={} currentStep={} advanced={} of {} estimate={}", wayPoint, Util.nf7(sim.getTime()),
            Util.nfe(currentStep), Util.nf7(timeAdvanced), Util.nf7(totalTimeStep), Util.nf7(nextEstimate));
            case COLLISIONS_TO_HANDLE, PRE_COLLISION, POST_COLLISION, HANDLE_REMOVE_DISTANT -> log.debug(
            "{} time={} numClose={} stats={} collisions={}", wayPoint, Util.nf7(sim.getTime()), numClose, stats,
            collisions);
            default -> log.debug("{} time={} stuckCount={} binarySearch={} stats={}", wayPoint,
                                 Util.nf7(sim.getTime()), stuckCount, binarySearch, stats);
        }
    }
}
