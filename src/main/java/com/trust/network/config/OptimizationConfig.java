package com.trust.network.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Immutable configuration for one optimization run.
 * Carries the budgets, thresholds and model selectors that the selectors and
 * the exporter read. Validation happens in {@link Builder#build()} so an invalid
 * combination is reported before any computation starts.
 */
public class OptimizationConfig {

    private static final int DEFAULT_SENTINEL_BUDGET = 10;
    private static final double DEFAULT_MAINTENANCE_BUDGET_MINUTES = 2800.0;
    private static final double DEFAULT_COVERAGE_THRESHOLD = 0.0;
    private static final Duration DEFAULT_SOLVER_TIME_LIMIT = Duration.ofMinutes(10);
    private static final double DEFAULT_DECAY_LAMBDA = 0.001;
    private static final double DEFAULT_FIXED_COST_MINUTES = 30.0;
    private static final int DEFAULT_RANDOM_COST_MIN = 15;
    private static final int DEFAULT_RANDOM_COST_MAX = 120;
    private static final long DEFAULT_RANDOM_SEED = 42L;
    private static final long DEFAULT_MIN_DORMANCY_DAYS = 30;

    static final String PREFIX = "optimizer.";
    public static final String DEFAULT_RESOURCE = "optimizer.properties";

    private final int sentinelBudget;
    private final double maintenanceBudgetMinutes;
    private final double coverageThreshold;
    private final Duration solverTimeLimit;
    private final DormancyModel dormancyModel;
    private final double decayLambda;
    private final CostModel costModel;
    private final double fixedCostMinutes;
    private final int randomCostMin;
    private final int randomCostMax;
    private final long randomSeed;
    private final long minDormancyDays;
    private final int localSwapIterations;
    private final MaintenanceOrdering maintenanceOrdering;
    private final SentinelGroupSource sentinelGroupSource;
    private final boolean parallelSelectors;

    private OptimizationConfig(Builder builder) {
        this.sentinelBudget = builder.sentinelBudget;
        this.maintenanceBudgetMinutes = builder.maintenanceBudgetMinutes;
        this.coverageThreshold = builder.coverageThreshold;
        this.solverTimeLimit = builder.solverTimeLimit;
        this.dormancyModel = builder.dormancyModel;
        this.decayLambda = builder.decayLambda;
        this.costModel = builder.costModel;
        this.fixedCostMinutes = builder.fixedCostMinutes;
        this.randomCostMin = builder.randomCostMin;
        this.randomCostMax = builder.randomCostMax;
        this.randomSeed = builder.randomSeed;
        this.minDormancyDays = builder.minDormancyDays;
        this.localSwapIterations = builder.localSwapIterations;
        this.maintenanceOrdering = builder.maintenanceOrdering;
        this.sentinelGroupSource = builder.sentinelGroupSource;
        this.parallelSelectors = builder.parallelSelectors;
    }

    public int getSentinelBudget() {
        return sentinelBudget;
    }

    public double getMaintenanceBudgetMinutes() {
        return maintenanceBudgetMinutes;
    }

    public double getCoverageThreshold() {
        return coverageThreshold;
    }

    public Duration getSolverTimeLimit() {
        return solverTimeLimit;
    }

    public DormancyModel getDormancyModel() {
        return dormancyModel;
    }

    public double getDecayLambda() {
        return decayLambda;
    }

    public CostModel getCostModel() {
        return costModel;
    }

    public double getFixedCostMinutes() {
        return fixedCostMinutes;
    }

    public int getRandomCostMin() {
        return randomCostMin;
    }

    public int getRandomCostMax() {
        return randomCostMax;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public long getMinDormancyDays() {
        return minDormancyDays;
    }

    public int getLocalSwapIterations() {
        return localSwapIterations;
    }

    public MaintenanceOrdering getMaintenanceOrdering() {
        return maintenanceOrdering;
    }

    public SentinelGroupSource getSentinelGroupSource() {
        return sentinelGroupSource;
    }

    public boolean isParallelSelectors() {
        return parallelSelectors;
    }

    /**
     * Creates the default configuration: K=10, T=2800 minutes, 10 minute solver limit.
     */
    public static OptimizationConfig defaults() {
        return builder().build();
    }

    /**
     * Reads a configuration from {@code optimizer.*} properties.
     * Missing or blank keys keep their defaults.
     *
     * @param properties the properties source
     * @return the validated configuration
     * @throws ConfigurationException if a value cannot be converted or the result is invalid
     */
    public static OptimizationConfig fromProperties(Properties properties) {
        return fromConfig(new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(toMap(properties), "optimizer-properties", 100))
                .build());
    }

    /**
     * Reads a configuration from a classpath properties resource, e.g. the bundled
     * {@value #DEFAULT_RESOURCE}. System properties and environment variables
     * override the resource.
     *
     * @throws ConfigurationException if the resource is missing, unreadable or invalid
     */
    public static OptimizationConfig fromResource(String resource) {
        try (InputStream in = OptimizationConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromConfig(new SmallRyeConfigBuilder()
                    .addSystemSources()
                    .withSources(new PropertiesConfigSource(toMap(properties), resource, 100))
                    .build());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration resource " + resource, e);
        }
    }

    /**
     * Reads the {@code optimizer.*} keys from a MicroProfile {@link Config}.
     * Missing keys keep their defaults.
     *
     * @throws ConfigurationException if a value cannot be converted or the result is invalid
     */
    public static OptimizationConfig fromConfig(Config config) {
        Builder builder = builder();
        value(config, "sentinel.budget", Integer.class).ifPresent(builder::sentinelBudget);
        value(config, "maintenance.budget-minutes", Double.class).ifPresent(builder::maintenanceBudgetMinutes);
        value(config, "coverage.threshold", Double.class).ifPresent(builder::coverageThreshold);
        value(config, "solver.time-limit-ms", Long.class)
                .ifPresent(ms -> builder.solverTimeLimit(Duration.ofMillis(ms)));
        enumValue(config, DormancyModel.class, "maintenance.dormancy-model").ifPresent(builder::dormancyModel);
        value(config, "maintenance.decay-lambda", Double.class).ifPresent(builder::decayLambda);
        enumValue(config, CostModel.class, "maintenance.cost-model").ifPresent(builder::costModel);
        value(config, "maintenance.fixed-cost-minutes", Double.class).ifPresent(builder::fixedCostMinutes);
        int costMin = value(config, "maintenance.random-cost-min", Integer.class).orElse(builder.randomCostMin);
        int costMax = value(config, "maintenance.random-cost-max", Integer.class).orElse(builder.randomCostMax);
        builder.randomCostRange(costMin, costMax);
        value(config, "maintenance.random-seed", Long.class).ifPresent(builder::randomSeed);
        value(config, "maintenance.min-dormancy-days", Long.class).ifPresent(builder::minDormancyDays);
        value(config, "maintenance.local-swap-iterations", Integer.class).ifPresent(builder::localSwapIterations);
        enumValue(config, MaintenanceOrdering.class, "maintenance.ordering").ifPresent(builder::maintenanceOrdering);
        enumValue(config, SentinelGroupSource.class, "sentinel.group-source").ifPresent(builder::sentinelGroupSource);
        booleanValue(config, "selectors.parallel").ifPresent(builder::parallelSelectors);
        return builder.build();
    }

    private static Map<String, String> toMap(Properties properties) {
        Map<String, String> map = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            map.put(name, properties.getProperty(name).trim());
        }
        return map;
    }

    private static <T> Optional<T> value(Config config, String key, Class<T> type) {
        try {
            return config.getOptionalValue(PREFIX + key, type);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(PREFIX + key + " must be a valid " + type.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    private static Optional<Boolean> booleanValue(Config config, String key) {
        return value(config, key, String.class).map(String::trim).map(raw -> {
            if ("true".equalsIgnoreCase(raw)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(raw)) {
                return Boolean.FALSE;
            }
            throw new ConfigurationException(PREFIX + key + " must be true or false: '" + raw + "'");
        });
    }

    private static <E extends Enum<E>> Optional<E> enumValue(Config config, Class<E> type, String key) {
        return value(config, key, String.class).map(String::trim).map(raw -> {
            try {
                return Enum.valueOf(type, raw.toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown " + PREFIX + key + ": '" + raw + "'", e);
            }
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int sentinelBudget = DEFAULT_SENTINEL_BUDGET;
        private double maintenanceBudgetMinutes = DEFAULT_MAINTENANCE_BUDGET_MINUTES;
        private double coverageThreshold = DEFAULT_COVERAGE_THRESHOLD;
        private Duration solverTimeLimit = DEFAULT_SOLVER_TIME_LIMIT;
        private DormancyModel dormancyModel = DormancyModel.LOGARITHMIC;
        private double decayLambda = DEFAULT_DECAY_LAMBDA;
        private CostModel costModel = CostModel.SEEDED_RANDOM;
        private double fixedCostMinutes = DEFAULT_FIXED_COST_MINUTES;
        private int randomCostMin = DEFAULT_RANDOM_COST_MIN;
        private int randomCostMax = DEFAULT_RANDOM_COST_MAX;
        private long randomSeed = DEFAULT_RANDOM_SEED;
        private long minDormancyDays = DEFAULT_MIN_DORMANCY_DAYS;
        private int localSwapIterations = 0;
        private MaintenanceOrdering maintenanceOrdering = MaintenanceOrdering.DAYS_DORMANT_DESC;
        private SentinelGroupSource sentinelGroupSource = SentinelGroupSource.EXACT;
        private boolean parallelSelectors = true;

        public Builder sentinelBudget(int sentinelBudget) {
            this.sentinelBudget = sentinelBudget;
            return this;
        }

        public Builder maintenanceBudgetMinutes(double maintenanceBudgetMinutes) {
            this.maintenanceBudgetMinutes = maintenanceBudgetMinutes;
            return this;
        }

        public Builder coverageThreshold(double coverageThreshold) {
            this.coverageThreshold = coverageThreshold;
            return this;
        }

        public Builder solverTimeLimit(Duration solverTimeLimit) {
            this.solverTimeLimit = solverTimeLimit;
            return this;
        }

        public Builder dormancyModel(DormancyModel dormancyModel) {
            this.dormancyModel = dormancyModel;
            return this;
        }

        public Builder decayLambda(double decayLambda) {
            this.decayLambda = decayLambda;
            return this;
        }

        public Builder costModel(CostModel costModel) {
            this.costModel = costModel;
            return this;
        }

        public Builder fixedCostMinutes(double fixedCostMinutes) {
            this.fixedCostMinutes = fixedCostMinutes;
            return this;
        }

        public Builder randomCostRange(int min, int max) {
            this.randomCostMin = min;
            this.randomCostMax = max;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder minDormancyDays(long minDormancyDays) {
            this.minDormancyDays = minDormancyDays;
            return this;
        }

        public Builder localSwapIterations(int localSwapIterations) {
            this.localSwapIterations = localSwapIterations;
            return this;
        }

        public Builder maintenanceOrdering(MaintenanceOrdering maintenanceOrdering) {
            this.maintenanceOrdering = maintenanceOrdering;
            return this;
        }

        public Builder sentinelGroupSource(SentinelGroupSource sentinelGroupSource) {
            this.sentinelGroupSource = sentinelGroupSource;
            return this;
        }

        public Builder parallelSelectors(boolean parallelSelectors) {
            this.parallelSelectors = parallelSelectors;
            return this;
        }

        public OptimizationConfig build() {
            if (sentinelBudget <= 0) {
                throw new ConfigurationException("sentinelBudget must be positive, was " + sentinelBudget);
            }
            if (!(maintenanceBudgetMinutes > 0.0) || Double.isInfinite(maintenanceBudgetMinutes)) {
                throw new ConfigurationException(
                        "maintenanceBudgetMinutes must be positive and finite, was " + maintenanceBudgetMinutes);
            }
            if (Double.isNaN(coverageThreshold) || coverageThreshold < 0.0) {
                throw new ConfigurationException("coverageThreshold must be >= 0, was " + coverageThreshold);
            }
            if (solverTimeLimit == null || solverTimeLimit.isNegative()) {
                throw new ConfigurationException("solverTimeLimit must be zero or positive");
            }
            if (dormancyModel == null) {
                throw new ConfigurationException("dormancyModel is required");
            }
            if (costModel == null) {
                throw new ConfigurationException("costModel is required");
            }
            if (Double.isNaN(decayLambda) || decayLambda < 0.0) {
                throw new ConfigurationException("decayLambda must be non-negative");
            }
            if (!(fixedCostMinutes > 0.0)) {
                throw new ConfigurationException("fixedCostMinutes must be positive");
            }
            if (randomCostMin <= 0 || randomCostMax < randomCostMin) {
                throw new ConfigurationException(
                        "random cost range must satisfy 0 < min <= max, was " + randomCostMin + ".." + randomCostMax);
            }
            if (minDormancyDays < 0) {
                throw new ConfigurationException("minDormancyDays must be >= 0");
            }
            if (localSwapIterations < 0) {
                throw new ConfigurationException("localSwapIterations must be >= 0");
            }
            if (maintenanceOrdering == null || sentinelGroupSource == null) {
                throw new ConfigurationException("maintenanceOrdering and sentinelGroupSource are required");
            }
            return new OptimizationConfig(this);
        }
    }

    @Override
    public String toString() {
        return "OptimizationConfig{" +
                "sentinelBudget=" + sentinelBudget +
                ", maintenanceBudgetMinutes=" + maintenanceBudgetMinutes +
                ", coverageThreshold=" + coverageThreshold +
                ", solverTimeLimit=" + solverTimeLimit +
                ", dormancyModel=" + dormancyModel +
                ", decayLambda=" + decayLambda +
                ", costModel=" + costModel +
                ", minDormancyDays=" + minDormancyDays +
                ", localSwapIterations=" + localSwapIterations +
                ", maintenanceOrdering=" + maintenanceOrdering +
                ", sentinelGroupSource=" + sentinelGroupSource +
                ", parallelSelectors=" + parallelSelectors +
                '}';
    }
}
