package com.trust.network.maintenance;

import com.trust.network.config.OptimizationConfig;
import com.trust.network.graph.NetworkSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Turns a snapshot into maintenance candidates.
 *
 * <p>A node qualifies when it has been dormant for more than the configured minimum,
 * has a positive score and at least one incident edge. Its value is
 * {@code urgency(days) * score * sqrt(degree)}, with urgency given by the configured
 * {@link com.trust.network.config.DormancyModel}. Costs follow the configured
 * {@link com.trust.network.config.CostModel}; seeded random costs are drawn for every
 * node in ascending id order so a node's cost does not depend on which other nodes
 * qualify.</p>
 */
public class MaintenanceCandidateFactory {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceCandidateFactory.class);

    private final OptimizationConfig config;

    public MaintenanceCandidateFactory(OptimizationConfig config) {
        this.config = config;
    }

    /**
     * @return candidates in ascending id order
     */
    public List<MaintenanceCandidate> candidates(NetworkSnapshot snapshot) {
        Map<Long, Double> costs = costs(snapshot);
        List<MaintenanceCandidate> candidates = new ArrayList<>();
        for (Long id : snapshot.allNodeIds()) {
            long days = snapshot.dormantDays(id);
            double score = snapshot.score(id);
            int degree = snapshot.degree(id);
            if (days <= config.getMinDormancyDays() || score <= 0 || degree <= 0) {
                continue;
            }
            double urgency = config.getDormancyModel().urgency(days, config.getDecayLambda());
            double value = urgency * score * Math.sqrt(degree);
            candidates.add(new MaintenanceCandidate(id, value, costs.get(id), days, degree, score));
        }
        log.info("maintenance.candidates count={} nodes={} minDormancyDays={} dormancyModel={} costModel={}",
                candidates.size(), snapshot.nodeCount(), config.getMinDormancyDays(),
                config.getDormancyModel(), config.getCostModel());
        return candidates;
    }

    Map<Long, Double> costs(NetworkSnapshot snapshot) {
        Map<Long, Double> costs = new HashMap<>();
        switch (config.getCostModel()) {
            case FIXED -> snapshot.allNodeIds().forEach(id -> costs.put(id, config.getFixedCostMinutes()));
            case DEGREE_PROPORTIONAL -> snapshot.allNodeIds().forEach(id -> costs.put(id,
                    config.getFixedCostMinutes() * Math.ceil(Math.sqrt(Math.max(1, snapshot.degree(id))))));
            case SEEDED_RANDOM -> {
                Random random = new Random(config.getRandomSeed());
                int span = config.getRandomCostMax() - config.getRandomCostMin() + 1;
                for (Long id : snapshot.allNodeIds()) {
                    costs.put(id, (double) (config.getRandomCostMin() + random.nextInt(span)));
                }
            }
        }
        return costs;
    }
}
