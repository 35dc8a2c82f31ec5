package com.trust.network.solver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A binary maximization program: {@code max c·x  s.t.  A x <= b,  x in {0,1}}.
 *
 * <p>Variables are identified by their declaration index. Callers declare variables
 * in a stable order (ascending node id) so that solves are reproducible.</p>
 *
 * <pre>
 * IntegerProgram.Builder b = IntegerProgram.builder("knapsack");
 * int x = b.addVariable("x_7", 10.0);
 * int y = b.addVariable("y_9", 8.0);
 * b.constraint("budget").term(x, 5).term(y, 5).atMost(10);
 * IntegerProgram program = b.build();
 * </pre>
 */
public final class IntegerProgram {

    private final String name;
    private final List<String> variableNames;
    private final double[] objective;
    private final List<LinearConstraint> constraints;
    private final BitSet warmStart;

    private IntegerProgram(Builder builder) {
        this.name = builder.name;
        this.variableNames = List.copyOf(builder.variableNames);
        this.objective = new double[builder.objective.size()];
        for (int i = 0; i < objective.length; i++) {
            objective[i] = builder.objective.get(i);
        }
        this.constraints = List.copyOf(builder.constraints);
        this.warmStart = builder.warmStart != null ? (BitSet) builder.warmStart.clone() : null;
    }

    public String getName() {
        return name;
    }

    public int variableCount() {
        return objective.length;
    }

    public String variableName(int variable) {
        return variableNames.get(variable);
    }

    public double objectiveCoefficient(int variable) {
        return objective[variable];
    }

    public List<LinearConstraint> getConstraints() {
        return constraints;
    }

    /**
     * A feasible starting assignment, if the caller supplied one.
     */
    public Optional<BitSet> getWarmStart() {
        return warmStart == null ? Optional.empty() : Optional.of((BitSet) warmStart.clone());
    }

    /**
     * Objective value of an assignment.
     */
    public double evaluate(BitSet ones) {
        double value = 0.0;
        for (int i = ones.nextSetBit(0); i >= 0 && i < objective.length; i = ones.nextSetBit(i + 1)) {
            value += objective[i];
        }
        return value;
    }

    /**
     * Whether an assignment satisfies every constraint within {@code tolerance}.
     */
    public boolean isFeasible(BitSet ones, double tolerance) {
        for (LinearConstraint constraint : constraints) {
            if (constraint.activity(ones) > constraint.rhs() + tolerance) {
                return false;
            }
        }
        return true;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        return "IntegerProgram{name='" + name + '\'' +
                ", variables=" + objective.length +
                ", constraints=" + constraints.size() + '}';
    }

    /**
     * A {@code <=} row of the program.
     *
     * @param name         constraint name
     * @param variables    variable indexes with a non-zero coefficient
     * @param coefficients coefficients, aligned with {@code variables}
     * @param rhs          right-hand side
     */
    public record LinearConstraint(String name, int[] variables, double[] coefficients, double rhs) {

        public LinearConstraint {
            if (variables.length != coefficients.length) {
                throw new IllegalArgumentException("variables and coefficients must align in " + name);
            }
            variables = variables.clone();
            coefficients = coefficients.clone();
        }

        public int size() {
            return variables.length;
        }

        public int variable(int term) {
            return variables[term];
        }

        public double coefficient(int term) {
            return coefficients[term];
        }

        public double activity(BitSet ones) {
            double activity = 0.0;
            for (int t = 0; t < variables.length; t++) {
                if (ones.get(variables[t])) {
                    activity += coefficients[t];
                }
            }
            return activity;
        }

        @Override
        public int[] variables() {
            return variables.clone();
        }

        @Override
        public double[] coefficients() {
            return coefficients.clone();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof LinearConstraint that)) return false;
            return Double.compare(rhs, that.rhs) == 0
                    && name.equals(that.name)
                    && Arrays.equals(variables, that.variables)
                    && Arrays.equals(coefficients, that.coefficients);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * name.hashCode() + Arrays.hashCode(variables)) + Arrays.hashCode(coefficients);
        }

        @Override
        public String toString() {
            return "LinearConstraint{name='" + name + "', terms=" + variables.length + ", rhs=" + rhs + '}';
        }
    }

    public static class Builder {
        private final String name;
        private final List<String> variableNames = new ArrayList<>();
        private final List<Double> objective = new ArrayList<>();
        private final List<LinearConstraint> constraints = new ArrayList<>();
        private BitSet warmStart;

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Declares a binary variable.
         *
         * @return the variable index
         */
        public int addVariable(String variableName, double objectiveCoefficient) {
            if (!Double.isFinite(objectiveCoefficient)) {
                throw new IllegalArgumentException("objective coefficient of " + variableName + " must be finite");
            }
            variableNames.add(variableName);
            objective.add(objectiveCoefficient);
            return objective.size() - 1;
        }

        /**
         * Starts a {@code <=} constraint.
         */
        public ConstraintBuilder constraint(String constraintName) {
            return new ConstraintBuilder(this, constraintName);
        }

        /**
         * Supplies a feasible assignment the backend may use as its first incumbent.
         */
        public Builder warmStart(BitSet ones) {
            this.warmStart = ones != null ? (BitSet) ones.clone() : null;
            return this;
        }

        public IntegerProgram build() {
            return new IntegerProgram(this);
        }
    }

    public static class ConstraintBuilder {
        private final Builder parent;
        private final String name;
        private final Map<Integer, Double> terms = new LinkedHashMap<>();

        private ConstraintBuilder(Builder parent, String name) {
            this.parent = parent;
            this.name = name;
        }

        public ConstraintBuilder term(int variable, double coefficient) {
            if (variable < 0 || variable >= parent.objective.size()) {
                throw new IllegalArgumentException("Unknown variable " + variable + " in constraint " + name);
            }
            if (!Double.isFinite(coefficient)) {
                throw new IllegalArgumentException("coefficient must be finite in constraint " + name);
            }
            terms.merge(variable, coefficient, Double::sum);
            return this;
        }

        /**
         * Closes the constraint as {@code sum(terms) <= rhs}.
         */
        public Builder atMost(double rhs) {
            terms.values().removeIf(coefficient -> coefficient == 0.0);
            int[] vars = new int[terms.size()];
            double[] coefs = new double[terms.size()];
            int i = 0;
            for (Map.Entry<Integer, Double> term : terms.entrySet()) {
                vars[i] = term.getKey();
                coefs[i] = term.getValue();
                i++;
            }
            parent.constraints.add(new LinearConstraint(name, vars, coefs, rhs));
            return parent;
        }
    }
}
