package com.system.allocator.schemas.algorithm.Genetic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pool-draining greedy crossover.
 *
 * <p>All parent pairings go into one pool. Offspring are built one at a time by taking
 * the cheapest pairing that does not share a row or column with what the offspring
 * already holds, removing it from the pool as it is taken. An offspring that runs out of
 * eligible pairings before reaching full length is dropped, and building continues with
 * what is left of the pool until the pool is empty.
 */
public class CrossoverOperator {

    private static final Logger logger = LoggerFactory.getLogger(CrossoverOperator.class);

    private final GeneticContext context;

    public CrossoverOperator(GeneticContext context) {
        this.context = context;
    }

    /**
     * @return offspring followed by the parents, the parents alone when no offspring
     *     could be completed, or the single parent untouched
     */
    public List<Candidate> crossover(List<Candidate> parents) {
        if (parents.size() <= 1) {
            return parents;
        }

        List<Assignment> pool = new ArrayList<>();
        for (Candidate parent : parents) {
            pool.addAll(parent.getAssignment());
        }

        int assignmentLength = parents.get(0).getAssignment().size();
        int offspringMaxLength = parents.size();
        List<Candidate> offspring = new ArrayList<>();

        while (!pool.isEmpty()) {
            List<Assignment> newAssignment = buildOffspring(pool, assignmentLength);
            if (newAssignment.size() == assignmentLength) {
                offspring.add(new Candidate(newAssignment));
            }
        }

        if (offspring.size() != offspringMaxLength) {
            if (context.isLoggingEnabled()) {
                logger.debug("\tOffspring padded with {} duplicates.", offspringMaxLength - offspring.size());
            }
            if (offspring.isEmpty()) {
                return parents;
            }
            fillRemainingOffspring(offspring, offspringMaxLength);
        }

        List<Candidate> result = new ArrayList<>(offspring);
        result.addAll(copies(parents));
        return result;
    }

    /**
     * Grows one offspring from the pool, consuming every pairing it takes.
     */
    private List<Assignment> buildOffspring(List<Assignment> pool, int assignmentLength) {
        List<Assignment> newAssignment = new ArrayList<>(assignmentLength);
        while (newAssignment.size() < assignmentLength) {
            int lowestIndex = findLowestCostValidIndex(pool, newAssignment);
            if (lowestIndex < 0) {
                break;
            }
            newAssignment.add(pool.remove(lowestIndex));
        }
        return newAssignment;
    }

    /**
     * Index in the pool of the cheapest pairing that fits next to {@code current};
     * the first one wins on equal cost. -1 when nothing fits.
     */
    static int findLowestCostValidIndex(List<Assignment> pool, List<Assignment> current) {
        int lowestIndex = -1;
        for (int i = 0; i < pool.size(); i++) {
            Assignment candidate = pool.get(i);
            if (!isValidAssignment(candidate, current)) {
                continue;
            }
            if (lowestIndex < 0 || candidate.getCost() < pool.get(lowestIndex).getCost()) {
                lowestIndex = i;
            }
        }
        return lowestIndex;
    }

    static boolean isValidAssignment(Assignment newAssignment, List<Assignment> currentAssignments) {
        for (Assignment assigned : currentAssignments) {
            if (assigned.conflictsWith(newAssignment)) {
                return false;
            }
        }
        return true;
    }

    // Pads with duplicates of randomly chosen offspring
    private void fillRemainingOffspring(List<Candidate> offspring, int maxLength) {
        while (offspring.size() < maxLength) {
            offspring.add(offspring.get(context.getRandom().intBetween(0, offspring.size() - 1)).copy());
        }
    }

    // Selection may return the same parent more than once; each slot gets its own instance
    private static List<Candidate> copies(List<Candidate> candidates) {
        List<Candidate> result = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            result.add(candidate.copy());
        }
        return result;
    }
}
