package software.amazon.wfst;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.wfst.flag.FlagDiacritics;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/*
 * Notes on the implementation:
 *
 * This is a best-first search over a non-deterministic weighted automaton. Partial paths sit in a priority queue
 *  keyed by accumulated cost; popping the cheapest one either reports it (when it has stopped in a final state and
 *  consumed the whole string) or expands it by one transition, or by stopping.
 *
 * Stopping is itself queued as a step that pays the final weight, so a path that could stop now competes fairly
 *  with its own continuations.
 *
 * There is no cycle detection. An automaton with epsilon cycles of zero or negative cost keeps the search busy
 *  forever once the cheaper results are exhausted; bound consumption from the outside if that matters.
 */

/**
 *  Lazily produces the results of passing a tokenized string through an automaton, cheapest first.
 */
final class PathFinder implements Iterator<ApplyResult> {

    private static final Logger logger = LoggerFactory.getLogger(PathFinder.class);

    private final SearchTask task;

    private ApplyResult next;

    private PathFinder(final SearchTask task) {
        this.task = task;
    }

    static Iterator<ApplyResult> find(final SearchTask task) {
        return new PathFinder(task);
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = advance();
        }
        return next != null;
    }

    @Override
    public ApplyResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ApplyResult result = next;
        next = null;
        return result;
    }

    // each iteration removes a step and adds zero or more new ones, until one can be reported
    private ApplyResult advance() {
        while (task.stepsRemain()) {
            SearchStep step = task.nextStep();
            if (logger.isTraceEnabled()) {
                logger.trace("Popped {}", step);
            }
            if (step.isFinished()) {
                ApplyResult result = tryReport(step);
                if (result != null) {
                    return result;
                }
            } else {
                expand(step);
            }
        }
        return null;
    }

    private ApplyResult tryReport(final SearchStep step) {
        if (step.consumed != task.tokens.size()) {
            return null;
        }
        List<String> produced = step.getProduced();
        if (!task.flagsAgree(produced)) {
            return null;
        }
        if (!task.configuration.isPrintFlags()) {
            produced = FlagDiacritics.filterFlags(produced);
        }
        return new ApplyResult(produced, step.cost, task.configuration);
    }

    private void expand(final SearchStep step) {
        State state = step.state;
        if (state.isFinal()) {
            task.addStep(step.finish(task.nextSequence()));
        }
        for (Transition transition : state.getTransitions()) {
            Label label = transition.getLabel();
            String consumedSide = label.getSide(task.inverse);
            String producedSide = label.getSide(!task.inverse);
            if (consumedSide.isEmpty() || FlagDiacritics.isFlag(consumedSide)) {
                task.addStep(step.advance(transition, 0, producedSide, task.nextSequence()));
            } else if (step.consumed < task.tokens.size()) {
                String token = task.tokens.get(step.consumed);
                String nextSymbol = task.isInAlphabet(token) ? token : Constants.WILDCARD;
                if (nextSymbol.equals(consumedSide)) {
                    boolean copyToken = nextSymbol.equals(Constants.WILDCARD)
                            && producedSide.equals(Constants.WILDCARD);
                    task.addStep(step.advance(transition, 1, copyToken ? token : producedSide,
                            task.nextSequence()));
                }
            }
        }
    }
}
