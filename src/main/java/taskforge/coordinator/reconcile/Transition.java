package taskforge.coordinator.reconcile;

import taskforge.coordinator.model.TaskStatus;

import java.util.Set;

/**
 * Result of applying one event to one status.
 */
public record Transition(TaskStatus from, TaskStatus to, Set<TransitionEffect> effects) {

    public Transition {
        effects = Set.copyOf(effects);
    }

    public boolean has(TransitionEffect effect) {
        return effects.contains(effect);
    }

    public boolean changesStatus() {
        return from != to;
    }
}
