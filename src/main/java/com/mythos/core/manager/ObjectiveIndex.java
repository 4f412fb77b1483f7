package com.mythos.core.manager;

import com.mythos.core.model.ObjectiveScope;
import com.mythos.core.model.ObjectiveType;
import com.mythos.core.objective.Objective;
import com.mythos.core.objective.ObjectiveDefinition;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the manager's objectives: an insertion-ordered slot map keyed by id, the type and
 * scope indices, and the parent/child links.
 * <p>
 * Links exist only between objectives that are both present. Declared relations to ids that
 * are not (yet) present are picked up when the missing objective is added, and removing an
 * objective unlinks it from both sides.
 */
class ObjectiveIndex {

    private static final class Slot {
        private final Objective objective;
        private String parentId;
        private final Set<String> childIds = new LinkedHashSet<>();

        private Slot(Objective objective) {
            this.objective = objective;
        }
    }

    private final Map<String, Slot> slots = new LinkedHashMap<>();
    private final Map<ObjectiveType, Set<String>> byType = new EnumMap<>(ObjectiveType.class);
    private final Map<ObjectiveScope, Set<String>> byScope = new EnumMap<>(ObjectiveScope.class);

    boolean contains(String objectiveId) {
        return slots.containsKey(objectiveId);
    }

    void add(Objective objective) {
        String id = objective.getObjectiveId();
        slots.put(id, new Slot(objective));
        byType.computeIfAbsent(objective.getObjectiveType(), k -> new LinkedHashSet<>()).add(id);
        byScope.computeIfAbsent(objective.getScope(), k -> new LinkedHashSet<>()).add(id);

        ObjectiveDefinition definition = objective.getDefinition();
        if (definition.parentObjective() != null && slots.containsKey(definition.parentObjective())) {
            link(definition.parentObjective(), id);
        }
        for (String childId : definition.childObjectives()) {
            if (slots.containsKey(childId)) {
                link(id, childId);
            }
        }
        for (Slot other : new ArrayList<>(slots.values())) {
            String otherId = other.objective.getObjectiveId();
            if (otherId.equals(id)) {
                continue;
            }
            ObjectiveDefinition otherDefinition = other.objective.getDefinition();
            if (id.equals(otherDefinition.parentObjective())) {
                link(id, otherId);
            }
            if (otherDefinition.childObjectives().contains(id)) {
                link(otherId, id);
            }
        }
    }

    private void link(String parentId, String childId) {
        if (parentId.equals(childId)) {
            return;
        }
        Slot child = slots.get(childId);
        if (child.parentId != null && !child.parentId.equals(parentId)) {
            slots.get(child.parentId).childIds.remove(childId);
        }
        child.parentId = parentId;
        slots.get(parentId).childIds.add(childId);
    }

    Optional<Objective> remove(String objectiveId) {
        Slot slot = slots.remove(objectiveId);
        if (slot == null) {
            return Optional.empty();
        }
        if (slot.parentId != null && slots.containsKey(slot.parentId)) {
            slots.get(slot.parentId).childIds.remove(objectiveId);
        }
        for (String childId : slot.childIds) {
            Slot child = slots.get(childId);
            if (child != null) {
                child.parentId = null;
            }
        }
        byType.getOrDefault(slot.objective.getObjectiveType(), new LinkedHashSet<>()).remove(objectiveId);
        byScope.getOrDefault(slot.objective.getScope(), new LinkedHashSet<>()).remove(objectiveId);
        return Optional.of(slot.objective);
    }

    Optional<Objective> get(String objectiveId) {
        Slot slot = slots.get(objectiveId);
        return slot == null ? Optional.empty() : Optional.of(slot.objective);
    }

    List<Objective> all() {
        return slots.values().stream().map(s -> s.objective).toList();
    }

    List<Objective> ofType(ObjectiveType type) {
        return resolve(byType.getOrDefault(type, Set.of()));
    }

    List<Objective> ofScope(ObjectiveScope scope) {
        return resolve(byScope.getOrDefault(scope, Set.of()));
    }

    List<Objective> children(String objectiveId) {
        Slot slot = slots.get(objectiveId);
        return slot == null ? List.of() : resolve(slot.childIds);
    }

    Optional<Objective> parent(String objectiveId) {
        Slot slot = slots.get(objectiveId);
        if (slot == null || slot.parentId == null) {
            return Optional.empty();
        }
        return get(slot.parentId);
    }

    int size() {
        return slots.size();
    }

    void clear() {
        slots.clear();
        byType.clear();
        byScope.clear();
    }

    private List<Objective> resolve(Set<String> ids) {
        List<Objective> result = new ArrayList<>();
        for (String id : ids) {
            Slot slot = slots.get(id);
            if (slot != null) {
                result.add(slot.objective);
            }
        }
        return result;
    }
}
