package com.mythos.core.achievement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mythos.core.events.EventBus;
import com.mythos.core.events.MythosEvent;
import com.mythos.core.metrics.MythosMetrics;
import com.mythos.core.model.StateValues;
import com.mythos.core.persistence.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates achievements against game and player snapshots and keeps the unlock history.
 * The default achievement set is registered at construction.
 */
@Service
public class AchievementManager {

    private static final Logger log = LoggerFactory.getLogger(AchievementManager.class);

    private static final int RECENT_UNLOCKS = 5;

    private final EventBus eventBus;
    private final MythosMetrics metrics;
    private final Clock clock;
    private final ObjectMapper objectMapper = JsonMapper.create();

    private final Map<String, Achievement> achievements = new LinkedHashMap<>();
    private final Set<String> unlockedIds = new LinkedHashSet<>();
    private final List<UnlockRecord> unlockHistory = new ArrayList<>();

    public AchievementManager(EventBus eventBus, MythosMetrics metrics, Clock clock) {
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        DefaultAchievements.create().forEach(this::addAchievement);
        log.info("Achievement manager initialized with {} achievements", achievements.size());
    }

    public void addAchievement(Achievement achievement) {
        if (achievements.putIfAbsent(achievement.getAchievementId(), achievement) != null) {
            throw new IllegalArgumentException("Achievement already registered: " + achievement.getAchievementId());
        }
        if (achievement.isUnlocked()) {
            unlockedIds.add(achievement.getAchievementId());
        }
        log.debug("Added achievement {}", achievement.getAchievementId());
    }

    /**
     * Unlocks every locked achievement whose prerequisites and criteria hold.
     * Calling it again with the same snapshots unlocks nothing new.
     *
     * @return the achievements unlocked by this call
     */
    public List<Achievement> checkAllAchievements(Map<String, Object> gameData, Map<String, Object> playerStats) {
        Map<String, Object> game = gameData == null ? Map.of() : gameData;
        Map<String, Object> stats = playerStats == null ? Map.of() : playerStats;
        List<Achievement> newlyUnlocked = new ArrayList<>();
        for (Achievement achievement : achievements.values()) {
            if (achievement.isUnlocked()) {
                continue;
            }
            Set<String> known = new LinkedHashSet<>(unlockedIds);
            known.addAll(StateValues.getStringList(game, "unlocked_achievements"));
            if (achievement.isEligible(game, stats, known) && unlock(achievement, game)) {
                newlyUnlocked.add(achievement);
            }
        }
        return newlyUnlocked;
    }

    private boolean unlock(Achievement achievement, Map<String, Object> context) {
        Instant now = clock.instant();
        if (!achievement.unlock(now, context)) {
            return false;
        }
        unlockedIds.add(achievement.getAchievementId());
        unlockHistory.add(new UnlockRecord(achievement.getAchievementId(), achievement.getTitle(), now,
                achievement.getRarity().weight(), achievement.getCategory().value()));
        metrics.recordAchievementUnlock(achievement.getRarity().label());
        log.info("Achievement unlocked: {} ({})", achievement.getTitle(), achievement.getRarity().label());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", achievement.getTitle());
        payload.put("category", achievement.getCategory().value());
        payload.put("rarity", achievement.getRarity().weight());
        payload.put("hidden", achievement.isHidden());
        eventBus.publish(new MythosEvent("achievement_unlocked", achievement.getAchievementId(), payload, now));
        return true;
    }

    public Optional<Achievement> getAchievement(String achievementId) {
        return Optional.ofNullable(achievements.get(achievementId));
    }

    public List<Achievement> getAllAchievements() {
        return List.copyOf(achievements.values());
    }

    public Optional<AchievementProgress> getAchievementProgress(String achievementId, Map<String, Object> gameData,
                                                                Map<String, Object> playerStats) {
        return getAchievement(achievementId).map(a -> a.progress(gameData, playerStats));
    }

    public List<Achievement> getAchievementsByCategory(AchievementCategory category, boolean includeHidden) {
        return achievements.values().stream()
                .filter(a -> a.getCategory() == category)
                .filter(a -> includeHidden || !a.isHidden())
                .toList();
    }

    public List<Achievement> getUnlockedAchievements() {
        return achievements.values().stream().filter(Achievement::isUnlocked).toList();
    }

    public Set<String> getUnlockedIds() {
        return Set.copyOf(unlockedIds);
    }

    public List<UnlockRecord> getUnlockHistory() {
        return List.copyOf(unlockHistory);
    }

    /** Unlocked rarity weight over total rarity weight, as a percentage. */
    public double getCompletionPercentage() {
        int total = achievements.values().stream().mapToInt(a -> a.getRarity().weight()).sum();
        int unlocked = getUnlockedAchievements().stream().mapToInt(a -> a.getRarity().weight()).sum();
        return total == 0 ? 0.0 : unlocked * 100.0 / total;
    }

    public Optional<Achievement> getRarestUnlocked() {
        return getUnlockedAchievements().stream()
                .max(Comparator.comparingInt(a -> a.getRarity().weight()));
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> byCategory = new LinkedHashMap<>();
        for (AchievementCategory category : AchievementCategory.values()) {
            byCategory.put(category.value(), breakdown(getAchievementsByCategory(category, false)));
        }
        Map<String, Object> byRarity = new LinkedHashMap<>();
        for (AchievementRarity rarity : AchievementRarity.values()) {
            byRarity.put(rarity.label(), breakdown(achievements.values().stream()
                    .filter(a -> a.getRarity() == rarity).toList()));
        }

        int total = achievements.size();
        int unlocked = getUnlockedAchievements().size();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_achievements", total);
        stats.put("unlocked_count", unlocked);
        stats.put("overall_unlock_rate", total == 0 ? 0.0 : (double) unlocked / total);
        stats.put("category_breakdown", byCategory);
        stats.put("rarity_breakdown", byRarity);
        stats.put("recent_unlocks", unlockHistory.subList(Math.max(0, unlockHistory.size() - RECENT_UNLOCKS),
                unlockHistory.size()).stream().toList());
        stats.put("rarest_unlocked", getRarestUnlocked().map(Achievement::getAchievementId).orElse(null));
        stats.put("completion_percentage", getCompletionPercentage());
        return stats;
    }

    private static Map<String, Object> breakdown(List<Achievement> group) {
        long unlocked = group.stream().filter(Achievement::isUnlocked).count();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("total", group.size());
        entry.put("unlocked", unlocked);
        entry.put("unlock_rate", group.isEmpty() ? 0.0 : (double) unlocked / group.size());
        return entry;
    }

    // -- Persistence ----------------------------------------------------------

    public boolean saveToFile(Path path) {
        Map<String, Instant> unlockedAt = new LinkedHashMap<>();
        for (Achievement achievement : getUnlockedAchievements()) {
            achievement.getUnlockedAt().ifPresent(at -> unlockedAt.put(achievement.getAchievementId(), at));
        }
        AchievementSnapshot snapshot = new AchievementSnapshot(List.copyOf(unlockedIds), unlockedAt,
                unlockHistory, clock.instant());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), snapshot);
            log.info("Saved achievement progress to {}", path);
            return true;
        } catch (IOException e) {
            log.error("Failed to save achievement progress to {}: {}", path, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Restores unlock state from a save file. Unknown achievement ids are ignored; nothing is
     * re-locked. On failure the in-memory state is left as it was.
     */
    public boolean loadFromFile(Path path) {
        AchievementSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(path.toFile(), AchievementSnapshot.class);
        } catch (IOException e) {
            log.error("Failed to load achievement progress from {}: {}", path, e.getMessage(), e);
            return false;
        }
        for (String id : snapshot.unlockedAchievements()) {
            Achievement achievement = achievements.get(id);
            if (achievement == null) {
                log.warn("Ignoring unknown achievement {} in {}", id, path);
                continue;
            }
            if (!achievement.isUnlocked()) {
                achievement.restoreUnlock(snapshot.unlockedAt().get(id));
            }
            unlockedIds.add(id);
        }
        unlockHistory.clear();
        unlockHistory.addAll(snapshot.unlockHistory());
        log.info("Loaded achievement progress from {} ({} unlocked)", path, unlockedIds.size());
        return true;
    }
}
