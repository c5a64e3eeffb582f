package com.salestracker.platform.service;

import com.salestracker.platform.exception.InvalidRequestException;
import com.salestracker.platform.model.Streak;
import com.salestracker.platform.model.User;
import com.salestracker.platform.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

@Service
public class StreakTracker {

    private static final Logger logger = LoggerFactory.getLogger(StreakTracker.class);

    private final UserRepository userRepository;
    private final Clock clock;
    private final KeyedLocks userLocks = new KeyedLocks();

    @Autowired
    public StreakTracker(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    /**
     * Streak of the user as of today. Unknown users have an empty streak.
     */
    public Streak getUserStreak(String userId) {
        return userRepository.findById(userId)
            .map(user -> StreakCalculator.asOf(user.getStreak(), LocalDate.now(clock)))
            .orElseGet(Streak::empty);
    }

    /**
     * Overwrites the stored streak.
     *
     * @return the stored streak, or empty when the user does not exist
     */
    public Optional<Streak> updateUserStreak(String userId, int currentStreak, int longestStreak,
                                             LocalDate lastActivityDate) {
        if (currentStreak < 0 || longestStreak < 0) {
            throw new InvalidRequestException("Streak values cannot be negative");
        }
        if (longestStreak < currentStreak) {
            throw new InvalidRequestException("longestStreak cannot be lower than currentStreak");
        }

        Streak streak = new Streak(currentStreak, longestStreak, lastActivityDate);
        if (!userRepository.updateStreak(userId, streak, clock.instant())) {
            return Optional.empty();
        }
        logger.info("Streak of user {} set to {} (longest {})", userId, currentStreak, longestStreak);
        return Optional.of(streak);
    }

    /**
     * Advances the stored streak for an activity dated {@code activityDate}. Advances for one user
     * run one at a time so two activities never both start from the same stored streak.
     *
     * @return the new streak, or empty when the user does not exist
     */
    public Optional<Streak> recordActivity(String userId, LocalDate activityDate) {
        return userLocks.withLock(userId, () -> {
            Optional<User> existing = userRepository.findById(userId);
            if (existing.isEmpty()) {
                logger.warn("Cannot advance streak of unknown user {}", userId);
                return Optional.empty();
            }

            Streak next = StreakCalculator.advance(existing.get().getStreak(), activityDate);
            if (!userRepository.updateStreak(userId, next, clock.instant())) {
                return Optional.empty();
            }
            logger.debug("Streak of user {} is now {}", userId, next.getCurrentStreak());
            return Optional.of(next);
        });
    }
}
