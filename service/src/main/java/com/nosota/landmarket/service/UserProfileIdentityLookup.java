package com.nosota.landmarket.service;

import com.nosota.landmarket.model.UserProfile;
import com.nosota.landmarket.repository.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.util.Optional;

/**
 * {@link IdentityLookup} backed by the local {@code user_profile} projection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserProfileIdentityLookup implements IdentityLookup {

    private static final int ADULT_AGE = 18;

    private final UserProfileRepository userProfileRepository;
    private final Clock clock;

    @Value("${marketplace.profit.default-withdraw-days}")
    private int defaultWithdrawDays;

    @Override
    public boolean isMinor(Long userId) {
        return findProfile(userId)
                .map(UserProfile::getBirthDate)
                .map(birthDate -> Period.between(birthDate, LocalDate.now(clock)).getYears() < ADULT_AGE)
                .orElse(false);
    }

    @Override
    public String displayName(Long userId) {
        return findProfile(userId)
                .map(UserProfile::getDisplayName)
                .orElse(String.valueOf(userId));
    }

    @Override
    public int withdrawProfitDays(Long userId) {
        return findProfile(userId)
                .map(UserProfile::getWithdrawProfitDays)
                .orElse(defaultWithdrawDays);
    }

    private Optional<UserProfile> findProfile(Long userId) {
        Optional<UserProfile> profile = userProfileRepository.findById(userId);
        if (profile.isEmpty()) {
            log.debug("No profile for user {}, using defaults", userId);
        }
        return profile;
    }
}
