package com.cardparser.backend.services.statements;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.cardparser.backend.services.statements.profiles.InstitutionProfile;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class BankDetector {

    private final ProfileRegistry profileRegistry;

    /**
     * First profile, in registry order, whose validator accepts the text. Scanning stops at the first hit.
     */
    public Optional<InstitutionProfile> detect(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        for (InstitutionProfile profile : profileRegistry.getProfiles()) {
            if (profile.validate(text)) {
                return Optional.of(profile);
            }
        }
        return Optional.empty();
    }

    /**
     * Every accepting profile in registry order. More than one entry means the statement is ambiguous
     * and {@link #detect(String)} resolved it by priority.
     */
    public List<InstitutionProfile> detectAll(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<InstitutionProfile> matches = new ArrayList<>();
        for (InstitutionProfile profile : profileRegistry.getProfiles()) {
            if (profile.validate(text)) {
                matches.add(profile);
            }
        }
        return List.copyOf(matches);
    }
}
