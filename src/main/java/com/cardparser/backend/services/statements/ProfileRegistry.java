package com.cardparser.backend.services.statements;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.cardparser.backend.services.statements.profiles.AmericanExpressInstitutionProfile;
import com.cardparser.backend.services.statements.profiles.AxisInstitutionProfile;
import com.cardparser.backend.services.statements.profiles.HdfcInstitutionProfile;
import com.cardparser.backend.services.statements.profiles.IciciInstitutionProfile;
import com.cardparser.backend.services.statements.profiles.InstitutionProfile;
import com.cardparser.backend.services.statements.profiles.SbiInstitutionProfile;

/**
 * Supported institutions in detection priority order.
 * <p>
 * The order is part of the contract: when a statement mentions more than one issuer (co-branded or
 * rebranded cards) the earliest profile wins. Keep {@link #DETECTION_ORDER} and the constructor in sync.
 */
@Component
public class ProfileRegistry {

    public static final List<String> DETECTION_ORDER = List.of(
            HdfcInstitutionProfile.ISSUER,
            IciciInstitutionProfile.ISSUER,
            SbiInstitutionProfile.ISSUER,
            AxisInstitutionProfile.ISSUER,
            AmericanExpressInstitutionProfile.ISSUER
    );

    private final List<InstitutionProfile> profiles;

    public ProfileRegistry() {
        this(List.of(
                new HdfcInstitutionProfile(),
                new IciciInstitutionProfile(),
                new SbiInstitutionProfile(),
                new AxisInstitutionProfile(),
                new AmericanExpressInstitutionProfile()
        ));
    }

    ProfileRegistry(List<InstitutionProfile> profiles) {
        if (profiles == null || profiles.isEmpty()) {
            throw new IllegalArgumentException("No institution profiles are configured.");
        }
        Set<String> seen = new HashSet<>();
        for (InstitutionProfile profile : profiles) {
            if (profile == null) {
                throw new IllegalArgumentException("Institution profile must not be null");
            }
            if (!seen.add(profile.issuerName())) {
                throw new IllegalArgumentException("Duplicate institution profile: " + profile.issuerName());
            }
        }
        this.profiles = List.copyOf(profiles);
    }

    public List<InstitutionProfile> getProfiles() {
        return profiles;
    }

    public List<String> supportedIssuers() {
        List<String> names = new ArrayList<>(profiles.size());
        for (InstitutionProfile profile : profiles) {
            names.add(profile.issuerName());
        }
        return List.copyOf(names);
    }
}
