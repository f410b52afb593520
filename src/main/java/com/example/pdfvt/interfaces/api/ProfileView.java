package com.example.pdfvt.interfaces.api;

import com.example.pdfvt.domain.model.VersionProfile;
import com.example.pdfvt.domain.model.VtVariant;

import java.util.List;

/**
 * Read-only projection of a {@link VersionProfile} for API clients.
 */
public record ProfileView(
        VtVariant variant,
        String marker,
        String pdfVersion,
        String versionRequirement,
        String baseStandard,
        List<String> features
) {
    static ProfileView from(VersionProfile profile) {
        return new ProfileView(
                profile.variant(),
                profile.marker(),
                profile.targetPdfVersion(),
                profile.pdfVersionRule().describe(),
                profile.baseStandardName(),
                profile.featureDescriptions()
        );
    }
}
