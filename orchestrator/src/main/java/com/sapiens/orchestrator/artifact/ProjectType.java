package com.sapiens.orchestrator.artifact;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/** What kind of real-world outcome a proposed project produces. */
public enum ProjectType {
    RESEARCH,    // published paper
    PRODUCT,     // live product with users
    CAMPAIGN,    // executed campaign with measured results
    STARTUP,     // small venture with attempted monetization
    MARKETING;   // professional report sent to stakeholders

    /** Lenient parse of model output; anything unrecognised becomes PRODUCT. */
    @JsonCreator
    public static ProjectType from(String value) {
        if (value != null) {
            String v = value.strip().toUpperCase(Locale.ROOT);
            for (ProjectType t : values()) {
                if (v.contains(t.name())) {
                    return t;
                }
            }
        }
        return PRODUCT;
    }
}
