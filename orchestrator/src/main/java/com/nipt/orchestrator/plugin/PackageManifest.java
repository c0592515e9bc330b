package com.nipt.orchestrator.plugin;

/**
 * Identity and documentation of an installed pipeline package.
 *
 * @param title       unique package title, also the label its output is stored under (e.g. "T1proc")
 * @param version     package version, informational
 * @param description help text returned by {@code howto}
 */
public record PackageManifest(String title, String version, String description) {

    public PackageManifest {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Package title must not be blank");
        }
        if (version == null) version = "";
        if (description == null) description = "";
    }
}
