package com.nipt.orchestrator.api.dto;

import com.nipt.orchestrator.plugin.PackageManifest;

/**
 * One installed package as listed by GET /packages.
 */
public record PackageResponse(int index, String title, String version) {

    public static PackageResponse from(int index, PackageManifest manifest) {
        return new PackageResponse(index, manifest.title(), manifest.version());
    }
}
