package com.nipt.orchestrator.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Installed pipeline packages, addressed by index.
 *
 * <p>Every {@link PipelinePackage} bean is collected at startup. Packages are
 * ordered by title and numbered from 0, so the index-to-title mapping is
 * contiguous and stays the same for the lifetime of the catalog. Two packages
 * with the same title are rejected.
 */
@Component
public class PackageCatalog {

    private static final Logger log = LoggerFactory.getLogger(PackageCatalog.class);

    private final List<PipelinePackage> packages;

    @Autowired
    public PackageCatalog(ObjectProvider<PipelinePackage> packages) {
        this(packages.orderedStream().toList());
    }

    public PackageCatalog(List<PipelinePackage> discovered) {
        List<PipelinePackage> sorted = discovered.stream()
                .sorted(Comparator.comparing(p -> p.manifest().title()))
                .toList();
        for (int i = 1; i < sorted.size(); i++) {
            String title = sorted.get(i).manifest().title();
            if (title.equals(sorted.get(i - 1).manifest().title())) {
                throw new IllegalStateException("Two pipeline packages share the title '" + title + "'");
            }
        }
        this.packages = sorted;

        if (packages.isEmpty()) {
            log.warn("No pipeline packages installed");
        }
        for (int i = 0; i < packages.size(); i++) {
            PackageManifest m = packages.get(i).manifest();
            log.info("Installed pipeline package {} : '{}' v{}", i, m.title(), m.version());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /** Titles keyed by index. */
    public SortedMap<Integer, String> installed() {
        SortedMap<Integer, String> titles = new TreeMap<>();
        for (int i = 0; i < packages.size(); i++) {
            titles.put(i, packages.get(i).manifest().title());
        }
        return Collections.unmodifiableSortedMap(titles);
    }

    public Optional<PipelinePackage> get(int index) {
        return index >= 0 && index < packages.size()
                ? Optional.of(packages.get(index))
                : Optional.empty();
    }

    public Optional<PipelinePackage> find(String title) {
        return packages.stream()
                .filter(p -> p.manifest().title().equals(title))
                .findFirst();
    }

    public int size() { return packages.size(); }
}
