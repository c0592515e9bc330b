package com.nipt.orchestrator.api;

import com.nipt.orchestrator.api.dto.PackageResponse;
import com.nipt.orchestrator.plugin.PackageCatalog;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.stream.IntStream;

/**
 * REST API over the installed pipeline packages.
 *
 * GET /packages                - installed packages with their indices
 * GET /packages/{index}/howto  - documentation of one package
 */
@RestController
@RequestMapping("/packages")
public class PackageController {

    private final PackageCatalog catalog;

    public PackageController(PackageCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public List<PackageResponse> list() {
        return IntStream.range(0, catalog.size())
                .mapToObj(i -> PackageResponse.from(i, catalog.get(i).orElseThrow().manifest()))
                .toList();
    }

    @GetMapping(value = "/{index}/howto", produces = MediaType.TEXT_PLAIN_VALUE)
    public String howto(@PathVariable int index) {
        return catalog.get(index)
                .map(p -> p.manifest().description())
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No installed pipeline package at index " + index));
    }
}
