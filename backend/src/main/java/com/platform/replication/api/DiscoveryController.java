package com.platform.replication.api;

import com.platform.replication.discovery.DiscoveryResult;
import com.platform.replication.discovery.DiscoveryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for backend discovery.
 */
@RestController
@RequestMapping("/api/discovery")
public class DiscoveryController {

    private final DiscoveryService discoveryService;

    public DiscoveryController(DiscoveryService discoveryService) {
        this.discoveryService = discoveryService;
    }

    @GetMapping
    public DiscoveryResult getDiscovery() {
        return discoveryService.discover();
    }

    @PostMapping("/refresh")
    public DiscoveryResult refresh() {
        return discoveryService.refresh();
    }
}
