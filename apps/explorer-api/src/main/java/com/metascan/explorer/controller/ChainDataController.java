package com.metascan.explorer.controller;

import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.exception.ResourceNotFoundException;
import com.metascan.explorer.modules.identity.Identity;
import com.metascan.explorer.modules.identity.IdentityGate;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.service.BlockService;
import com.metascan.explorer.service.EventService;
import com.metascan.explorer.service.ExtrinsicService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Blocks, extrinsics, events and logs.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ChainDataController {

    private final BlockService blockService;
    private final ExtrinsicService extrinsicService;
    private final EventService eventService;
    private final IdentityGate identityGate;
    private final ResponseRenderer renderer;
    private final ExplorerProperties properties;

    @GetMapping("/block")
    public ResponseEntity<String> listBlocks(HttpServletRequest http,
                                             @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "block", () -> blockService.listBlocks(request(params)));
    }

    @GetMapping("/block/{id}")
    public ResponseEntity<String> getBlock(HttpServletRequest http,
                                           @PathVariable String id,
                                           @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "block", () -> blockService.getBlock(id, request(params))
                .orElseThrow(() -> new ResourceNotFoundException("block", id)));
    }

    @GetMapping("/block-total")
    public ResponseEntity<String> listBlockTotals(HttpServletRequest http,
                                                  @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "block-total", () -> blockService.listBlockTotals(request(params)));
    }

    @GetMapping("/block-total/{id}")
    public ResponseEntity<String> getBlockTotal(HttpServletRequest http, @PathVariable String id) {
        return renderer.render(http, "block-total", () -> blockService.getBlockTotal(id)
                .orElseThrow(() -> new ResourceNotFoundException("block-total", id)));
    }

    @GetMapping("/extrinsic")
    public ResponseEntity<String> listExtrinsics(HttpServletRequest http,
                                                 @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "extrinsic", () -> extrinsicService.listExtrinsics(request(params)));
    }

    @GetMapping("/extrinsic/{id}")
    public ResponseEntity<String> getExtrinsic(@PathVariable String id,
                                               @RequestParam MultiValueMap<String, String> params,
                                               @RequestHeader(value = "Authorization", required = false) String authorization) {
        Identity viewer = identityGate.resolve(authorization);
        return renderer.uncached(() -> extrinsicService.getExtrinsic(id, request(params), viewer)
                .orElseThrow(() -> new ResourceNotFoundException("extrinsic", id)));
    }

    @GetMapping("/event")
    public ResponseEntity<String> listEvents(HttpServletRequest http,
                                             @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "event", () -> eventService.listEvents(request(params)));
    }

    @GetMapping("/event/{id}")
    public ResponseEntity<String> getEvent(@PathVariable String id,
                                           @RequestHeader(value = "Authorization", required = false) String authorization) {
        Identity viewer = identityGate.resolve(authorization);
        return renderer.uncached(() -> eventService.getEvent(id, viewer)
                .orElseThrow(() -> new ResourceNotFoundException("event", id)));
    }

    @GetMapping("/log")
    public ResponseEntity<String> listLogs(HttpServletRequest http,
                                           @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "log", () -> eventService.listLogs(request(params)));
    }

    @GetMapping("/log/{id}")
    public ResponseEntity<String> getLog(HttpServletRequest http, @PathVariable String id) {
        return renderer.render(http, "log", () -> eventService.getLog(id)
                .orElseThrow(() -> new ResourceNotFoundException("log", id)));
    }

    private ResourceRequest request(MultiValueMap<String, String> params) {
        return ResourceRequest.of(params, properties.getPaging());
    }
}
