package com.metascan.explorer.controller;

import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.exception.ResourceNotFoundException;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.service.RuntimeService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runtime metadata endpoints.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RuntimeController {

    private final RuntimeService runtimeService;
    private final ResponseRenderer renderer;
    private final ExplorerProperties properties;

    @GetMapping("/runtime")
    public ResponseEntity<String> listRuntimes(HttpServletRequest http,
                                               @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "runtime", () -> runtimeService.listRuntimes(request(params)));
    }

    @GetMapping("/runtime/{specVersion}")
    public ResponseEntity<String> getRuntime(HttpServletRequest http,
                                             @PathVariable String specVersion,
                                             @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "runtime", () -> runtimeService.getRuntime(specVersion, request(params))
                .orElseThrow(() -> new ResourceNotFoundException("runtime", specVersion)));
    }

    @GetMapping("/runtime-call")
    public ResponseEntity<String> listCalls(HttpServletRequest http,
                                            @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "runtime-call", () -> runtimeService.listCalls(request(params)));
    }

    @GetMapping("/runtime-call/{id}")
    public ResponseEntity<String> getCall(HttpServletRequest http,
                                          @PathVariable String id,
                                          @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "runtime-call", () -> runtimeService.getCall(id, request(params))
                .orElseThrow(() -> new ResourceNotFoundException("runtime call", id)));
    }

    @GetMapping("/runtime-event")
    public ResponseEntity<String> listEvents(HttpServletRequest http,
                                             @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "runtime-event", () -> runtimeService.listEvents(request(params)));
    }

    @GetMapping("/runtime-event/{id}")
    public ResponseEntity<String> getEvent(HttpServletRequest http,
                                           @PathVariable String id,
                                           @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "runtime-event", () -> runtimeService.getEvent(id, request(params))
                .orElseThrow(() -> new ResourceNotFoundException("runtime event", id)));
    }

    @GetMapping("/runtime-type")
    public ResponseEntity<String> listTypes(HttpServletRequest http,
                                            @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "runtime-type", () -> runtimeService.listTypes(request(params)));
    }

    @GetMapping("/runtime-module")
    public ResponseEntity<String> listModules(HttpServletRequest http,
                                              @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "runtime-module", () -> runtimeService.listModules(request(params)));
    }

    @GetMapping("/runtime-module/{id}")
    public ResponseEntity<String> getModule(HttpServletRequest http,
                                            @PathVariable String id,
                                            @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "runtime-module", () -> runtimeService.getModule(id, request(params))
                .orElseThrow(() -> new ResourceNotFoundException("runtime module", id)));
    }

    @GetMapping("/runtime-storage/{id}")
    public ResponseEntity<String> getStorage(HttpServletRequest http, @PathVariable String id) {
        return renderer.render(http, "runtime-storage", () -> runtimeService.getStorage(id)
                .orElseThrow(() -> new ResourceNotFoundException("runtime storage", id)));
    }

    @GetMapping("/runtime-constant")
    public ResponseEntity<String> listConstants(HttpServletRequest http,
                                                @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "runtime-constant", () -> runtimeService.listConstants(request(params)));
    }

    @GetMapping("/runtime-constant/{id}")
    public ResponseEntity<String> getConstant(HttpServletRequest http, @PathVariable String id) {
        return renderer.render(http, "runtime-constant", () -> runtimeService.getConstant(id)
                .orElseThrow(() -> new ResourceNotFoundException("runtime constant", id)));
    }

    private ResourceRequest request(MultiValueMap<String, String> params) {
        return ResourceRequest.of(params, properties.getPaging());
    }
}
