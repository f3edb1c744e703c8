package com.metascan.explorer.controller;

import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.exception.ResourceNotFoundException;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.service.ContractService;
import com.metascan.explorer.service.SessionService;
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
 * Sessions with their validators and nominators, and deployed contracts.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;
    private final ContractService contractService;
    private final ResponseRenderer renderer;
    private final ExplorerProperties properties;

    @GetMapping("/session/session")
    public ResponseEntity<String> listSessions(HttpServletRequest http,
                                               @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "session", () -> sessionService.listSessions(request(params)));
    }

    @GetMapping("/session/session/{id}")
    public ResponseEntity<String> getSession(HttpServletRequest http,
                                             @PathVariable String id,
                                             @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "session", () -> sessionService.getSession(id, request(params))
                .orElseThrow(() -> new ResourceNotFoundException("session", id)));
    }

    @GetMapping("/session/validator")
    public ResponseEntity<String> listValidators(HttpServletRequest http,
                                                 @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "session-validator", () -> sessionService.listValidators(request(params)));
    }

    @GetMapping("/session/validator/{id}")
    public ResponseEntity<String> getValidator(HttpServletRequest http,
                                               @PathVariable String id,
                                               @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "session-validator", () -> sessionService.getValidator(id, request(params))
                .orElseThrow(() -> new ResourceNotFoundException("validator", id)));
    }

    @GetMapping("/session/nominator")
    public ResponseEntity<String> listNominators(HttpServletRequest http,
                                                 @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "session-nominator", () -> sessionService.listNominators(request(params)));
    }

    @GetMapping("/contract/contract")
    public ResponseEntity<String> listContracts(HttpServletRequest http,
                                                @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "contract", () -> contractService.listContracts(request(params)));
    }

    @GetMapping("/contract/contract/{codeHash}")
    public ResponseEntity<String> getContract(HttpServletRequest http, @PathVariable String codeHash) {
        return renderer.render(http, "contract", () -> contractService.getContract(codeHash)
                .orElseThrow(() -> new ResourceNotFoundException("contract", codeHash)));
    }

    private ResourceRequest request(MultiValueMap<String, String> params) {
        return ResourceRequest.of(params, properties.getPaging());
    }
}
