package com.metascan.explorer.controller;

import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.exception.ResourceNotFoundException;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.service.AccountService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/account")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final ResponseRenderer renderer;
    private final ExplorerProperties properties;

    @GetMapping
    public ResponseEntity<String> listAccounts(HttpServletRequest http,
                                               @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "account", () -> accountService.listAccounts(request(params)));
    }

    @GetMapping("/index")
    public ResponseEntity<String> listIndices(HttpServletRequest http,
                                              @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "account-index", () -> accountService.listIndices(request(params)));
    }

    @GetMapping("/index/{shortAddress}")
    public ResponseEntity<String> getIndex(HttpServletRequest http,
                                           @PathVariable String shortAddress,
                                           @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "account-index", () -> accountService.getIndex(shortAddress, request(params))
                .orElseThrow(() -> new ResourceNotFoundException("account index", shortAddress)));
    }

    @GetMapping("/{address}")
    public ResponseEntity<String> getAccount(HttpServletRequest http,
                                             @PathVariable String address,
                                             @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "account-detail", () -> accountService.getAccount(address, request(params))
                .orElseThrow(() -> new ResourceNotFoundException("account", address)));
    }

    private ResourceRequest request(MultiValueMap<String, String> params) {
        return ResourceRequest.of(params, properties.getPaging());
    }
}
