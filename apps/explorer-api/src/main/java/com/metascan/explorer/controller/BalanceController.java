package com.metascan.explorer.controller;

import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.exception.ResourceNotFoundException;
import com.metascan.explorer.modules.identity.Identity;
import com.metascan.explorer.modules.identity.IdentityGate;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.service.BalanceTransferService;
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
 * Balance transfers, transfer history and top holders.
 */
@RestController
@RequestMapping("/api/v1/balances")
@RequiredArgsConstructor
public class BalanceController {

    private final BalanceTransferService transferService;
    private final IdentityGate identityGate;
    private final ResponseRenderer renderer;
    private final ExplorerProperties properties;

    @GetMapping("/transfer")
    public ResponseEntity<String> listTransfers(HttpServletRequest http,
                                                @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "balance-transfer",
                () -> transferService.listTransfers(ResourceRequest.of(params, properties.getPaging())));
    }

    @GetMapping("/transfer/history")
    public ResponseEntity<String> listHistory(HttpServletRequest http,
                                              @RequestParam MultiValueMap<String, String> params) {
        return renderer.render(http, "balance-transfer-history",
                () -> transferService.listHistory(ResourceRequest.of(params, properties.getPaging())));
    }

    @GetMapping("/transfer/history/{did}")
    public ResponseEntity<String> historyByDid(@PathVariable String did,
                                               @RequestHeader(value = "Authorization", required = false) String authorization) {
        Identity viewer = identityGate.resolve(authorization);
        return renderer.uncached(() -> transferService.historyByDid(did, viewer));
    }

    @GetMapping("/transfer/{id}")
    public ResponseEntity<String> getTransfer(@PathVariable String id,
                                              @RequestHeader(value = "Authorization", required = false) String authorization) {
        Identity viewer = identityGate.resolve(authorization);
        return renderer.uncached(() -> transferService.getTransfer(id, viewer)
                .orElseThrow(() -> new ResourceNotFoundException("balancetransfer", id)));
    }

    @GetMapping("/top-holders")
    public ResponseEntity<String> topHolders(HttpServletRequest http) {
        return renderer.render(http, "top-holders", transferService::topHolders);
    }
}
