package com.metascan.explorer.controller;

import com.metascan.explorer.service.StatsService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Currency and network statistics. These always answer 200, falling back to a sentinel document.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class StatsController {

    private final StatsService statsService;
    private final ResponseRenderer renderer;

    @GetMapping({"/stats", "/stats/{currencyId}"})
    public ResponseEntity<String> currencyStats(HttpServletRequest http,
                                                @PathVariable(required = false) String currencyId) {
        String id = currencyId == null ? statsService.defaultCurrencyId() : currencyId;
        return renderer.render(http, "stats", () -> statsService.currencyStats(id));
    }

    @GetMapping({"/networkstats", "/networkstats/{currencyId}"})
    public ResponseEntity<String> networkStats(HttpServletRequest http,
                                               @PathVariable(required = false) String currencyId) {
        String id = currencyId == null ? statsService.defaultCurrencyId() : currencyId;
        return renderer.render(http, "network-stats", () -> statsService.networkStats(id));
    }

    @GetMapping("/metamui-stats/{field}")
    public ResponseEntity<String> defaultCurrencyField(HttpServletRequest http, @PathVariable String field) {
        return renderer.render(http, "metamui-stats", () -> statsService.defaultCurrencyField(field));
    }
}
