package com.metascan.explorer.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.modules.cache.LocalResponseCache;
import com.metascan.explorer.modules.identity.Identity;
import com.metascan.explorer.modules.identity.IdentityGate;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.privacy.PrivacyMask;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.search.SearchIndexResolver;
import com.metascan.explorer.modules.transfer.TransferNormalizer;
import com.metascan.explorer.repository.AccountInfoSnapshotRepository;
import com.metascan.explorer.repository.BlockRepository;
import com.metascan.explorer.repository.EventRepository;
import com.metascan.explorer.service.BalanceTransferService;
import com.metascan.explorer.service.EventService;
import com.metascan.explorer.service.RuntimeService;
import com.metascan.explorer.service.StatsService;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ResponseCachingControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonApiSerializer serializer = new JsonApiSerializer(objectMapper);
    private final StatsService statsService = mock(StatsService.class);
    private final RuntimeService runtimeService = mock(RuntimeService.class);
    private final BalanceTransferService transferService = mock(BalanceTransferService.class);
    private final IdentityGate identityGate = mock(IdentityGate.class);

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ExplorerProperties properties = new ExplorerProperties(null, null,
                new ExplorerProperties.Cache(ExplorerProperties.CacheType.LOCAL, "explorer:test",
                        Map.of("stats", Duration.ofSeconds(6), "runtime", Duration.ofSeconds(60))),
                null, null, null, null, null);
        ResponseRenderer renderer = new ResponseRenderer(
                new LocalResponseCache("explorer:test", 100), serializer, properties);
        mockMvc = MockMvcBuilders
                .standaloneSetup(
                        new StatsController(statsService, renderer),
                        new RuntimeController(runtimeService, renderer, properties),
                        new BalanceController(transferService, identityGate, renderer, properties))
                .setControllerAdvice(new ExplorerExceptionHandler(objectMapper))
                .build();
    }

    @Test
    void secondIdenticalRequestIsServedFromCache() throws Exception {
        when(statsService.currencyStats("metamui")).thenReturn(serializer.document(
                serializer.resource("currency_stats", "metamui", serializer.objectNode().put("currency_id", "metamui"))));

        mockMvc.perform(get("/api/v1/stats/metamui"))
                .andExpect(status().isOk())
                .andExpect(header().string(ResponseRenderer.CACHE_HEADER, "MISS"))
                .andExpect(jsonPath("$.data.attributes.currency_id").value("metamui"));
        mockMvc.perform(get("/api/v1/stats/metamui"))
                .andExpect(status().isOk())
                .andExpect(header().string(ResponseRenderer.CACHE_HEADER, "HIT"))
                .andExpect(jsonPath("$.data.id").value("metamui"));

        verify(statsService, times(1)).currencyStats("metamui");
    }

    @Test
    void statsWithoutCurrencyUsesDefault() throws Exception {
        when(statsService.defaultCurrencyId()).thenReturn("metamui");
        when(statsService.currencyStats("metamui")).thenReturn(serializer.document(serializer.objectNode()));

        mockMvc.perform(get("/api/v1/stats"))
                .andExpect(status().isOk());

        verify(statsService).currencyStats("metamui");
    }

    @Test
    void notFoundIsNotCached() throws Exception {
        when(runtimeService.getRuntime(eq("42"), any())).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/runtime/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.data").value(nullValue()))
                .andExpect(jsonPath("$.errors[0].status").value("404"));
        mockMvc.perform(get("/api/v1/runtime/42"))
                .andExpect(status().isNotFound());

        verify(runtimeService, times(2)).getRuntime(eq("42"), any());
    }

    @Test
    void identityDependentResponsesCarryNoCacheHeader() throws Exception {
        when(identityGate.resolve(anyString())).thenReturn(Identity.authenticated("did:ssid:alice"));
        when(transferService.getTransfer(eq("12-3"), any())).thenReturn(Optional.of(serializer.document(
                serializer.resource("balancetransfer", "12-3", serializer.objectNode()))));

        mockMvc.perform(get("/api/v1/balances/transfer/12-3").header("Authorization", "Bearer token"))
                .andExpect(status().isOk())
                .andExpect(header().doesNotExist(ResponseRenderer.CACHE_HEADER))
                .andExpect(jsonPath("$.data.id").value("12-3"));

        verify(transferService).getTransfer("12-3", Identity.authenticated("did:ssid:alice"));
    }

    @Test
    void blankDidHistoryIsBadRequestWithEmptyData() throws Exception {
        ExplorerProperties properties = ExplorerProperties.defaults();
        EventRepository eventRepository = mock(EventRepository.class);
        BalanceTransferService realTransferService = new BalanceTransferService(
                eventRepository,
                mock(BlockRepository.class),
                mock(AccountInfoSnapshotRepository.class),
                new TransferNormalizer(new PrivacyMask(properties)),
                new QueryResolver(mock(SearchIndexResolver.class), OpenTelemetry.noop().getTracer("test")),
                serializer,
                mock(EventService.class),
                properties);
        when(identityGate.resolve(any())).thenReturn(Identity.anonymous());
        MockMvc historyMvc = MockMvcBuilders
                .standaloneSetup(new BalanceController(realTransferService, identityGate,
                        new ResponseRenderer(new LocalResponseCache("explorer:test", 100), serializer, properties),
                        properties))
                .setControllerAdvice(new ExplorerExceptionHandler(objectMapper))
                .build();

        historyMvc.perform(get("/api/v1/balances/transfer/history/{did}", " "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data").isArray())
                .andExpect(jsonPath("$.data").isEmpty())
                .andExpect(jsonPath("$.errors[0].status").value("400"));

        verify(eventRepository, never()).findAllTransfersMentioning(anyString());
    }
}
