package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.entity.Account;
import com.metascan.explorer.entity.AccountIndex;
import com.metascan.explorer.entity.AccountInfoSnapshot;
import com.metascan.explorer.modules.chain.ChainAccountBalance;
import com.metascan.explorer.modules.chain.ChainRpcClient;
import com.metascan.explorer.modules.chain.UpstreamUnavailableException;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.query.FilterParams;
import com.metascan.explorer.modules.query.ListQuery;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.modules.query.Specs;
import com.metascan.explorer.repository.AccountIndexRepository;
import com.metascan.explorer.repository.AccountInfoSnapshotRepository;
import com.metascan.explorer.repository.AccountRepository;
import com.metascan.explorer.repository.ExtrinsicRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Accounts, their indices and balance history.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class AccountService {

    private static final int BALANCE_HISTORY_LIMIT = 1000;

    private static final Map<String, String> ROLE_FILTERS = Map.ofEntries(
            Map.entry("is_validator", "isValidator"),
            Map.entry("is_nominator", "isNominator"),
            Map.entry("is_council_member", "isCouncilMember"),
            Map.entry("is_registrar", "isRegistrar"),
            Map.entry("is_sudo", "isSudo"),
            Map.entry("is_tech_comm_member", "isTechCommMember"),
            Map.entry("is_treasury", "isTreasury"),
            Map.entry("was_validator", "wasValidator"),
            Map.entry("was_nominator", "wasNominator"),
            Map.entry("was_council_member", "wasCouncilMember"),
            Map.entry("was_registrar", "wasRegistrar"),
            Map.entry("was_sudo", "wasSudo"),
            Map.entry("was_tech_comm_member", "wasTechCommMember"));

    private final AccountRepository accountRepository;
    private final AccountIndexRepository accountIndexRepository;
    private final AccountInfoSnapshotRepository snapshotRepository;
    private final ExtrinsicRepository extrinsicRepository;
    private final ChainRpcClient chainRpcClient;
    private final QueryResolver queryResolver;
    private final JsonApiSerializer serializer;
    private final int tokenDecimals;

    public AccountService(AccountRepository accountRepository,
                          AccountIndexRepository accountIndexRepository,
                          AccountInfoSnapshotRepository snapshotRepository,
                          ExtrinsicRepository extrinsicRepository,
                          ChainRpcClient chainRpcClient,
                          QueryResolver queryResolver,
                          JsonApiSerializer serializer,
                          ExplorerProperties properties) {
        this.accountRepository = accountRepository;
        this.accountIndexRepository = accountIndexRepository;
        this.snapshotRepository = snapshotRepository;
        this.extrinsicRepository = extrinsicRepository;
        this.chainRpcClient = chainRpcClient;
        this.queryResolver = queryResolver;
        this.serializer = serializer;
        this.tokenDecimals = properties.getCurrency().getTokenDecimals();
    }

    public ObjectNode listAccounts(ResourceRequest request) {
        ListQuery<Account> query = ListQuery.<Account>builder()
                .resource("account")
                .executor(accountRepository)
                .sort(Sort.by(Sort.Direction.DESC, "balanceTotal"))
                .filters(AccountService::accountFilters)
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public Optional<ObjectNode> getAccount(String address, ResourceRequest request) {
        return queryResolver.getItem("account", address, () -> findByAddress(address))
                .map(account -> serializer.document(renderDetail(account, request)));
    }

    public ObjectNode listIndices(ResourceRequest request) {
        ListQuery<AccountIndex> query = ListQuery.<AccountIndex>builder()
                .resource("indices")
                .executor(accountIndexRepository)
                .sort(Sort.by(Sort.Direction.DESC, "updatedAtBlock"))
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public Optional<ObjectNode> getIndex(String shortAddress, ResourceRequest request) {
        return queryResolver.getItem("indices", shortAddress,
                        () -> accountIndexRepository.findFirstByShortAddress(shortAddress))
                .map(index -> {
                    ObjectNode resource = serializer.resource(index);
                    Optional<Account> account = Optional.ofNullable(index.getAccountId())
                            .flatMap(accountRepository::findById);
                    account.ifPresent(a -> attributes(resource).set("account", serializer.resource(a)));
                    if (request.includes("recent_extrinsics")) {
                        serializer.withRelatedRecords(resource, "recent_extrinsics", account
                                .map(a -> extrinsicRepository.findTop10ByAddressOrderByBlockIdDesc(a.getAddress()))
                                .orElse(List.of()));
                    }
                    return serializer.document(resource);
                });
    }

    /**
     * Account whose DID address or index address equals {@code address}.
     */
    public Optional<Account> findByAddress(String address) {
        if (address == null || address.isEmpty()) {
            return Optional.empty();
        }
        return accountRepository.findFirstByAddressOrIndexAddress(address, address);
    }

    public Map<String, Account> findByAddresses(Collection<String> addresses) {
        if (addresses.isEmpty()) {
            return Map.of();
        }
        return accountRepository.findByAddressIn(addresses).stream()
                .collect(Collectors.toMap(Account::getAddress, Function.identity(), (a, b) -> a));
    }

    private ObjectNode renderDetail(Account account, ResourceRequest request) {
        ObjectNode resource = serializer.resource(account);
        ObjectNode attributes = attributes(resource);
        attributes.set("balance_history", balanceHistory(account));

        try {
            Optional<ChainAccountBalance> balance = chainRpcClient.fetchAccountBalance(account.getId());
            balance.ifPresent(b -> {
                attributes.set("balance_free", serializer.tree(b.getFree()));
                attributes.set("balance_reserved", serializer.tree(b.getReserved()));
                attributes.set("misc_frozen_balance", serializer.tree(b.getMiscFrozen()));
                attributes.set("fee_frozen_balance", serializer.tree(b.getFeeFrozen()));
                attributes.set("nonce", serializer.tree(b.getNonce()));
            });
        } catch (UpstreamUnavailableException e) {
            log.warn("Live balance unavailable for account {}: {}", account.getId(), e.getMessage());
        }

        if (request.includes("recent_extrinsics")) {
            serializer.withRelatedRecords(resource, "recent_extrinsics",
                    extrinsicRepository.findTop10ByAddressOrderByBlockIdDesc(account.getAddress()));
        }
        if (request.includes("indices")) {
            serializer.withRelatedRecords(resource, "indices",
                    accountIndexRepository.findByAccountIdOrderByUpdatedAtBlockDesc(account.getId()));
        }
        return resource;
    }

    /**
     * One line series of total balance per snapshot, oldest first, in whole tokens.
     */
    private ArrayNode balanceHistory(Account account) {
        List<AccountInfoSnapshot> snapshots =
                snapshotRepository.findTop1000ByAccountIdOrderByBlockIdDesc(account.getId());
        ArrayNode history = serializer.arrayNode();
        ObjectNode series = history.addObject();
        series.put("name", "Total balance");
        series.put("type", "line");
        ArrayNode data = series.putArray("data");
        for (int i = Math.min(snapshots.size(), BALANCE_HISTORY_LIMIT) - 1; i >= 0; i--) {
            AccountInfoSnapshot snapshot = snapshots.get(i);
            BigDecimal total = snapshot.getBalanceTotal() == null ? BigDecimal.ZERO : snapshot.getBalanceTotal();
            ArrayNode point = data.addArray();
            point.add(snapshot.getBlockId());
            point.add(total.movePointLeft(tokenDecimals).doubleValue());
        }
        return history;
    }

    private static Specification<Account> accountFilters(FilterParams filters) {
        Specification<Account> spec = Specs.all();
        for (Map.Entry<String, String> role : ROLE_FILTERS.entrySet()) {
            if (filters.has(role.getKey())) {
                spec = spec.and(Specs.isTrue(role.getValue()));
            }
        }
        if (filters.has("has_identity")) {
            spec = spec.and(Specs.<Account>isTrue("hasIdentity")).and(Specs.equal("identityJudgementBad", 0));
        }
        if (filters.has("has_subidentity")) {
            spec = spec.and(Specs.<Account>isTrue("hasSubidentity")).and(Specs.equal("identityJudgementBad", 0));
        }
        if (filters.has("identity_judgement_good")) {
            spec = spec.and(Specs.<Account>atLeast("identityJudgementGood", 1))
                    .and(Specs.equal("identityJudgementBad", 0));
        }
        if (filters.has("blacklist")) {
            spec = spec.and(Specs.atLeast("identityJudgementBad", 1));
        }
        return spec;
    }

    private static ObjectNode attributes(ObjectNode resource) {
        return (ObjectNode) resource.get("attributes");
    }
}
