package com.metascan.explorer.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Settings bound once at startup from the {@code explorer.*} namespace.
 *
 * <p>All sections are immutable after binding and are handed to components through
 * constructor injection.</p>
 */
@Getter
@ConfigurationProperties(prefix = "explorer")
public class ExplorerProperties {

    private final Privacy privacy;
    private final Auth auth;
    private final Cache cache;
    private final SearchIndex searchIndex;
    private final Paging paging;
    private final Currency currency;
    private final Params params;
    private final Rpc rpc;

    public ExplorerProperties(Privacy privacy,
                              Auth auth,
                              Cache cache,
                              SearchIndex searchIndex,
                              Paging paging,
                              Currency currency,
                              Params params,
                              Rpc rpc) {
        this.privacy = privacy != null ? privacy : new Privacy(12, 32, '*');
        this.auth = auth != null ? auth : new Auth(List.of(), List.of());
        this.cache = cache != null ? cache : new Cache(CacheType.REDIS, "explorer:v1", Map.of());
        this.searchIndex = searchIndex != null ? searchIndex : new SearchIndex(1, 2, 3, 4);
        this.paging = paging != null ? paging : new Paging(25, 100);
        this.currency = currency != null ? currency : Currency.defaults();
        this.params = params != null ? params : new Params(200_000);
        this.rpc = rpc != null ? rpc : new Rpc(false, null, "did_accountInfo", Duration.ofSeconds(5));
    }

    public static ExplorerProperties defaults() {
        return new ExplorerProperties(null, null, null, null, null, null, null, null);
    }

    @Getter
    public static class Privacy {
        /**
         * Number of leading DID characters left visible.
         */
        private final int maskLength;
        /**
         * Width every masked DID is padded to.
         */
        private final int displayLength;
        private final char maskChar;

        public Privacy(@DefaultValue("12") int maskLength,
                       @DefaultValue("32") int displayLength,
                       @DefaultValue("*") char maskChar) {
            if (maskLength < 0 || displayLength < maskLength) {
                throw new IllegalArgumentException(
                        "explorer.privacy requires 0 <= mask-length <= display-length");
            }
            this.maskLength = maskLength;
            this.displayLength = displayLength;
            this.maskChar = maskChar;
        }
    }

    @Getter
    public static class Auth {
        private final List<String> trustedIssuers;
        /**
         * HS256 shared secrets; a token is accepted when any one of them verifies it.
         */
        private final List<String> trustedKeys;

        public Auth(List<String> trustedIssuers, List<String> trustedKeys) {
            this.trustedIssuers = trustedIssuers == null ? List.of() : List.copyOf(trustedIssuers);
            this.trustedKeys = trustedKeys == null ? List.of() : List.copyOf(trustedKeys);
        }
    }

    public enum CacheType {
        REDIS,
        LOCAL
    }

    @Getter
    public static class Cache {
        private final CacheType type;
        private final String keyPrefix;
        /**
         * Per-resource TTL. A resource without an entry is not cached.
         */
        private final Map<String, Duration> ttl;

        public Cache(@DefaultValue("redis") CacheType type,
                     @DefaultValue("explorer:v1") String keyPrefix,
                     Map<String, Duration> ttl) {
            this.type = type;
            this.keyPrefix = keyPrefix;
            this.ttl = ttl == null ? Map.of() : Map.copyOf(ttl);
        }

        public Optional<Duration> ttlFor(String resource) {
            return Optional.ofNullable(ttl.get(resource));
        }
    }

    @Getter
    public static class SearchIndex {
        private final int balanceTransfer;
        private final int claimsClaimed;
        private final int balancesDeposit;
        private final int stakingReward;

        public SearchIndex(@DefaultValue("1") int balanceTransfer,
                           @DefaultValue("2") int claimsClaimed,
                           @DefaultValue("3") int balancesDeposit,
                           @DefaultValue("4") int stakingReward) {
            this.balanceTransfer = balanceTransfer;
            this.claimsClaimed = claimsClaimed;
            this.balancesDeposit = balancesDeposit;
            this.stakingReward = stakingReward;
        }

        public List<Integer> transferCategories() {
            return List.of(balanceTransfer, claimsClaimed, balancesDeposit, stakingReward);
        }
    }

    @Getter
    public static class Paging {
        private final int defaultSize;
        private final int maxSize;

        public Paging(@DefaultValue("25") int defaultSize, @DefaultValue("100") int maxSize) {
            this.defaultSize = defaultSize;
            this.maxSize = maxSize;
        }
    }

    @Getter
    public static class Currency {
        private final String defaultId;
        private final BigDecimal totalSupply;
        /**
         * Decimal places of the scaled balances in the top holder report.
         */
        private final int displayDecimals;
        /**
         * Decimal places of the chain's native token, used for balance history.
         */
        private final int tokenDecimals;
        private final String holderDidPrefix;
        private final int topHoldersLimit;

        public Currency(@DefaultValue("metamui") String defaultId,
                        @DefaultValue("1000000000") BigDecimal totalSupply,
                        @DefaultValue("6") int displayDecimals,
                        @DefaultValue("6") int tokenDecimals,
                        @DefaultValue("did:ssid:") String holderDidPrefix,
                        @DefaultValue("100") int topHoldersLimit) {
            this.defaultId = defaultId;
            this.totalSupply = totalSupply;
            this.displayDecimals = displayDecimals;
            this.tokenDecimals = tokenDecimals;
            this.holderDidPrefix = holderDidPrefix;
            this.topHoldersLimit = topHoldersLimit;
        }

        static Currency defaults() {
            return new Currency("metamui", new BigDecimal("1000000000"), 6, 6, "did:ssid:", 100);
        }
    }

    @Getter
    public static class Params {
        /**
         * Hex payloads longer than this are replaced by a downloadable reference.
         */
        private final int maxInlineLength;

        public Params(@DefaultValue("200000") int maxInlineLength) {
            this.maxInlineLength = maxInlineLength;
        }
    }

    @Getter
    public static class Rpc {
        private final boolean enabled;
        private final String url;
        private final String balanceMethod;
        private final Duration timeout;

        public Rpc(@DefaultValue("false") boolean enabled,
                   String url,
                   @DefaultValue("did_accountInfo") String balanceMethod,
                   @DefaultValue("5s") Duration timeout) {
            this.enabled = enabled;
            this.url = url;
            this.balanceMethod = balanceMethod;
            this.timeout = timeout;
        }
    }
}
