package com.cryptosignal.collector.service.fetch;

import com.cryptosignal.collector.entity.Article;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 기사 본문에서 코인 심볼, 속보 여부, 카테고리를 추출하고 GUID가 없으면 생성한다.
 * I/O 없음.
 */
@Component
@RequiredArgsConstructor
public class ArticleEnricher {

    static final Duration BREAKING_WINDOW = Duration.ofHours(2);

    static final String GENERATED_GUID_PREFIX = "gen-";

    private static final List<String> BREAKING_KEYWORDS = List.of(
            "breaking", "just in", "urgent", "alert", "flash", "developing");

    private static final Map<String, List<String>> COIN_NAMES = buildCoinNames();

    private static final Map<String, List<Pattern>> COIN_PATTERNS = compile(COIN_NAMES);

    private static final Map<String, List<String>> CATEGORY_KEYWORDS = buildCategoryKeywords();

    private static final String DEFAULT_CATEGORY = "general";

    private final Clock clock;

    private static Map<String, List<String>> buildCoinNames() {
        Map<String, List<String>> coins = new LinkedHashMap<>();
        coins.put("BTC", List.of("bitcoin", "btc"));
        coins.put("ETH", List.of("ethereum", "ether", "eth"));
        coins.put("BNB", List.of("binance coin", "binance", "bnb"));
        coins.put("XRP", List.of("ripple", "xrp"));
        coins.put("SOL", List.of("solana", "sol"));
        coins.put("DOGE", List.of("dogecoin", "doge"));
        coins.put("ADA", List.of("cardano", "ada"));
        coins.put("AVAX", List.of("avalanche", "avax"));
        coins.put("DOT", List.of("polkadot", "dot"));
        coins.put("MATIC", List.of("polygon", "matic"));
        coins.put("LINK", List.of("chainlink", "link"));
        coins.put("UNI", List.of("uniswap", "uni"));
        coins.put("ATOM", List.of("cosmos", "atom"));
        coins.put("LTC", List.of("litecoin", "ltc"));
        coins.put("ETC", List.of("ethereum classic", "etc"));
        coins.put("XLM", List.of("stellar", "xlm"));
        coins.put("ALGO", List.of("algorand", "algo"));
        coins.put("VET", List.of("vechain", "vet"));
        coins.put("FIL", List.of("filecoin", "fil"));
        coins.put("NEAR", List.of("near protocol", "near"));
        coins.put("APT", List.of("aptos", "apt"));
        coins.put("ARB", List.of("arbitrum", "arb"));
        coins.put("OP", List.of("optimism"));
        coins.put("SUI", List.of("sui"));
        coins.put("SEI", List.of("sei"));
        coins.put("TIA", List.of("celestia", "tia"));
        coins.put("INJ", List.of("injective", "inj"));
        coins.put("PEPE", List.of("pepe"));
        coins.put("SHIB", List.of("shiba inu", "shib"));
        coins.put("BONK", List.of("bonk"));
        coins.put("WIF", List.of("dogwifhat", "wif"));
        coins.put("USDT", List.of("tether", "usdt"));
        coins.put("USDC", List.of("usdc", "usd coin"));
        return coins;
    }

    private static Map<String, List<Pattern>> compile(Map<String, List<String>> names) {
        Map<String, List<Pattern>> patterns = new LinkedHashMap<>();
        names.forEach((symbol, variants) -> patterns.put(symbol, variants.stream()
                .map(variant -> Pattern.compile("\\b" + Pattern.quote(variant) + "\\b",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList()));
        return patterns;
    }

    private static Map<String, List<String>> buildCategoryKeywords() {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        categories.put("defi", List.of("defi", "decentralized finance", "yield", "liquidity", "apy", "tvl", "lending", "borrowing"));
        categories.put("nft", List.of("nft", "non-fungible", "opensea", "blur", "digital art", "collectible"));
        categories.put("regulation", List.of("sec", "regulation", "law", "legal", "compliance", "ban", "sanction", "lawsuit"));
        categories.put("exchange", List.of("binance", "coinbase", "kraken", "exchange", "trading", "listing", "delisting"));
        categories.put("mining", List.of("mining", "miner", "hash rate", "proof of work", "pow"));
        categories.put("staking", List.of("staking", "stake", "proof of stake", "pos", "validator"));
        categories.put("layer2", List.of("layer 2", "l2", "rollup", "zk", "optimistic", "scaling"));
        categories.put("market", List.of("price", "market", "bullish", "bearish", "rally", "crash", "pump", "dump"));
        categories.put("technology", List.of("upgrade", "fork", "protocol", "development", "mainnet", "testnet"));
        return categories;
    }

    /**
     * Symbols whose name variants occur as whole words, in coin-table order, without duplicates.
     * Never null.
     */
    public List<String> extractMentionedCoins(String text) {
        List<String> found = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        for (Map.Entry<String, List<Pattern>> coin : COIN_PATTERNS.entrySet()) {
            for (Pattern pattern : coin.getValue()) {
                if (pattern.matcher(text).find()) {
                    found.add(coin.getKey());
                    break;
                }
            }
        }
        return found;
    }

    /**
     * Published within the last two hours, or title carries a breaking keyword.
     */
    public boolean isBreaking(Article article) {
        Instant cutoff = clock.instant().minus(BREAKING_WINDOW);
        if (article.getPubDate() != null && article.getPubDate().isAfter(cutoff)) {
            return true;
        }
        String title = article.getTitle();
        if (title == null) {
            return false;
        }
        String lowerTitle = title.toLowerCase(Locale.ROOT);
        return BREAKING_KEYWORDS.stream().anyMatch(lowerTitle::contains);
    }

    /**
     * Caller-supplied category wins; otherwise first keyword category found in the text, else "general".
     */
    public String detectCategory(String text, String sourceCategory) {
        if (sourceCategory != null && !sourceCategory.isBlank()) {
            return sourceCategory;
        }
        String lowerText = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> category : CATEGORY_KEYWORDS.entrySet()) {
            if (category.getValue().stream().anyMatch(lowerText::contains)) {
                return category.getKey();
            }
        }
        return DEFAULT_CATEGORY;
    }

    /**
     * Deterministic fallback id: "gen-" + first 16 bytes of sha256(sourceId|link|title), hex encoded.
     */
    public String generateGuid(Article article) {
        String seed = String.join("|",
                String.valueOf(article.getSourceId()),
                nullToEmpty(article.getLink()),
                nullToEmpty(article.getTitle()));
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(seed.getBytes(StandardCharsets.UTF_8));
            return GENERATED_GUID_PREFIX + HexFormat.of().formatHex(hash, 0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Fills coins, breaking flag, category (when the feed gave none) and GUID (when missing) in place.
     */
    public void enrich(Article article, String sourceCategory) {
        String text = nullToEmpty(article.getTitle()) + " " + nullToEmpty(article.getDescription());
        article.setMentionedCoins(extractMentionedCoins(text));
        article.setBreaking(isBreaking(article));

        if (article.getCategories().isEmpty()) {
            article.setCategories(List.of(detectCategory(text, sourceCategory)));
        }
        if (article.getGuid() == null || article.getGuid().isBlank()) {
            article.setGuid(generateGuid(article));
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
